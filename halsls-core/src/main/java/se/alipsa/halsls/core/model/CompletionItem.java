package se.alipsa.halsls.core.model;

public final class CompletionItem {
  public enum Kind { KEYWORD, MODULE, FUNCTION, VARIABLE, CONSTANT, STRUCT, REFERENCE, SNIPPET }

  private final String label;         // what the user sees in the list
  private final Kind kind;
  private final String detail;        // e.g., the declared data type
  private final String documentation;

  public CompletionItem(String label, Kind kind, String detail, String documentation) {
    this.label = label;
    this.kind = kind;
    this.detail = detail;
    this.documentation = documentation;
  }

  public String getLabel() {
    return label;
  }

  public Kind getKind() {
    return kind;
  }

  public String getDetail() {
    return detail;
  }

  public String getDocumentation() {
    return documentation;
  }

  @Override
  public String toString() {
    return label + " (" + kind + ")";
  }
}
