package se.alipsa.halsls.hals.model;

public final class CompletionEntry {
  private final String label;
  private final SymbolKind kind;
  private final String detail;
  private final String documentation;

  public CompletionEntry(String label, SymbolKind kind, String detail, String documentation) {
    this.label = label;
    this.kind = kind;
    this.detail = detail;
    this.documentation = documentation;
  }

  public String getLabel() { return label; }
  public SymbolKind getKind() { return kind; }
  public String getDetail() { return detail; }
  public String getDocumentation() { return documentation; }

  @Override
  public String toString() {
    return label + " (" + kind.tag() + ")";
  }
}
