package se.alipsa.halsls.core.model;

/** One entry of a document outline. */
public final class SymbolInfo {
  public enum Kind { MODULE, FUNCTION, VARIABLE, CONSTANT, STRUCT, KEY, STRING }

  private final String languageId;     // plugin id(), e.g. "hals"
  private final Kind kind;
  private final String name;
  private final String detail;         // e.g. "MATRIX(3,3)"
  private final Location location;     // range of the whole declaration
  private final Range selectionRange;  // range of the name

  public SymbolInfo(String languageId, Kind kind, String name, String detail,
                    Location location, Range selectionRange) {
    this.languageId = languageId;
    this.kind = kind;
    this.name = name;
    this.detail = detail;
    this.location = location;
    this.selectionRange = selectionRange;
  }

  public String getLanguageId() { return languageId; }
  public Kind getKind() { return kind; }
  public String getName() { return name; }
  public String getDetail() { return detail; }
  public Location getLocation() { return location; }
  public Range getSelectionRange() { return selectionRange; }

  @Override
  public String toString() {
    return name + " " + kind + " @" + location;
  }
}
