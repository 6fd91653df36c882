package se.alipsa.halsls.hals.model;

/** One row of the document outline. */
public final class OutlineEntry {
  private final String name;
  private final SymbolKind kind;
  private final String detail;
  private final int line;
  private final int column;

  public OutlineEntry(Symbol symbol) {
    this.name = symbol.getName();
    this.kind = symbol.getKind();
    this.detail = symbol.getDataType();
    this.line = symbol.getLine();
    this.column = symbol.getColumn();
  }

  public String getName() { return name; }
  public SymbolKind getKind() { return kind; }
  public String getDetail() { return detail; }
  public int getLine() { return line; }
  public int getColumn() { return column; }

  @Override
  public String toString() {
    return "Line " + line + ": " + name + " (" + kind.tag() + ")";
  }
}
