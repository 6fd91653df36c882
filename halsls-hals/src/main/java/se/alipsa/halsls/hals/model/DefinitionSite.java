package se.alipsa.halsls.hals.model;

/** Where a symbol is declared. */
public final class DefinitionSite {
  private final int line;
  private final int column;
  private final String name;

  public DefinitionSite(int line, int column, String name) {
    this.line = line;
    this.column = column;
    this.name = name;
  }

  public int getLine() { return line; }
  public int getColumn() { return column; }
  public String getName() { return name; }

  @Override
  public String toString() {
    return name + "@" + line + ":" + column;
  }
}
