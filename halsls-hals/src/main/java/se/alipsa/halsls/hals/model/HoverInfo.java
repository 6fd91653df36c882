package se.alipsa.halsls.hals.model;

/** What hovering a token shows: either the keyword banner or a symbol's name, type and docs. */
public final class HoverInfo {
  private final String name;
  private final String type;
  private final String documentation;
  private final boolean keyword;

  private HoverInfo(String name, String type, String documentation, boolean keyword) {
    this.name = name;
    this.type = type;
    this.documentation = documentation;
    this.keyword = keyword;
  }

  public static HoverInfo keyword(String word) {
    return new HoverInfo(word, SymbolKind.KEYWORD.tag(), "HAL/S keyword", true);
  }

  public static HoverInfo of(Symbol symbol) {
    return new HoverInfo(symbol.getName(), symbol.getDataType(), symbol.getDocumentation(), false);
  }

  public String getName() { return name; }
  public String getDocumentation() { return documentation; }
  public boolean isKeyword() { return keyword; }

  public String toMarkdown() {
    if (keyword) {
      return "**" + name + "**\n\n" + documentation;
    }
    return "**" + name + "**: " + type + "\n\n" + documentation;
  }

  @Override
  public String toString() {
    return toMarkdown();
  }
}
