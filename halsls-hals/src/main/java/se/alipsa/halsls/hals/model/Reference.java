package se.alipsa.halsls.hals.model;

import java.util.Objects;

/** One occurrence of a (non-keyword) identifier, declaring occurrences included. */
public final class Reference {

  private final String name;     // canonical
  private final int line;
  private final int column;
  private final int endColumn;   // exclusive
  private final String context;  // the line it sits on, trimmed

  public Reference(String name, int line, int column, int endColumn, String context) {
    this.name = Objects.requireNonNull(name, "name");
    this.line = line;
    this.column = column;
    this.endColumn = endColumn;
    this.context = context == null ? "" : context;
  }

  public String getName() { return name; }
  public int getLine() { return line; }
  public int getColumn() { return column; }
  public int getEndColumn() { return endColumn; }
  public String getContext() { return context; }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Reference that)) return false;
    return line == that.line && column == that.column && endColumn == that.endColumn
        && name.equals(that.name) && context.equals(that.context);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, line, column, endColumn, context);
  }

  @Override
  public String toString() {
    return name + "@" + line + ":" + column + "-" + endColumn;
  }
}
