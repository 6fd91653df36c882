package se.alipsa.halsls.hals.model;

import java.util.List;
import java.util.Objects;

/**
 * A declared HAL/S entity. The name is canonical (upper case) and is the key of the
 * symbol table; positions are 0-based and refer to the normalized text.
 */
public final class Symbol {

  private final String name;
  private final SymbolKind kind;
  private final String dataType;       // e.g. "VECTOR(3)", "INTEGER FUNCTION"
  private final int line;
  private final int column;
  private final int endLine;
  private final int endColumn;
  private final List<String> parameters;
  private final List<String> dimensions;
  private final String documentation;

  public Symbol(String name, SymbolKind kind, String dataType,
                int line, int column, int endLine, int endColumn,
                List<String> parameters, List<String> dimensions,
                String documentation) {
    this.name = Objects.requireNonNull(name, "name");
    this.kind = Objects.requireNonNull(kind, "kind");
    if (kind == SymbolKind.KEYWORD) {
      throw new IllegalArgumentException("A keyword is not a declared symbol: " + name);
    }
    this.dataType = dataType == null ? "" : dataType;
    this.line = line;
    this.column = column;
    this.endLine = endLine;
    this.endColumn = endColumn;
    this.parameters = parameters == null ? List.of() : List.copyOf(parameters);
    this.dimensions = dimensions == null ? List.of() : List.copyOf(dimensions);
    this.documentation = documentation == null ? "" : documentation;
  }

  public String getName() { return name; }
  public SymbolKind getKind() { return kind; }
  public String getDataType() { return dataType; }
  public int getLine() { return line; }
  public int getColumn() { return column; }
  public int getEndLine() { return endLine; }
  public int getEndColumn() { return endColumn; }
  public List<String> getParameters() { return parameters; }
  public List<String> getDimensions() { return dimensions; }
  public String getDocumentation() { return documentation; }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Symbol that)) return false;
    return line == that.line && column == that.column
        && endLine == that.endLine && endColumn == that.endColumn
        && name.equals(that.name) && kind == that.kind
        && dataType.equals(that.dataType)
        && parameters.equals(that.parameters) && dimensions.equals(that.dimensions)
        && documentation.equals(that.documentation);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, kind, dataType, line, column, endLine, endColumn, parameters, dimensions, documentation);
  }

  @Override
  public String toString() {
    return name + " " + kind.tag() + " " + dataType + " @" + line + ":" + column;
  }
}
