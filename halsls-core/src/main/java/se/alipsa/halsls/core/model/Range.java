package se.alipsa.halsls.core.model;

import java.util.Objects;

public class Range {
  public final Position start;
  public final Position end;

  public Range(Position start, Position end) {
    this.start = start;
    this.end = end;
  }

  /** A range on a single line, e.g. the span of an identifier. */
  public static Range onLine(int line, int startColumn, int endColumn) {
    return new Range(new Position(line, startColumn), new Position(line, endColumn));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Range that)) return false;
    return Objects.equals(start, that.start) && Objects.equals(end, that.end);
  }

  @Override
  public int hashCode() {
    return Objects.hash(start, end);
  }

  @Override
  public String toString() {
    return "[" + start + "-" + end + "]";
  }
}
