package se.alipsa.halsls.core.model;

import java.util.Objects;

/** Hover text for a position, in markdown. */
public final class Hover {
  private final String contents;

  public Hover(String contents) {
    this.contents = Objects.requireNonNull(contents, "contents");
  }

  public String getContents() {
    return contents;
  }

  @Override
  public String toString() {
    return "Hover{" + contents + '}';
  }
}
