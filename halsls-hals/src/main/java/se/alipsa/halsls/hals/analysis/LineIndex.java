package se.alipsa.halsls.hals.analysis;

import se.alipsa.halsls.core.model.Position;

import java.util.Arrays;

/** Offset to (line, column) lookup over one text: line = newlines before the offset, column = distance to the last one. */
final class LineIndex {

  private final int[] lineStarts;

  LineIndex(String text) {
    int count = 1;
    for (int i = 0; i < text.length(); i++) {
      if (text.charAt(i) == '\n') count++;
    }
    lineStarts = new int[count];
    int line = 1;
    for (int i = 0; i < text.length(); i++) {
      if (text.charAt(i) == '\n') lineStarts[line++] = i + 1;
    }
  }

  Position at(int offset) {
    int idx = Arrays.binarySearch(lineStarts, offset);
    int line = idx >= 0 ? idx : -idx - 2;
    return new Position(line, offset - lineStarts[line]);
  }
}
