package se.alipsa.halsls.core;

import se.alipsa.halsls.core.model.Position;

/** Tiny helpers for token/position math that don't depend on any language-specific lexer. */
public final class TokenUtil {
  private TokenUtil() {}

  public static int positionToOffset(String text, int line, int column) {
    int curLine = 0, idx = 0, n = text.length();
    while (curLine < line && idx < n) {
      int nl = text.indexOf('\n', idx);
      if (nl < 0) return n;
      idx = nl + 1;
      curLine++;
    }
    return Math.min(idx + column, n);
  }

  /** Inverse of {@link #positionToOffset}: lines are counted by '\n', columns from the preceding '\n'. */
  public static Position offsetToPosition(String text, int offset) {
    int end = Math.max(0, Math.min(offset, text.length()));
    int line = 0, lineStart = 0;
    for (int i = 0; i < end; i++) {
      if (text.charAt(i) == '\n') { line++; lineStart = i + 1; }
    }
    return new Position(line, end - lineStart);
  }

  /** Split on '\n' keeping trailing empty lines, so "a\n" has two lines. */
  public static String[] lines(String text) {
    if (text == null) return new String[] { "" };
    return text.split("\n", -1);
  }

  public static CharSequence preview(String text) {
    int n = Math.min(text == null ? 0 : text.length(), 1024);
    return text == null ? "" : text.subSequence(0, n);
  }
}
