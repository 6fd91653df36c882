package se.alipsa.halsls.hals.analysis;

import se.alipsa.halsls.core.TokenUtil;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalizes raw HAL/S source before recognition.
 * <p>
 * The first pass handles the column-1 markers of the multi-line listing format:
 * {@code E} (exponent) and {@code S} (subscript) lines are dropped, the {@code M} marker of a
 * main line is removed, and a {@code C} line becomes a block comment. The second pass removes
 * all {@code /* ... *&#47;} comments (shortest match, may span lines, no nesting).
 * <p>
 * With {@code preserveLineNumbers} a dropped line leaves an empty line behind and a removed
 * comment is blanked with spaces, keeping its line breaks, so lines and columns stay those of
 * the raw text. The exception is an {@code M} line, whose tokens move one column left.
 * Without it the legacy behaviour applies: comments vanish and later lines move up.
 */
public final class Preprocessor {

  private static final Pattern BLOCK_COMMENT = Pattern.compile("/\\*.*?\\*/", Pattern.DOTALL);

  private final boolean preserveLineNumbers;

  public Preprocessor(boolean preserveLineNumbers) {
    this.preserveLineNumbers = preserveLineNumbers;
  }

  public String normalize(String text) {
    return stripComments(unfoldContinuations(text));
  }

  String unfoldContinuations(String text) {
    StringBuilder sb = new StringBuilder(text.length() + 16);
    boolean first = true;
    for (String line : TokenUtil.lines(text)) {
      String out = line;
      if (!line.isEmpty()) {
        switch (Character.toUpperCase(line.charAt(0))) {
          case 'E', 'S' -> out = preserveLineNumbers ? "" : null;
          case 'M' -> out = line.substring(1);
          case 'C' -> out = "/*" + line.substring(1) + "*/";
          default -> { }
        }
      }
      if (out == null) continue;
      if (!first) sb.append('\n');
      sb.append(out);
      first = false;
    }
    return sb.toString();
  }

  String stripComments(String text) {
    Matcher m = BLOCK_COMMENT.matcher(text);
    if (!preserveLineNumbers) {
      return m.replaceAll("");
    }
    return m.replaceAll(mr -> blanked(mr.group()));
  }

  private static String blanked(String s) {
    StringBuilder sb = new StringBuilder(s.length());
    for (int i = 0; i < s.length(); i++) {
      sb.append(s.charAt(i) == '\n' ? '\n' : ' ');
    }
    return sb.toString();
  }
}
