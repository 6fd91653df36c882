package se.alipsa.halsls.hals.analysis;

import se.alipsa.halsls.core.TokenUtil;
import se.alipsa.halsls.core.model.Position;
import se.alipsa.halsls.hals.model.Reference;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Records every non-keyword identifier of the normalized text, declared or not. */
public final class ReferenceCollector {

  static final Pattern IDENTIFIER = Pattern.compile("\\b([A-Z_][A-Z0-9_]*)\\b", Pattern.CASE_INSENSITIVE);

  public void collect(String text, List<Reference> out) {
    LineIndex index = new LineIndex(text);
    String[] lines = TokenUtil.lines(text);
    Matcher m = IDENTIFIER.matcher(text);
    while (m.find()) {
      String name = m.group(1).toUpperCase(Locale.ROOT);
      if (Keywords.isKeyword(name)) continue;

      Position start = index.at(m.start());
      out.add(new Reference(name, start.line, start.column, start.column + m.group(1).length(),
          lines[start.line].strip()));
    }
  }
}
