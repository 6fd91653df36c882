package test.alipsa.halsls.plugins;

import se.alipsa.halsls.core.LanguagePlugin;
import se.alipsa.halsls.core.TokenUtil;
import se.alipsa.halsls.core.model.*;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Recognizes "declare NAME" lines in .tdl files; enough to drive the core engine in tests. */
public final class TrivialDeclarePlugin implements LanguagePlugin {

  private static final Pattern DECL = Pattern.compile("(?m)^\\s*declare\\s+([A-Za-z_]\\w*)");
  private static final Pattern WORD = Pattern.compile("[A-Za-z_]\\w*");

  private final Map<String, String> contentByUri = new ConcurrentHashMap<>();

  @Override public String id() { return "trivial-declare"; }
  @Override public Set<String> fileExtensions() { return Set.of("tdl"); }

  @Override
  public List<Diagnostic> index(String fileUri, String content) {
    contentByUri.put(fileUri, content);
    if (content.contains("boom")) throw new IllegalStateException("boom");
    if (!DECL.matcher(content).find()) {
      return List.of(new Diagnostic(Range.onLine(0, 0, 1), "nothing declared",
          Diagnostic.Severity.WARNING, id(), "empty"));
    }
    return List.of();
  }

  @Override
  public List<CompletionItem> completions(String fileUri, Position position) {
    var out = new ArrayList<CompletionItem>();
    for (var decl : declarations(fileUri).keySet()) {
      out.add(new CompletionItem(decl, CompletionItem.Kind.VARIABLE, "declared", ""));
    }
    return out;
  }

  @Override
  public Optional<Location> definition(String fileUri, Position position) {
    String word = wordAt(fileUri, position);
    Integer offset = declarations(fileUri).get(word);
    if (offset == null) return Optional.empty();
    String content = contentByUri.get(fileUri);
    Position start = TokenUtil.offsetToPosition(content, offset);
    return Optional.of(new Location(fileUri, Range.onLine(start.line, start.column, start.column + word.length())));
  }

  @Override public void forget(String fileUri) { contentByUri.remove(fileUri); }

  private Map<String, Integer> declarations(String fileUri) {
    String content = contentByUri.get(fileUri);
    var out = new LinkedHashMap<String, Integer>();
    if (content == null) return out;
    Matcher m = DECL.matcher(content);
    while (m.find()) out.put(m.group(1), m.start(1));
    return out;
  }

  private String wordAt(String fileUri, Position position) {
    String content = contentByUri.get(fileUri);
    if (content == null) return "";
    int offset = TokenUtil.positionToOffset(content, position.line, position.column);
    Matcher m = WORD.matcher(content);
    while (m.find()) {
      if (m.start() <= offset && offset < m.end()) return m.group();
    }
    return "";
  }
}
