package se.alipsa.halsls.hals;

import se.alipsa.halsls.core.LanguagePlugin;
import se.alipsa.halsls.core.PluginEnvironment;
import se.alipsa.halsls.core.model.*;
import se.alipsa.halsls.hals.analysis.AnalysisSession;
import se.alipsa.halsls.hals.model.*;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/** HAL/S support for the core engine; one {@link AnalysisSession} per open document. */
public final class HalsPlugin implements LanguagePlugin {

  private final HalsConfig config;
  private final boolean claimsEverything;
  private final Map<String, AnalysisSession> sessionByUri = new ConcurrentHashMap<>();
  private PluginEnvironment env;

  /** Used by ServiceLoader; reads {@code halsls-config.yml}. */
  public HalsPlugin() {
    this(HalsConfig.load());
  }

  public HalsPlugin(HalsConfig config) {
    this(config, false);
  }

  private HalsPlugin(HalsConfig config, boolean claimsEverything) {
    this.config = Objects.requireNonNull(config, "config");
    this.claimsEverything = claimsEverything;
  }

  /**
   * A plugin that takes every document whatever its URI, for hosts that only ever hand it
   * HAL/S text (untitled buffers, extensions the editor maps to HAL/S).
   */
  public static HalsPlugin forAllDocuments(HalsConfig config) {
    return new HalsPlugin(config, true);
  }

  @Override public String id() { return "hals"; }
  @Override public String displayName() { return "HAL/S"; }
  @Override public Set<String> fileExtensions() { return Set.of("hal", "hals"); }

  @Override
  public double claim(String fileUri, Supplier<CharSequence> contentPreview) {
    return claimsEverything ? 1.0 : LanguagePlugin.super.claim(fileUri, contentPreview);
  }

  @Override
  public void configure(PluginEnvironment env) {
    this.env = env;
    log("DEBUG", "HAL/S analysis configured: " + config);
  }

  @Override
  public List<Diagnostic> index(String fileUri, String content) {
    AnalysisSession session = sessionByUri.computeIfAbsent(fileUri, u -> new AnalysisSession(config));
    session.parse(content);
    log("DEBUG", "Indexed " + fileUri + ": " + session.getSymbols().size() + " symbols, "
        + session.getReferences().size() + " references");
    return List.copyOf(session.getDiagnostics());
  }

  @Override
  public List<CompletionItem> completions(String fileUri, Position position) {
    AnalysisSession session = sessionByUri.get(fileUri);
    if (session == null) return List.of();

    var out = new ArrayList<CompletionItem>();
    for (CompletionEntry e : session.completion(position.line, position.column)) {
      out.add(new CompletionItem(e.getLabel(), completionKind(e.getKind()), e.getDetail(), e.getDocumentation()));
    }
    return out;
  }

  @Override
  public Optional<Hover> hover(String fileUri, Position position) {
    AnalysisSession session = sessionByUri.get(fileUri);
    if (session == null) return Optional.empty();
    return session.hover(position.line, position.column).map(h -> new Hover(h.toMarkdown()));
  }

  @Override
  public Optional<Location> definition(String fileUri, Position position) {
    AnalysisSession session = sessionByUri.get(fileUri);
    if (session == null) return Optional.empty();
    return session.definition(position.line, position.column)
        .map(d -> new Location(fileUri, nameRange(d.getLine(), d.getColumn(), d.getName())));
  }

  @Override
  public List<Location> references(String fileUri, Position position) {
    AnalysisSession session = sessionByUri.get(fileUri);
    if (session == null) return List.of();

    var out = new ArrayList<Location>();
    for (Reference ref : session.referencesAt(position.line, position.column)) {
      out.add(new Location(fileUri, Range.onLine(ref.getLine(), ref.getColumn(), ref.getEndColumn())));
    }
    return out;
  }

  @Override
  public List<SymbolInfo> documentSymbols(String fileUri) {
    AnalysisSession session = sessionByUri.get(fileUri);
    if (session == null) return List.of();

    var out = new ArrayList<SymbolInfo>();
    for (OutlineEntry e : session.documentSymbols()) {
      Range name = nameRange(e.getLine(), e.getColumn(), e.getName());
      out.add(new SymbolInfo(id(), outlineKind(e.getKind()), e.getName(), e.getDetail(),
          new Location(fileUri, name), name));
    }
    return out;
  }

  @Override public void forget(String fileUri) { sessionByUri.remove(fileUri); }

  static CompletionItem.Kind completionKind(SymbolKind kind) {
    return switch (kind) {
      case KEYWORD -> CompletionItem.Kind.KEYWORD;
      case PROGRAM, TASK, COMPOOL -> CompletionItem.Kind.MODULE;
      case PROCEDURE, FUNCTION -> CompletionItem.Kind.FUNCTION;
      case VARIABLE, PARAMETER -> CompletionItem.Kind.VARIABLE;
      case CONSTANT -> CompletionItem.Kind.CONSTANT;
      case STRUCTURE -> CompletionItem.Kind.STRUCT;
      case LABEL -> CompletionItem.Kind.REFERENCE;
      case REPLACE -> CompletionItem.Kind.SNIPPET;
    };
  }

  static SymbolInfo.Kind outlineKind(SymbolKind kind) {
    return switch (kind) {
      case PROGRAM, TASK, COMPOOL -> SymbolInfo.Kind.MODULE;
      case PROCEDURE, FUNCTION -> SymbolInfo.Kind.FUNCTION;
      case CONSTANT -> SymbolInfo.Kind.CONSTANT;
      case STRUCTURE -> SymbolInfo.Kind.STRUCT;
      case LABEL -> SymbolInfo.Kind.KEY;
      case REPLACE -> SymbolInfo.Kind.STRING;
      default -> SymbolInfo.Kind.VARIABLE;
    };
  }

  // definition and outline ranges cover the name's length from the declaration column
  private static Range nameRange(int line, int column, String name) {
    return Range.onLine(line, column, column + name.length());
  }

  private void log(String level, String message) {
    if (env != null) env.log(level, message, null);
  }
}
