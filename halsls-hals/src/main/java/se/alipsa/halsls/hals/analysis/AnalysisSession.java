package se.alipsa.halsls.hals.analysis;

import se.alipsa.halsls.core.TokenUtil;
import se.alipsa.halsls.core.model.Diagnostic;
import se.alipsa.halsls.hals.HalsConfig;
import se.alipsa.halsls.hals.model.*;

import java.util.*;

/**
 * The analysis state of one document: its symbol table, references, diagnostics and raw lines.
 * <p>
 * {@link #parse(String)} throws all of it away and rebuilds it from the full text; the query
 * methods read whatever the last parse produced. Instances are not thread safe, callers
 * serialize parse and query calls per session.
 */
public final class AnalysisSession {

  private final Preprocessor preprocessor;
  private final DeclarationExtractor extractor;
  private final ReferenceCollector collector = new ReferenceCollector();

  private Map<String, Symbol> symbols = Map.of();
  private List<Reference> references = List.of();
  private List<Diagnostic> diagnostics = List.of();
  private String[] lines = new String[] { "" };
  private QueryEngine queries = new QueryEngine(symbols, references, lines);

  public AnalysisSession() {
    this(HalsConfig.defaults());
  }

  public AnalysisSession(HalsConfig config) {
    Objects.requireNonNull(config, "config");
    this.preprocessor = new Preprocessor(config.isPreserveLineNumbers());
    this.extractor = new DeclarationExtractor(config.getLabelLookahead());
  }

  public void parse(String text) {
    String raw = text == null ? "" : text;
    String normalized = preprocessor.normalize(raw);

    Map<String, Symbol> table = new LinkedHashMap<>();
    extractor.extract(normalized, table);
    List<Reference> refs = new ArrayList<>();
    collector.collect(normalized, refs);

    symbols = Collections.unmodifiableMap(table);
    references = Collections.unmodifiableList(refs);
    diagnostics = List.of();
    lines = TokenUtil.lines(raw);
    queries = new QueryEngine(symbols, references, lines);
  }

  /** Canonical name to symbol, in the order names were first entered. */
  public Map<String, Symbol> getSymbols() { return symbols; }

  public Optional<Symbol> getSymbol(String name) {
    return name == null ? Optional.empty() : Optional.ofNullable(symbols.get(name.toUpperCase(Locale.ROOT)));
  }

  public List<Reference> getReferences() { return references; }

  /** Always empty: the analysis reports no problems, but the channel exists. */
  public List<Diagnostic> getDiagnostics() { return diagnostics; }

  /** Raw lines of the last parsed text. */
  public List<String> getLines() { return List.of(lines); }

  public List<CompletionEntry> completion(int line, int column) { return queries.completion(line, column); }

  public Optional<HoverInfo> hover(int line, int column) { return queries.hover(line, column); }

  public Optional<DefinitionSite> definition(int line, int column) { return queries.definition(line, column); }

  public List<Reference> referencesAt(int line, int column) { return queries.referencesAt(line, column); }

  public List<OutlineEntry> documentSymbols() { return queries.documentSymbols(); }
}
