package se.alipsa.halsls.hals.analysis;

import se.alipsa.halsls.hals.model.*;

import java.util.*;
import java.util.regex.Matcher;

/**
 * Positional lookups over one analysis result. Tokens under the cursor are read from the raw
 * lines of the document; nothing here changes the state it was built from.
 */
public final class QueryEngine {

  private final Map<String, Symbol> symbols;
  private final List<Reference> references;
  private final String[] lines;

  QueryEngine(Map<String, Symbol> symbols, List<Reference> references, String[] lines) {
    this.symbols = symbols;
    this.references = references;
    this.lines = lines;
  }

  /** Every keyword, then every symbol. The position does not narrow the result. */
  public List<CompletionEntry> completion(int line, int column) {
    List<CompletionEntry> out = new ArrayList<>(Keywords.all().size() + symbols.size());
    for (String kw : Keywords.all()) {
      out.add(new CompletionEntry(kw, SymbolKind.KEYWORD, "HAL/S keyword", "HAL/S keyword: " + kw));
    }
    for (Symbol sym : symbols.values()) {
      out.add(new CompletionEntry(sym.getName(), sym.getKind(), sym.getDataType(), sym.getDocumentation()));
    }
    return out;
  }

  public Optional<HoverInfo> hover(int line, int column) {
    return wordAt(line, column).flatMap(word -> {
      if (Keywords.isKeyword(word)) return Optional.of(HoverInfo.keyword(word));
      return Optional.ofNullable(symbols.get(word)).map(HoverInfo::of);
    });
  }

  public Optional<DefinitionSite> definition(int line, int column) {
    return wordAt(line, column)
        .map(symbols::get)
        .map(sym -> new DefinitionSite(sym.getLine(), sym.getColumn(), sym.getName()));
  }

  /** All references sharing the canonical name of the token under the cursor, in text order. */
  public List<Reference> referencesAt(int line, int column) {
    Optional<String> word = wordAt(line, column);
    if (word.isEmpty()) return List.of();
    List<Reference> out = new ArrayList<>();
    for (Reference ref : references) {
      if (ref.getName().equals(word.get())) out.add(ref);
    }
    return out;
  }

  /** Symbols ordered by declaration line; ties keep symbol-table order. */
  public List<OutlineEntry> documentSymbols() {
    List<OutlineEntry> out = new ArrayList<>(symbols.size());
    for (Symbol sym : symbols.values()) out.add(new OutlineEntry(sym));
    out.sort(Comparator.comparingInt(OutlineEntry::getLine));
    return out;
  }

  /**
   * Canonical form of the first identifier on the line whose span contains the column. The end
   * is inclusive, so a cursor right behind a word still hits it.
   */
  Optional<String> wordAt(int line, int column) {
    if (line < 0 || line >= lines.length) return Optional.empty();
    Matcher m = ReferenceCollector.IDENTIFIER.matcher(lines[line]);
    while (m.find()) {
      if (m.start() <= column && column <= m.end()) {
        return Optional.of(m.group(1).toUpperCase(Locale.ROOT));
      }
    }
    return Optional.empty();
  }
}
