package se.alipsa.halsls.hals.analysis;

import se.alipsa.halsls.core.model.Position;
import se.alipsa.halsls.hals.model.Symbol;
import se.alipsa.halsls.hals.model.SymbolKind;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fills a symbol table from normalized HAL/S text.
 * <p>
 * Each recognizer scans the whole text on its own, in a fixed order: program, procedure,
 * function, task, compool, scalar declare, array declare, constant declare, vector declare,
 * matrix declare, structure, replace, label. A match replaces whatever entry the table had for
 * the name, so for a name matched by several passes the last pass wins. Labels are the
 * exception: they are only added for names nobody claimed yet.
 */
public final class DeclarationExtractor {

  private static final String NAME = "([A-Z_][A-Z0-9_]*)";
  private static final String VALUE_TYPE = "(INTEGER|SCALAR|VECTOR|MATRIX|BOOLEAN|CHARACTER|BIT)";
  private static final List<String> UNIT_KEYWORDS = List.of("PROGRAM", "PROCEDURE", "FUNCTION", "TASK", "COMPOOL");

  private static final Pattern PROGRAM = compile("\\b" + NAME + "\\s*:\\s*PROGRAM\\s*;");
  private static final Pattern PROCEDURE = compile("\\b" + NAME + "\\s*:\\s*PROCEDURE\\s*(?:\\(([^)]*)\\))?\\s*;");
  private static final Pattern FUNCTION = compile("\\b" + NAME + "\\s*:\\s*" + VALUE_TYPE + "?\\s*FUNCTION\\s*(?:\\(([^)]*)\\))?\\s*;");
  private static final Pattern TASK = compile("\\b" + NAME + "\\s*:\\s*TASK\\s*;");
  private static final Pattern COMPOOL = compile("\\b" + NAME + "\\s*:\\s*COMPOOL\\s*;");
  private static final Pattern SCALAR_DECLARE = compile("\\bDECLARE\\s+" + NAME
      + "\\s+(INTEGER|SCALAR|VECTOR|MATRIX|BOOLEAN|CHARACTER|BIT|EVENT)\\s*(?:INITIAL\\s*\\([^)]*\\))?\\s*;");
  private static final Pattern ARRAY_DECLARE = compile("\\bDECLARE\\s+" + NAME + "\\s+ARRAY\\s*\\(([^)]+)\\)\\s+" + VALUE_TYPE + "\\s*;");
  private static final Pattern CONSTANT_DECLARE = compile("\\bDECLARE\\s+" + NAME + "\\s+CONSTANT\\s*\\(([^)]+)\\)\\s*;");
  private static final Pattern VECTOR_DECLARE = compile("\\bDECLARE\\s+" + NAME + "\\s+VECTOR\\s*\\((\\d+)\\)\\s*;");
  private static final Pattern MATRIX_DECLARE = compile("\\bDECLARE\\s+" + NAME + "\\s+MATRIX\\s*\\((\\d+)\\s*,\\s*(\\d+)\\)\\s*;");
  private static final Pattern STRUCTURE = compile("\\bDECLARE\\s+" + NAME + "\\s+STRUCTURE\\s*;");
  private static final Pattern REPLACE = compile("\\bREPLACE\\s+" + NAME + "\\s+BY\\s+\"([^\"]+)\"\\s*;");
  private static final Pattern LABEL = compile("\\b" + NAME + "\\s*:");

  @FunctionalInterface
  private interface SymbolFactory {
    Symbol create(Matcher m, Position start, Position end);
  }

  private static final class Recognizer {
    final Pattern pattern;
    final SymbolFactory factory;

    Recognizer(Pattern pattern, SymbolFactory factory) {
      this.pattern = pattern;
      this.factory = factory;
    }
  }

  // order matters, see class doc
  private static final List<Recognizer> RECOGNIZERS = List.of(
      new Recognizer(PROGRAM, (m, s, e) ->
          symbol(m, SymbolKind.PROGRAM, "PROGRAM", s, e, List.of(), List.of(), "HAL/S Program unit")),
      new Recognizer(PROCEDURE, (m, s, e) -> {
        List<String> params = splitList(m.group(2));
        String doc = params.isEmpty() ? "Procedure" : "Procedure with " + params.size() + " parameters";
        return symbol(m, SymbolKind.PROCEDURE, "PROCEDURE", s, e, params, List.of(), doc);
      }),
      new Recognizer(FUNCTION, (m, s, e) -> {
        String returnType = m.group(2) == null ? "SCALAR" : upper(m.group(2));
        return symbol(m, SymbolKind.FUNCTION, returnType + " FUNCTION", s, e, splitList(m.group(3)), List.of(),
            "Function returning " + returnType);
      }),
      new Recognizer(TASK, (m, s, e) ->
          symbol(m, SymbolKind.TASK, "TASK", s, e, List.of(), List.of(), "Real-time task (schedulable process)")),
      new Recognizer(COMPOOL, (m, s, e) ->
          symbol(m, SymbolKind.COMPOOL, "COMPOOL", s, e, List.of(), List.of(), "Communication pool (shared data)")),
      new Recognizer(SCALAR_DECLARE, (m, s, e) -> {
        String type = upper(m.group(2));
        return symbol(m, SymbolKind.VARIABLE, type, s, e, List.of(), List.of(), type + " variable");
      }),
      new Recognizer(ARRAY_DECLARE, (m, s, e) -> {
        String dims = m.group(2);
        String type = upper(m.group(3));
        return symbol(m, SymbolKind.VARIABLE, "ARRAY(" + dims + ") " + type, s, e, List.of(), splitList(dims),
            "Array of " + type + " with dimensions (" + dims + ")");
      }),
      new Recognizer(CONSTANT_DECLARE, (m, s, e) ->
          symbol(m, SymbolKind.CONSTANT, "CONSTANT", s, e, List.of(), List.of(), "Constant = " + m.group(2))),
      new Recognizer(VECTOR_DECLARE, (m, s, e) -> {
        String size = m.group(2);
        return symbol(m, SymbolKind.VARIABLE, "VECTOR(" + size + ")", s, e, List.of(), List.of(size),
            "Vector of " + size + " elements");
      }),
      new Recognizer(MATRIX_DECLARE, (m, s, e) -> {
        String rows = m.group(2);
        String cols = m.group(3);
        return symbol(m, SymbolKind.VARIABLE, "MATRIX(" + rows + "," + cols + ")", s, e, List.of(), List.of(rows, cols),
            "Matrix of " + rows + "x" + cols + " elements");
      }),
      new Recognizer(STRUCTURE, (m, s, e) ->
          symbol(m, SymbolKind.STRUCTURE, "STRUCTURE", s, e, List.of(), List.of(), "Structure type")),
      new Recognizer(REPLACE, (m, s, e) ->
          symbol(m, SymbolKind.REPLACE, "REPLACE", s, e, List.of(), List.of(), "Macro expanding to: " + m.group(2)))
  );

  private final int labelLookahead;

  public DeclarationExtractor(int labelLookahead) {
    if (labelLookahead < 1) throw new IllegalArgumentException("labelLookahead must be positive: " + labelLookahead);
    this.labelLookahead = labelLookahead;
  }

  /** Run every pass over {@code text}, writing into {@code table} (keyed by canonical name). */
  public void extract(String text, Map<String, Symbol> table) {
    LineIndex index = new LineIndex(text);
    for (Recognizer r : RECOGNIZERS) {
      Matcher m = r.pattern.matcher(text);
      while (m.find()) {
        Symbol sym = r.factory.create(m, index.at(m.start()), index.at(m.end()));
        table.put(sym.getName(), sym);
      }
    }
    extractLabels(text, index, table);
  }

  private void extractLabels(String text, LineIndex index, Map<String, Symbol> table) {
    Matcher m = LABEL.matcher(text);
    while (m.find()) {
      if (introducesProgramUnit(text, m.end())) continue;
      String name = upper(m.group(1));
      if (table.containsKey(name)) continue;

      table.put(name, symbol(m, SymbolKind.LABEL, "LABEL", index.at(m.start()), index.at(m.end()),
          List.of(), List.of(), "Statement label (GO TO target)"));
    }
  }

  /** True when the window after a colon, trimmed, starts with a program-unit keyword. */
  private boolean introducesProgramUnit(String text, int afterColon) {
    String window = text.substring(afterColon, Math.min(text.length(), afterColon + labelLookahead));
    String after = upper(window.strip());
    for (String kw : UNIT_KEYWORDS) {
      if (after.startsWith(kw)) return true;
    }
    return false;
  }

  private static Symbol symbol(Matcher m, SymbolKind kind, String dataType, Position start, Position end,
                               List<String> params, List<String> dims, String doc) {
    return new Symbol(upper(m.group(1)), kind, dataType, start.line, start.column, end.line, end.column,
        params, dims, doc);
  }

  private static List<String> splitList(String csv) {
    if (csv == null || csv.isBlank()) return List.of();
    List<String> out = new ArrayList<>();
    for (String part : csv.split(",", -1)) out.add(part.strip());
    return out;
  }

  private static String upper(String s) {
    return s.toUpperCase(Locale.ROOT);
  }

  private static Pattern compile(String regex) {
    return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
  }
}
