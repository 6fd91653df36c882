package se.alipsa.halsls.hals.model;

import java.util.Locale;

/**
 * Kind tags of analysis results. Every kind except {@link #KEYWORD} can label a declared
 * {@link Symbol}; keywords only show up in completion and hover.
 */
public enum SymbolKind {
  PROGRAM, PROCEDURE, FUNCTION, TASK, COMPOOL,
  VARIABLE, CONSTANT, STRUCTURE, LABEL, PARAMETER, REPLACE,
  KEYWORD;

  /** Lower-case wire tag, e.g. "procedure". */
  public String tag() {
    return name().toLowerCase(Locale.ROOT);
  }
}
