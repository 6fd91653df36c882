package se.alipsa.halsls.hals.analysis;

import java.util.Arrays;
import java.util.Collections;
import java.util.Locale;
import java.util.SortedSet;
import java.util.TreeSet;

/** Reserved words of HAL/S. Identifiers in this set are never references. */
public final class Keywords {
  private Keywords() {}

  private static final SortedSet<String> ALL = Collections.unmodifiableSortedSet(new TreeSet<>(Arrays.asList(
      // program units
      "PROGRAM", "PROCEDURE", "FUNCTION", "TASK", "COMPOOL", "UPDATE", "CLOSE", "RETURN",
      // declarations
      "DECLARE", "CONSTANT", "INITIAL", "STATIC", "AUTOMATIC", "TEMPORARY", "DENSE", "ALIGNED",
      "RIGID", "REMOTE", "ACCESS", "ASSIGN", "NAME", "LOCK", "EXCLUSIVE", "LATCHED", "REPLACE",
      "STRUCTURE", "ARRAY",
      // data types
      "INTEGER", "SCALAR", "VECTOR", "MATRIX", "BOOLEAN", "CHARACTER", "BIT", "EVENT",
      "SINGLE", "DOUBLE",
      // control flow
      "IF", "THEN", "ELSE", "DO", "END", "FOR", "TO", "BY", "WHILE", "UNTIL", "REPEAT", "EXIT",
      "GO", "GOTO", "CASE",
      // real time
      "SCHEDULE", "WAIT", "SIGNAL", "PRIORITY", "TERMINATE", "CANCEL", "SET", "RESET", "ON",
      "OFF", "ERROR", "DEPENDENT", "IGNORE",
      // i/o
      "READ", "READALL", "WRITE", "FILE",
      // operator words
      "NOT", "AND", "OR", "CAT", "MOD", "TRUE", "FALSE",
      // built-in functions
      "ABS", "CEILING", "FLOOR", "TRUNCATE", "ROUND", "ODD", "SIGN", "MAX", "MIN", "SUM", "PROD",
      "SHL", "SHR", "SIZE", "LENGTH", "INDEX", "MIDVAL", "RANDOM", "RANDOMG", "DATE", "RUNTIME",
      "CLOCKTIME", "PRIO", "NEXTIME",
      // math
      "SIN", "COS", "TAN", "ARCSIN", "ARCCOS", "ARCTAN", "ARCTAN2", "SINH", "COSH", "TANH",
      "EXP", "LOG", "SQRT",
      // vector and matrix
      "TRANSPOSE", "TRACE", "DET", "INVERSE", "IDENTITY", "UNIT", "ABVAL", "DOT", "CROSS"
  )));

  /** All keywords in alphabetical order. */
  public static SortedSet<String> all() {
    return ALL;
  }

  /** Case-insensitive membership test. */
  public static boolean isKeyword(String word) {
    return word != null && ALL.contains(word.toUpperCase(Locale.ROOT));
  }
}
