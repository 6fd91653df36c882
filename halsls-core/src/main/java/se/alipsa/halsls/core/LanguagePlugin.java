package se.alipsa.halsls.core;

import se.alipsa.halsls.core.model.*;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

public interface LanguagePlugin {

  /** Unique, stable identifier, e.g. "hals". */
  String id();

  /** Human-friendly name, e.g. "HAL/S". */
  default String displayName() { return id(); }

  /** File extensions (lowercase, no dot), e.g. ["hal", "hals"]. */
  Set<String> fileExtensions();

  /**
   * Claim how confident you are that you handle this file. 0.0 = not mine, 1.0 = certainly mine.
   * Core calls this when it needs to choose a plugin. Use URI and a cheap content peek.
   */
  default double claim(String fileUri, Supplier<CharSequence> contentPreview) {
    String ext = fileUri.contains(".") ? fileUri.substring(fileUri.lastIndexOf('.') + 1).toLowerCase() : "";
    return fileExtensions().contains(ext) ? 0.9 : 0.0; // extensions win by default
  }

  /** Called once after registration; plugins can cache references to core services. */
  default void configure(PluginEnvironment env) {}

  /** Analyze the full text of a file, replacing whatever was known about it. Return diagnostics. */
  List<Diagnostic> index(String fileUri, String content);

  /** Language-specific completions. */
  default List<CompletionItem> completions(String fileUri, Position position) { return List.of(); }

  default Optional<Hover> hover(String fileUri, Position position) { return Optional.empty(); }

  /** Declaration of the symbol under the cursor. */
  default Optional<Location> definition(String fileUri, Position position) { return Optional.empty(); }

  /** Every occurrence of the symbol under the cursor, declaration included. */
  default List<Location> references(String fileUri, Position position) { return List.of(); }

  /** Outline of the file. */
  default List<SymbolInfo> documentSymbols(String fileUri) { return List.of(); }

  /** Forget any cached state for file. */
  default void forget(String fileUri) {}

}
