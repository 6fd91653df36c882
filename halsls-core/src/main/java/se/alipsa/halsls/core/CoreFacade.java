package se.alipsa.halsls.core;

import se.alipsa.halsls.core.model.*;

import java.util.List;
import java.util.Optional;

/** Transport-agnostic API that both the in-proc server and the LSP adapter call. */
public interface CoreFacade {

  /** Open (or replace) a file’s content. Triggers (re)indexing. */
  List<Diagnostic> openFile(String uri, String text);

  /** Update a file’s content with its full new text. Triggers (re)indexing. */
  List<Diagnostic> changeFile(String uri, String text);

  /** Close a file and discard caches and diagnostics. */
  void closeFile(String uri);

  /** (Re)analyze the current content of a file. */
  List<Diagnostic> analyze(String uri);

  /** Language-specific completions at a position. */
  List<CompletionItem> completions(String uri, Position position);

  /** Hover text for the token at a position. */
  Optional<Hover> hover(String uri, Position position);

  /** Go to definition for the token at a position. */
  Optional<Location> definition(String uri, Position position);

  /** All references to the token at a position. */
  List<Location> references(String uri, Position position);

  /** Outline of a file, ordered by declaration line. */
  List<SymbolInfo> documentSymbols(String uri);
}
