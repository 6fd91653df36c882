package se.alipsa.halsls.lsp;

import org.eclipse.lsp4j.CompletionItem;
import org.eclipse.lsp4j.CompletionList;
import org.eclipse.lsp4j.CompletionParams;
import org.eclipse.lsp4j.DefinitionParams;
import org.eclipse.lsp4j.DidChangeTextDocumentParams;
import org.eclipse.lsp4j.DidCloseTextDocumentParams;
import org.eclipse.lsp4j.DidOpenTextDocumentParams;
import org.eclipse.lsp4j.DidSaveTextDocumentParams;
import org.eclipse.lsp4j.DocumentSymbol;
import org.eclipse.lsp4j.DocumentSymbolParams;
import org.eclipse.lsp4j.Hover;
import org.eclipse.lsp4j.HoverParams;
import org.eclipse.lsp4j.Location;
import org.eclipse.lsp4j.LocationLink;
import org.eclipse.lsp4j.ReferenceParams;
import org.eclipse.lsp4j.SymbolInformation;
import org.eclipse.lsp4j.TextDocumentContentChangeEvent;
import org.eclipse.lsp4j.TextDocumentItem;
import org.eclipse.lsp4j.jsonrpc.messages.Either;
import org.eclipse.lsp4j.services.TextDocumentService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.halsls.core.model.SymbolInfo;
import se.alipsa.halsls.core.server.CoreServer;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Document synchronization and queries, answered by the core server.
 * <p>
 * Results are computed on the calling (message reader) thread and returned as completed
 * futures, so a query always sees the text of every notification received before it.
 */
final class HalsTextDocumentService implements TextDocumentService {

  private static final Logger log = LoggerFactory.getLogger(HalsTextDocumentService.class);

  private final CoreServer core;

  HalsTextDocumentService(CoreServer core) {
    this.core = core;
  }

  @Override
  public void didOpen(DidOpenTextDocumentParams params) {
    TextDocumentItem doc = params.getTextDocument();
    log.debug("Opened {}", doc.getUri());
    core.openFile(doc.getUri(), doc.getText());
  }

  @Override
  public void didChange(DidChangeTextDocumentParams params) {
    String uri = params.getTextDocument().getUri();
    List<TextDocumentContentChangeEvent> changes = params.getContentChanges();
    if (changes == null || changes.isEmpty()) return;
    // full sync: each change carries the whole text, the last one is current
    core.changeFile(uri, changes.get(changes.size() - 1).getText());
  }

  @Override
  public void didSave(DidSaveTextDocumentParams params) {
    String uri = params.getTextDocument().getUri();
    if (params.getText() == null) {
      log.debug("Saved {} without text, nothing to re-analyze", uri);
      return;
    }
    core.changeFile(uri, params.getText());
  }

  @Override
  public void didClose(DidCloseTextDocumentParams params) {
    String uri = params.getTextDocument().getUri();
    log.debug("Closed {}", uri);
    core.closeFile(uri);
  }

  @Override
  public CompletableFuture<Either<List<CompletionItem>, CompletionList>> completion(CompletionParams params) {
    var items = new ArrayList<CompletionItem>();
    for (var c : core.completions(params.getTextDocument().getUri(), LspConverters.toCore(params.getPosition()))) {
      items.add(LspConverters.toLsp(c));
    }
    return CompletableFuture.completedFuture(Either.forLeft(items));
  }

  @Override
  public CompletableFuture<Hover> hover(HoverParams params) {
    Hover hover = core.hover(params.getTextDocument().getUri(), LspConverters.toCore(params.getPosition()))
        .map(LspConverters::toLsp)
        .orElse(null);
    return CompletableFuture.completedFuture(hover);
  }

  @Override
  public CompletableFuture<Either<List<? extends Location>, List<? extends LocationLink>>> definition(DefinitionParams params) {
    List<Location> locations = core.definition(params.getTextDocument().getUri(), LspConverters.toCore(params.getPosition()))
        .map(l -> List.of(LspConverters.toLsp(l)))
        .orElse(List.of());
    return CompletableFuture.completedFuture(Either.forLeft(locations));
  }

  @Override
  public CompletableFuture<List<? extends Location>> references(ReferenceParams params) {
    var out = new ArrayList<Location>();
    for (var l : core.references(params.getTextDocument().getUri(), LspConverters.toCore(params.getPosition()))) {
      out.add(LspConverters.toLsp(l));
    }
    return CompletableFuture.completedFuture(out);
  }

  @Override
  public CompletableFuture<List<Either<SymbolInformation, DocumentSymbol>>> documentSymbol(DocumentSymbolParams params) {
    var out = new ArrayList<Either<SymbolInformation, DocumentSymbol>>();
    for (SymbolInfo s : core.documentSymbols(params.getTextDocument().getUri())) {
      out.add(Either.forRight(LspConverters.toLsp(s)));
    }
    return CompletableFuture.completedFuture(out);
  }
}
