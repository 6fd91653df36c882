package se.alipsa.halsls.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.halsls.core.model.*;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiFunction;

/** Default implementation of CoreFacade. */
public final class CoreEngine implements CoreFacade {

  private static final Logger log = LoggerFactory.getLogger(CoreEngine.class);

  private final PluginRegistry plugins;
  private final DocumentStore docs;

  /** Track which plugin currently owns a given URI. */
  private final Map<String, LanguagePlugin> pluginByUri = new ConcurrentHashMap<>();

  public CoreEngine(PluginRegistry plugins, DocumentStore docs) {
    this.plugins = Objects.requireNonNull(plugins);
    this.docs = Objects.requireNonNull(docs);
  }

  @Override
  public List<Diagnostic> openFile(String uri, String text) {
    docs.put(uri, text);
    return reindex(uri, text);
  }

  @Override
  public List<Diagnostic> changeFile(String uri, String text) {
    docs.put(uri, text);
    return reindex(uri, text);
  }

  @Override
  public void closeFile(String uri) {
    docs.remove(uri);
    var pl = pluginByUri.remove(uri);
    if (pl != null) {
      try {
        pl.forget(uri);
      } catch (RuntimeException e) {
        log.warn("Plugin {} failed to forget {}", pl.id(), uri, e);
      }
    }
  }

  @Override
  public List<Diagnostic> analyze(String uri) {
    String text = docs.get(uri);
    if (text == null) return List.of();
    return reindex(uri, text);
  }

  @Override
  public List<CompletionItem> completions(String uri, Position position) {
    return query(uri, "completions", List.of(), (pl, u) -> pl.completions(u, position));
  }

  @Override
  public Optional<Hover> hover(String uri, Position position) {
    return query(uri, "hover", Optional.empty(), (pl, u) -> pl.hover(u, position));
  }

  @Override
  public Optional<Location> definition(String uri, Position position) {
    return query(uri, "definition", Optional.empty(), (pl, u) -> pl.definition(u, position));
  }

  @Override
  public List<Location> references(String uri, Position position) {
    return query(uri, "references", List.of(), (pl, u) -> pl.references(u, position));
  }

  @Override
  public List<SymbolInfo> documentSymbols(String uri) {
    return query(uri, "documentSymbols", List.of(), LanguagePlugin::documentSymbols);
  }

  // --- internals --------------------------------------------------------------------------------

  private <T> T query(String uri, String what, T empty, BiFunction<LanguagePlugin, String, T> call) {
    var pl = pluginByUri.get(uri);
    if (pl == null) return empty;
    try {
      T result = call.apply(pl, uri);
      return result == null ? empty : result;
    } catch (RuntimeException e) {
      log.warn("Plugin {} failed to answer {} for {}", pl.id(), what, uri, e);
      return empty;
    }
  }

  private List<Diagnostic> reindex(String uri, String text) {
    var pluginOpt = plugins.forFile(uri, () -> TokenUtil.preview(text));
    if (pluginOpt.isEmpty()) {
      // Drop any stale owner for this file and report info diagnostic
      var stale = pluginByUri.remove(uri);
      if (stale != null) stale.forget(uri);
      return List.of(new Diagnostic(
          new Range(new Position(0,0), new Position(0,1)),
          "No plugin registered to handle " + uri,
          Diagnostic.Severity.INFORMATION,
          "core",
          "no-plugin"));
    }

    LanguagePlugin plugin = pluginOpt.get();
    pluginByUri.put(uri, plugin);

    log.debug("Indexing {} with plugin {}", uri, plugin.id());
    List<Diagnostic> diags;
    try {
      diags = plugin.index(uri, text);
    } catch (RuntimeException e) {
      log.warn("Plugin {} failed to index {}", plugin.id(), uri, e);
      diags = List.of(new Diagnostic(
          new Range(new Position(0,0), new Position(0,1)),
          "Plugin error: " + e.getMessage(),
          Diagnostic.Severity.ERROR,
          plugin.id(),
          "plugin-exception"));
    }
    return diags == null ? List.of() : diags;
  }
}
