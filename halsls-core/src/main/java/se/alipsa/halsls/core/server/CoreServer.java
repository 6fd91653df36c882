package se.alipsa.halsls.core.server;

import se.alipsa.halsls.core.*;
import se.alipsa.halsls.core.model.*;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process server façade for super-fast local usage.
 * - Delegates to CoreEngine
 * - Publishes diagnostics via DiagnosticsPublisher
 */
public final class CoreServer implements CoreFacade, AutoCloseable {

  private final CoreEngine engine;
  private final PluginRegistry registry;
  private final DiagnosticsPublisher publisher;

  // open documents, so close() can release them
  private final Set<String> openUris = ConcurrentHashMap.newKeySet();

  private CoreServer(CoreEngine engine, PluginRegistry registry, DiagnosticsPublisher publisher) {
    this.engine = Objects.requireNonNull(engine);
    this.registry = Objects.requireNonNull(registry);
    this.publisher = Objects.requireNonNullElse(publisher, DiagnosticsPublisher.NO_OP);
  }

  /** Build a CoreServer with sensible defaults and plugins discovered via ServiceLoader. */
  public static CoreServer createDefault(DiagnosticsPublisher publisher) {
    PluginRegistry registry = new PluginRegistry(new DefaultPluginEnvironment());
    return create(registry, new DocumentStore(), publisher);
  }

  /** Build a CoreServer with exactly the given plugins, nothing discovered. */
  public static CoreServer createWith(DiagnosticsPublisher publisher, LanguagePlugin... plugins) {
    PluginRegistry registry = new PluginRegistry(new DefaultPluginEnvironment(), false);
    for (LanguagePlugin p : plugins) registry.register(p);
    return create(registry, new DocumentStore(), publisher);
  }

  /** Advanced factory in case you want to supply your own pieces (tests, custom logging, etc.). */
  public static CoreServer create(PluginRegistry registry,
                                  DocumentStore docs,
                                  DiagnosticsPublisher publisher) {
    CoreEngine engine = new CoreEngine(registry, docs);
    return new CoreServer(engine, registry, publisher);
  }

  public PluginRegistry plugins() {
    return registry;
  }

  // --- CoreFacade (delegates + publishes diagnostics) -------------------------------------------

  @Override
  public List<Diagnostic> openFile(String uri, String text) {
    openUris.add(uri);
    List<Diagnostic> diags = engine.openFile(uri, text);
    publisher.publish(uri, diags);
    return diags;
  }

  @Override
  public List<Diagnostic> changeFile(String uri, String text) {
    openUris.add(uri);
    List<Diagnostic> diags = engine.changeFile(uri, text);
    publisher.publish(uri, diags);
    return diags;
  }

  @Override
  public void closeFile(String uri) {
    openUris.remove(uri);
    engine.closeFile(uri);
    publisher.publish(uri, List.of()); // clear diagnostics
  }

  @Override
  public List<Diagnostic> analyze(String uri) {
    List<Diagnostic> diags = engine.analyze(uri);
    publisher.publish(uri, diags);
    return diags;
  }

  @Override
  public List<CompletionItem> completions(String uri, Position position) {
    return engine.completions(uri, position);
  }

  @Override
  public Optional<Hover> hover(String uri, Position position) {
    return engine.hover(uri, position);
  }

  @Override
  public Optional<Location> definition(String uri, Position position) {
    return engine.definition(uri, position);
  }

  @Override
  public List<Location> references(String uri, Position position) {
    return engine.references(uri, position);
  }

  @Override
  public List<SymbolInfo> documentSymbols(String uri) {
    return engine.documentSymbols(uri);
  }

  // --- Lifecycle --------------------------------------------------------------------------------

  @Override
  public void close() {
    for (String uri : List.copyOf(openUris)) {
      engine.closeFile(uri);
    }
    openUris.clear();
  }
}
