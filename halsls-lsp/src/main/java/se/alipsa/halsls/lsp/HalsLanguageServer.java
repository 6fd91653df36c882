package se.alipsa.halsls.lsp;

import org.eclipse.lsp4j.CompletionOptions;
import org.eclipse.lsp4j.InitializeParams;
import org.eclipse.lsp4j.InitializeResult;
import org.eclipse.lsp4j.InitializedParams;
import org.eclipse.lsp4j.MessageParams;
import org.eclipse.lsp4j.MessageType;
import org.eclipse.lsp4j.SaveOptions;
import org.eclipse.lsp4j.ServerCapabilities;
import org.eclipse.lsp4j.ServerInfo;
import org.eclipse.lsp4j.TextDocumentSyncKind;
import org.eclipse.lsp4j.TextDocumentSyncOptions;
import org.eclipse.lsp4j.jsonrpc.messages.Either;
import org.eclipse.lsp4j.services.LanguageClient;
import org.eclipse.lsp4j.services.LanguageClientAware;
import org.eclipse.lsp4j.services.LanguageServer;
import org.eclipse.lsp4j.services.TextDocumentService;
import org.eclipse.lsp4j.services.WorkspaceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.halsls.core.server.CoreServer;
import se.alipsa.halsls.hals.HalsConfig;
import se.alipsa.halsls.hals.HalsPlugin;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.IntConsumer;

/** The HAL/S language server: lifecycle and capabilities, with document work delegated to the core server. */
public final class HalsLanguageServer implements LanguageServer, LanguageClientAware {

  private static final Logger log = LoggerFactory.getLogger(HalsLanguageServer.class);

  public static final String SERVER_NAME = "HAL/S Language Server";
  static final String READY_MESSAGE = "[HAL/S] " + SERVER_NAME + " ready";

  private final HalsConfig config;
  private final IntConsumer exitHandler;
  private final LspDiagnosticsPublisher publisher = new LspDiagnosticsPublisher();
  private final CoreServer core;
  private final HalsTextDocumentService textDocuments;
  private final HalsWorkspaceService workspace = new HalsWorkspaceService();

  private volatile LanguageClient client;
  private volatile boolean shutdown;

  /**
   * @param config analysis settings and the reported server version
   * @param exitHandler receives the process exit code on {@code exit}
   */
  public HalsLanguageServer(HalsConfig config, IntConsumer exitHandler) {
    this.config = Objects.requireNonNull(config, "config");
    this.exitHandler = Objects.requireNonNull(exitHandler, "exitHandler");
    this.core = CoreServer.createWith(publisher, HalsPlugin.forAllDocuments(config));
    this.textDocuments = new HalsTextDocumentService(core);
  }

  @Override
  public void connect(LanguageClient client) {
    this.client = client;
    publisher.connect(client);
  }

  @Override
  public CompletableFuture<InitializeResult> initialize(InitializeParams params) {
    log.info("Initializing {} {}", SERVER_NAME, config.getServerVersion());
    return CompletableFuture.completedFuture(
        new InitializeResult(capabilities(), new ServerInfo(SERVER_NAME, config.getServerVersion())));
  }

  @Override
  public void initialized(InitializedParams params) {
    LanguageClient c = client;
    if (c != null) c.logMessage(new MessageParams(MessageType.Info, READY_MESSAGE));
  }

  @Override
  public CompletableFuture<Object> shutdown() {
    log.info("Shutdown requested");
    shutdown = true;
    core.close();
    return CompletableFuture.completedFuture(null);
  }

  @Override
  public void exit() {
    int code = shutdown ? 0 : 1;
    log.info("Exiting with code {}", code);
    exitHandler.accept(code);
  }

  @Override
  public TextDocumentService getTextDocumentService() {
    return textDocuments;
  }

  @Override
  public WorkspaceService getWorkspaceService() {
    return workspace;
  }

  boolean isShutdown() {
    return shutdown;
  }

  static ServerCapabilities capabilities() {
    TextDocumentSyncOptions sync = new TextDocumentSyncOptions();
    sync.setOpenClose(true);
    sync.setChange(TextDocumentSyncKind.Full);
    sync.setSave(Either.forRight(new SaveOptions(true)));

    ServerCapabilities caps = new ServerCapabilities();
    caps.setTextDocumentSync(Either.forRight(sync));
    caps.setCompletionProvider(new CompletionOptions(false, List.of(".", ":", " ")));
    caps.setHoverProvider(true);
    caps.setDefinitionProvider(true);
    caps.setReferencesProvider(true);
    caps.setDocumentSymbolProvider(true);
    return caps;
  }
}
