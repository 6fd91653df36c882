package se.alipsa.halsls.lsp;

import org.eclipse.lsp4j.jsonrpc.Launcher;
import org.eclipse.lsp4j.launch.LSPLauncher;
import org.eclipse.lsp4j.services.LanguageClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.halsls.hals.HalsConfig;

import java.util.concurrent.ExecutionException;

/** Runs the server over stdin/stdout. Logging goes to stderr. */
public final class HalsLanguageServerLauncher {

  private static final Logger log = LoggerFactory.getLogger(HalsLanguageServerLauncher.class);

  private HalsLanguageServerLauncher() {}

  public static void main(String[] args) {
    HalsConfig config = HalsConfig.load();
    HalsLanguageServer server = new HalsLanguageServer(config, System::exit);

    Launcher<LanguageClient> launcher = LSPLauncher.createServerLauncher(server, System.in, System.out);
    server.connect(launcher.getRemoteProxy());
    log.info("Starting {} {} on stdio", HalsLanguageServer.SERVER_NAME, config.getServerVersion());

    try {
      launcher.startListening().get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while listening", e);
    } catch (ExecutionException e) {
      log.error("Message loop failed", e.getCause());
      System.exit(1);
    }
  }
}
