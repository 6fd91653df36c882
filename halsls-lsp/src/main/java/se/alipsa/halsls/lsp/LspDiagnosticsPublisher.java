package se.alipsa.halsls.lsp;

import org.eclipse.lsp4j.PublishDiagnosticsParams;
import org.eclipse.lsp4j.services.LanguageClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.halsls.core.model.Diagnostic;
import se.alipsa.halsls.core.server.DiagnosticsPublisher;

import java.util.ArrayList;
import java.util.List;

/** Forwards core diagnostics to the connected client as {@code textDocument/publishDiagnostics}. */
final class LspDiagnosticsPublisher implements DiagnosticsPublisher {

  private static final Logger log = LoggerFactory.getLogger(LspDiagnosticsPublisher.class);

  private volatile LanguageClient client;

  void connect(LanguageClient client) {
    this.client = client;
  }

  @Override
  public void publish(String uri, List<Diagnostic> diagnostics) {
    LanguageClient c = client;
    if (c == null) {
      log.debug("No client connected, dropping {} diagnostics for {}", diagnostics.size(), uri);
      return;
    }
    var out = new ArrayList<org.eclipse.lsp4j.Diagnostic>(diagnostics.size());
    for (Diagnostic d : diagnostics) out.add(LspConverters.toLsp(d));
    c.publishDiagnostics(new PublishDiagnosticsParams(uri, out));
  }
}
