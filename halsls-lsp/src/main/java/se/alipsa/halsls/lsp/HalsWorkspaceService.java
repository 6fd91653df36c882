package se.alipsa.halsls.lsp;

import org.eclipse.lsp4j.DidChangeConfigurationParams;
import org.eclipse.lsp4j.DidChangeWatchedFilesParams;
import org.eclipse.lsp4j.services.WorkspaceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Workspace notifications are accepted; HAL/S analysis is per document. */
final class HalsWorkspaceService implements WorkspaceService {

  private static final Logger log = LoggerFactory.getLogger(HalsWorkspaceService.class);

  @Override
  public void didChangeConfiguration(DidChangeConfigurationParams params) {
    log.debug("Ignoring workspace/didChangeConfiguration");
  }

  @Override
  public void didChangeWatchedFiles(DidChangeWatchedFilesParams params) {
    log.debug("Ignoring workspace/didChangeWatchedFiles ({} changes)", params.getChanges().size());
  }
}
