package se.alipsa.halsls.core.server;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.halsls.core.PluginEnvironment;

import java.util.Locale;

/** PluginEnvironment used by the in-proc server bootstrap; plugin log calls go to SLF4J. */
final class DefaultPluginEnvironment implements PluginEnvironment {

  private static final Logger log = LoggerFactory.getLogger("se.alipsa.halsls.plugin");

  @Override public void log(String level, String message, Throwable t) {
    switch (level == null ? "INFO" : level.toUpperCase(Locale.ROOT)) {
      case "ERROR" -> log.error(message, t);
      case "WARN", "WARNING" -> log.warn(message, t);
      case "DEBUG" -> log.debug(message, t);
      case "TRACE" -> log.trace(message, t);
      default -> log.info(message, t);
    }
  }
}
