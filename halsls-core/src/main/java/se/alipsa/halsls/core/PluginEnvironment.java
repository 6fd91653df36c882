package se.alipsa.halsls.core;

public interface PluginEnvironment {
  void log(String level, String message, Throwable t);
}
