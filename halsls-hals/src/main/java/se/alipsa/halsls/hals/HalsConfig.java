package se.alipsa.halsls.hals;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Settings of the HAL/S analysis, read from {@code halsls-config.yml}.
 * <p>
 * The file is looked up at the path in the {@code halsls.config} system property, or in the
 * working directory when the property is not set. A missing file gives the defaults.
 */
public final class HalsConfig {

  private static final Logger log = LoggerFactory.getLogger(HalsConfig.class);

  public static final String CONFIG_FILE_NAME = "halsls-config.yml";
  public static final String CONFIG_PROPERTY = "halsls.config";

  private static final boolean DEFAULT_PRESERVE_LINE_NUMBERS = true;
  private static final int DEFAULT_LABEL_LOOKAHEAD = 20;
  private static final String DEFAULT_SERVER_VERSION = "1.0.0";

  private final boolean preserveLineNumbers;
  private final int labelLookahead;
  private final String serverVersion;

  private HalsConfig(boolean preserveLineNumbers, int labelLookahead, String serverVersion) {
    this.preserveLineNumbers = preserveLineNumbers;
    this.labelLookahead = labelLookahead;
    this.serverVersion = serverVersion;
  }

  /**
   * Whether dropped continuation lines and removed multi-line comments leave empty lines
   * behind, so that analysis positions match the lines of the editor buffer.
   */
  public boolean isPreserveLineNumbers() {
    return preserveLineNumbers;
  }

  /** Characters after a label's colon that are searched for a program-unit keyword. */
  public int getLabelLookahead() {
    return labelLookahead;
  }

  public String getServerVersion() {
    return serverVersion;
  }

  public static HalsConfig defaults() {
    return new HalsConfig(DEFAULT_PRESERVE_LINE_NUMBERS, DEFAULT_LABEL_LOOKAHEAD, DEFAULT_SERVER_VERSION);
  }

  public static HalsConfig with(boolean preserveLineNumbers, int labelLookahead) {
    int effectiveLookahead = labelLookahead > 0 ? labelLookahead : DEFAULT_LABEL_LOOKAHEAD;
    return new HalsConfig(preserveLineNumbers, effectiveLookahead, DEFAULT_SERVER_VERSION);
  }

  public static HalsConfig load() {
    String override = System.getProperty(CONFIG_PROPERTY);
    Path configPath = (override == null || override.isBlank()) ? Paths.get(CONFIG_FILE_NAME) : Paths.get(override);
    return load(configPath);
  }

  public static HalsConfig load(Path configPath) {
    if (configPath == null || !Files.exists(configPath)) {
      return defaults();
    }

    try {
      ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
      YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
      if (yamlConfig != null) {
        boolean effectivePreserve = yamlConfig.preserveLineNumbers != null
            ? yamlConfig.preserveLineNumbers
            : DEFAULT_PRESERVE_LINE_NUMBERS;
        int effectiveLookahead = (yamlConfig.labelLookahead != null && yamlConfig.labelLookahead > 0)
            ? yamlConfig.labelLookahead
            : DEFAULT_LABEL_LOOKAHEAD;
        String effectiveVersion = (yamlConfig.serverVersion != null && !yamlConfig.serverVersion.isBlank())
            ? yamlConfig.serverVersion
            : DEFAULT_SERVER_VERSION;
        log.debug("Loaded {} from {}", CONFIG_FILE_NAME, configPath);
        return new HalsConfig(effectivePreserve, effectiveLookahead, effectiveVersion);
      }
    } catch (IOException e) {
      log.warn("Could not read {}, using defaults: {}", configPath, e.getMessage());
    }

    return defaults();
  }

  @Override
  public String toString() {
    return "HalsConfig{preserveLineNumbers=" + preserveLineNumbers
        + ", labelLookahead=" + labelLookahead
        + ", serverVersion='" + serverVersion + "'}";
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  static final class YamlConfig {
    public Boolean preserveLineNumbers;
    public Integer labelLookahead;
    public String serverVersion;
  }
}
