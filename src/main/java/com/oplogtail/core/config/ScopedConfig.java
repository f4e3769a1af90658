package com.oplogtail.core.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.cdimascio.dotenv.Dotenv;
import java.io.File;
import java.io.IOException;
import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ScopedConfig {

  private static final Logger log = LoggerFactory.getLogger(ScopedConfig.class);

  static final String COMMON_KEY = "common";
  static final String CONFIG_FILE = "oplogtail.json";

  private static final Dotenv dotenv;
  private static final Map<String, Map<String, String>> jsonConfig;
  private static volatile String activeProfile;

  static {
    dotenv = Dotenv.configure().directory(".").filename(".env").ignoreIfMissing().load();
    jsonConfig = loadJsonConfig(CONFIG_FILE);

    log.info("[Config] dotenv loaded: {} entries", dotenv.entries().size());
    log.info("[Config] json loaded: {} sections", jsonConfig.size());
  }

  private ScopedConfig() {}

  public static void activateProfile(String profile) {
    activeProfile = profile;
    log.info("[Config] active profile: {}", profile);
  }

  /** Resolution order: System property → env var → .env → JSON[activeProfile] → JSON[common] */
  public static String require(String key) {
    String value = resolve(key);
    if (value == null || value.isBlank()) {
      throw new IllegalStateException("Missing required config: " + key);
    }
    return value;
  }

  public static String getOrDefault(String key, String defaultValue) {
    String value = resolve(key);
    return (value != null && !value.isBlank()) ? value : defaultValue;
  }

  public static int getInt(String key, int defaultValue) {
    String value = resolve(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Config " + key + " is not an integer: " + value, e);
    }
  }

  public static boolean getBoolean(String key, boolean defaultValue) {
    String value = resolve(key);
    return (value != null && !value.isBlank()) ? Boolean.parseBoolean(value.trim()) : defaultValue;
  }

  /** Durations are configured in milliseconds. */
  public static Duration getMillis(String key, Duration defaultValue) {
    String value = resolve(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Duration.ofMillis(Long.parseLong(value.trim()));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Config " + key + " is not a millisecond value: " + value, e);
    }
  }

  public static boolean exists(String key) {
    String value = resolve(key);
    return value != null && !value.isBlank();
  }

  private static String resolve(String key) {
    String value = System.getProperty(key);
    if (value != null) return value;

    value = System.getenv(key);
    if (value != null) return value;

    value = dotenv.get(key);
    if (value != null) return value;

    if (activeProfile != null) {
      Map<String, String> profileSection = jsonConfig.get(activeProfile);
      if (profileSection != null) {
        value = profileSection.get(key);
        if (value != null) return value;
      }
    }

    Map<String, String> commonSection = jsonConfig.get(COMMON_KEY);
    if (commonSection != null) {
      value = commonSection.get(key);
      if (value != null) return value;
    }

    return null;
  }

  static Map<String, Map<String, String>> loadJsonConfig(String path) {
    File file = new File(path);
    if (!file.exists()) {
      return Collections.emptyMap();
    }
    try {
      ObjectMapper mapper = new ObjectMapper();
      return mapper.readValue(file, new TypeReference<>() {});
    } catch (IOException e) {
      log.error("[Config] Failed to load {}: {}", path, e.getMessage());
      return Collections.emptyMap();
    }
  }
}
