package com.onthegomap.tilegen.util;

import java.io.IOException;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Accessor for the build info inserted by maven into the {@code buildinfo.properties} file. */
public record BuildInfo(String version, String buildTime) {

  private static final Logger LOGGER = LoggerFactory.getLogger(BuildInfo.class);
  private static final String UNKNOWN = "unknown";

  private static final BuildInfo instance;
  static {
    BuildInfo result = new BuildInfo(UNKNOWN, null);
    try (var properties = BuildInfo.class.getResourceAsStream("/buildinfo.properties")) {
      if (properties != null) {
        var parsed = new Properties();
        parsed.load(properties);
        result = new BuildInfo(
          unfiltered(parsed.getProperty("version")) ? UNKNOWN : parsed.getProperty("version"),
          unfiltered(parsed.getProperty("timestamp")) ? null : parsed.getProperty("timestamp")
        );
      }
    } catch (IOException e) {
      LOGGER.error("Error getting build properties", e);
    }
    instance = result;
  }

  // running from an IDE without maven resource filtering leaves the ${...} placeholders in place
  private static boolean unfiltered(String value) {
    return value == null || value.isBlank() || value.startsWith("${");
  }

  /** Returns info inserted by maven at build-time into the {@code buildinfo.properties} file. */
  public static BuildInfo get() {
    return instance;
  }
}
