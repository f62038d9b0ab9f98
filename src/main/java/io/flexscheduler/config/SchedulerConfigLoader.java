package io.flexscheduler.config;

import java.io.IOException;
import java.io.InputStream;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Properties;

/**
 * Loads SchedulerConfig from a properties file on the classpath.
 *
 * <p>Required keys: {@code flexscheduler.timerThreads}, {@code flexscheduler.dispatchThreads},
 * {@code flexscheduler.zone} and {@code flexscheduler.shutdownTimeoutMillis}.
 */
public final class SchedulerConfigLoader {

  /** The file read by {@link #load()}. */
  public static final String DEFAULT_FILE = "flexscheduler.properties";

  private SchedulerConfigLoader() {}

  /**
   * Loads {@value #DEFAULT_FILE}, or returns {@link SchedulerConfig#defaults()} when the file is
   * not on the classpath.
   */
  public static SchedulerConfig load() {
    if (SchedulerConfigLoader.class.getClassLoader().getResource(DEFAULT_FILE) == null) {
      return SchedulerConfig.defaults();
    }
    return loadFromClasspath(DEFAULT_FILE);
  }

  public static SchedulerConfig loadFromClasspath(String fileName) {
    Properties props = new Properties();

    try (InputStream in =
        SchedulerConfigLoader.class.getClassLoader().getResourceAsStream(fileName)) {
      if (in == null) {
        throw new IllegalStateException("Config file not found on classpath: " + fileName);
      }
      props.load(in);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to load config: " + fileName, e);
    }

    int timerThreads = getInt(props, "flexscheduler.timerThreads");
    int dispatchThreads = getInt(props, "flexscheduler.dispatchThreads");
    long shutdownTimeoutMillis = getInt(props, "flexscheduler.shutdownTimeoutMillis");
    ZoneId zone;
    try {
      zone = ZoneId.of(getString(props, "flexscheduler.zone").trim());
    } catch (DateTimeException e) {
      throw new IllegalStateException("Invalid flexscheduler.zone in " + fileName, e);
    }

    return new SchedulerConfig(
        timerThreads, dispatchThreads, zone, Duration.ofMillis(shutdownTimeoutMillis));
  }

  private static int getInt(Properties props, String key) {
    String value = getString(props, key).trim();
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new IllegalStateException("Config key " + key + " is not a number: " + value, e);
    }
  }

  private static String getString(Properties props, String key) {
    String value = props.getProperty(key);
    if (value == null) {
      throw new IllegalStateException("Missing required config key: " + key);
    }
    return value;
  }
}
