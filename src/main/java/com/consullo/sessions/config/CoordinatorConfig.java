package com.consullo.sessions.config;

import com.consullo.sessions.workspace.TabLayoutConfig;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Coordinator configuration values.
 *
 * @param averageTabWidth upper bound for an ideal tab width
 * @param minimumTabWidth smallest usable tab width
 * @param autoRearrangeTabs pack tabs after every workspace membership change
 * @param defaultColumns columns of a newly created window's screen
 * @param defaultRows rows of a newly created window's screen
 * @param maxHistoryLines scrollback kept per screen
 * @param defaultShell shell used by default-shell and login-shell sessions
 * @param keepWindowOpenOnExit keep dead sessions for respawn instead of disposing them
 * @param useTabs add new windows to the active workspace instead of a workspace of their own
 * @since 1.0
 */
public record CoordinatorConfig(
    double averageTabWidth,
    double minimumTabWidth,
    boolean autoRearrangeTabs,
    int defaultColumns,
    int defaultRows,
    int maxHistoryLines,
    String defaultShell,
    boolean keepWindowOpenOnExit,
    boolean useTabs) implements PreferenceStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(CoordinatorConfig.class);

  /** Classpath resource read by {@link #load()}. */
  public static final String RESOURCE = "coordinator.properties";

  private static final String PREFIX = "coordinator.";

  public CoordinatorConfig {
    if (defaultColumns <= 0 || defaultRows <= 0) {
      throw new IllegalArgumentException("defaultColumns/defaultRows must be positive.");
    }
    if (maxHistoryLines <= 0) {
      throw new IllegalArgumentException("maxHistoryLines must be positive.");
    }
    if (StringUtils.isBlank(defaultShell)) {
      throw new IllegalArgumentException("defaultShell must not be blank.");
    }
    // validates the widths
    new TabLayoutConfig(averageTabWidth, minimumTabWidth);
  }

  /**
   * Built-in defaults. The shell comes from {@code $SHELL}, falling back to {@code /bin/sh}.
   *
   * @return default configuration
   */
  public static CoordinatorConfig defaults() {
    String shell = StringUtils.defaultIfBlank(System.getenv("SHELL"), "/bin/sh");
    return new CoordinatorConfig(320, 48, true, 80, 24, 10_000, shell, false, true);
  }

  /**
   * Reads {@code coordinator.*} keys, using {@link #defaults()} for missing ones.
   *
   * @param properties source properties
   * @return configuration
   */
  public static CoordinatorConfig fromProperties(Properties properties) {
    CoordinatorConfig d = defaults();
    return new CoordinatorConfig(
            readDouble(properties, "averageTabWidth", d.averageTabWidth()),
            readDouble(properties, "minimumTabWidth", d.minimumTabWidth()),
            readBoolean(properties, "autoRearrangeTabs", d.autoRearrangeTabs()),
            readInt(properties, "defaultColumns", d.defaultColumns()),
            readInt(properties, "defaultRows", d.defaultRows()),
            readInt(properties, "maxHistoryLines", d.maxHistoryLines()),
            StringUtils.defaultIfBlank(properties.getProperty(PREFIX + "defaultShell"), d.defaultShell()),
            readBoolean(properties, "keepWindowOpenOnExit", d.keepWindowOpenOnExit()),
            readBoolean(properties, "useTabs", d.useTabs()));
  }

  /**
   * Reads the {@value #RESOURCE} classpath resource, or returns the defaults if it is absent.
   *
   * @return configuration
   */
  public static CoordinatorConfig load() {
    Properties properties = new Properties();
    try (InputStream in = CoordinatorConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
      if (in == null) {
        LOGGER.info("No {} on the classpath, using defaults", RESOURCE);
        return defaults();
      }
      properties.load(in);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed reading " + RESOURCE, e);
    }
    return fromProperties(properties);
  }

  /**
   * @return tab packing constants derived from this configuration
   */
  public TabLayoutConfig tabLayout() {
    return new TabLayoutConfig(averageTabWidth, minimumTabWidth);
  }

  private static double readDouble(Properties properties, String key, double fallback) {
    String value = properties.getProperty(PREFIX + key);
    if (StringUtils.isBlank(value)) {
      return fallback;
    }
    try {
      return Double.parseDouble(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid number for " + PREFIX + key + ": " + value, e);
    }
  }

  private static int readInt(Properties properties, String key, int fallback) {
    String value = properties.getProperty(PREFIX + key);
    if (StringUtils.isBlank(value)) {
      return fallback;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid integer for " + PREFIX + key + ": " + value, e);
    }
  }

  private static boolean readBoolean(Properties properties, String key, boolean fallback) {
    String value = properties.getProperty(PREFIX + key);
    return StringUtils.isBlank(value) ? fallback : Boolean.parseBoolean(value.trim());
  }
}
