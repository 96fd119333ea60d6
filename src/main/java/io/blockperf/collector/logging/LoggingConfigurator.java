package io.blockperf.collector.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts collector logging at startup from CLI flags.
 * <p><strong>Why:</strong> Operators chasing a missing block sample need DEBUG output (discarded events, from-state
 * mismatches, sweeps) without editing {@code logback.xml}.</p>
 * <p><strong>Thread-safety:</strong> Intended for the CLI bootstrap thread.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings keep their defaults and a warning is logged.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Raises the root logger to DEBUG.
   *
   * @return {@code true} when the level was changed or already DEBUG
   */
  public static boolean enableVerboseLogging() {
    return setRootLevel(Level.DEBUG);
  }

  /**
   * Sets the root logger level by name, e.g. {@code INFO} or {@code TRACE}.
   *
   * @param levelName Logback level name; unknown names fall back to DEBUG
   * @return {@code true} when the backend accepted the change
   */
  public static boolean setRootLevel(String levelName) {
    return setRootLevel(Level.toLevel(levelName, Level.DEBUG));
  }

  private static boolean setRootLevel(Level level) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      if (!level.equals(root.getLevel())) {
        root.setLevel(level);
      }
      return true;
    }
    log.warn("Log level change to {} requested but backend {} does not support dynamic level updates",
        level, factory.getClass().getName());
    return false;
  }
}
