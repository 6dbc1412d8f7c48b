package ca.gc.cra.logrelay.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts relay logging levels at startup.
 * <p><strong>Why:</strong> Operators raise verbosity with {@code --verbose} instead of editing {@code logback.xml}.</p>
 * <p><strong>Thread-safety:</strong> Intended for the CLI bootstrap thread.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings log a warning and keep their defaults.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Elevates the root logger level to DEBUG within the running JVM.
   */
  public static void enableVerboseLogging() {
    setLevel(org.slf4j.Logger.ROOT_LOGGER_NAME, Level.DEBUG);
  }

  /**
   * Sets the level of one logger.
   *
   * @param loggerName logger name, or {@code ROOT}
   * @param level new level
   * @return {@code true} if the backend accepted the change
   */
  public static boolean setLevel(String loggerName, Level level) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger logger = context.getLogger(loggerName);
      if (!level.equals(logger.getLevel())) {
        logger.setLevel(level);
      }
      return true;
    }
    log.warn("Log level change for {} requested but backend {} does not support dynamic level updates",
        loggerName, factory.getClass().getName());
    return false;
  }
}
