package com.github.sherter.oftee.proxy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Applies the configured log level to the logging backend. */
final class LoggingConfigurator {

  private static final Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {}

  /**
   * Sets the root log level. A name that is not a known level selects {@code WARN}.
   *
   * @return the level that was applied, {@code null} if the backend is not Logback
   */
  static Level setLevel(String name) {
    Level level = Level.toLevel(name, null);
    if (level == null) {
      log.warn("unable to parse log level specified '{}', defaulting to 'warn'", name);
      level = Level.WARN;
    }
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext)) {
      log.warn(
          "log level {} requested but backend {} does not support dynamic level updates",
          level,
          factory.getClass().getName());
      return null;
    }
    ((LoggerContext) factory).getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
    return level;
  }
}
