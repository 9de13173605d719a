package com.github.sherter.oftee.proxy;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {

  private final Logger root =
      ((LoggerContext) LoggerFactory.getILoggerFactory())
          .getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
  private final Level original = root.getLevel();

  @AfterEach
  void restoreLevel() {
    root.setLevel(original);
  }

  @Test
  void knownLevelIsApplied() {
    assertEquals(Level.ERROR, LoggingConfigurator.setLevel("error"));
    assertEquals(Level.ERROR, root.getLevel());
  }

  @Test
  void levelNamesAreCaseInsensitive() {
    assertEquals(Level.TRACE, LoggingConfigurator.setLevel("TRACE"));
  }

  @Test
  void unknownLevelFallsBackToWarn() {
    assertEquals(Level.WARN, LoggingConfigurator.setLevel("loud"));
    assertEquals(Level.WARN, root.getLevel());
  }
}
