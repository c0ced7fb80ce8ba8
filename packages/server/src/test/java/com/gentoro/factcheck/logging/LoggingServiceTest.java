package com.gentoro.factcheck.logging;

import static org.junit.jupiter.api.Assertions.*;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingServiceTest {

  private static Logger logback(String name) {
    return (Logger) LoggerFactory.getLogger(name);
  }

  @AfterEach
  void resetLevels() {
    logback("com.gentoro.factcheck.sample").setLevel(null);
    logback("com.gentoro.factcheck.other").setLevel(null);
  }

  @Test
  void appliesLevelsPerLoggerName() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.addProperty("logging.level.com.gentoro.factcheck.sample", "DEBUG");
    cfg.addProperty("logging.level.com.gentoro.factcheck.other", " error ");

    LoggingService.applyConfiguration(cfg);

    assertEquals(Level.DEBUG, logback("com.gentoro.factcheck.sample").getLevel());
    assertEquals(Level.ERROR, logback("com.gentoro.factcheck.other").getLevel());
  }

  @Test
  void unknownLevelsAreSkipped() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.addProperty("logging.level.com.gentoro.factcheck.sample", "LOUD");

    LoggingService.applyConfiguration(cfg);
    LoggingService.applyConfiguration(null);

    assertNull(logback("com.gentoro.factcheck.sample").getLevel());
  }
}
