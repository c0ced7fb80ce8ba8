package com.gentoro.factcheck.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Hands out SLF4J loggers and applies per-logger levels from the application configuration. */
public final class LoggingService {
  private static final Logger log = LoggerFactory.getLogger(LoggingService.class);
  private static final String LEVELS_PREFIX = "logging.level";

  private LoggingService() {}

  public static Logger getLogger(Class<?> clazz) {
    return LoggerFactory.getLogger(clazz);
  }

  /**
   * Every key below {@code logging.level} names a logger, {@code root} meaning the root logger:
   *
   * <pre>
   * logging:
   *   level:
   *     root: INFO
   *     org.eclipse.jetty: WARN
   * </pre>
   *
   * Blank or unknown levels are skipped. Without a logback binding nothing changes.
   */
  public static void applyConfiguration(Configuration cfg) {
    if (cfg == null) return;
    if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext ctx)) {
      log.warn("SLF4J is not bound to logback; keeping the default log levels");
      return;
    }
    Configuration levels = cfg.subset(LEVELS_PREFIX);
    Iterator<String> keys = levels.getKeys();
    while (keys.hasNext()) {
      String name = keys.next();
      String value = levels.getString(name, "");
      if (value.isBlank()) continue;
      String loggerName = "root".equalsIgnoreCase(name) ? Logger.ROOT_LOGGER_NAME : name;
      setLevel(ctx.getLogger(loggerName), value.trim());
    }
  }

  private static void setLevel(ch.qos.logback.classic.Logger logger, String value) {
    Level level = Level.toLevel(value, null);
    if (level == null) {
      log.warn("Ignoring unknown level '{}' for logger {}", value, logger.getName());
      return;
    }
    logger.setLevel(level);
    log.debug("Logger {} set to {}", logger.getName(), level);
  }
}
