package com.gentoro.graphdb.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single entry point for obtaining loggers and applying level overrides from configuration.
 *
 * <p>Levels are read from keys below {@code logging.level}, e.g.
 *
 * <pre>{@code
 * logging:
 *   level:
 *     root: WARN
 *     com.gentoro.graphdb.storage: DEBUG
 * }</pre>
 *
 * <p>Overrides only take effect when Logback is the bound SLF4J backend.
 */
public final class LoggingService {
  static final String LEVEL_PREFIX = "logging.level";

  private static final Logger log = LoggerFactory.getLogger(LoggingService.class);

  private LoggingService() {}

  public static Logger getLogger(Class<?> type) {
    return LoggerFactory.getLogger(type);
  }

  /**
   * Apply {@code logging.level.*} entries to the Logback context.
   *
   * @return number of loggers whose level was changed
   */
  public static int applyConfiguration(Configuration configuration) {
    if (configuration == null) return 0;
    if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
      log.debug("Logback is not the active SLF4J backend; skipping level overrides");
      return 0;
    }
    int applied = 0;
    Iterator<String> keys = configuration.getKeys(LEVEL_PREFIX);
    while (keys.hasNext()) {
      String key = keys.next();
      if (key.length() <= LEVEL_PREFIX.length() + 1) continue;
      String value = configuration.getString(key);
      Level level = Level.toLevel(value, null);
      // Dots inside YAML keys come back escaped as ".." from the hierarchical configuration.
      String loggerName = key.substring(LEVEL_PREFIX.length() + 1).replace("..", ".");
      if (level == null) {
        log.warn("Ignoring unknown log level '{}' for logger '{}'", value, loggerName);
        continue;
      }
      String target = "root".equalsIgnoreCase(loggerName) ? Logger.ROOT_LOGGER_NAME : loggerName;
      context.getLogger(target).setLevel(level);
      log.trace("Logger '{}' set to {}", target, level);
      applied++;
    }
    return applied;
  }
}
