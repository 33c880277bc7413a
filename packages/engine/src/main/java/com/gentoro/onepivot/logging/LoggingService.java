package com.gentoro.onepivot.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Central access point for engine loggers.
 *
 * <p>All engine classes obtain their logger through {@link #getLogger(Class)}, so levels can be
 * tuned from the engine configuration via {@link #applyConfiguration(Configuration)} without
 * touching {@code logback.xml}.
 */
public final class LoggingService {
  static final String LEVELS_PREFIX = "logging.levels";

  private LoggingService() {}

  public static Logger getLogger(Class<?> type) {
    return LoggerFactory.getLogger(type);
  }

  /**
   * Apply {@code logging.levels.<logger-name>: <LEVEL>} entries to the Logback context. Unknown
   * level names fall back to {@code DEBUG} (Logback's own rule); a non-Logback SLF4J binding is
   * left untouched.
   */
  public static void applyConfiguration(Configuration configuration) {
    if (configuration == null) {
      return;
    }
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      getLogger(LoggingService.class)
          .debug("SLF4J binding is not Logback; skipping level configuration");
      return;
    }
    Configuration levels = configuration.subset(LEVELS_PREFIX);
    for (Iterator<String> it = levels.getKeys(); it.hasNext(); ) {
      String loggerName = it.next();
      String level = levels.getString(loggerName);
      if (level == null || level.isBlank()) {
        continue;
      }
      // hierarchical (YAML) sources escape dots inside a key as ".."
      context.getLogger(loggerName.replace("..", ".")).setLevel(Level.toLevel(level.trim()));
    }
  }
}
