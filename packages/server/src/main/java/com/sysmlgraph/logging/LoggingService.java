package com.sysmlgraph.logging;

import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Central place to obtain SLF4J loggers and apply configured log levels. */
public final class LoggingService {
  private static final Logger log = LoggerFactory.getLogger(LoggingService.class);

  private LoggingService() {}

  public static Logger getLogger(Class<?> clazz) {
    return LoggerFactory.getLogger(clazz);
  }

  /**
   * Apply logging levels from application configuration.
   *
   * <p>Expected YAML structure: logging: level: root: INFO com.sysmlgraph.mapping: DEBUG
   *
   * @return number of loggers whose level was changed
   */
  public static int applyConfiguration(Configuration cfg) {
    if (cfg == null) return 0;
    int applied = 0;
    try {
      ch.qos.logback.classic.LoggerContext ctx =
          (ch.qos.logback.classic.LoggerContext) LoggerFactory.getILoggerFactory();

      String rootLvl = cfg.getString("logging.level.root", null);
      if (rootLvl != null && !rootLvl.isBlank()) {
        if (setLevel(ctx.getLogger(Logger.ROOT_LOGGER_NAME), rootLvl)) applied++;
      }

      Configuration levels = cfg.subset("logging.level");
      if (levels != null) {
        Iterator<String> it = levels.getKeys();
        while (it.hasNext()) {
          String key = it.next();
          if ("root".equalsIgnoreCase(key)) continue;
          String lvl = levels.getString(key, null);
          if (lvl == null || lvl.isBlank()) continue;
          if (setLevel(ctx.getLogger(key), lvl)) applied++;
        }
      }
    } catch (ClassCastException e) {
      log.warn("Logback is not the active SLF4J backend; keeping logback.xml settings", e);
    }
    return applied;
  }

  private static boolean setLevel(ch.qos.logback.classic.Logger logger, String levelStr) {
    if (logger == null || levelStr == null) return false;
    ch.qos.logback.classic.Level level =
        ch.qos.logback.classic.Level.toLevel(levelStr.trim(), null);
    if (level == null) {
      log.warn("Unknown log level '{}'; ignoring for logger {}", levelStr, logger.getName());
      return false;
    }
    logger.setLevel(level);
    log.debug("Set logger '{}' to level {}", logger.getName(), level);
    return true;
  }
}
