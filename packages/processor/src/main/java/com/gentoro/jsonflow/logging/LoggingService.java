package com.gentoro.jsonflow.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Central access point for loggers. Components obtain their logger through {@link
 * #getLogger(Class)} so that levels can be adjusted from {@code application.yaml} in one place.
 */
public final class LoggingService {
  static final String LIBRARY_PACKAGE = "com.gentoro.jsonflow";

  private LoggingService() {}

  public static Logger getLogger(Class<?> type) {
    return LoggerFactory.getLogger(type);
  }

  /**
   * Apply log levels from configuration. Recognized keys:
   *
   * <ul>
   *   <li>{@code logging.level} - level of the root logger
   *   <li>{@code logging.processor-level} - level of the library's own loggers
   * </ul>
   *
   * Unknown level names fall back to {@code INFO}. Does nothing when Logback is not the bound
   * SLF4J backend.
   */
  public static void applyConfiguration(Configuration configuration) {
    if (configuration == null) {
      return;
    }
    if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
      getLogger(LoggingService.class)
          .debug("Logback is not the active SLF4J backend; skipping level configuration");
      return;
    }

    String rootLevel = configuration.getString("logging.level", null);
    if (StringUtils.isNotBlank(rootLevel)) {
      context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(Level.toLevel(rootLevel, Level.INFO));
    }
    String processorLevel = configuration.getString("logging.processor-level", null);
    if (StringUtils.isNotBlank(processorLevel)) {
      context.getLogger(LIBRARY_PACKAGE).setLevel(Level.toLevel(processorLevel, Level.INFO));
    }
  }
}
