package ca.gc.cra.patmat.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts PATMAT logging verbosity at runtime.
 * <p><strong>Why:</strong> Lets embedding applications see why a call dispatched (or failed to) without
 * editing their logging configuration.</p>
 * <p><strong>Role:</strong> Utility bridging library switches to the logging backend.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Detect the active SLF4J implementation and adjust logger levels.</li>
 *   <li>Warn when the backend does not support dynamic level changes.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Methods synchronize via the underlying logging framework.</p>
 * <p><strong>Observability:</strong> Emits SLF4J warnings when dynamic configuration is unsupported.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings fall back to warning and retain defaults.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  /** Logger namespace covering the dispatch engine and registries. */
  public static final String DISPATCH_LOGGER = "ca.gc.cra.patmat.application.dispatch";

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Elevates the root logger level to DEBUG within the running JVM.
   *
   * @return {@code true} when the level was applied
   */
  public static boolean enableVerboseLogging() {
    return setLevel(org.slf4j.Logger.ROOT_LOGGER_NAME, Level.DEBUG);
  }

  /**
   * Elevates the dispatch loggers to TRACE so every candidate decision is logged.
   *
   * @return {@code true} when the level was applied
   */
  public static boolean enableDispatchTracing() {
    return setLevel(DISPATCH_LOGGER, Level.TRACE);
  }

  private static boolean setLevel(String loggerName, Level level) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger logger = context.getLogger(loggerName);
      if (!level.equals(logger.getLevel())) {
        logger.setLevel(level);
      }
      return true;
    }
    log.warn("Logger level change for {} requested but backend {} does not support dynamic level updates",
        loggerName, factory.getClass().getName());
    return false;
  }
}
