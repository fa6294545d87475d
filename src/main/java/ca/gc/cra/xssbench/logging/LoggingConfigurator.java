package ca.gc.cra.xssbench.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Switches the benchmark to verbose logging for {@code --verbose} runs.
 *
 * <p>Verbose output shows session phase changes and every classifier decision on stderr. Call it from the CLI
 * thread before workers start.</p>
 *
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {}

  /**
   * Lowers the root Logback threshold to DEBUG.
   *
   * @return {@code false} when the SLF4J backend is not Logback and nothing changed
   */
  public static boolean enableVerboseLogging() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      log.warn("--verbose ignored: logging backend {} is not Logback", factory.getClass().getName());
      return false;
    }
    ch.qos.logback.classic.Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
    if (root.getLevel() != Level.DEBUG) {
      root.setLevel(Level.DEBUG);
      log.debug("Root log level raised to DEBUG");
    }
    return true;
  }
}
