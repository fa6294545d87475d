package ca.gc.cra.xssbench.application.port;

import ca.gc.cra.xssbench.domain.bench.BrowserEngine;
import java.util.Objects;

/**
 * Raised when a browser session cannot be started; aborts a run before any case executes.
 *
 * @since 0.1.0
 */
public class BrowserLaunchException extends Exception {
  private static final long serialVersionUID = 1L;

  private final BrowserEngine engine;

  /**
   * Creates an exception.
   *
   * @param engine engine that failed to launch
   * @param message description
   * @param cause underlying failure; may be {@code null}
   */
  public BrowserLaunchException(BrowserEngine engine, String message, Throwable cause) {
    super(message, cause);
    this.engine = Objects.requireNonNull(engine, "engine");
  }

  /**
   * Returns the engine that failed.
   *
   * @return engine
   */
  public BrowserEngine engine() {
    return engine;
  }
}
