package ca.gc.cra.xssbench.application.port;

/**
 * Raised when a harness run fails in a way that is not an execution signal.
 *
 * <p>The orchestrator records it as an {@code error} case and continues with the next case.</p>
 *
 * @since 0.1.0
 */
public class HarnessException extends Exception {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception.
   *
   * @param message description
   * @param cause underlying failure; may be {@code null}
   */
  public HarnessException(String message, Throwable cause) {
    super(message, cause);
  }
}
