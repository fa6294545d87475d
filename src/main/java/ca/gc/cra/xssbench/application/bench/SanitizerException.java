package ca.gc.cra.xssbench.application.bench;

/**
 * Wraps any failure raised by a sanitizer adapter so it can be recorded as an {@code error} case.
 *
 * @since 0.1.0
 */
public final class SanitizerException extends Exception {
  private static final long serialVersionUID = 1L;

  private final String sanitizer;

  /**
   * Creates the exception.
   *
   * @param sanitizer name of the failing sanitizer
   * @param cause exception raised by the adapter
   */
  public SanitizerException(String sanitizer, Throwable cause) {
    super(cause.getClass().getSimpleName() + ": " + cause.getMessage(), cause);
    this.sanitizer = sanitizer;
  }

  /**
   * Returns the failing sanitizer.
   *
   * @return sanitizer name
   */
  public String sanitizer() {
    return sanitizer;
  }
}
