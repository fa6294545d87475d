package ca.gc.cra.xssbench.application.port;

import java.util.Objects;

/**
 * Raised by {@link BrowserPage} when a page action fails.
 *
 * <p>The {@link Kind} lets the session map failures onto named state transitions instead of inspecting
 * messages.</p>
 *
 * @since 0.1.0
 */
public class PageActionException extends Exception {
  private static final long serialVersionUID = 1L;

  /** Failure categories the session reacts to. */
  public enum Kind {
    /** The action did not complete within its timeout. */
    TIMEOUT,
    /** A navigation tore down the execution context the action ran in. */
    CONTEXT_DESTROYED,
    /** Any other failure. */
    OTHER
  }

  private final Kind kind;

  /**
   * Creates an exception.
   *
   * @param kind failure category
   * @param message description
   * @param cause underlying automation failure; may be {@code null}
   */
  public PageActionException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  /**
   * Returns the failure category.
   *
   * @return kind
   */
  public Kind kind() {
    return kind;
  }
}
