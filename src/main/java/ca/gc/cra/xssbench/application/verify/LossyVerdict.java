package ca.gc.cra.xssbench.application.verify;

import java.util.Objects;

/**
 * Outcome of a markup shape check.
 *
 * @param lossy whether the sanitizer stripped or reshaped expected markup
 * @param details explanation; empty when not lossy
 * @since 0.1.0
 */
public record LossyVerdict(boolean lossy, String details) {
  /** Verdict for output whose shape matches, or was not checked. */
  public static final LossyVerdict INTACT = new LossyVerdict(false, "");

  public LossyVerdict {
    details = Objects.requireNonNullElse(details, "");
  }

  static LossyVerdict lossy(String details) {
    return new LossyVerdict(true, details);
  }
}
