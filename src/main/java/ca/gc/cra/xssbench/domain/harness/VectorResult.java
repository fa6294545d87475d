package ca.gc.cra.xssbench.domain.harness;

import java.util.Objects;

/**
 * Outcome of one low-level harness run, produced exactly once per case.
 *
 * @param executed whether script execution was observed
 * @param signal leak hint; always {@link ExecutionSignal#NONE} when {@code executed}
 * @param details human-readable explanation
 * @since 0.1.0
 */
public record VectorResult(boolean executed, ExecutionSignal signal, String details) {
  /** Details reported when nothing fired. */
  public static final String NO_EXECUTION = "No execution detected";

  public VectorResult {
    signal = Objects.requireNonNullElse(signal, ExecutionSignal.NONE);
    details = Objects.requireNonNullElse(details, "");
    if (executed && signal != ExecutionSignal.NONE) {
      throw new IllegalArgumentException("executed results cannot carry a leak signal");
    }
  }

  /**
   * Creates an execution verdict.
   *
   * @param details explanation
   * @return executed result
   */
  public static VectorResult executed(String details) {
    return new VectorResult(true, ExecutionSignal.NONE, details);
  }

  /**
   * Creates a leak verdict.
   *
   * @param details explanation
   * @return non-executed result with {@link ExecutionSignal#HTTP_LEAK}
   */
  public static VectorResult leak(String details) {
    return new VectorResult(false, ExecutionSignal.HTTP_LEAK, details);
  }

  /**
   * Creates a pass verdict.
   *
   * @return result reporting {@link #NO_EXECUTION}
   */
  public static VectorResult pass() {
    return new VectorResult(false, ExecutionSignal.NONE, NO_EXECUTION);
  }

  /**
   * Indicates whether the run observed a leak.
   *
   * @return {@code true} when {@link #signal()} is {@link ExecutionSignal#HTTP_LEAK}
   */
  public boolean leaked() {
    return signal == ExecutionSignal.HTTP_LEAK;
  }
}
