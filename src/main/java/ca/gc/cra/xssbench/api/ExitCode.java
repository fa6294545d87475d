package ca.gc.cra.xssbench.api;

/**
 * <strong>What:</strong> Process exit codes of the benchmark CLI.
 * <p><strong>Why:</strong> CI jobs gate on the status alone: execution found, cases that could not be judged,
 * or a setup failure each need a distinct value.</p>
 * <p><strong>Precedence:</strong> When a run has both executed cases and errors or lossy cases,
 * {@link #CASE_FAILURES} is reported. A fail-fast stop reports {@link #EXECUTION_DETECTED}.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** No execution, no errors and no lossy cases. */
  SUCCESS(0),
  /** At least one case executed script. */
  EXECUTION_DETECTED(1),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** At least one case ended in {@code error} or was lossy. */
  CASE_FAILURES(2),
  /** IO failure occurred while running the CLI. */
  IO_ERROR(3),
  /** Configuration was missing or malformed. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure, including a browser that could not be launched. */
  RUNTIME_FAILURE(5),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value encoded by this exit code.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
