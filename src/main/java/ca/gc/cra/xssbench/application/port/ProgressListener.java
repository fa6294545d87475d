package ca.gc.cra.xssbench.application.port;

import ca.gc.cra.xssbench.domain.bench.BenchCaseResult;

/**
 * Receives progress while a benchmark runs. Always invoked from the orchestrating thread.
 *
 * @since 0.1.0
 */
public interface ProgressListener {
  /**
   * Called after each case result is folded into the run.
   *
   * @param done cases completed so far
   * @param total planned cases
   * @param result latest result
   */
  void onCaseCompleted(int done, int total, BenchCaseResult result);

  /**
   * Called for run-level status lines such as worker start-up.
   *
   * @param message status text
   */
  default void onStatus(String message) {}

  /** Listener that ignores everything. */
  ProgressListener NONE = (done, total, result) -> {};
}
