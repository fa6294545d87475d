package ca.gc.cra.xssbench.application.port;

import ca.gc.cra.xssbench.domain.harness.CaseRequest;
import ca.gc.cra.xssbench.domain.harness.VectorResult;

/**
 * <strong>What:</strong> Renders one sanitized payload in a live browser and reports whether it executed or
 * leaked.
 * <p><strong>Role:</strong> Port between the case runner and the signal-capture session.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe. A harness is owned by one worker and its runs execute
 * strictly in submission order.</p>
 *
 * @since 0.1.0
 */
public interface ExecutionHarness extends AutoCloseable {
  /**
   * Runs one case.
   *
   * @param request payload, sanitized output, context and wait window
   * @param token run-wide cancellation; a cancelled token ends the wait window early
   * @return classified result
   * @throws HarnessException when the browser fails in a way that is not an execution signal
   */
  VectorResult run(CaseRequest request, CancellationToken token) throws HarnessException;

  /** Closes the underlying page and browser. */
  @Override
  void close();
}
