package ca.gc.cra.xssbench.application.port;

import ca.gc.cra.xssbench.domain.bench.BrowserEngine;

/**
 * Opens execution harnesses for one worker.
 *
 * <p>Each worker thread owns its own factory because browser automation drivers are not thread-safe;
 * closing the factory releases everything it opened.</p>
 *
 * @since 0.1.0
 */
public interface HarnessFactory extends AutoCloseable {
  /**
   * Launches a browser for {@code engine} and wraps it in a ready harness.
   *
   * @param engine engine to launch
   * @return idle harness
   * @throws BrowserLaunchException when the browser cannot be started
   */
  ExecutionHarness open(BrowserEngine engine) throws BrowserLaunchException;

  @Override
  void close();
}
