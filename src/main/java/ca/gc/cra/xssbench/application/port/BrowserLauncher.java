package ca.gc.cra.xssbench.application.port;

import ca.gc.cra.xssbench.domain.bench.BrowserEngine;

/**
 * Launches isolated browser pages. One launcher serves one thread.
 *
 * @since 0.1.0
 */
public interface BrowserLauncher extends AutoCloseable {
  /**
   * Starts a browser process for {@code engine} and opens a single page in it.
   *
   * @param engine engine to launch
   * @return new page owned by the caller
   * @throws BrowserLaunchException when the engine is missing or fails to start
   */
  BrowserPage launch(BrowserEngine engine) throws BrowserLaunchException;

  /** Releases the automation driver and any browser still open. */
  @Override
  void close();
}
