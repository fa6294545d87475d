package ca.gc.cra.xssbench.application.bench;

import ca.gc.cra.xssbench.application.port.BrowserLaunchException;
import ca.gc.cra.xssbench.application.port.ExecutionHarness;
import ca.gc.cra.xssbench.application.port.HarnessFactory;
import ca.gc.cra.xssbench.domain.bench.BrowserEngine;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One open harness per engine, owned by a single worker for the whole run.
 */
final class SessionSet implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(SessionSet.class);

  private final Map<BrowserEngine, ExecutionHarness> harnesses;

  private SessionSet(Map<BrowserEngine, ExecutionHarness> harnesses) {
    this.harnesses = harnesses;
  }

  /**
   * Opens every engine up front so a missing browser fails before any case runs.
   *
   * @param factory worker-owned factory
   * @param browsers engines to open
   * @return open sessions
   * @throws BrowserLaunchException when any engine fails to launch; already opened sessions are closed
   */
  static SessionSet open(HarnessFactory factory, List<BrowserEngine> browsers) throws BrowserLaunchException {
    Map<BrowserEngine, ExecutionHarness> opened = new EnumMap<>(BrowserEngine.class);
    SessionSet sessions = new SessionSet(opened);
    try {
      for (BrowserEngine browser : browsers) {
        opened.put(browser, factory.open(browser));
      }
    } catch (BrowserLaunchException | RuntimeException ex) {
      sessions.close();
      throw ex;
    }
    return sessions;
  }

  ExecutionHarness get(BrowserEngine browser) {
    ExecutionHarness harness = harnesses.get(browser);
    if (harness == null) {
      throw new IllegalStateException("No session open for " + browser.wireName());
    }
    return harness;
  }

  @Override
  public void close() {
    for (Map.Entry<BrowserEngine, ExecutionHarness> entry : harnesses.entrySet()) {
      try {
        entry.getValue().close();
      } catch (RuntimeException ex) {
        log.warn("Failed to close {} session", entry.getKey().wireName(), ex);
      }
    }
    harnesses.clear();
  }
}
