package ca.gc.cra.xssbench.infrastructure.browser;

import ca.gc.cra.xssbench.application.harness.SessionSettings;
import ca.gc.cra.xssbench.application.harness.SignalCaptureSession;
import ca.gc.cra.xssbench.application.port.BrowserLaunchException;
import ca.gc.cra.xssbench.application.port.BrowserLauncher;
import ca.gc.cra.xssbench.application.port.BrowserPage;
import ca.gc.cra.xssbench.application.port.ClockPort;
import ca.gc.cra.xssbench.application.port.ExecutionHarness;
import ca.gc.cra.xssbench.application.port.HarnessFactory;
import ca.gc.cra.xssbench.application.port.MetricsPort;
import ca.gc.cra.xssbench.application.port.PageActionException;
import ca.gc.cra.xssbench.domain.bench.BrowserEngine;
import java.util.Objects;

/**
 * Opens signal-capture sessions on pages from a worker-owned {@link BrowserLauncher}.
 *
 * @since 0.1.0
 */
public final class PlaywrightHarnessFactory implements HarnessFactory {
  private final BrowserLauncher launcher;
  private final SessionSettings settings;
  private final MetricsPort metrics;
  private final ClockPort clock;

  /**
   * Creates a factory.
   *
   * @param launcher launcher owned by this factory; closed with it
   * @param settings session timeouts
   * @param metrics metrics sink shared by all sessions
   * @param clock time source
   */
  public PlaywrightHarnessFactory(
      BrowserLauncher launcher, SessionSettings settings, MetricsPort metrics, ClockPort clock) {
    this.launcher = Objects.requireNonNull(launcher, "launcher");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
    this.clock = Objects.requireNonNullElse(clock, ClockPort.SYSTEM);
  }

  @Override
  public ExecutionHarness open(BrowserEngine engine) throws BrowserLaunchException {
    BrowserPage page = launcher.launch(engine);
    try {
      return SignalCaptureSession.open(page, engine, settings, metrics, clock);
    } catch (PageActionException ex) {
      page.close();
      throw new BrowserLaunchException(engine, "Failed to instrument " + engine.wireName() + " page: "
          + ex.getMessage(), ex);
    }
  }

  @Override
  public void close() {
    launcher.close();
  }
}
