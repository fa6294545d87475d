package ca.gc.cra.xssbench.infrastructure.browser;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.xssbench.application.harness.SessionSettings;
import ca.gc.cra.xssbench.application.port.CancellationToken;
import ca.gc.cra.xssbench.application.port.ClockPort;
import ca.gc.cra.xssbench.application.port.ExecutionHarness;
import ca.gc.cra.xssbench.application.port.MetricsPort;
import ca.gc.cra.xssbench.domain.bench.BrowserEngine;
import ca.gc.cra.xssbench.domain.harness.CaseRequest;
import ca.gc.cra.xssbench.domain.harness.VectorResult;
import ca.gc.cra.xssbench.domain.vector.PayloadContext;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIfSystemProperty;

/** Drives a real Chromium; run with {@code -Dxssbench.browserTests=true}. */
@EnabledIfSystemProperty(named = "xssbench.browserTests", matches = "true")
class PlaywrightHarnessFactorySmokeTest {

  @Test
  void detectsOnerrorAndPassesInertMarkup() throws Exception {
    try (PlaywrightHarnessFactory factory = new PlaywrightHarnessFactory(
            new PlaywrightBrowserLauncher(true), SessionSettings.defaults(), MetricsPort.NO_OP, ClockPort.SYSTEM);
        ExecutionHarness harness = factory.open(BrowserEngine.CHROMIUM)) {
      String payload = "<img src=x onerror=alert(1)>";
      VectorResult executed = harness.run(
          new CaseRequest(payload, payload, PayloadContext.HTML, 0), new CancellationToken());
      assertTrue(executed.executed(), executed.details());

      VectorResult inert = harness.run(
          new CaseRequest("<b>x</b>", "<b>x</b>", PayloadContext.HTML, 0), new CancellationToken());
      assertFalse(inert.executed(), inert.details());
    }
  }

  @Test
  void timerFromPreviousCaseDoesNotLeakIntoNextCase() throws Exception {
    try (PlaywrightHarnessFactory factory = new PlaywrightHarnessFactory(
            new PlaywrightBrowserLauncher(true), SessionSettings.defaults(), MetricsPort.NO_OP, ClockPort.SYSTEM);
        ExecutionHarness harness = factory.open(BrowserEngine.CHROMIUM)) {
      String timer = "setInterval(() => { try { location.href = 'http://xssbench.local/'; } catch (e) {} }, 5)";
      VectorResult reloading = harness.run(
          new CaseRequest(timer, timer, PayloadContext.JS, 50), new CancellationToken());
      assertTrue(reloading.executed(), reloading.details());

      // Let the interval fire a few more times before the next case loads.
      Thread.sleep(50);

      String payload = "<noscript onmouseout=\"alert(1)\">test</noscript>";
      VectorResult next = harness.run(
          new CaseRequest(payload, "test", PayloadContext.HTML, 0), new CancellationToken());
      assertFalse(next.executed(), next.details());
    }
  }
}
