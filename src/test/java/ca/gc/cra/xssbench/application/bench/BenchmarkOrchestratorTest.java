package ca.gc.cra.xssbench.application.bench;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.xssbench.application.port.BrowserLaunchException;
import ca.gc.cra.xssbench.application.port.ProgressListener;
import ca.gc.cra.xssbench.domain.bench.BenchCaseResult;
import ca.gc.cra.xssbench.domain.bench.BenchSummary;
import ca.gc.cra.xssbench.domain.bench.BrowserEngine;
import ca.gc.cra.xssbench.domain.bench.CaseOutcome;
import ca.gc.cra.xssbench.domain.bench.Sanitizer;
import ca.gc.cra.xssbench.domain.harness.VectorResult;
import ca.gc.cra.xssbench.domain.vector.PayloadContext;
import ca.gc.cra.xssbench.domain.vector.Vector;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class BenchmarkOrchestratorTest {
  private static final Sanitizer NOOP = Sanitizer.universal("noop", "", (html, context) -> html);
  private static final Sanitizer STRIP = Sanitizer.universal("strip", "", (html, context) -> "");

  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final List<FakeHarnessFactory> factories = new CopyOnWriteArrayList<>();

  private BenchmarkOrchestrator orchestrator(FakeHarness.Behaviour behaviour) {
    return new BenchmarkOrchestrator(() -> {
      FakeHarnessFactory factory = new FakeHarnessFactory(behaviour);
      factories.add(factory);
      return factory;
    }, metrics, null);
  }

  private static BenchRequest request(
      List<Vector> vectors, List<Sanitizer> sanitizers, List<BrowserEngine> browsers, int workers,
      boolean failFast, long workerTaskTimeoutSec) {
    return new BenchRequest(vectors, sanitizers, browsers, OptionalLong.of(0), workers, failFast, 0,
        workerTaskTimeoutSec);
  }

  private static final class RecordingListener implements ProgressListener {
    final List<Integer> done = new CopyOnWriteArrayList<>();
    final List<String> statuses = new CopyOnWriteArrayList<>();

    @Override
    public void onCaseCompleted(int done, int total, BenchCaseResult result) {
      this.done.add(done);
    }

    @Override
    public void onStatus(String message) {
      statuses.add(message);
    }
  }

  @Test
  void sequentialRunCoversMatrixInBrowserSanitizerVectorOrder() throws Exception {
    RecordingListener listener = new RecordingListener();

    BenchSummary summary = orchestrator(FakeHarness.ALWAYS_PASS).run(
        request(BenchRequestTest.vectors(2), List.of(NOOP, STRIP),
            List.of(BrowserEngine.CHROMIUM, BrowserEngine.FIREFOX), 1, false, 0),
        listener);

    assertEquals(8, summary.totalCases());
    assertEquals(List.of(1, 2, 3, 4, 5, 6, 7, 8), listener.done);
    List<String> labels = summary.results().stream().map(BenchCaseResult::label).toList();
    assertEquals("noop / chromium / v0 (html)", labels.get(0));
    assertEquals("noop / chromium / v1 (html)", labels.get(1));
    assertEquals("strip / chromium / v0 (html)", labels.get(2));
    assertEquals("noop / firefox / v0 (html)", labels.get(4));

    assertEquals(1, factories.size());
    FakeHarnessFactory factory = factories.get(0);
    assertTrue(factory.closed);
    assertEquals(2, factory.opened.size());
    assertTrue(factory.opened.stream().allMatch(harness -> harness.closed));
  }

  @Test
  void sequentialFailFastStopsAtFirstExecution() throws Exception {
    List<Vector> vectors = List.of(
        Vector.unchecked("safe", "<b>x</b>", PayloadContext.HTML),
        Vector.unchecked("hit", "<svg onload=alert(1)>", PayloadContext.HTML),
        Vector.unchecked("later", "<img onerror=alert(2)>", PayloadContext.HTML));

    BenchSummary summary = orchestrator(FakeHarness.ALERT_EXECUTES).run(
        request(vectors, List.of(NOOP), List.of(BrowserEngine.CHROMIUM), 1, true, 0), null);

    assertEquals(2, summary.totalCases());
    assertEquals(1, summary.totalExecuted());
    assertEquals("hit", summary.firstExecuted().orElseThrow().vectorId());
  }

  @Test
  void sequentialLaunchFailureAbortsAndClosesOpenedSessions() {
    BenchmarkOrchestrator orchestrator = new BenchmarkOrchestrator(() -> {
      FakeHarnessFactory factory = new FakeHarnessFactory(FakeHarness.ALWAYS_PASS);
      factory.failingEngine = BrowserEngine.WEBKIT;
      factories.add(factory);
      return factory;
    }, metrics, null);

    BrowserLaunchException ex = assertThrows(BrowserLaunchException.class, () -> orchestrator.run(
        request(BenchRequestTest.vectors(1), List.of(NOOP),
            List.of(BrowserEngine.CHROMIUM, BrowserEngine.WEBKIT), 1, false, 0),
        ProgressListener.NONE));

    assertEquals(BrowserEngine.WEBKIT, ex.engine());
    assertTrue(factories.get(0).opened.get(0).closed);
    assertTrue(factories.get(0).closed);
  }

  @Test
  void parallelRunCoversEveryCaseOnce() throws Exception {
    RecordingListener listener = new RecordingListener();

    BenchSummary summary = orchestrator(FakeHarness.ALWAYS_PASS).run(
        request(BenchRequestTest.vectors(6), List.of(NOOP),
            List.of(BrowserEngine.CHROMIUM, BrowserEngine.FIREFOX), 2, false, 60),
        listener);

    assertEquals(12, summary.totalCases());
    Set<String> labels = new HashSet<>();
    for (BenchCaseResult result : summary.results()) {
      assertEquals(CaseOutcome.PASS, result.outcome());
      labels.add(result.label());
    }
    assertEquals(12, labels.size());
    assertEquals(12, listener.done.size());
    assertEquals(12, listener.done.get(11).intValue());
    assertTrue(listener.statuses.get(0).startsWith("[0/12] starting 2 workers"), listener.statuses.get(0));
    assertEquals(2, factories.size());
    assertTrue(factories.stream().allMatch(factory -> factory.closed));
  }

  @Test
  void parallelFailFastReportsTheHit() throws Exception {
    List<Vector> vectors = new ArrayList<>(BenchRequestTest.vectors(8));
    vectors.set(3, Vector.unchecked("hit", "<svg onload=alert(1)>", PayloadContext.HTML));

    BenchSummary summary = orchestrator(FakeHarness.ALERT_EXECUTES).run(
        request(vectors, List.of(NOOP), List.of(BrowserEngine.CHROMIUM), 2, true, 60), null);

    assertEquals("hit", summary.firstExecuted().orElseThrow().vectorId());
    assertTrue(summary.totalCases() <= 8);
  }

  @Test
  void parallelFailFastNeverReportsInterruptedCaseAsPass() throws Exception {
    CountDownLatch slowStarted = new CountDownLatch(1);
    FakeHarness.Behaviour behaviour = (request, token) -> {
      if (request.sanitizedHtml().contains("alert")) {
        try {
          slowStarted.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
        }
        return VectorResult.executed("Executed: hook:alert:1");
      }
      slowStarted.countDown();
      while (!token.isCancelled()) {
        try {
          Thread.sleep(5);
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
          break;
        }
      }
      return VectorResult.pass();
    };
    List<Vector> vectors = List.of(
        Vector.unchecked("slow", "<b>x</b>", PayloadContext.HTML),
        Vector.unchecked("hit", "<svg onload=alert(1)>", PayloadContext.HTML));

    BenchSummary summary = orchestrator(behaviour).run(
        request(vectors, List.of(NOOP), List.of(BrowserEngine.CHROMIUM), 2, true, 60), null);

    assertEquals("hit", summary.firstExecuted().orElseThrow().vectorId());
    for (BenchCaseResult result : summary.results()) {
      if (result.vectorId().equals("slow")) {
        assertEquals(CaseOutcome.ERROR, result.outcome(), result.details());
        assertTrue(result.details().startsWith("Cancelled before the wait window completed (fail-fast:"));
      }
    }
  }

  @Test
  void parallelStallFailsPendingCases() throws Exception {
    FakeHarness.Behaviour hang = (request, token) -> {
      while (!token.isCancelled()) {
        try {
          Thread.sleep(10);
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
          break;
        }
      }
      return VectorResult.pass();
    };

    BenchSummary summary = orchestrator(hang).run(
        request(BenchRequestTest.vectors(2), List.of(NOOP), List.of(BrowserEngine.CHROMIUM), 2, false, 1),
        null);

    assertEquals(2, summary.totalCases());
    assertEquals(2, summary.totalErrors());
    assertEquals("Parallel run stalled (no completed chunks for 1s)", summary.results().get(0).details());
    assertEquals(1, metrics.count("bench.parallel.stall"));
  }

  @Test
  void parallelWorkerCrashFailsPendingCases() throws Exception {
    BenchmarkOrchestrator orchestrator = new BenchmarkOrchestrator(() -> {
      FakeHarnessFactory factory = new FakeHarnessFactory(FakeHarness.ALWAYS_PASS);
      factory.openFailure = new IllegalStateException("driver died");
      return factory;
    }, metrics, null);

    BenchSummary summary = orchestrator.run(
        request(BenchRequestTest.vectors(3), List.of(NOOP), List.of(BrowserEngine.CHROMIUM), 2, false, 60),
        null);

    assertEquals(3, summary.totalCases());
    assertEquals(3, summary.totalErrors());
    assertEquals("Worker crashed (IllegalStateException: driver died)", summary.results().get(0).details());
    assertTrue(metrics.count("bench.parallel.crash") >= 1);
  }

  @Test
  void parallelLaunchFailureBeforeAnyWorkerStartsIsRaised() {
    BenchmarkOrchestrator orchestrator = new BenchmarkOrchestrator(() -> {
      FakeHarnessFactory factory = new FakeHarnessFactory(FakeHarness.ALWAYS_PASS);
      factory.failingEngine = BrowserEngine.FIREFOX;
      return factory;
    }, metrics, null);

    assertThrows(BrowserLaunchException.class, () -> orchestrator.run(
        request(BenchRequestTest.vectors(4), List.of(NOOP), List.of(BrowserEngine.FIREFOX), 2, false, 60),
        null));
  }

  @Test
  void emptyCorpusProducesEmptySummary() throws Exception {
    BenchSummary summary = orchestrator(FakeHarness.ALWAYS_PASS).run(
        request(List.of(), List.of(NOOP), List.of(BrowserEngine.CHROMIUM), 4, false, 0), null);

    assertEquals(0, summary.totalCases());
    assertFalse(summary.firstExecuted().isPresent());
  }
}
