package ca.gc.cra.xssbench.application.bench;

import ca.gc.cra.xssbench.application.port.BrowserLaunchException;
import ca.gc.cra.xssbench.application.port.CancellationToken;
import ca.gc.cra.xssbench.application.port.ClockPort;
import ca.gc.cra.xssbench.application.port.HarnessFactory;
import ca.gc.cra.xssbench.application.port.MetricsPort;
import ca.gc.cra.xssbench.application.port.ProgressListener;
import ca.gc.cra.xssbench.application.render.DocumentRenderer;
import ca.gc.cra.xssbench.application.verify.LossyVerifier;
import ca.gc.cra.xssbench.domain.bench.BenchCaseResult;
import ca.gc.cra.xssbench.domain.bench.BenchSummary;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Runs the sanitizer x browser x vector matrix and folds the results into a
 * {@link BenchSummary}.
 * <p><strong>Why:</strong> Single entry point for both execution models; callers only choose a worker count.</p>
 * <p><strong>Role:</strong> Application use case invoked by the {@code run} command.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Pick sequential mode for one effective worker and parallel mode otherwise.</li>
 *   <li>Build the shared {@link CaseRunner} for the request's timeout policy.</li>
 *   <li>Abort before any case runs when no browser can be launched.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Runs are independent; each call creates its own cancellation token
 * unless the caller supplies one.</p>
 *
 * @since 0.1.0
 */
public final class BenchmarkOrchestrator {
  private static final Logger log = LoggerFactory.getLogger(BenchmarkOrchestrator.class);

  private final SequentialBenchRunner sequential;
  private final ParallelBenchRunner parallel;
  private final LossyVerifier verifier;
  private final DocumentRenderer renderer;
  private final MetricsPort metrics;
  private final ClockPort clock;

  /**
   * Creates an orchestrator.
   *
   * @param harnessFactories creates one factory per worker; each factory is closed by the worker that
   *     obtained it
   * @param metrics metrics sink
   * @param clock time source
   */
  public BenchmarkOrchestrator(Supplier<HarnessFactory> harnessFactories, MetricsPort metrics, ClockPort clock) {
    Objects.requireNonNull(harnessFactories, "harnessFactories");
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
    this.clock = Objects.requireNonNullElse(clock, ClockPort.SYSTEM);
    this.sequential = new SequentialBenchRunner(harnessFactories);
    this.parallel = new ParallelBenchRunner(harnessFactories, this.metrics, this.clock);
    this.verifier = new LossyVerifier();
    this.renderer = new DocumentRenderer();
  }

  /**
   * Runs the benchmark with a fresh cancellation token.
   *
   * @param request run inputs
   * @param listener progress callback, invoked on the calling thread
   * @return summary of every case that ran
   * @throws BrowserLaunchException when no browser session can be launched
   * @throws InterruptedException when the calling thread is interrupted
   */
  public BenchSummary run(BenchRequest request, ProgressListener listener)
      throws BrowserLaunchException, InterruptedException {
    return run(request, listener, new CancellationToken());
  }

  /**
   * Runs the benchmark under a caller-owned cancellation token.
   *
   * @param request run inputs
   * @param listener progress callback, invoked on the calling thread
   * @param token cancellation shared with the caller
   * @return summary of every case that ran
   * @throws BrowserLaunchException when no browser session can be launched
   * @throws InterruptedException when the calling thread is interrupted
   */
  public BenchSummary run(BenchRequest request, ProgressListener listener, CancellationToken token)
      throws BrowserLaunchException, InterruptedException {
    Objects.requireNonNull(request, "request");
    Objects.requireNonNull(token, "token");
    ProgressListener progress = Objects.requireNonNullElse(listener, ProgressListener.NONE);
    CaseRunner caseRunner = new CaseRunner(verifier, renderer, request.timeoutMs(), metrics, clock);

    long start = clock.nowMillis();
    log.info("Benchmark starting: {} vectors x {} sanitizers x {} browsers = {} cases ({} mode)",
        request.vectors().size(), request.sanitizers().size(), request.browsers().size(),
        request.totalCases(), request.parallel() ? "parallel" : "sequential");
    List<BenchCaseResult> results = request.parallel()
        ? parallel.run(request, caseRunner, progress, token)
        : sequential.run(request, caseRunner, progress, token);
    BenchSummary summary = BenchSummary.fromResults(results);
    log.info("Benchmark finished in {} ms: {} cases, {} executed, {} leaks, {} errors, {} lossy, {} skipped",
        clock.nowMillis() - start, summary.totalCases(), summary.totalExecuted(), summary.totalExternal(),
        summary.totalErrors(), summary.totalLossy(), summary.totalSkipped());
    return summary;
  }
}
