package ca.gc.cra.xssbench.application.bench;

import ca.gc.cra.xssbench.application.port.BrowserLaunchException;
import ca.gc.cra.xssbench.application.port.CancellationToken;
import ca.gc.cra.xssbench.application.port.HarnessFactory;
import ca.gc.cra.xssbench.application.port.ProgressListener;
import ca.gc.cra.xssbench.domain.bench.BenchCaseResult;
import ca.gc.cra.xssbench.domain.bench.BrowserEngine;
import ca.gc.cra.xssbench.domain.bench.Sanitizer;
import ca.gc.cra.xssbench.domain.vector.Vector;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Runs the whole matrix on the calling thread, reusing one session per engine.
 *
 * <p>Cases run browser by browser so each session sees a contiguous stream of cases. The session cleans up
 * after the previous payload at the start of every run.</p>
 */
final class SequentialBenchRunner {
  private static final Logger log = LoggerFactory.getLogger(SequentialBenchRunner.class);

  private final Supplier<HarnessFactory> harnessFactories;

  SequentialBenchRunner(Supplier<HarnessFactory> harnessFactories) {
    this.harnessFactories = Objects.requireNonNull(harnessFactories, "harnessFactories");
  }

  List<BenchCaseResult> run(
      BenchRequest request, CaseRunner caseRunner, ProgressListener listener, CancellationToken token)
      throws BrowserLaunchException, InterruptedException {
    MDC.put("pipeline", "bench");
    int total = request.totalCases();
    List<BenchCaseResult> results = new ArrayList<>(total);
    try (HarnessFactory factory = harnessFactories.get();
        SessionSet sessions = SessionSet.open(factory, request.browsers())) {
      log.info("Sequential run of {} cases across {} browser(s)", total, request.browsers().size());
      outer:
      for (BrowserEngine browser : request.browsers()) {
        MDC.put("browser", browser.wireName());
        for (Sanitizer sanitizer : request.sanitizers()) {
          for (Vector vector : request.vectors()) {
            if (Thread.currentThread().isInterrupted()) {
              token.cancel("interrupted");
              throw new InterruptedException("Benchmark interrupted after " + results.size() + " cases");
            }
            if (token.isCancelled()) {
              log.info("Sequential run stopped after {} cases: {}", results.size(), token.reason());
              break outer;
            }
            BenchCaseResult result = caseRunner.run(sanitizer, browser, vector, sessions.get(browser), token);
            results.add(result);
            listener.onCaseCompleted(results.size(), total, result);
            if (request.failFast() && result.executed()) {
              token.cancel("fail-fast: " + result.label());
              log.info("Fail-fast stop at {}", result.label());
              break outer;
            }
          }
        }
      }
    } finally {
      MDC.remove("browser");
      MDC.remove("pipeline");
    }
    return results;
  }
}
