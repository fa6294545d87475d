package ca.gc.cra.xssbench.application.bench;

import ca.gc.cra.xssbench.application.bench.SanitizerInputs.PreparedInput;
import ca.gc.cra.xssbench.application.harness.TimeoutPolicy;
import ca.gc.cra.xssbench.application.port.CancellationToken;
import ca.gc.cra.xssbench.application.port.ClockPort;
import ca.gc.cra.xssbench.application.port.ExecutionHarness;
import ca.gc.cra.xssbench.application.port.HarnessException;
import ca.gc.cra.xssbench.application.port.MetricsPort;
import ca.gc.cra.xssbench.application.render.DocumentRenderer;
import ca.gc.cra.xssbench.application.verify.LossyVerdict;
import ca.gc.cra.xssbench.application.verify.LossyVerifier;
import ca.gc.cra.xssbench.domain.bench.BenchCaseResult;
import ca.gc.cra.xssbench.domain.bench.BrowserEngine;
import ca.gc.cra.xssbench.domain.bench.CaseOutcome;
import ca.gc.cra.xssbench.domain.bench.Sanitizer;
import ca.gc.cra.xssbench.domain.harness.CaseRequest;
import ca.gc.cra.xssbench.domain.harness.VectorResult;
import ca.gc.cra.xssbench.domain.vector.Vector;
import ca.gc.cra.xssbench.logging.Logs;
import java.util.Objects;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Executes one (sanitizer, browser, vector) case end to end.
 * <p><strong>Why:</strong> Both orchestration modes share this exact sequence, so a case classifies the same
 * way whether it ran sequentially or on a worker thread.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Skip unsupported contexts without calling the sanitizer.</li>
 *   <li>Prepare the sanitizer input, sanitize and run the lossy check.</li>
 *   <li>Render, execute through the harness and fold everything into a {@link BenchCaseResult}.</li>
 * </ul>
 * <p>Sanitizer and harness failures become {@code error} results; nothing thrown by a case escapes.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from its collaborators; one instance may serve every
 * worker as long as each worker passes its own harness.</p>
 * <p><strong>Observability:</strong> Emits {@code bench.case.<outcome>}, {@code bench.case.lossy} and
 * {@code bench.case.latencyMs}.</p>
 *
 * @since 0.1.0
 */
public final class CaseRunner {
  private static final Logger log = LoggerFactory.getLogger(CaseRunner.class);
  private static final int LOG_PAYLOAD_BYTES = 120;

  private final LossyVerifier verifier;
  private final DocumentRenderer renderer;
  private final OptionalLong fixedTimeoutMs;
  private final MetricsPort metrics;
  private final ClockPort clock;

  /**
   * Creates a case runner.
   *
   * @param verifier lossy verifier
   * @param renderer document renderer, used to record the rendered document
   * @param fixedTimeoutMs fixed wait window; empty selects the adaptive window per case
   * @param metrics metrics sink
   * @param clock time source for latency
   */
  public CaseRunner(
      LossyVerifier verifier,
      DocumentRenderer renderer,
      OptionalLong fixedTimeoutMs,
      MetricsPort metrics,
      ClockPort clock) {
    this.verifier = Objects.requireNonNull(verifier, "verifier");
    this.renderer = Objects.requireNonNull(renderer, "renderer");
    this.fixedTimeoutMs = Objects.requireNonNull(fixedTimeoutMs, "fixedTimeoutMs");
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
    this.clock = Objects.requireNonNullElse(clock, ClockPort.SYSTEM);
  }

  /**
   * Runs one case.
   *
   * @param sanitizer sanitizer under test
   * @param browser engine behind {@code harness}
   * @param vector vector to run
   * @param harness harness owned by the calling worker
   * @param token run-wide cancellation
   * @return classified result; never {@code null}
   */
  public BenchCaseResult run(
      Sanitizer sanitizer,
      BrowserEngine browser,
      Vector vector,
      ExecutionHarness harness,
      CancellationToken token) {
    long start = clock.nowMillis();
    BenchCaseResult result = execute(sanitizer, browser, vector, harness, token);
    metrics.increment("bench.case." + result.outcome().wireName());
    if (result.lossy()) {
      metrics.increment("bench.case.lossy");
    }
    metrics.observe("bench.case.latencyMs", clock.nowMillis() - start);
    log.debug("{} -> {} {}", result.label(), result.outcome().wireName(),
        Logs.truncate(result.details(), LOG_PAYLOAD_BYTES));
    return result;
  }

  private BenchCaseResult execute(
      Sanitizer sanitizer,
      BrowserEngine browser,
      Vector vector,
      ExecutionHarness harness,
      CancellationToken token) {
    if (!sanitizer.supports(vector.context())) {
      return new BenchCaseResult(
          sanitizer.name(), browser, vector.id(), vector.context(), vector.context(), CaseOutcome.SKIP,
          false, false, "",
          "Skipped: " + sanitizer.name() + " does not support context " + vector.context().wireName(),
          "", "", "");
    }

    PreparedInput input = SanitizerInputs.prepare(vector, sanitizer);
    String sanitized;
    try {
      sanitized = sanitize(sanitizer, input);
    } catch (SanitizerException ex) {
      log.debug("Sanitizer {} failed on {}", sanitizer.name(), vector.key(), ex);
      return new BenchCaseResult(
          sanitizer.name(), browser, vector.id(), vector.context(), input.runContext(), CaseOutcome.ERROR,
          false, false, "", "Sanitizer error: " + ex.getMessage(), input.html(), "", "");
    }

    LossyVerdict lossy = verifier.verify(sanitized, vector.expectedTags());
    String rendered = renderer.render(sanitized, input.runContext());
    long timeoutMs = TimeoutPolicy.resolve(fixedTimeoutMs, vector.payloadHtml(), sanitized);
    CaseRequest request = new CaseRequest(vector.payloadHtml(), sanitized, input.runContext(), timeoutMs);

    VectorResult verdict;
    try {
      verdict = harness.run(request, token);
    } catch (HarnessException ex) {
      log.debug("Harness failed on {}", vector.key(), ex);
      return new BenchCaseResult(
          sanitizer.name(), browser, vector.id(), vector.context(), input.runContext(), CaseOutcome.ERROR,
          false, lossy.lossy(), lossy.details(), "Harness error: " + ex.getMessage(),
          input.html(), sanitized, rendered);
    } catch (RuntimeException ex) {
      log.warn("Unexpected harness failure on {} in {}", vector.key(), browser.wireName(), ex);
      return new BenchCaseResult(
          sanitizer.name(), browser, vector.id(), vector.context(), input.runContext(), CaseOutcome.ERROR,
          false, lossy.lossy(), lossy.details(),
          "Harness error: " + ex.getClass().getSimpleName() + ": " + ex.getMessage(),
          input.html(), sanitized, rendered);
    }

    CaseOutcome outcome;
    if (verdict.executed()) {
      outcome = CaseOutcome.XSS;
    } else if (verdict.leaked()) {
      outcome = CaseOutcome.HTTP_LEAK;
    } else {
      outcome = CaseOutcome.PASS;
    }
    return new BenchCaseResult(
        sanitizer.name(), browser, vector.id(), vector.context(), input.runContext(), outcome,
        verdict.executed(), lossy.lossy(), lossy.details(), verdict.details(),
        input.html(), sanitized, rendered);
  }

  private static String sanitize(Sanitizer sanitizer, PreparedInput input) throws SanitizerException {
    try {
      return sanitizer.sanitize(input.html(), input.runContext());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new SanitizerException(sanitizer.name(), ex);
    } catch (Exception ex) {
      throw new SanitizerException(sanitizer.name(), ex);
    }
  }
}
