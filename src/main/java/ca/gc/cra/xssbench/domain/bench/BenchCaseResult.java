package ca.gc.cra.xssbench.domain.bench;

import ca.gc.cra.xssbench.domain.vector.PayloadContext;
import java.util.Objects;

/**
 * <strong>What:</strong> The reportable unit of a benchmark run.
 * <p><strong>Why:</strong> Carries enough context (inputs, outputs and rendered document) to reproduce a
 * finding by hand.</p>
 * <p><strong>Invariants:</strong> {@code executed} implies {@code outcome == XSS}; {@code lossy} is
 * independent of the outcome, so an {@code xss} case can also be lossy.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param sanitizer sanitizer name
 * @param browser engine the case ran in
 * @param vectorId vector identifier
 * @param payloadContext context declared by the vector
 * @param runPayloadContext context the sanitized output was actually rendered in
 * @param outcome classified outcome
 * @param executed whether script execution was observed
 * @param lossy whether expected markup was stripped
 * @param lossyDetails explanation of the lossy verdict; empty when not lossy
 * @param details classifier or error explanation
 * @param sanitizerInputHtml exact text handed to the sanitizer
 * @param sanitizedHtml sanitizer output
 * @param renderedHtml synthetic document served to the browser; empty when nothing was rendered
 * @since 0.1.0
 */
public record BenchCaseResult(
    String sanitizer,
    BrowserEngine browser,
    String vectorId,
    PayloadContext payloadContext,
    PayloadContext runPayloadContext,
    CaseOutcome outcome,
    boolean executed,
    boolean lossy,
    String lossyDetails,
    String details,
    String sanitizerInputHtml,
    String sanitizedHtml,
    String renderedHtml) {

  public BenchCaseResult {
    Objects.requireNonNull(sanitizer, "sanitizer");
    Objects.requireNonNull(browser, "browser");
    Objects.requireNonNull(vectorId, "vectorId");
    Objects.requireNonNull(payloadContext, "payloadContext");
    runPayloadContext = Objects.requireNonNullElse(runPayloadContext, payloadContext);
    Objects.requireNonNull(outcome, "outcome");
    lossyDetails = Objects.requireNonNullElse(lossyDetails, "");
    details = Objects.requireNonNullElse(details, "");
    sanitizerInputHtml = Objects.requireNonNullElse(sanitizerInputHtml, "");
    sanitizedHtml = Objects.requireNonNullElse(sanitizedHtml, "");
    renderedHtml = Objects.requireNonNullElse(renderedHtml, "");
    if (executed && outcome != CaseOutcome.XSS) {
      throw new IllegalArgumentException("executed cases must have outcome xss (was " + outcome + ")");
    }
  }

  /**
   * Builds a synthetic {@code error} result for a case that never produced its own result.
   *
   * @param sanitizer sanitizer name
   * @param browser engine
   * @param vectorId vector identifier
   * @param context vector context
   * @param details error explanation
   * @return error result with empty HTML fields
   */
  public static BenchCaseResult error(
      String sanitizer, BrowserEngine browser, String vectorId, PayloadContext context, String details) {
    return new BenchCaseResult(
        sanitizer, browser, vectorId, context, context, CaseOutcome.ERROR,
        false, false, "", details, "", "", "");
  }

  /**
   * Formats the case coordinates the way reports print them.
   *
   * @return {@code sanitizer / browser / id (context)}
   */
  public String label() {
    return sanitizer + " / " + browser.wireName() + " / " + vectorId + " (" + payloadContext.wireName() + ")";
  }
}
