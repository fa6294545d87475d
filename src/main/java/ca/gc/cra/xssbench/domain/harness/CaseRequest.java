package ca.gc.cra.xssbench.domain.harness;

import ca.gc.cra.xssbench.domain.vector.PayloadContext;
import java.util.Objects;

/**
 * Input to one harness run.
 *
 * @param payloadHtml raw vector payload, quoted in result details
 * @param sanitizedHtml sanitizer output to render
 * @param context context to render the output in
 * @param timeoutMs post-trigger wait window in milliseconds; zero skips polling
 * @since 0.1.0
 */
public record CaseRequest(String payloadHtml, String sanitizedHtml, PayloadContext context, long timeoutMs) {
  public CaseRequest {
    Objects.requireNonNull(payloadHtml, "payloadHtml");
    Objects.requireNonNull(sanitizedHtml, "sanitizedHtml");
    Objects.requireNonNull(context, "context");
    if (timeoutMs < 0) {
      throw new IllegalArgumentException("timeoutMs must be >= 0 (was " + timeoutMs + ")");
    }
  }
}
