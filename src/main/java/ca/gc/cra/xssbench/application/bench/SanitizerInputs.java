package ca.gc.cra.xssbench.application.bench;

import ca.gc.cra.xssbench.domain.bench.Sanitizer;
import ca.gc.cra.xssbench.domain.vector.PayloadContext;
import ca.gc.cra.xssbench.domain.vector.Vector;

/**
 * Adapts raw payloads into the markup a sanitizer expects to see.
 *
 * <p>HTML sanitizers take whole markup, not a lone attribute value, so attribute-shaped payloads are wrapped
 * in a minimal element and rendered as HTML instead of in their own sink.</p>
 */
final class SanitizerInputs {
  private SanitizerInputs() {}

  /**
   * Text handed to the sanitizer and the context its output is rendered in.
   *
   * @param html sanitizer input
   * @param runContext sink the output is rendered in
   */
  record PreparedInput(String html, PayloadContext runContext) {}

  static PreparedInput prepare(Vector vector, Sanitizer sanitizer) {
    String payload = vector.payloadHtml();
    return switch (vector.context()) {
      case HREF -> sanitizer.declares(PayloadContext.HREF)
          ? new PreparedInput(payload, PayloadContext.HREF)
          : new PreparedInput("<a href=\"" + payload + "\">x</a>", PayloadContext.HTML);
      case ONERROR_ATTR -> new PreparedInput(
          "<img src=\"nonexistent://x\" onerror=\"" + payload + "\">", PayloadContext.HTML);
      default -> new PreparedInput(payload, vector.context());
    };
  }
}
