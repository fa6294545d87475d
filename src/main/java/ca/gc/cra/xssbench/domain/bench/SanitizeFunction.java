package ca.gc.cra.xssbench.domain.bench;

import ca.gc.cra.xssbench.domain.vector.PayloadContext;

/**
 * Opaque {@code html -> html} transformation supplied by a sanitizer adapter.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface SanitizeFunction {
  /**
   * Sanitizes the prepared input.
   *
   * @param html sanitizer input; already wrapped when the sink is an attribute value
   * @param context context the output will be rendered in
   * @return sanitized markup
   * @throws Exception any adapter failure; recorded as an {@code error} case, never fatal to the run
   */
  String sanitize(String html, PayloadContext context) throws Exception;
}
