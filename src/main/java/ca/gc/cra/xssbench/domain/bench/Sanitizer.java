package ca.gc.cra.xssbench.domain.bench;

import ca.gc.cra.xssbench.domain.vector.PayloadContext;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> A named sanitizer plus the payload contexts it claims to handle.
 * <p><strong>Why:</strong> Cases whose context the sanitizer does not support are reported as skipped rather
 * than run, so the benchmark never blames a sanitizer for a sink it never promised to cover.</p>
 * <p><strong>Thread-safety:</strong> Immutable; the sanitize function must tolerate concurrent calls when
 * the benchmark runs with more than one worker.</p>
 *
 * @param name unique sanitizer name
 * @param description one-line description for listings
 * @param function sanitize function
 * @param supportedContexts contexts the sanitizer supports; empty means universal support
 * @since 0.1.0
 */
public record Sanitizer(
    String name,
    String description,
    SanitizeFunction function,
    Optional<Set<PayloadContext>> supportedContexts) {

  public Sanitizer {
    Objects.requireNonNull(name, "name");
    description = Objects.requireNonNullElse(description, "");
    Objects.requireNonNull(function, "function");
    supportedContexts = Objects.requireNonNullElse(supportedContexts, Optional.<Set<PayloadContext>>empty())
        .map(Set::copyOf);
  }

  /**
   * Creates a sanitizer that assumes every context is supported.
   *
   * @param name sanitizer name
   * @param description description
   * @param function sanitize function
   * @return universal sanitizer
   */
  public static Sanitizer universal(String name, String description, SanitizeFunction function) {
    return new Sanitizer(name, description, function, Optional.empty());
  }

  /**
   * Indicates whether cases in {@code context} should run.
   *
   * @param context vector context
   * @return {@code true} when support is universal or the context is listed
   */
  public boolean supports(PayloadContext context) {
    return supportedContexts.map(contexts -> contexts.contains(context)).orElse(true);
  }

  /**
   * Indicates whether the sanitizer lists {@code context} explicitly.
   *
   * @param context vector context
   * @return {@code false} for universal sanitizers
   */
  public boolean declares(PayloadContext context) {
    return supportedContexts.map(contexts -> contexts.contains(context)).orElse(false);
  }

  /**
   * Runs the sanitize function.
   *
   * @param html prepared input
   * @param context context the output will be rendered in
   * @return sanitized markup; {@code null} results become the empty string
   * @throws Exception propagated from the adapter
   */
  public String sanitize(String html, PayloadContext context) throws Exception {
    String out = function.sanitize(html, context);
    return out == null ? "" : out;
  }
}
