package ca.gc.cra.xssbench.domain.vector;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> One adversarial payload bound to the sink it targets.
 * <p><strong>Why:</strong> The benchmark matrix is built from these; the {@code (id, context)} pair is the
 * identity reported in every result.</p>
 * <p><strong>Thread-safety:</strong> Immutable; shared read-only across workers.</p>
 *
 * @param id vector identifier, unique per context within a loaded corpus
 * @param description human-readable description
 * @param payloadHtml raw payload before sanitization
 * @param context sink the payload targets
 * @param expectedTags element shape expected after sanitization; empty when the shape is not checked
 * @since 0.1.0
 */
public record Vector(
    String id,
    String description,
    String payloadHtml,
    PayloadContext context,
    Optional<List<ExpectedTag>> expectedTags) {

  public Vector {
    Objects.requireNonNull(id, "id");
    description = Objects.requireNonNullElse(description, "");
    Objects.requireNonNull(payloadHtml, "payloadHtml");
    context = Objects.requireNonNullElse(context, PayloadContext.HTML);
    expectedTags = Objects.requireNonNullElse(expectedTags, Optional.<List<ExpectedTag>>empty())
        .map(List::copyOf);
  }

  /**
   * Creates a vector without a shape expectation.
   *
   * @param id vector identifier
   * @param payloadHtml raw payload
   * @param context target sink
   * @return vector whose lossy check is skipped
   */
  public static Vector unchecked(String id, String payloadHtml, PayloadContext context) {
    return new Vector(id, "", payloadHtml, context, Optional.empty());
  }

  /**
   * Returns the identity used for duplicate detection and reports.
   *
   * @return {@code id@context}
   */
  public String key() {
    return id + "@" + context.wireName();
  }
}
