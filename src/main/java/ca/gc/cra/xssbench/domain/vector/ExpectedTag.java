package ca.gc.cra.xssbench.domain.vector;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One element a vector expects to survive sanitization.
 *
 * <p>A bare tag ({@code attributes} empty) means the surviving element must carry no attributes at all;
 * otherwise the surviving element must carry at least the listed attributes.</p>
 *
 * @param name lowercase tag name
 * @param attributes lowercase attribute names that must be present; empty for a bare tag
 * @since 0.1.0
 */
public record ExpectedTag(String name, Set<String> attributes) {
  private static final Pattern SHAPE = Pattern.compile("^([A-Za-z][A-Za-z0-9:-]*)(?:\\[(.*)])?$");

  public ExpectedTag {
    Objects.requireNonNull(name, "name");
    name = name.trim().toLowerCase(Locale.ROOT);
    if (name.isEmpty()) {
      throw new IllegalArgumentException("expected tag name must not be blank");
    }
    TreeSet<String> normalized = new TreeSet<>();
    if (attributes != null) {
      for (String attribute : attributes) {
        normalized.add(attribute.trim().toLowerCase(Locale.ROOT));
      }
    }
    attributes = Set.copyOf(normalized);
  }

  /**
   * Parses {@code tag} or {@code tag[attr1,attr2]}.
   *
   * @param raw textual shape from a vector file
   * @return parsed expectation
   * @throws IllegalArgumentException for malformed shapes and for {@code tag[]}
   */
  public static ExpectedTag parse(String raw) {
    Objects.requireNonNull(raw, "expected tag");
    String trimmed = raw.trim();
    Matcher matcher = SHAPE.matcher(trimmed);
    if (!matcher.matches()) {
      throw new IllegalArgumentException("Invalid expected tag: '" + raw + "'");
    }
    String inner = matcher.group(2);
    if (inner == null) {
      return new ExpectedTag(matcher.group(1), Set.of());
    }
    if (inner.isBlank()) {
      throw new IllegalArgumentException(
          "Expected tag '" + raw + "' must not use empty brackets; write the bare tag instead");
    }
    TreeSet<String> attributes = new TreeSet<>();
    for (String part : inner.split(",")) {
      String attribute = part.trim();
      if (attribute.isEmpty()) {
        throw new IllegalArgumentException("Expected tag '" + raw + "' contains a blank attribute");
      }
      attributes.add(attribute);
    }
    return new ExpectedTag(matcher.group(1), attributes);
  }

  /**
   * Indicates whether the expectation forbids every attribute.
   *
   * @return {@code true} for a bare tag
   */
  public boolean bare() {
    return attributes.isEmpty();
  }

  /**
   * Formats the expectation the way vector files write it.
   *
   * @return {@code tag} or {@code tag[a,b]} with attributes sorted
   */
  public String shape() {
    if (attributes.isEmpty()) {
      return name;
    }
    return name + "[" + String.join(",", new TreeSet<>(attributes)) + "]";
  }
}
