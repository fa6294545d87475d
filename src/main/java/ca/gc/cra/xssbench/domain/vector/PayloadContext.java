package ca.gc.cra.xssbench.domain.vector;

import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * <strong>What:</strong> Closed set of sinks a payload can be rendered into.
 * <p><strong>Why:</strong> The sink decides what the browser parses the sanitized fragment as (markup, URL,
 * script, string literal, event handler), so every template and classification rule switches on it.</p>
 * <p><strong>Role:</strong> Domain value shared by the corpus loader, renderer, classifier and reports.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum PayloadContext {
  /** Fragment inside {@code <div id="root">} in the body. */
  HTML("html"),
  /** Fragment inside {@code <head>}. */
  HTML_HEAD("html_head"),
  /** Fragment placed after {@code </head>}, for whole-document elements. */
  HTML_OUTER("html_outer"),
  /** Fragment is the {@code href} value of a dedicated anchor. */
  HREF("href"),
  /** Fragment is a raw script body. */
  JS("js"),
  /** Fragment is the delay argument of {@code setTimeout}. */
  JS_ARG("js_arg"),
  /** Fragment inside a single-quoted JS string literal. */
  JS_STRING("js_string"),
  /** Fragment inside a double-quoted JS string literal. */
  JS_STRING_DOUBLE("js_string_double"),
  /** Fragment is the value of an {@code onerror} attribute on a broken image. */
  ONERROR_ATTR("onerror_attr"),
  /** Leak primitive placed in both head and body. */
  HTTP_LEAK("http_leak"),
  /** Style-based leak primitive placed in both head and body. */
  HTTP_LEAK_STYLE("http_leak_style");

  private final String wireName;

  PayloadContext(String wireName) {
    this.wireName = wireName;
  }

  /**
   * Returns the lowercase name used in vector files and reports.
   *
   * @return wire name such as {@code html_head}
   */
  public String wireName() {
    return wireName;
  }

  /**
   * Resolves a wire name.
   *
   * @param raw name from a vector file or CLI; case-insensitive
   * @return matching context
   * @throws IllegalArgumentException when the name is unknown, listing the allowed names
   */
  public static PayloadContext fromWireName(String raw) {
    Objects.requireNonNull(raw, "payload_context");
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    for (PayloadContext context : values()) {
      if (context.wireName.equals(normalized)) {
        return context;
      }
    }
    throw new IllegalArgumentException(
        "Invalid payload_context '" + raw + "'. Allowed: " + allowedNames());
  }

  /**
   * Lists every wire name in declaration order.
   *
   * @return comma-separated wire names
   */
  public static String allowedNames() {
    return Arrays.stream(values()).map(PayloadContext::wireName).collect(Collectors.joining(", "));
  }

  /**
   * Indicates whether navigations in this context count as leaks rather than execution.
   *
   * @return {@code true} for {@link #HTTP_LEAK} and {@link #HTTP_LEAK_STYLE}
   */
  public boolean isHttpLeak() {
    return switch (this) {
      case HTTP_LEAK, HTTP_LEAK_STYLE -> true;
      case HTML, HTML_HEAD, HTML_OUTER, HREF, JS, JS_ARG, JS_STRING, JS_STRING_DOUBLE, ONERROR_ATTR -> false;
    };
  }

  /**
   * Indicates whether the sink is not markup, so a tag-shape expectation makes no sense.
   *
   * @return {@code true} for {@code href} and every script sink
   */
  public boolean isNonMarkupSink() {
    return switch (this) {
      case HREF, JS, JS_ARG, JS_STRING, JS_STRING_DOUBLE -> true;
      case HTML, HTML_HEAD, HTML_OUTER, ONERROR_ATTR, HTTP_LEAK, HTTP_LEAK_STYLE -> false;
    };
  }

  @Override
  public String toString() {
    return wireName;
  }
}
