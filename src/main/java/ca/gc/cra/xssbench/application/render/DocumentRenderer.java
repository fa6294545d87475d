package ca.gc.cra.xssbench.application.render;

import ca.gc.cra.xssbench.domain.vector.PayloadContext;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Builds the synthetic HTML document that places a sanitized fragment at its sink.
 * <p><strong>Why:</strong> Execution only means something relative to where the output lands; each
 * {@link PayloadContext} maps to exactly one template.</p>
 * <p><strong>Role:</strong> Pure application service used by the signal-capture session.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Choose a template per context, including the head-and-body placement for leak contexts.</li>
 *   <li>Pin every document to {@link #BASE_URL} so relative and scheme-relative URLs resolve
 *       deterministically.</li>
 *   <li>Rewrite meta-refresh delays to zero so navigation-based detection stays fast.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class DocumentRenderer {
  /** Synthetic origin every document is served from. */
  public static final String BASE_URL = "http://xssbench.local/";

  private static final String HEAD_OPEN = """
      <!doctype html>
      <html>
        <head>
          <meta charset="utf-8">
          <base href="http://xssbench.local/">
      """;

  private static final Pattern FIRST_TAG = Pattern.compile("<\\s*([A-Za-z][A-Za-z0-9:-]*)");
  private static final Pattern META_REFRESH = Pattern.compile(
      "(<meta\\b[^>]*\\bhttp-equiv\\s*=\\s*['\"]?refresh['\"]?[^>]*\\bcontent\\s*=\\s*['\"])([^'\"]*)(['\"])",
      Pattern.CASE_INSENSITIVE);
  private static final Pattern REFRESH_CONTENT = Pattern.compile(
      "^\\s*(?<delay>\\d+)?\\s*(?:;\\s*)?(?:url\\s*=\\s*(?<url>.+?))?\\s*$",
      Pattern.CASE_INSENSITIVE);

  /**
   * Renders the document for one case.
   *
   * @param sanitizedHtml sanitizer output, inserted verbatim
   * @param context sink to place it in
   * @return complete HTML document
   */
  public String render(String sanitizedHtml, PayloadContext context) {
    Objects.requireNonNull(sanitizedHtml, "sanitizedHtml");
    Objects.requireNonNull(context, "context");
    String p = sanitizedHtml;
    String document = switch (context) {
      case HTML -> body("    <div id=\"root\">" + p + "</div>\n");
      case HTML_HEAD -> HEAD_OPEN
          + "    " + p + "\n"
          + "  </head>\n"
          + "  <body>\n"
          + "    <div id=\"root\"></div>\n"
          + "  </body>\n"
          + "</html>\n";
      case HTML_OUTER -> outer(p);
      case HREF -> body("    <a id=\"xssbench-link\" href=\"" + p + "\">x</a>\n");
      case JS -> body("    <script>" + p + "</script>\n");
      case JS_ARG -> body("    <script>setTimeout(function(){}, " + p + ");</script>\n");
      case JS_STRING -> body("    <script>var __xssbench = '" + p + "';</script>\n");
      case JS_STRING_DOUBLE -> body("    <script>var __xssbench = \"" + p + "\";</script>\n");
      case ONERROR_ATTR -> body(
          "    <img id=\"xssbench-img\" src=\"nonexistent://x\" onerror=\"" + p + "\">\n");
      case HTTP_LEAK, HTTP_LEAK_STYLE -> leak(p);
    };
    return speedUpMetaRefresh(document);
  }

  /**
   * Rewrites {@code <meta http-equiv="refresh" content="N; url=U">} to a zero delay.
   *
   * @param html document or fragment
   * @return rewritten text; unchanged when no meta refresh is present
   */
  static String speedUpMetaRefresh(String html) {
    String lower = html.toLowerCase(Locale.ROOT);
    if (!lower.contains("http-equiv") || !lower.contains("refresh")) {
      return html;
    }
    Matcher matcher = META_REFRESH.matcher(html);
    StringBuilder out = new StringBuilder(html.length());
    while (matcher.find()) {
      Matcher content = REFRESH_CONTENT.matcher(matcher.group(2));
      String replacement;
      if (content.matches()) {
        String url = content.group("url") == null ? "" : stripQuotes(content.group("url").trim());
        replacement = matcher.group(1) + (url.isEmpty() ? "0" : "0; url=" + url) + matcher.group(3);
      } else {
        replacement = matcher.group();
      }
      matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
    }
    matcher.appendTail(out);
    return out.toString();
  }

  private static String body(String bodyContent) {
    return HEAD_OPEN
        + "  </head>\n"
        + "  <body>\n"
        + bodyContent
        + "  </body>\n"
        + "</html>\n";
  }

  private static String outer(String fragment) {
    return HEAD_OPEN
        + "  </head>\n"
        + "  " + fragment + "\n"
        + "</html>\n";
  }

  private static String leak(String fragment) {
    Matcher first = FIRST_TAG.matcher(fragment);
    String tag = first.find() ? first.group(1).toLowerCase(Locale.ROOT) : "";
    if (tag.equals("html") || tag.equals("body") || tag.equals("frameset")) {
      return outer(fragment);
    }
    // Parsers drop whichever placement is invalid for the tag.
    return HEAD_OPEN
        + "    " + fragment + "\n"
        + "  </head>\n"
        + "  <body>\n"
        + "    <div id=\"root\">" + fragment + "</div>\n"
        + "    <s id=\"xssbench-css-target\">x</s>\n"
        + "    <big id=\"xssbench-css-target2\">x</big>\n"
        + "  </body>\n"
        + "</html>\n";
  }

  private static String stripQuotes(String value) {
    int start = 0;
    int end = value.length();
    while (start < end && (value.charAt(start) == '"' || value.charAt(start) == '\'')) {
      start++;
    }
    while (end > start && (value.charAt(end - 1) == '"' || value.charAt(end - 1) == '\'')) {
      end--;
    }
    return value.substring(start, end);
  }
}
