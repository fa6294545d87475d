package ca.gc.cra.xssbench.infrastructure.sanitizer;

import ca.gc.cra.xssbench.application.port.SanitizerCatalog;
import ca.gc.cra.xssbench.domain.bench.Sanitizer;
import ca.gc.cra.xssbench.domain.vector.PayloadContext;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.safety.Safelist;

/**
 * Sanitizers shipped with the benchmark.
 *
 * <ul>
 *   <li>{@code noop} returns its input unchanged. It proves the harness detects execution at all.</li>
 *   <li>{@code jsoup} applies a jsoup {@link Safelist} allowlist for common formatting markup.</li>
 * </ul>
 *
 * @since 0.1.0
 */
public final class BuiltinSanitizers implements SanitizerCatalog {
  static final String BASE_URI = "http://xssbench.local/";
  private static final List<String> DEFAULT_NAMES = List.of("noop", "jsoup");

  private final Map<String, Sanitizer> byName = new LinkedHashMap<>();

  /** Registers the built-in sanitizers. */
  public BuiltinSanitizers() {
    register(Sanitizer.universal("noop", "Returns input unchanged (baseline)", (html, context) -> html));
    Safelist safelist = jsoupSafelist();
    register(new Sanitizer(
        "jsoup",
        "jsoup Safelist allowlist for common formatting markup",
        (html, context) -> context == PayloadContext.HREF ? cleanUrl(html, safelist) : cleanHtml(html, safelist),
        Optional.<Set<PayloadContext>>of(EnumSet.of(
            PayloadContext.HTML,
            PayloadContext.HTML_HEAD,
            PayloadContext.HTML_OUTER,
            PayloadContext.HREF,
            PayloadContext.ONERROR_ATTR,
            PayloadContext.HTTP_LEAK,
            PayloadContext.HTTP_LEAK_STYLE))));
  }

  private void register(Sanitizer sanitizer) {
    if (byName.putIfAbsent(sanitizer.name(), sanitizer) != null) {
      throw new IllegalStateException("Duplicate sanitizer name: " + sanitizer.name());
    }
  }

  @Override
  public List<Sanitizer> all() {
    return List.copyOf(byName.values());
  }

  @Override
  public List<Sanitizer> defaults() {
    return select(DEFAULT_NAMES);
  }

  @Override
  public List<Sanitizer> select(List<String> names) {
    List<Sanitizer> selected = new ArrayList<>(names.size());
    for (String raw : names) {
      String name = raw.trim();
      Sanitizer sanitizer = byName.get(name);
      if (sanitizer == null) {
        throw new IllegalArgumentException(
            "Unknown sanitizer '" + name + "'. Available: " + String.join(", ", byName.keySet()));
      }
      if (!selected.contains(sanitizer)) {
        selected.add(sanitizer);
      }
    }
    return List.copyOf(selected);
  }

  static Safelist jsoupSafelist() {
    return new Safelist()
        .addTags("p", "br", "div", "span", "blockquote", "pre", "code", "hr", "strong", "em", "b", "i", "u", "s",
            "sub", "sup", "ul", "ol", "li", "h1", "h2", "h3", "h4", "h5", "h6", "a", "img", "table", "thead",
            "tbody", "tfoot", "tr", "th", "td")
        .addAttributes(":all", "class", "id", "title", "lang", "dir", "style")
        .addAttributes("a", "href", "title")
        .addAttributes("img", "src", "alt", "title", "width", "height", "loading")
        .addAttributes("th", "colspan", "rowspan")
        .addAttributes("td", "colspan", "rowspan")
        .addProtocols("a", "href", "http", "https", "mailto", "tel")
        .addProtocols("img", "src", "http", "https")
        .preserveRelativeLinks(true);
  }

  static String cleanHtml(String html, Safelist safelist) {
    return Jsoup.clean(html, BASE_URI, safelist);
  }

  /**
   * Keeps a bare URL only when the allowlist would keep it on an anchor. The result is encoded for a
   * double-quoted attribute value.
   */
  static String cleanUrl(String url, Safelist safelist) {
    Document shell = Document.createShell(BASE_URI);
    Element anchor = shell.body().appendElement("a").attr("href", url).text("x");
    Element cleaned = Jsoup.parseBodyFragment(cleanHtml(anchor.outerHtml(), safelist), BASE_URI)
        .selectFirst("a");
    return cleaned == null ? "" : escapeAttribute(cleaned.attr("href"));
  }

  static String escapeAttribute(String value) {
    return value.replace("&", "&amp;").replace("\"", "&quot;");
  }
}
