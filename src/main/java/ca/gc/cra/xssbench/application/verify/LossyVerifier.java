package ca.gc.cra.xssbench.application.verify;

import ca.gc.cra.xssbench.domain.vector.ExpectedTag;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.TreeSet;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.ParseSettings;
import org.jsoup.parser.Parser;

/**
 * <strong>What:</strong> Compares the tag shape of sanitized markup with what a vector expects to survive.
 * <p><strong>Why:</strong> Separates "the sanitizer stripped too much" from "the sanitizer let something
 * dangerous through". The check never looks at execution and never suppresses it.</p>
 * <p><strong>Parsing:</strong> jsoup's XML tree builder with HTML name normalization, so the element sequence
 * is exactly the start tags present in the text. HTML tree building would invent {@code html}, {@code head}
 * and {@code body} elements and move misplaced tags around. Contents of {@code script} and {@code style}
 * are not inspected.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe to share.</p>
 *
 * @since 0.1.0
 */
public final class LossyVerifier {
  private static final int MAX_LISTED_TAGS = 20;

  /**
   * Checks {@code sanitizedHtml} against the expected shape.
   *
   * @param sanitizedHtml sanitizer output
   * @param expectedTags expected element sequence; empty list means no element may survive, an empty optional
   *     disables the check
   * @return verdict with positional details when lossy
   */
  public LossyVerdict verify(String sanitizedHtml, Optional<List<ExpectedTag>> expectedTags) {
    if (expectedTags.isEmpty()) {
      return LossyVerdict.INTACT;
    }
    List<ExpectedTag> expected = expectedTags.get();
    List<ExpectedTag> actual = elements(sanitizedHtml == null ? "" : sanitizedHtml);

    if (expected.isEmpty()) {
      if (actual.isEmpty()) {
        return LossyVerdict.INTACT;
      }
      List<String> names = new ArrayList<>();
      for (ExpectedTag tag : actual.subList(0, Math.min(MAX_LISTED_TAGS, actual.size()))) {
        names.add(tag.name());
      }
      return LossyVerdict.lossy("Expected no tags after sanitization, but found: " + String.join(", ", names));
    }

    List<String> issues = new ArrayList<>();
    int length = Math.max(expected.size(), actual.size());
    for (int i = 0; i < length; i++) {
      int position = i + 1;
      if (i >= actual.size()) {
        issues.add("position " + position + ": missing " + expected.get(i).shape());
      } else if (i >= expected.size()) {
        issues.add("position " + position + ": unexpected " + actual.get(i).shape());
      } else if (!matches(expected.get(i), actual.get(i))) {
        issues.add("position " + position + ": expected " + expected.get(i).shape()
            + ", found " + actual.get(i).shape());
      }
    }
    if (issues.isEmpty()) {
      return LossyVerdict.INTACT;
    }
    return LossyVerdict.lossy("Missing expected tags after sanitization: " + String.join("; ", issues));
  }

  /**
   * Extracts the ordered element shapes of {@code html}.
   *
   * @param html markup fragment
   * @return one entry per start or self-closing tag, in document order
   */
  List<ExpectedTag> elements(String html) {
    Parser parser = Parser.xmlParser().settings(ParseSettings.htmlDefault);
    Document document = parser.parseInput(html, "");
    List<ExpectedTag> out = new ArrayList<>();
    for (Element child : document.children()) {
      collect(child, out);
    }
    return out;
  }

  private static void collect(Element element, List<ExpectedTag> out) {
    String name = element.normalName().toLowerCase(Locale.ROOT);
    TreeSet<String> attributes = new TreeSet<>();
    for (Attribute attribute : element.attributes()) {
      attributes.add(attribute.getKey().toLowerCase(Locale.ROOT));
    }
    out.add(new ExpectedTag(name, attributes));
    if (name.equals("script") || name.equals("style")) {
      return;
    }
    for (Element child : element.children()) {
      collect(child, out);
    }
  }

  private static boolean matches(ExpectedTag expected, ExpectedTag actual) {
    if (!expected.name().equals(actual.name())) {
      return false;
    }
    if (expected.bare()) {
      return actual.attributes().isEmpty();
    }
    return actual.attributes().containsAll(expected.attributes());
  }
}
