package ca.gc.cra.xssbench.application.harness;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Element attribute whose value uses the {@code javascript:} scheme.
 *
 * @param tag lowercase tag name
 * @param attribute attribute name
 * @param value raw attribute value
 */
record JsUrlHit(String tag, String attribute, String value) {

  /**
   * Converts the value returned by {@code detect-javascript-urls.js}.
   *
   * @param evaluated list of {@code {tag, attr, value}} maps; anything else yields no hits
   * @return hits in document order
   */
  static List<JsUrlHit> fromEvaluated(Object evaluated) {
    if (!(evaluated instanceof List<?> items)) {
      return List.of();
    }
    List<JsUrlHit> hits = new ArrayList<>(items.size());
    for (Object item : items) {
      if (item instanceof Map<?, ?> map) {
        hits.add(new JsUrlHit(text(map.get("tag")), text(map.get("attr")), text(map.get("value"))));
      }
    }
    return List.copyOf(hits);
  }

  String describe() {
    return tag + "[" + attribute + "]=" + value;
  }

  private static String text(Object value) {
    return value == null ? "" : value.toString();
  }
}
