package ca.gc.cra.xssbench.application.harness;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Page instrumentation sources, loaded once from {@code /xssbench/js} on the classpath.
 */
final class PageScripts {
  static final String PRELUDE = load("prelude.js");
  static final String DETECT_JAVASCRIPT_URLS = load("detect-javascript-urls.js");
  static final String TRIGGER_EVENTS = load("trigger-events.js");
  static final String EXTERNAL_REQUEST_GESTURES = load("external-request-gestures.js");
  static final String JAVASCRIPT_LINK_INDICES = load("javascript-link-indices.js");

  static final String CLEANUP =
      "() => { try { window.__xssbench && window.__xssbench.cleanup && window.__xssbench.cleanup(); } "
          + "catch (e) {} }";
  static final String HOOK_STATE =
      "() => { const s = window.__xssbench; "
          + "return { executed: !!(s && s.executed), details: s ? String(s.details || '') : '' }; }";
  static final String HREF_TARGET =
      "() => { const a = document.getElementById('xssbench-link'); return a ? String(a.href || '') : ''; }";

  static final String LINK_SELECTOR = "a[href], area[href]";
  static final String HREF_LINK_SELECTOR = "#xssbench-link";

  private PageScripts() {}

  private static String load(String name) {
    String resource = "/xssbench/js/" + name;
    try (InputStream in = PageScripts.class.getResourceAsStream(resource)) {
      if (in == null) {
        throw new IllegalStateException("Missing page script on classpath: " + resource);
      }
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException ex) {
      throw new UncheckedIOException("Unable to read page script " + resource, ex);
    }
  }
}
