package ca.gc.cra.xssbench.domain.bench;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.xssbench.domain.vector.PayloadContext;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;

class BenchSummaryTest {

  private static BenchCaseResult result(String id, CaseOutcome outcome, boolean lossy) {
    return new BenchCaseResult("noop", BrowserEngine.CHROMIUM, id, PayloadContext.HTML, null, outcome,
        outcome == CaseOutcome.XSS, lossy, lossy ? "Missing expected tags" : "", "", "", "", "");
  }

  @Test
  void countsEveryOutcome() {
    BenchSummary summary = BenchSummary.fromResults(List.of(
        result("a", CaseOutcome.PASS, true),
        result("b", CaseOutcome.XSS, true),
        result("c", CaseOutcome.HTTP_LEAK, false),
        result("d", CaseOutcome.ERROR, false),
        result("e", CaseOutcome.SKIP, false),
        result("f", CaseOutcome.XSS, false)));

    assertEquals(6, summary.totalCases());
    assertEquals(2, summary.totalExecuted());
    assertEquals(1, summary.totalExternal());
    assertEquals(1, summary.totalErrors());
    assertEquals(2, summary.totalLossy());
    assertEquals(1, summary.totalSkipped());
    assertEquals("b", summary.firstExecuted().orElseThrow().vectorId());
  }

  @Test
  void resultDefaultsAndInvariants() {
    BenchCaseResult error = BenchCaseResult.error("noop", BrowserEngine.WEBKIT, "x", PayloadContext.HREF, "boom");

    assertEquals(PayloadContext.HREF, error.runPayloadContext());
    assertEquals("noop / webkit / x (href)", error.label());
    assertEquals("", result("a", CaseOutcome.PASS, false).sanitizedHtml());
    assertThrows(IllegalArgumentException.class, () -> new BenchCaseResult("noop", BrowserEngine.CHROMIUM, "x",
        PayloadContext.HTML, PayloadContext.HTML, CaseOutcome.PASS, true, false, "", "", "", "", ""));
  }

  @Test
  void browserListParsing() {
    assertEquals(List.of(BrowserEngine.values()), BrowserEngine.parseList("all"));
    assertEquals(List.of(BrowserEngine.values()), BrowserEngine.parseList(" "));
    assertEquals(List.of(BrowserEngine.WEBKIT, BrowserEngine.CHROMIUM),
        BrowserEngine.parseList("webkit, chromium,webkit"));
    assertThrows(IllegalArgumentException.class, () -> BrowserEngine.parseList("edge"));
    assertThrows(IllegalArgumentException.class, () -> BrowserEngine.parseList(",,"));
  }

  @Test
  void sanitizerContextSupport() throws Exception {
    Sanitizer universal = Sanitizer.universal("noop", null, (html, context) -> null);
    Sanitizer narrow = new Sanitizer("narrow", "", (html, context) -> html,
        Optional.of(Set.of(PayloadContext.HTML)));

    assertTrue(universal.supports(PayloadContext.JS));
    assertFalse(universal.declares(PayloadContext.HREF));
    assertFalse(narrow.supports(PayloadContext.JS));
    assertEquals("", universal.sanitize("<b>", PayloadContext.HTML));
  }
}
