package ca.gc.cra.xssbench.api;

import ca.gc.cra.xssbench.domain.bench.BenchCaseResult;
import ca.gc.cra.xssbench.domain.bench.BenchSummary;
import ca.gc.cra.xssbench.domain.bench.CaseOutcome;
import ca.gc.cra.xssbench.logging.Logs;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Formats the end-of-run report.
 *
 * <p>Findings come first, grouped as {@code XSS:}, {@code Leaks:}, {@code Errors:} and
 * {@code Lossy (expected tags stripped):}; the per sanitizer and browser count table comes last so it stays
 * visible at the bottom of the terminal.</p>
 */
final class ReportPrinter {
  static final int HTML_LIMIT = 400;
  static final int FAIL_FAST_HTML_LIMIT = 2_000;
  private static final String ROW_FORMAT = "%-22s  %-8s  %6s  %6s  %6s  %6s  %7s  %5s";

  private ReportPrinter() {}

  /**
   * Builds the report lines for a finished run.
   *
   * @param summary run summary
   * @return lines to print, without trailing newlines
   */
  static List<String> report(BenchSummary summary) {
    List<String> lines = new ArrayList<>();
    section(lines, "XSS:", summary, r -> r.outcome() == CaseOutcome.XSS, BenchCaseResult::details, false);
    section(lines, "Leaks:", summary, r -> r.outcome() == CaseOutcome.HTTP_LEAK, BenchCaseResult::details, false);
    section(lines, "Errors:", summary, r -> r.outcome() == CaseOutcome.ERROR, BenchCaseResult::details, false);
    section(lines, "Lossy (expected tags stripped):", summary, BenchCaseResult::lossy,
        BenchCaseResult::lossyDetails, true);
    if (!lines.isEmpty()) {
      lines.add("");
    }
    lines.addAll(table(summary));
    return lines;
  }

  /**
   * Builds the lines printed when a fail-fast run stopped on an executed case.
   *
   * @param hit first executed case
   * @return lines for stderr
   */
  static List<String> failFast(BenchCaseResult hit) {
    List<String> lines = new ArrayList<>();
    lines.add("FAIL-FAST: " + hit.label() + ": " + hit.details());
    if (!hit.sanitizedHtml().isEmpty()) {
      lines.add("sanitized_html=" + Logs.quoteTruncated(hit.sanitizedHtml(), FAIL_FAST_HTML_LIMIT));
    }
    if (!hit.sanitizerInputHtml().isEmpty()) {
      lines.add("sanitizer_input_html=" + Logs.quoteTruncated(hit.sanitizerInputHtml(), FAIL_FAST_HTML_LIMIT));
    }
    return lines;
  }

  private static void section(
      List<String> lines,
      String title,
      BenchSummary summary,
      Predicate<BenchCaseResult> filter,
      Function<BenchCaseResult, String> details,
      boolean alwaysShowSanitized) {
    List<BenchCaseResult> matching = summary.results().stream().filter(filter).toList();
    if (matching.isEmpty()) {
      return;
    }
    if (!lines.isEmpty()) {
      lines.add("");
    }
    lines.add(title);
    for (BenchCaseResult result : matching) {
      lines.add("- " + result.label() + ": " + details.apply(result));
      if (!result.sanitizerInputHtml().isEmpty()) {
        lines.add("  sanitizer_input_html=" + Logs.quoteTruncated(result.sanitizerInputHtml(), HTML_LIMIT));
      }
      // An empty output is often the whole story for a lossy case.
      if (alwaysShowSanitized || !result.sanitizedHtml().isEmpty()) {
        lines.add("  sanitized_html=" + Logs.quoteTruncated(result.sanitizedHtml(), HTML_LIMIT));
      }
    }
  }

  private static List<String> table(BenchSummary summary) {
    // Keyed by sanitizer then browser; NUL sorts before any name character.
    Map<String, Counts> rows = new TreeMap<>();
    for (BenchCaseResult result : summary.results()) {
      rows.computeIfAbsent(result.sanitizer() + '\u0000' + result.browser().wireName(),
          key -> new Counts(result.sanitizer(), result.browser().wireName())).add(result);
    }
    List<String> lines = new ArrayList<>();
    String header = String.format(Locale.ROOT, ROW_FORMAT,
        "sanitizer", "browser", "xss", "leaks", "lossy", "errors", "skipped", "total");
    lines.add(header);
    lines.add("-".repeat(header.length()));
    for (Counts row : rows.values()) {
      lines.add(String.format(Locale.ROOT, ROW_FORMAT,
          row.sanitizer, row.browser, row.xss, row.leaks, row.lossy, row.errors, row.skipped, row.total));
    }
    return lines;
  }

  private static final class Counts {
    private final String sanitizer;
    private final String browser;
    private int xss;
    private int leaks;
    private int lossy;
    private int errors;
    private int skipped;
    private int total;

    Counts(String sanitizer, String browser) {
      this.sanitizer = sanitizer;
      this.browser = browser;
    }

    void add(BenchCaseResult result) {
      total++;
      if (result.executed()) {
        xss++;
      }
      if (result.lossy()) {
        lossy++;
      }
      switch (result.outcome()) {
        case HTTP_LEAK -> leaks++;
        case ERROR -> errors++;
        case SKIP -> skipped++;
        default -> {
          // pass and xss need no extra column
        }
      }
    }
  }
}
