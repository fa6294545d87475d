package ca.gc.cra.xssbench.domain.bench;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Aggregate counts for a benchmark run plus the full result list.
 * <p><strong>Why:</strong> Totals are always folded from {@link #results()} in {@link #fromResults(List)},
 * so they can never disagree with the list.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param totalCases number of results
 * @param totalExecuted results with {@code executed = true}
 * @param totalExternal results with outcome {@code http_leak}
 * @param totalErrors results with outcome {@code error}
 * @param totalLossy results with {@code lossy = true}
 * @param totalSkipped results with outcome {@code skip}
 * @param results every case result in completion order
 * @since 0.1.0
 */
public record BenchSummary(
    int totalCases,
    int totalExecuted,
    int totalExternal,
    int totalErrors,
    int totalLossy,
    int totalSkipped,
    List<BenchCaseResult> results) {

  public BenchSummary {
    results = List.copyOf(Objects.requireNonNull(results, "results"));
  }

  /**
   * Folds a result list into a summary.
   *
   * @param results case results; copied
   * @return summary whose totals match the list
   */
  public static BenchSummary fromResults(List<BenchCaseResult> results) {
    int executed = 0;
    int external = 0;
    int errors = 0;
    int lossy = 0;
    int skipped = 0;
    for (BenchCaseResult result : results) {
      if (result.executed()) {
        executed++;
      }
      if (result.lossy()) {
        lossy++;
      }
      switch (result.outcome()) {
        case HTTP_LEAK -> external++;
        case ERROR -> errors++;
        case SKIP -> skipped++;
        case PASS, XSS -> {
          // counted through executed
        }
      }
    }
    return new BenchSummary(results.size(), executed, external, errors, lossy, skipped, results);
  }

  /**
   * Returns the first executed case, if any.
   *
   * @return first {@code xss} result in list order
   */
  public Optional<BenchCaseResult> firstExecuted() {
    return results.stream().filter(BenchCaseResult::executed).findFirst();
  }
}
