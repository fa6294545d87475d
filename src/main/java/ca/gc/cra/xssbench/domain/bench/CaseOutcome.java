package ca.gc.cra.xssbench.domain.bench;

/**
 * Classified outcome of one {@code (sanitizer, browser, vector)} case.
 *
 * <p>Lossiness is not an outcome; it is carried separately on {@link BenchCaseResult#lossy()}.</p>
 *
 * @since 0.1.0
 */
public enum CaseOutcome {
  /** Nothing executed and nothing leaked. */
  PASS("pass"),
  /** Script execution was observed. */
  XSS("xss"),
  /** A cross-origin non-script fetch was attempted. */
  HTTP_LEAK("http_leak"),
  /** The sanitizer does not support the vector's context. */
  SKIP("skip"),
  /** The sanitizer or the harness failed. */
  ERROR("error");

  private final String wireName;

  CaseOutcome(String wireName) {
    this.wireName = wireName;
  }

  /**
   * Returns the lowercase name used in reports, JSON output and metric keys.
   *
   * @return wire name
   */
  public String wireName() {
    return wireName;
  }

  @Override
  public String toString() {
    return wireName;
  }
}
