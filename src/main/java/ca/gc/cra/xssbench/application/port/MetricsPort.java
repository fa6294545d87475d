package ca.gc.cra.xssbench.application.port;

/**
 * <strong>What:</strong> Port abstracting benchmark metrics emission.
 * <p><strong>Why:</strong> Lets the harness and orchestrator count outcomes and time cases without binding to a
 * vendor SDK.</p>
 * <p><strong>Role:</strong> Outbound port implemented by {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Count case outcomes, navigation timeouts, stalls and crashes.</li>
 *   <li>Record per-case and per-run latency observations.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent updates from every worker.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code bench.case.xss},
 * {@code harness.run.latencyMs}).</p>
 *
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier (e.g., {@code bench.parallel.stall}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram-style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value, in the unit the key names
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
