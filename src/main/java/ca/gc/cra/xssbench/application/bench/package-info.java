/**
 * <strong>Purpose:</strong> Benchmark use cases: running one case, and running the whole matrix either
 * sequentially or across worker threads.
 * <p><strong>Errors:</strong> Case-level failures become {@code error} results; only a browser that cannot be
 * launched or an interrupt escapes a run.</p>
 * <p><strong>Observability:</strong> Emits {@code bench.case.*} and {@code bench.parallel.*} metrics; worker
 * log lines carry the {@code worker} and {@code browser} MDC keys.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.xssbench.application.bench;
