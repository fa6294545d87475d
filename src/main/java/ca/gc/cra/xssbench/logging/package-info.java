/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and keep payload text bounded.
 * <p><strong>Pipeline role:</strong> Cross-cutting support for the harness, the case runner and the CLI report.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe when invoked from worker threads.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.
 *
 * @since 0.1.0
 */
package ca.gc.cra.xssbench.logging;
