/**
 * <strong>Purpose:</strong> Ports between the benchmark use cases and the host: browsers, corpus files,
 * sanitizer catalogs, metrics, clocks and progress reporting.
 * <p><strong>Pipeline role:</strong> Application layer; infrastructure adapters implement these interfaces.</p>
 * <p><strong>Concurrency:</strong> A {@link ca.gc.cra.xssbench.application.port.ExecutionHarness} is confined to
 * one thread; {@link ca.gc.cra.xssbench.application.port.MetricsPort} implementations must be thread-safe.</p>
 * <p><strong>Errors:</strong> Browser failures are checked exceptions so callers decide between an
 * execution signal, a case error and an aborted run.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.xssbench.application.port;
