/**
 * OpenTelemetry adapter for the benchmark metrics port.
 * <p><strong>Role:</strong> Adapter layer on the observability plane.</p>
 * <p><strong>Concurrency:</strong> Thread-safe; every parallel worker updates the same adapter.</p>
 * <p><strong>Metrics:</strong> Publishes under the {@code bench.*} and {@code harness.*} namespaces.</p>
 * <p><strong>Security:</strong> Payloads and URLs are never exported; only metric keys are attached.</p>
 */
package ca.gc.cra.xssbench.infrastructure.metrics;
