/**
 * Configuration aggregate and composition root wiring for the benchmark CLI.
 * <p><strong>Role:</strong> Bootstrap layer merging defaults, YAML and CLI arguments, then selecting adapters.</p>
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share with worker threads.</p>
 * <p><strong>Security:</strong> Values are validated through {@code ca.gc.cra.xssbench.validation} before any
 * browser is launched.</p>
 */
package ca.gc.cra.xssbench.config;
