/**
 * <strong>Purpose:</strong> Validation helpers for configuration values arriving as strings.
 * <p><strong>Concurrency:</strong> Stateless; thread-safe.
 * <p><strong>Observability:</strong> Failures surface as {@link java.lang.IllegalArgumentException}s that name
 * the offending key.
 *
 * @since 0.1.0
 */
package ca.gc.cra.xssbench.validation;
