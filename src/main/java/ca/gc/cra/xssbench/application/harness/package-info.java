/**
 * <strong>Purpose:</strong> Signal capture for one rendered document: the session state machine, the
 * per-run signal collector, the execution classifier, the adaptive timeout and the injected page scripts.
 * <p><strong>Concurrency:</strong> A session and its signals belong to the thread that opened them. Browser
 * callbacks may arrive on the driver thread, so signal collections are synchronized.</p>
 * <p><strong>Observability:</strong> Emits {@code harness.run.latencyMs} and
 * {@code harness.navigation.timeout}; logs phase changes at DEBUG.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.xssbench.application.harness;
