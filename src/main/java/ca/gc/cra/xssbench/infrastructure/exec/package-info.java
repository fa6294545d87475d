/**
 * Executor factories for benchmark worker pools.
 * <p><strong>Role:</strong> Infrastructure utility configuring the threads parallel runs fan out on.</p>
 * <p><strong>Concurrency:</strong> Workers are daemon threads so a stuck browser cannot keep the JVM alive
 * after the orchestrator gave up on it.</p>
 */
package ca.gc.cra.xssbench.infrastructure.exec;
