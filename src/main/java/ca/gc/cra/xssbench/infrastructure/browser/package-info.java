/**
 * Playwright adapters for the browser ports.
 * <p><strong>Role:</strong> Adapter layer between the signal-capture session and real browser engines.</p>
 * <p><strong>Concurrency:</strong> Playwright objects are confined to the thread that created them; one
 * launcher per worker.</p>
 * <p><strong>Security:</strong> Every request is intercepted and either served locally or aborted, so
 * payloads never reach the network.</p>
 */
package ca.gc.cra.xssbench.infrastructure.browser;
