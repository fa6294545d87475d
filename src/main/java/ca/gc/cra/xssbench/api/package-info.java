/**
 * CLI entry points for the XSS sanitizer benchmark.
 * <p><strong>Role:</strong> Adapter layer on the driving side; parses arguments, configures logging and
 * telemetry, invokes the orchestrator and maps outcomes to {@link ca.gc.cra.xssbench.api.ExitCode}.</p>
 * <p><strong>Output:</strong> The report goes to stdout; progress, fail-fast details and logs go to stderr.</p>
 */
package ca.gc.cra.xssbench.api;
