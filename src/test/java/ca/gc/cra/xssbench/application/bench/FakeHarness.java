package ca.gc.cra.xssbench.application.bench;

import ca.gc.cra.xssbench.application.port.CancellationToken;
import ca.gc.cra.xssbench.application.port.ExecutionHarness;
import ca.gc.cra.xssbench.application.port.HarnessException;
import ca.gc.cra.xssbench.domain.bench.BrowserEngine;
import ca.gc.cra.xssbench.domain.harness.CaseRequest;
import ca.gc.cra.xssbench.domain.harness.VectorResult;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Harness that answers from a lambda instead of a browser.
 */
final class FakeHarness implements ExecutionHarness {

  @FunctionalInterface
  interface Behaviour {
    VectorResult run(CaseRequest request, CancellationToken token) throws HarnessException;
  }

  static final Behaviour ALWAYS_PASS = (request, token) -> VectorResult.pass();

  /** Executes whenever the sanitized output still contains {@code alert}. */
  static final Behaviour ALERT_EXECUTES = (request, token) -> request.sanitizedHtml().contains("alert")
      ? VectorResult.executed("Executed: hook:alert:1")
      : VectorResult.pass();

  final BrowserEngine engine;
  final List<CaseRequest> requests = new CopyOnWriteArrayList<>();
  private final Behaviour behaviour;
  volatile boolean closed;

  FakeHarness(BrowserEngine engine, Behaviour behaviour) {
    this.engine = engine;
    this.behaviour = behaviour;
  }

  @Override
  public VectorResult run(CaseRequest request, CancellationToken token) throws HarnessException {
    requests.add(request);
    return behaviour.run(request, token);
  }

  @Override
  public void close() {
    closed = true;
  }
}
