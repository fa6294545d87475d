package ca.gc.cra.xssbench.application.bench;

import ca.gc.cra.xssbench.application.port.BrowserLaunchException;
import ca.gc.cra.xssbench.application.port.ExecutionHarness;
import ca.gc.cra.xssbench.application.port.HarnessFactory;
import ca.gc.cra.xssbench.domain.bench.BrowserEngine;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Opens {@link FakeHarness} sessions and remembers them for assertions.
 */
final class FakeHarnessFactory implements HarnessFactory {
  private final FakeHarness.Behaviour behaviour;
  final List<FakeHarness> opened = new CopyOnWriteArrayList<>();
  BrowserEngine failingEngine;
  RuntimeException openFailure;
  volatile boolean closed;

  FakeHarnessFactory(FakeHarness.Behaviour behaviour) {
    this.behaviour = behaviour;
  }

  @Override
  public ExecutionHarness open(BrowserEngine engine) throws BrowserLaunchException {
    if (openFailure != null) {
      throw openFailure;
    }
    if (engine == failingEngine) {
      throw new BrowserLaunchException(engine, "Executable doesn't exist for " + engine.wireName(), null);
    }
    FakeHarness harness = new FakeHarness(engine, behaviour);
    opened.add(harness);
    return harness;
  }

  @Override
  public void close() {
    closed = true;
  }
}
