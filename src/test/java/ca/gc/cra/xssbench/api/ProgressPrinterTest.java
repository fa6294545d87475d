package ca.gc.cra.xssbench.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.xssbench.application.port.ClockPort;
import ca.gc.cra.xssbench.domain.bench.BenchCaseResult;
import ca.gc.cra.xssbench.domain.bench.BrowserEngine;
import ca.gc.cra.xssbench.domain.bench.CaseOutcome;
import ca.gc.cra.xssbench.domain.vector.PayloadContext;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ProgressPrinterTest {
  private final AtomicLong now = new AtomicLong(10_000);
  private final ClockPort clock = now::get;
  private StringWriter err;

  @BeforeEach
  void setUp() {
    err = new StringWriter();
    CliPrinter.setWritersForTesting(new PrintWriter(new StringWriter(), true), new PrintWriter(err, true));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriters();
  }

  private static BenchCaseResult result(String id, CaseOutcome outcome, boolean lossy) {
    return new BenchCaseResult("noop", BrowserEngine.CHROMIUM, id, PayloadContext.HTML, null, outcome,
        outcome == CaseOutcome.XSS, lossy, "", "", "", "", "");
  }

  @Test
  void cadenceOnePrintsOneCharacterPerCase() {
    ProgressPrinter printer = new ProgressPrinter(1, clock);
    BenchCaseResult[] results = {
        result("a", CaseOutcome.PASS, false),
        result("b", CaseOutcome.XSS, false),
        result("c", CaseOutcome.ERROR, false),
        result("d", CaseOutcome.PASS, true),
        result("e", CaseOutcome.HTTP_LEAK, false),
        result("f", CaseOutcome.SKIP, false)};

    for (int i = 0; i < results.length; i++) {
      printer.onCaseCompleted(i + 1, results.length, results[i]);
    }

    assertEquals(".XELHS\n", err.toString());
  }

  @Test
  void largerCadencePrintsStatusLines() {
    ProgressPrinter printer = new ProgressPrinter(2, clock);

    printer.onCaseCompleted(1, 3, result("a", CaseOutcome.XSS, false));
    now.addAndGet(1_500);
    printer.onCaseCompleted(2, 3, result("b", CaseOutcome.ERROR, false));
    printer.onCaseCompleted(3, 3, result("c", CaseOutcome.PASS, false));

    String[] lines = err.toString().split("\\R");
    assertEquals(3, lines.length);
    assertEquals("[1/3] 0.0s  xss=1  errors=0  noop / chromium / a (html)", lines[0]);
    assertEquals("[2/3] 1.5s  xss=1  errors=1  noop / chromium / b (html)", lines[1]);
    assertEquals("[3/3] 1.5s  xss=1  errors=1  noop / chromium / c (html)", lines[2]);
  }

  @Test
  void cadenceZeroIsSilent() {
    ProgressPrinter printer = new ProgressPrinter(0, clock);

    printer.onStatus("[0/4] starting 2 workers");
    printer.onCaseCompleted(1, 1, result("a", CaseOutcome.XSS, false));

    assertEquals("", err.toString());
  }

  @Test
  void statusLinesPassThrough() {
    new ProgressPrinter(25, clock).onStatus("[0/4] starting 2 workers");

    assertEquals("[0/4] starting 2 workers" + System.lineSeparator(), err.toString());
  }

  @Test
  void negativeCadenceIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> new ProgressPrinter(-1, clock));
  }
}
