package ca.gc.cra.xssbench.api;

import ca.gc.cra.xssbench.application.port.ClockPort;
import ca.gc.cra.xssbench.application.port.ProgressListener;
import ca.gc.cra.xssbench.domain.bench.BenchCaseResult;
import ca.gc.cra.xssbench.domain.bench.CaseOutcome;
import java.util.Locale;

/**
 * Writes run progress to stderr.
 *
 * <p>With a cadence of {@code 1} every case prints one character ({@code E} error, {@code X} executed,
 * {@code L} lossy, {@code H} leak, {@code S} skip, {@code .} pass). With a larger cadence a status line is
 * printed at the first case, every {@code every} cases and the last case. A cadence of {@code 0} prints
 * nothing.</p>
 */
final class ProgressPrinter implements ProgressListener {
  private static final int DOT_FLUSH_EVERY = 50;

  private final int every;
  private final ClockPort clock;
  private final long startedMillis;
  private int executed;
  private int errors;

  ProgressPrinter(int every, ClockPort clock) {
    if (every < 0) {
      throw new IllegalArgumentException("every must be >= 0 (was " + every + ")");
    }
    this.every = every;
    this.clock = clock;
    this.startedMillis = clock.nowMillis();
  }

  @Override
  public void onCaseCompleted(int done, int total, BenchCaseResult result) {
    if (result.outcome() == CaseOutcome.ERROR) {
      errors++;
    } else if (result.executed()) {
      executed++;
    }
    if (every == 0) {
      return;
    }
    if (every == 1) {
      CliPrinter.errPrint(String.valueOf(symbol(result)));
      if (done == total) {
        CliPrinter.errPrint("\n");
        CliPrinter.errFlush();
      } else if (done % DOT_FLUSH_EVERY == 0) {
        CliPrinter.errFlush();
      }
      return;
    }
    if (done == 1 || done == total || done % every == 0) {
      double elapsed = (clock.nowMillis() - startedMillis) / 1000.0;
      CliPrinter.errPrintln(String.format(Locale.ROOT, "[%d/%d] %.1fs  xss=%d  errors=%d  %s",
          done, total, elapsed, executed, errors, result.label()));
    }
  }

  @Override
  public void onStatus(String message) {
    if (every > 0) {
      CliPrinter.errPrintln(message);
    }
  }

  static char symbol(BenchCaseResult result) {
    if (result.outcome() == CaseOutcome.ERROR) {
      return 'E';
    }
    if (result.executed()) {
      return 'X';
    }
    if (result.lossy()) {
      return 'L';
    }
    return switch (result.outcome()) {
      case HTTP_LEAK -> 'H';
      case SKIP -> 'S';
      default -> '.';
    };
  }
}
