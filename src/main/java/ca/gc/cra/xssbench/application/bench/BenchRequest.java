package ca.gc.cra.xssbench.application.bench;

import ca.gc.cra.xssbench.domain.bench.BrowserEngine;
import ca.gc.cra.xssbench.domain.bench.Sanitizer;
import ca.gc.cra.xssbench.domain.vector.Vector;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Inputs of one benchmark run.
 *
 * @param vectors vectors to run, in corpus order
 * @param sanitizers sanitizers under test
 * @param browsers engines to run in
 * @param timeoutMs fixed per-case wait window; empty selects the adaptive window
 * @param workers requested worker count; more than one selects parallel mode
 * @param failFast stop at the first executed case
 * @param progressEvery progress cadence in cases; {@code 0} disables progress
 * @param workerTaskTimeoutSec parallel stall window in seconds; {@code 0} disables the watchdog
 * @since 0.1.0
 */
public record BenchRequest(
    List<Vector> vectors,
    List<Sanitizer> sanitizers,
    List<BrowserEngine> browsers,
    OptionalLong timeoutMs,
    int workers,
    boolean failFast,
    int progressEvery,
    long workerTaskTimeoutSec) {

  public BenchRequest {
    vectors = List.copyOf(Objects.requireNonNull(vectors, "vectors"));
    sanitizers = List.copyOf(Objects.requireNonNull(sanitizers, "sanitizers"));
    browsers = List.copyOf(Objects.requireNonNull(browsers, "browsers"));
    timeoutMs = Objects.requireNonNullElse(timeoutMs, OptionalLong.empty());
    if (sanitizers.isEmpty()) {
      throw new IllegalArgumentException("at least one sanitizer is required");
    }
    if (browsers.isEmpty()) {
      throw new IllegalArgumentException("at least one browser is required");
    }
    if (timeoutMs.isPresent() && timeoutMs.getAsLong() < 0) {
      throw new IllegalArgumentException("timeoutMs must be >= 0 (was " + timeoutMs.getAsLong() + ")");
    }
    if (workers < 1) {
      throw new IllegalArgumentException("workers must be >= 1 (was " + workers + ")");
    }
    if (progressEvery < 0) {
      throw new IllegalArgumentException("progressEvery must be >= 0 (was " + progressEvery + ")");
    }
    if (workerTaskTimeoutSec < 0) {
      throw new IllegalArgumentException(
          "workerTaskTimeoutSec must be >= 0 (was " + workerTaskTimeoutSec + ")");
    }
  }

  /**
   * Number of cases each vector expands to.
   *
   * @return sanitizers times browsers
   */
  public int casesPerVector() {
    return sanitizers.size() * browsers.size();
  }

  /**
   * Size of the full matrix.
   *
   * @return planned case count
   */
  public int totalCases() {
    return vectors.size() * casesPerVector();
  }

  /**
   * Worker count actually used; never more than there are vectors.
   *
   * @return effective worker count, at least one
   */
  public int effectiveWorkers() {
    return Math.max(1, Math.min(workers, vectors.size()));
  }

  /**
   * Indicates whether the run fans out across worker threads.
   *
   * @return {@code true} when more than one worker is effective
   */
  public boolean parallel() {
    return effectiveWorkers() > 1;
  }

  /**
   * Batch size that keeps parallel progress reports near the requested cadence.
   *
   * @return vectors per task, at least one
   */
  public int vectorsPerTask() {
    if (progressEvery <= 0) {
      return 1;
    }
    return Math.max(1, (progressEvery + casesPerVector() - 1) / casesPerVector());
  }
}
