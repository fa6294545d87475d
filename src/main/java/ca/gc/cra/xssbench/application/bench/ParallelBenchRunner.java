package ca.gc.cra.xssbench.application.bench;

import ca.gc.cra.xssbench.application.bench.BatchPlan.VectorBatch;
import ca.gc.cra.xssbench.application.port.BrowserLaunchException;
import ca.gc.cra.xssbench.application.port.CancellationToken;
import ca.gc.cra.xssbench.application.port.ClockPort;
import ca.gc.cra.xssbench.application.port.HarnessFactory;
import ca.gc.cra.xssbench.application.port.MetricsPort;
import ca.gc.cra.xssbench.application.port.ProgressListener;
import ca.gc.cra.xssbench.domain.bench.BenchCaseResult;
import ca.gc.cra.xssbench.domain.bench.BrowserEngine;
import ca.gc.cra.xssbench.domain.bench.CaseOutcome;
import ca.gc.cra.xssbench.domain.bench.Sanitizer;
import ca.gc.cra.xssbench.domain.vector.Vector;
import ca.gc.cra.xssbench.infrastructure.exec.ExecutorFactories;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Fans the matrix out across worker threads that each own a full session set.
 * <p><strong>Why:</strong> Browser automation drivers are single-threaded, so parallelism comes from
 * independent drivers rather than from sharing one.</p>
 * <p><strong>Protocol:</strong>
 * <ul>
 *   <li>The orchestrating thread offers vector batches to a bounded task queue without blocking and keeps
 *       whatever does not fit in a deferred list.</li>
 *   <li>Workers send {@link WorkerEvent}s on an unbounded event queue: a heartbeat after every case, batch
 *       results after every batch.</li>
 *   <li>A watchdog fails every pending batch when no event arrives within the stall window; a crashed worker
 *       triggers the same fallback immediately. Both cancel the run token.</li>
 *   <li>Shutdown sends one sentinel per worker, waits five seconds, then interrupts stragglers.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link #run} must be called from a single thread; the instance may be
 * reused for sequential runs.</p>
 * <p><strong>Observability:</strong> Emits {@code bench.parallel.stall} and {@code bench.parallel.crash};
 * worker log lines carry the {@code worker} and {@code browser} MDC keys.</p>
 */
final class ParallelBenchRunner {
  private static final Logger log = LoggerFactory.getLogger(ParallelBenchRunner.class);

  private static final long EVENT_POLL_MILLIS = 100L;
  private static final long TASK_POLL_MILLIS = 25L;
  private static final int QUEUE_SLOTS_PER_WORKER = 4;
  private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(5);
  private static final Duration SHUTDOWN_FORCE = Duration.ofSeconds(2);

  private final Supplier<HarnessFactory> harnessFactories;
  private final MetricsPort metrics;
  private final ClockPort clock;

  ParallelBenchRunner(Supplier<HarnessFactory> harnessFactories, MetricsPort metrics, ClockPort clock) {
    this.harnessFactories = Objects.requireNonNull(harnessFactories, "harnessFactories");
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
    this.clock = Objects.requireNonNullElse(clock, ClockPort.SYSTEM);
  }

  List<BenchCaseResult> run(
      BenchRequest request, CaseRunner caseRunner, ProgressListener listener, CancellationToken token)
      throws BrowserLaunchException, InterruptedException {
    int workers = request.effectiveWorkers();
    int vectorsPerTask = request.vectorsPerTask();
    int total = request.totalCases();
    List<VectorBatch> batches = BatchPlan.split(request.vectors(), vectorsPerTask);

    Map<Integer, VectorBatch> pending = new LinkedHashMap<>();
    for (VectorBatch batch : batches) {
      pending.put(batch.taskId(), batch);
    }
    Deque<VectorBatch> deferred = new ArrayDeque<>(batches);
    BlockingQueue<VectorBatch> tasks = new ArrayBlockingQueue<>(workers * QUEUE_SLOTS_PER_WORKER);
    BlockingQueue<WorkerEvent> events = new LinkedBlockingQueue<>();
    List<BenchCaseResult> results = new ArrayList<>(total);

    listener.onStatus(String.format(Locale.ROOT,
        "[0/%d] starting %d workers (vectors_per_task=%d, cases_per_vector=%d)",
        total, workers, vectorsPerTask, request.casesPerVector()));
    log.info("Parallel run of {} cases: {} workers, {} batches of up to {} vectors",
        total, workers, batches.size(), vectorsPerTask);

    ExecutorService pool = ExecutorFactories.benchWorkers(workers,
        (thread, ex) -> log.error("Worker thread {} died", thread.getName(), ex));
    long stallMillis = TimeUnit.SECONDS.toMillis(request.workerTaskTimeoutSec());
    long lastEventAt = clock.nowMillis();
    int started = 0;
    try {
      for (int i = 0; i < workers; i++) {
        pool.execute(new Worker(i, request, caseRunner, tasks, events, token));
      }
      while (!pending.isEmpty()) {
        feed(tasks, deferred);
        WorkerEvent event = events.poll(EVENT_POLL_MILLIS, TimeUnit.MILLISECONDS);
        long now = clock.nowMillis();
        if (event == null) {
          if (stallMillis > 0 && now - lastEventAt >= stallMillis) {
            metrics.increment("bench.parallel.stall");
            String reason = "Parallel run stalled (no completed chunks for " + request.workerTaskTimeoutSec() + "s)";
            log.warn("{}; failing {} pending batches", reason, pending.size());
            token.cancel(reason);
            failPending(pending, request, reason, results, listener, total);
          }
          continue;
        }
        lastEventAt = now;
        if (event instanceof WorkerEvent.Started) {
          started++;
          log.debug("Worker {} started ({}/{})", event.workerId(), started, workers);
        } else if (event instanceof WorkerEvent.TaskCompleted completed) {
          if (pending.remove(completed.taskId()) == null) {
            continue;
          }
          for (BenchCaseResult result : completed.results()) {
            results.add(result);
            listener.onCaseCompleted(results.size(), total, result);
          }
          if (completed.failFastHit()) {
            log.info("Fail-fast stop reported by worker {}; {} batches abandoned",
                completed.workerId(), pending.size());
            break;
          }
        } else if (event instanceof WorkerEvent.Crashed crashed) {
          metrics.increment("bench.parallel.crash");
          if (crashed.cause() instanceof BrowserLaunchException launchFailure && started == 0) {
            token.cancel("browser launch failed");
            throw launchFailure;
          }
          String reason = "Worker crashed (" + crashed.reason() + ")";
          log.error("Worker {} crashed; failing {} pending batches", crashed.workerId(), pending.size(),
              crashed.cause());
          token.cancel(reason);
          failPending(pending, request, reason, results, listener, total);
        }
      }
    } catch (InterruptedException ex) {
      token.cancel("interrupted");
      throw ex;
    } finally {
      deferred.clear();
      shutdown(pool, tasks, workers);
    }
    return results;
  }

  private static void feed(BlockingQueue<VectorBatch> tasks, Deque<VectorBatch> deferred) {
    while (!deferred.isEmpty() && tasks.offer(deferred.peekFirst())) {
      deferred.pollFirst();
    }
  }

  private static void failPending(
      Map<Integer, VectorBatch> pending,
      BenchRequest request,
      String reason,
      List<BenchCaseResult> results,
      ProgressListener listener,
      int total) {
    for (VectorBatch batch : pending.values()) {
      for (BenchCaseResult result : batch.failAll(request.sanitizers(), request.browsers(), reason)) {
        results.add(result);
        listener.onCaseCompleted(results.size(), total, result);
      }
    }
    pending.clear();
  }

  private static void shutdown(ExecutorService pool, BlockingQueue<VectorBatch> tasks, int workers) {
    tasks.clear();
    for (int i = 0; i < workers; i++) {
      if (!tasks.offer(VectorBatch.SENTINEL)) {
        break;
      }
    }
    ExecutorFactories.stopWorkers(pool, SHUTDOWN_GRACE, SHUTDOWN_FORCE);
  }

  /**
   * Turns a {@code pass} that finished after cancellation into an {@code error}: its wait window may have been
   * cut short, so the pass proves nothing. Positive verdicts stand.
   *
   * @param result case result
   * @param reason cancellation reason
   * @return {@code result}, or an {@code error} copy of it
   */
  static BenchCaseResult cutShort(BenchCaseResult result, String reason) {
    if (result.outcome() != CaseOutcome.PASS) {
      return result;
    }
    return new BenchCaseResult(
        result.sanitizer(),
        result.browser(),
        result.vectorId(),
        result.payloadContext(),
        result.runPayloadContext(),
        CaseOutcome.ERROR,
        false,
        result.lossy(),
        result.lossyDetails(),
        "Cancelled before the wait window completed (" + reason + ")",
        result.sanitizerInputHtml(),
        result.sanitizedHtml(),
        result.renderedHtml());
  }

  /** Pulls batches until a sentinel arrives or the run is cancelled. */
  private final class Worker implements Runnable {
    private final int id;
    private final BenchRequest request;
    private final CaseRunner caseRunner;
    private final BlockingQueue<VectorBatch> tasks;
    private final BlockingQueue<WorkerEvent> events;
    private final CancellationToken token;

    Worker(
        int id,
        BenchRequest request,
        CaseRunner caseRunner,
        BlockingQueue<VectorBatch> tasks,
        BlockingQueue<WorkerEvent> events,
        CancellationToken token) {
      this.id = id;
      this.request = request;
      this.caseRunner = caseRunner;
      this.tasks = tasks;
      this.events = events;
      this.token = token;
    }

    @Override
    public void run() {
      MDC.put("worker", Integer.toString(id));
      try (HarnessFactory factory = harnessFactories.get();
          SessionSet sessions = SessionSet.open(factory, request.browsers())) {
        events.offer(new WorkerEvent.Started(id));
        pullTasks(sessions);
      } catch (BrowserLaunchException ex) {
        events.offer(new WorkerEvent.Crashed(id, "browser launch failed: " + ex.getMessage(), ex));
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        log.debug("Worker {} interrupted", id);
      } catch (RuntimeException | Error ex) {
        events.offer(new WorkerEvent.Crashed(id, ex.getClass().getSimpleName() + ": " + ex.getMessage(), ex));
        throw ex;
      } finally {
        MDC.remove("browser");
        MDC.remove("worker");
      }
    }

    private void pullTasks(SessionSet sessions) throws InterruptedException {
      while (!token.isCancelled()) {
        VectorBatch batch = tasks.poll(TASK_POLL_MILLIS, TimeUnit.MILLISECONDS);
        if (batch == null) {
          continue;
        }
        if (batch.sentinel()) {
          return;
        }
        runBatch(batch, sessions);
      }
    }

    private void runBatch(VectorBatch batch, SessionSet sessions) {
      List<BenchCaseResult> out = new ArrayList<>(batch.vectors().size() * request.casesPerVector());
      boolean hit = false;
      outer:
      for (BrowserEngine browser : request.browsers()) {
        MDC.put("browser", browser.wireName());
        for (Sanitizer sanitizer : request.sanitizers()) {
          for (Vector vector : batch.vectors()) {
            if (token.isCancelled()) {
              break outer;
            }
            BenchCaseResult result = caseRunner.run(sanitizer, browser, vector, sessions.get(browser), token);
            if (token.isCancelled()) {
              result = cutShort(result, token.reason());
            }
            out.add(result);
            events.offer(new WorkerEvent.Heartbeat(id));
            if (request.failFast() && result.executed()) {
              token.cancel("fail-fast: " + result.label());
              hit = true;
              break outer;
            }
          }
        }
      }
      events.offer(new WorkerEvent.TaskCompleted(id, batch.taskId(), out, hit));
    }
  }
}
