package ca.gc.cra.xssbench.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds and stops the pools that host parallel benchmark workers.
 *
 * <p>Worker threads are daemons named {@code xssbench-worker-N}, numbered from 1, so a stuck browser never keeps
 * the JVM alive after the CLI returns.</p>
 */
public final class ExecutorFactories {
  private static final Logger log = LoggerFactory.getLogger(ExecutorFactories.class);

  /** Thread-name prefix of benchmark workers. */
  public static final String WORKER_PREFIX = "xssbench-worker";

  private ExecutorFactories() {}

  /**
   * Creates a pool with exactly one thread per worker. Each worker is a long-running loop, so a submission
   * beyond {@code workers} is rejected instead of queued.
   *
   * @param workers number of worker threads
   * @param onCrash handler for exceptions escaping a worker loop; {@code null} ignores them
   * @return pool ready for {@code workers} submissions
   */
  public static ExecutorService benchWorkers(int workers, UncaughtExceptionHandler onCrash) {
    if (workers <= 0) {
      throw new IllegalArgumentException("workers must be positive (was " + workers + ")");
    }
    UncaughtExceptionHandler handler = onCrash != null ? onCrash : (thread, ex) -> { };
    AtomicInteger next = new AtomicInteger(1);
    return new ThreadPoolExecutor(
        workers,
        workers,
        0L,
        TimeUnit.MILLISECONDS,
        new SynchronousQueue<>(),
        runnable -> {
          Thread thread = new Thread(runnable, WORKER_PREFIX + "-" + next.getAndIncrement());
          thread.setDaemon(true);
          thread.setUncaughtExceptionHandler(handler);
          return thread;
        },
        new ThreadPoolExecutor.AbortPolicy());
  }

  /**
   * Stops a worker pool in two stages: waits {@code grace} for workers to drain, then interrupts them and
   * waits {@code force} more.
   *
   * @param pool pool to stop
   * @param grace wait before interrupting
   * @param force wait after interrupting
   * @return {@code true} when every worker terminated
   */
  public static boolean stopWorkers(ExecutorService pool, Duration grace, Duration force) {
    pool.shutdown();
    try {
      if (pool.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
        return true;
      }
      log.warn("Workers still busy after {} ms; interrupting", grace.toMillis());
      pool.shutdownNow();
      if (pool.awaitTermination(force.toMillis(), TimeUnit.MILLISECONDS)) {
        return true;
      }
      log.warn("Workers did not stop within {} ms after interruption", force.toMillis());
      return false;
    } catch (InterruptedException ex) {
      pool.shutdownNow();
      Thread.currentThread().interrupt();
      return false;
    }
  }
}
