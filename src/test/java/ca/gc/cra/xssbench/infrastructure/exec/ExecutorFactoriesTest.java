package ca.gc.cra.xssbench.infrastructure.exec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

class ExecutorFactoriesTest {

  @Test
  void workersAreNamedDaemons() throws Exception {
    ExecutorService pool = ExecutorFactories.benchWorkers(1, null);
    AtomicReference<String> name = new AtomicReference<>();
    AtomicBoolean daemon = new AtomicBoolean();
    CountDownLatch done = new CountDownLatch(1);

    pool.execute(() -> {
      name.set(Thread.currentThread().getName());
      daemon.set(Thread.currentThread().isDaemon());
      done.countDown();
    });

    assertTrue(done.await(5, TimeUnit.SECONDS));
    assertEquals("xssbench-worker-1", name.get());
    assertTrue(daemon.get());
    assertTrue(ExecutorFactories.stopWorkers(pool, Duration.ofSeconds(5), Duration.ofSeconds(1)));
  }

  @Test
  void extraSubmissionIsRejected() {
    ExecutorService pool = ExecutorFactories.benchWorkers(1, null);
    CountDownLatch release = new CountDownLatch(1);
    try {
      pool.execute(() -> {
        try {
          release.await();
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
        }
      });
      assertThrows(RejectedExecutionException.class, () -> pool.execute(() -> { }));
    } finally {
      release.countDown();
      ExecutorFactories.stopWorkers(pool, Duration.ofSeconds(5), Duration.ofSeconds(1));
    }
  }

  @Test
  void stuckWorkerIsInterrupted() {
    ExecutorService pool = ExecutorFactories.benchWorkers(1, null);
    AtomicBoolean interrupted = new AtomicBoolean();
    CountDownLatch started = new CountDownLatch(1);
    pool.execute(() -> {
      started.countDown();
      try {
        Thread.sleep(60_000);
      } catch (InterruptedException ex) {
        interrupted.set(true);
      }
    });

    try {
      assertTrue(started.await(5, TimeUnit.SECONDS));
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
    assertTrue(ExecutorFactories.stopWorkers(pool, Duration.ofMillis(50), Duration.ofSeconds(5)));
    assertTrue(interrupted.get());
  }

  @Test
  void rejectsEmptyPool() {
    assertThrows(IllegalArgumentException.class, () -> ExecutorFactories.benchWorkers(0, null));
    assertFalse(Thread.currentThread().isInterrupted());
  }
}
