package ca.gc.cra.xssbench.application.bench;

import ca.gc.cra.xssbench.domain.bench.BenchCaseResult;
import java.util.List;

/**
 * Messages parallel workers send to the orchestrating thread. Every event counts as a heartbeat for the
 * stall watchdog.
 */
sealed interface WorkerEvent {
  int workerId();

  /** Worker opened its sessions and is pulling tasks. */
  record Started(int workerId) implements WorkerEvent {}

  /** Worker finished one case. */
  record Heartbeat(int workerId) implements WorkerEvent {}

  /**
   * Worker finished (or abandoned after cancellation) one batch.
   *
   * @param workerId worker index
   * @param taskId batch sequence number
   * @param results results of the cases that ran
   * @param failFastHit whether the batch stopped on an executed case
   */
  record TaskCompleted(int workerId, int taskId, List<BenchCaseResult> results, boolean failFastHit)
      implements WorkerEvent {
    public TaskCompleted {
      results = List.copyOf(results);
    }
  }

  /**
   * Worker died.
   *
   * @param workerId worker index
   * @param reason short description
   * @param cause failure, when known
   */
  record Crashed(int workerId, String reason, Throwable cause) implements WorkerEvent {}
}
