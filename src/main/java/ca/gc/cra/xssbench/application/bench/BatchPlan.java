package ca.gc.cra.xssbench.application.bench;

import ca.gc.cra.xssbench.domain.bench.BenchCaseResult;
import ca.gc.cra.xssbench.domain.bench.BrowserEngine;
import ca.gc.cra.xssbench.domain.bench.Sanitizer;
import ca.gc.cra.xssbench.domain.vector.Vector;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits the vector list into contiguous batches handed to parallel workers.
 */
final class BatchPlan {
  private BatchPlan() {}

  /**
   * Contiguous slice of the vector list.
   *
   * @param taskId sequence number; {@code -1} marks the shutdown sentinel
   * @param firstVector index of the first vector in the full list
   * @param vectors vectors of the batch
   */
  record VectorBatch(int taskId, int firstVector, List<Vector> vectors) {
    static final VectorBatch SENTINEL = new VectorBatch(-1, -1, List.of());

    boolean sentinel() {
      return taskId < 0;
    }

    /**
     * Builds one error result per case of the batch.
     *
     * @param sanitizers sanitizers of the run
     * @param browsers engines of the run
     * @param details error explanation
     * @return error results in worker iteration order
     */
    List<BenchCaseResult> failAll(List<Sanitizer> sanitizers, List<BrowserEngine> browsers, String details) {
      List<BenchCaseResult> out = new ArrayList<>(vectors.size() * sanitizers.size() * browsers.size());
      for (BrowserEngine browser : browsers) {
        for (Sanitizer sanitizer : sanitizers) {
          for (Vector vector : vectors) {
            out.add(BenchCaseResult.error(sanitizer.name(), browser, vector.id(), vector.context(), details));
          }
        }
      }
      return out;
    }
  }

  static List<VectorBatch> split(List<Vector> vectors, int vectorsPerTask) {
    if (vectorsPerTask < 1) {
      throw new IllegalArgumentException("vectorsPerTask must be >= 1 (was " + vectorsPerTask + ")");
    }
    List<VectorBatch> batches = new ArrayList<>();
    for (int start = 0; start < vectors.size(); start += vectorsPerTask) {
      int end = Math.min(vectors.size(), start + vectorsPerTask);
      batches.add(new VectorBatch(batches.size(), start, List.copyOf(vectors.subList(start, end))));
    }
    return batches;
  }
}
