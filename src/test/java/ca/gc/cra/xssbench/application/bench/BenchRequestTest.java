package ca.gc.cra.xssbench.application.bench;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.xssbench.application.bench.BatchPlan.VectorBatch;
import ca.gc.cra.xssbench.domain.bench.BenchCaseResult;
import ca.gc.cra.xssbench.domain.bench.BrowserEngine;
import ca.gc.cra.xssbench.domain.bench.CaseOutcome;
import ca.gc.cra.xssbench.domain.bench.Sanitizer;
import ca.gc.cra.xssbench.domain.vector.PayloadContext;
import ca.gc.cra.xssbench.domain.vector.Vector;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;
import org.junit.jupiter.api.Test;

class BenchRequestTest {
  private static final Sanitizer A = Sanitizer.universal("a", "", (html, context) -> html);
  private static final Sanitizer B = Sanitizer.universal("b", "", (html, context) -> html);

  static List<Vector> vectors(int count) {
    List<Vector> out = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      out.add(Vector.unchecked("v" + i, "<p>" + i + "</p>", PayloadContext.HTML));
    }
    return out;
  }

  private static BenchRequest request(int vectors, int workers, int progressEvery) {
    return new BenchRequest(vectors(vectors), List.of(A, B), List.of(BrowserEngine.CHROMIUM, BrowserEngine.FIREFOX),
        OptionalLong.empty(), workers, false, progressEvery, 3600);
  }

  @Test
  void matrixSizeAndMode() {
    BenchRequest request = request(5, 1, 25);

    assertEquals(4, request.casesPerVector());
    assertEquals(20, request.totalCases());
    assertFalse(request.parallel());
    assertTrue(request(5, 3, 25).parallel());
  }

  @Test
  void workersAreCappedByVectorCount() {
    assertEquals(2, request(2, 8, 25).effectiveWorkers());
    assertEquals(1, request(0, 8, 25).effectiveWorkers());
    assertFalse(request(1, 8, 25).parallel());
  }

  @Test
  void batchSizeTracksProgressCadence() {
    assertEquals(7, request(10, 2, 25).vectorsPerTask());
    assertEquals(1, request(10, 2, 1).vectorsPerTask());
    assertEquals(1, request(10, 2, 0).vectorsPerTask());
  }

  @Test
  void invalidRequestsAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> new BenchRequest(vectors(1), List.of(),
        List.of(BrowserEngine.CHROMIUM), OptionalLong.empty(), 1, false, 0, 0));
    assertThrows(IllegalArgumentException.class, () -> new BenchRequest(vectors(1), List.of(A),
        List.of(), OptionalLong.empty(), 1, false, 0, 0));
    assertThrows(IllegalArgumentException.class, () -> new BenchRequest(vectors(1), List.of(A),
        List.of(BrowserEngine.CHROMIUM), OptionalLong.of(-1), 1, false, 0, 0));
    assertThrows(IllegalArgumentException.class, () -> new BenchRequest(vectors(1), List.of(A),
        List.of(BrowserEngine.CHROMIUM), OptionalLong.empty(), 0, false, 0, 0));
  }

  @Test
  void splitKeepsVectorsContiguous() {
    List<VectorBatch> batches = BatchPlan.split(vectors(5), 2);

    assertEquals(3, batches.size());
    assertEquals(List.of(0, 2, 4), batches.stream().map(VectorBatch::firstVector).toList());
    assertEquals("v4", batches.get(2).vectors().get(0).id());
    assertEquals(2, batches.get(2).taskId());
    assertThrows(IllegalArgumentException.class, () -> BatchPlan.split(vectors(1), 0));
  }

  @Test
  void failedBatchProducesOneErrorPerCase() {
    VectorBatch batch = BatchPlan.split(vectors(2), 2).get(0);

    List<BenchCaseResult> failed = batch.failAll(List.of(A, B), List.of(BrowserEngine.WEBKIT), "stalled");

    assertEquals(4, failed.size());
    assertTrue(failed.stream().allMatch(result -> result.outcome() == CaseOutcome.ERROR));
    assertEquals("a / webkit / v0 (html)", failed.get(0).label());
    assertEquals("stalled", failed.get(3).details());
    assertTrue(VectorBatch.SENTINEL.sentinel());
  }
}
