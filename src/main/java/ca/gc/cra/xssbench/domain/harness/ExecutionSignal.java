package ca.gc.cra.xssbench.domain.harness;

/**
 * Secondary classification hint attached to a {@link VectorResult}.
 *
 * @since 0.1.0
 */
public enum ExecutionSignal {
  /** No leak observed (the run either executed or passed). */
  NONE,
  /** A cross-origin non-script fetch was attempted. */
  HTTP_LEAK
}
