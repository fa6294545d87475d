package ca.gc.cra.xssbench.application.harness;

/**
 * Phases of one harness run, in order. Any phase may end the run early with a verdict.
 */
enum RunPhase {
  /** Clean up the previous case, render and load the synthetic document. */
  NAVIGATING,
  /** First look at the DOM and the gathered signals. */
  SIGNAL_CHECK,
  /** Dispatch synthetic events, click links and (for leak contexts) fire request gestures. */
  EVENT_TRIGGER,
  /** Poll signals until the wait window elapses or the run is cancelled. */
  POLL_WAIT,
  /** Last classification, including late passive fetches. */
  FINAL_CHECK
}
