package ca.gc.cra.xssbench.application.harness;

/**
 * Tunables for a signal-capture session.
 *
 * @param actionTimeoutMs cap for navigation, click and evaluation calls
 * @param pollIntervalMs interval between signal checks during the wait window
 * @since 0.1.0
 */
public record SessionSettings(long actionTimeoutMs, long pollIntervalMs) {
  /** Default cap for page actions. */
  public static final long DEFAULT_ACTION_TIMEOUT_MS = 5_000;
  /** Default polling interval. */
  public static final long DEFAULT_POLL_INTERVAL_MS = 50;

  public SessionSettings {
    if (actionTimeoutMs <= 0) {
      throw new IllegalArgumentException("actionTimeoutMs must be positive (was " + actionTimeoutMs + ")");
    }
    if (pollIntervalMs <= 0) {
      throw new IllegalArgumentException("pollIntervalMs must be positive (was " + pollIntervalMs + ")");
    }
  }

  /**
   * Returns the default settings.
   *
   * @return 5000 ms action cap, 50 ms polling
   */
  public static SessionSettings defaults() {
    return new SessionSettings(DEFAULT_ACTION_TIMEOUT_MS, DEFAULT_POLL_INTERVAL_MS);
  }
}
