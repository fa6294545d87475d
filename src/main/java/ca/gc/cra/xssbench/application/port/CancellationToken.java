package ca.gc.cra.xssbench.application.port;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Run-wide cooperative cancellation flag threaded through every blocking call of a benchmark.
 *
 * <p>Fail-fast, stalled workers and crashed workers all cancel the same token; workers check it between
 * cases and the session checks it while polling.</p>
 *
 * @since 0.1.0
 */
public final class CancellationToken {
  private final AtomicReference<String> reason = new AtomicReference<>();

  /**
   * Requests cancellation. Only the first reason is kept.
   *
   * @param why short description for logs
   * @return {@code true} when this call cancelled the token
   */
  public boolean cancel(String why) {
    return reason.compareAndSet(null, why == null ? "cancelled" : why);
  }

  /**
   * Indicates whether cancellation was requested.
   *
   * @return {@code true} once {@link #cancel(String)} has been called
   */
  public boolean isCancelled() {
    return reason.get() != null;
  }

  /**
   * Returns the first cancellation reason.
   *
   * @return reason, or {@code null} while not cancelled
   */
  public String reason() {
    return reason.get();
  }
}
