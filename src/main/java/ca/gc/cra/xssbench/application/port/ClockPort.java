package ca.gc.cra.xssbench.application.port;

/**
 * <strong>What:</strong> Monotonic time source for wait windows, watchdogs and latency metrics.
 * <p><strong>Why:</strong> Lets tests drive deadlines without sleeping.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @implNote Default implementation derives milliseconds from {@link System#nanoTime()}.
 * @since 0.1.0
 */
public interface ClockPort {
  /**
   * Returns a monotonic timestamp.
   *
   * @return milliseconds from an arbitrary origin; only differences are meaningful
   */
  long nowMillis();

  /** Default {@link ClockPort} backed by {@link System#nanoTime()}. */
  ClockPort SYSTEM = () -> System.nanoTime() / 1_000_000L;
}
