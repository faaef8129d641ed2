package ca.gc.cra.ferry.application.port;

/**
 * <strong>What:</strong> Port supplying wall-clock time and blocking delays to batch workers.
 * <p><strong>Why:</strong> Rate-limit deadlines and exponential backoff depend on time; tests substitute a virtual
 * clock so retry schedules can be asserted without real sleeps.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe; every worker reads the clock.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /**
   * Blocks the calling thread for the given delay.
   *
   * @param millis delay in milliseconds; non-positive values return immediately
   * @throws InterruptedException if the thread is interrupted while waiting
   */
  default void sleepMillis(long millis) throws InterruptedException {
    if (millis > 0) {
      Thread.sleep(millis);
    }
  }

  /**
   * Default {@link ClockPort} using {@link System#currentTimeMillis()} and {@link Thread#sleep(long)}.
   */
  ClockPort SYSTEM = System::currentTimeMillis;
}
