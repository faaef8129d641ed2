package ca.gc.cra.ferry.application.batch;

import ca.gc.cra.ferry.application.port.ClockPort;
import java.util.Objects;

/**
 * Shared "do not send before" deadline for every worker of one processor.
 *
 * <p>The deadline only moves forward. The lock is held to read or advance it, never while sleeping.</p>
 *
 * @since 0.1.0
 */
public final class RateLimitState {
  private final ClockPort clock;
  private final Object lock = new Object();
  private long notBeforeMillis;

  /**
   * Creates a state that is initially clear.
   *
   * @param clock time source used for deadlines and waits
   */
  public RateLimitState(ClockPort clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Pushes the deadline to {@code now + delayMillis} unless it already lies further ahead.
   *
   * @param delayMillis deferral requested by a rate-limited response
   * @return effective deadline in epoch milliseconds
   */
  public long deferFor(long delayMillis) {
    synchronized (lock) {
      long candidate = clock.nowMillis() + Math.max(0L, delayMillis);
      if (candidate > notBeforeMillis) {
        notBeforeMillis = candidate;
      }
      return notBeforeMillis;
    }
  }

  /**
   * Blocks until the current time reaches the deadline; re-checks after each sleep since other workers may have
   * extended it meanwhile.
   *
   * @return total milliseconds spent waiting
   * @throws InterruptedException if interrupted while waiting
   */
  public long awaitClearance() throws InterruptedException {
    long waited = 0L;
    while (true) {
      long remaining;
      synchronized (lock) {
        remaining = notBeforeMillis - clock.nowMillis();
      }
      if (remaining <= 0) {
        return waited;
      }
      clock.sleepMillis(remaining);
      waited += remaining;
    }
  }

  public long notBeforeMillis() {
    synchronized (lock) {
      return notBeforeMillis;
    }
  }
}
