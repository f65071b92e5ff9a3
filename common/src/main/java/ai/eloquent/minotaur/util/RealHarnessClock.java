package ai.eloquent.minotaur.util;

import java.time.Duration;

/**
 * A {@link HarnessClock} backed by the system wall clock.
 */
public class RealHarnessClock implements HarnessClock {

  /** A shared instance; the class holds no state. */
  public static final RealHarnessClock INSTANCE = new RealHarnessClock();


  /** {@inheritDoc} */
  @Override
  public long now() {
    return System.currentTimeMillis();
  }


  /**
   * {@inheritDoc}
   *
   * <p>
   *   {@link Thread#sleep(long)} may return early on some platforms, so we keep sleeping
   *   until the monotonic clock says we're done.
   * </p>
   */
  @Override
  public void sleep(Duration duration) {
    long sleepTill = System.nanoTime() + duration.toNanos();
    long remaining;
    while ((remaining = sleepTill - System.nanoTime()) > 0) {
      try {
        Thread.sleep(remaining / 1000000, (int) (remaining % 1000000));
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new RuntimeInterruptedException("Interrupted while sleeping for " + TimerUtils.formatDuration(duration), e);
      }
    }
  }


  /** {@inheritDoc} */
  @Override
  public String toString() {
    return "RealHarnessClock";
  }
}
