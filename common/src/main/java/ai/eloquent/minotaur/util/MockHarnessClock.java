package ai.eloquent.minotaur.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A virtual clock for unit tests.
 * Time only moves when someone sleeps on it or calls {@link #advanceTime(long)}, so a test can
 * step through a sixty second deadline without waiting sixty seconds.
 *
 * <p>
 *   Sleeping advances the shared virtual time by the full sleep duration and returns immediately.
 *   With several threads sleeping at once, time advances by the sum of their sleeps; tests that
 *   care about exact timestamps should drive the clock from a single thread.
 * </p>
 */
public class MockHarnessClock implements HarnessClock {
  /**
   * An SLF4J Logger for this class.
   */
  private static final Logger log = LoggerFactory.getLogger(MockHarnessClock.class);

  /** The current virtual time, in milliseconds. */
  private final AtomicLong mockTime;


  /** Create a clock starting at the given virtual time. */
  public MockHarnessClock(long startTime) {
    this.mockTime = new AtomicLong(startTime);
  }


  /** Create a clock starting at time 0. */
  public MockHarnessClock() {
    this(0L);
  }


  /**
   * This moves time forward on the mock clock.
   *
   * @param millis The number of milliseconds to move forward. Must be non-negative.
   *
   * @return The new virtual time.
   */
  public long advanceTime(long millis) {
    if (millis < 0) {
      throw new IllegalArgumentException("Cannot move a clock backwards (asked for " + millis + "ms)");
    }
    long now = mockTime.addAndGet(millis);
    log.trace("[{}] advanced mock clock by {}ms", now, millis);
    return now;
  }


  /** {@inheritDoc} */
  @Override
  public long now() {
    return mockTime.get();
  }


  /**
   * {@inheritDoc}
   *
   * <p>
   *   On the mock clock this returns immediately after moving virtual time forward.
   *   It still honors interrupts, so that cancellation behaves the same as on a real clock.
   * </p>
   */
  @Override
  public void sleep(Duration duration) {
    if (Thread.currentThread().isInterrupted()) {
      throw new RuntimeInterruptedException("Interrupted before sleeping on the mock clock", new InterruptedException());
    }
    advanceTime(duration.toMillis());
    Thread.yield();
  }


  /** {@inheritDoc} */
  @Override
  public String toString() {
    return "MockHarnessClock@" + mockTime.get();
  }
}
