package ai.eloquent.minotaur.util;

import java.time.Duration;


/**
 * The notion of time used by the scenario harness.
 * Every deadline and every sleep in a scenario goes through one of these, so that
 * unit tests can swap in a {@link MockHarnessClock} and run in virtual time.
 */
public interface HarnessClock {
  /**
   * This retrieves the current time, in milliseconds. This is only here so that it can be mocked.
   */
  long now();


  /**
   * Block the calling thread for the given duration.
   * Interrupts are not swallowed: an interrupted sleep throws a {@link RuntimeInterruptedException}
   * with the interrupt flag re-asserted, so that cancellation reaches the caller.
   *
   * @param duration The amount of time to sleep for.
   */
  void sleep(Duration duration);


  /**
   * @see #sleep(Duration)
   */
  default void sleep(long millis) {
    sleep(Duration.ofMillis(millis));
  }


  /**
   * The time elapsed since the given timestamp on this clock.
   *
   * @param startTime A timestamp previously returned by {@link #now()}.
   */
  default Duration since(long startTime) {
    return Duration.ofMillis(Math.max(0, now() - startTime));
  }
}
