package ai.eloquent.minotaur;

import ai.eloquent.minotaur.util.HarnessClock;
import ai.eloquent.minotaur.util.TimerUtils;

import java.time.Duration;

/**
 * A point in time on a {@link HarnessClock} by which something has to be done.
 * The convergence poller and the orchestrator's waits run against one of these, so that no wait outlives the
 * phase it belongs to. Workload windows and grace periods are not deadlines: they bound real worker threads,
 * and are always measured on the wall clock.
 */
public final class Deadline {

  /** The clock this deadline is measured on. */
  private final HarnessClock clock;

  /** When this deadline was created, on {@link #clock}. */
  public final long startTime;

  /** The instant, on {@link #clock}, at which this deadline expires. */
  public final long expiresAt;


  private Deadline(HarnessClock clock, long startTime, long expiresAt) {
    this.clock = clock;
    this.startTime = startTime;
    this.expiresAt = expiresAt;
  }


  /**
   * Create a deadline the given duration from now.
   */
  public static Deadline after(HarnessClock clock, Duration duration) {
    if (duration.isNegative()) {
      throw new IllegalArgumentException("Deadline cannot be in the past: " + duration);
    }
    long now = clock.now();
    return new Deadline(clock, now, now + duration.toMillis());
  }


  /**
   * The time left before this deadline expires; zero if it already has.
   */
  public Duration remaining() {
    return Duration.ofMillis(Math.max(0, expiresAt - clock.now()));
  }


  /**
   * The time since this deadline was created.
   */
  public Duration elapsed() {
    return clock.since(startTime);
  }


  /**
   * Whether this deadline has passed.
   */
  public boolean isExpired() {
    return clock.now() >= expiresAt;
  }


  /**
   * Clamp a per-attempt timeout so that it doesn't run past this deadline.
   */
  public Duration min(Duration timeout) {
    Duration remaining = remaining();
    return timeout.compareTo(remaining) < 0 ? timeout : remaining;
  }


  /** {@inheritDoc} */
  @Override
  public String toString() {
    return "Deadline(" + TimerUtils.formatDuration(remaining()) + " remaining)";
  }
}
