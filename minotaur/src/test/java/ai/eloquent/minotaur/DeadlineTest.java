package ai.eloquent.minotaur;

import ai.eloquent.minotaur.util.MockHarnessClock;
import org.junit.Test;

import java.time.Duration;

import static org.junit.Assert.*;

/**
 * Test {@link Deadline}.
 */
public class DeadlineTest {

  @Test
  public void expires() {
    MockHarnessClock clock = new MockHarnessClock(1000);
    Deadline deadline = Deadline.after(clock, Duration.ofSeconds(10));
    assertEquals(11000, deadline.expiresAt);
    assertFalse(deadline.isExpired());
    assertEquals(Duration.ofSeconds(10), deadline.remaining());

    clock.advanceTime(9999);
    assertFalse(deadline.isExpired());
    assertEquals(Duration.ofMillis(1), deadline.remaining());

    clock.advanceTime(1);
    assertTrue(deadline.isExpired());
    assertEquals(Duration.ZERO, deadline.remaining());

    clock.advanceTime(5000);
    assertEquals("Remaining time is never negative", Duration.ZERO, deadline.remaining());
    assertEquals(Duration.ofSeconds(15), deadline.elapsed());
  }


  /**
   * A per-attempt timeout should never run past the deadline.
   */
  @Test
  public void clampsTimeouts() {
    MockHarnessClock clock = new MockHarnessClock();
    Deadline deadline = Deadline.after(clock, Duration.ofSeconds(7));
    assertEquals(Duration.ofSeconds(5), deadline.min(Duration.ofSeconds(5)));
    clock.advanceTime(4000);
    assertEquals(Duration.ofSeconds(3), deadline.min(Duration.ofSeconds(5)));
    clock.advanceTime(4000);
    assertEquals(Duration.ZERO, deadline.min(Duration.ofSeconds(5)));
  }


  @Test
  public void zeroDeadlineIsAlreadyExpired() {
    assertTrue(Deadline.after(new MockHarnessClock(), Duration.ZERO).isExpired());
  }


  @Test(expected = IllegalArgumentException.class)
  public void noDeadlinesInThePast() {
    Deadline.after(new MockHarnessClock(), Duration.ofMillis(-1));
  }
}
