package ai.eloquent.minotaur.util;

import org.junit.Test;

import java.time.Duration;

import static org.junit.Assert.*;

/**
 * Test {@link MockHarnessClock}.
 */
public class MockHarnessClockTest {

  @Test
  public void startsWhereToldTo() {
    assertEquals(0L, new MockHarnessClock().now());
    assertEquals(1000L, new MockHarnessClock(1000L).now());
  }


  @Test
  public void advanceTime() {
    MockHarnessClock clock = new MockHarnessClock();
    assertEquals(50L, clock.advanceTime(50));
    assertEquals(50L, clock.now());
    assertEquals("Advancing by zero is fine", 50L, clock.advanceTime(0));
  }


  @Test(expected = IllegalArgumentException.class)
  public void cannotGoBackwards() {
    new MockHarnessClock(100L).advanceTime(-1);
  }


  /**
   * Sleeping should return immediately, but move virtual time forward.
   */
  @Test
  public void sleepMovesTime() {
    MockHarnessClock clock = new MockHarnessClock();
    long wallStart = System.currentTimeMillis();
    clock.sleep(Duration.ofMinutes(10));
    clock.sleep(500);
    assertEquals(600500L, clock.now());
    assertTrue("Should not actually have slept", System.currentTimeMillis() - wallStart < 5000);
  }


  @Test
  public void since() {
    MockHarnessClock clock = new MockHarnessClock(10L);
    long start = clock.now();
    clock.advanceTime(250);
    assertEquals(Duration.ofMillis(250), clock.since(start));
    assertEquals("Never negative", Duration.ZERO, clock.since(start + 1000));
  }


  /**
   * An interrupted thread should not be able to sleep on the mock clock, same as on a real one.
   */
  @Test
  public void sleepHonorsInterrupts() {
    MockHarnessClock clock = new MockHarnessClock();
    Thread.currentThread().interrupt();
    try {
      clock.sleep(100);
      fail("Should have thrown on an interrupted thread");
    } catch (RuntimeInterruptedException e) {
      assertEquals("Time should not have moved", 0L, clock.now());
    } finally {
      Thread.interrupted();  // clear the flag for the other tests
    }
  }
}
