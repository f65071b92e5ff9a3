package ai.eloquent.minotaur;

import javax.annotation.Nullable;

/**
 * The cluster was observed in a state the scenario says it must not be in: the wrong view,
 * committed data that should not have been committed (or vice versa), a view going backwards.
 * Always carries both the expected and the observed value.
 */
public class ScenarioAssertionException extends ScenarioFailedException {

  /** What we expected to see. */
  @Nullable
  public final Object expected;

  /** What we actually saw. */
  @Nullable
  public final Object observed;


  public ScenarioAssertionException(String message, @Nullable Object expected, @Nullable Object observed) {
    super(message + " (expected " + expected + ", observed " + observed + ")");
    this.expected = expected;
    this.observed = observed;
  }


  /**
   * Check that two values are equal, throwing a {@link ScenarioAssertionException} otherwise.
   */
  public static void assertEquals(String message, @Nullable Object expected, @Nullable Object observed) {
    if (expected == null ? observed != null : !expected.equals(observed)) {
      throw new ScenarioAssertionException(message, expected, observed);
    }
  }


  /**
   * Check that a condition holds, throwing a {@link ScenarioAssertionException} otherwise.
   */
  public static void assertTrue(String message, boolean condition, @Nullable Object expected, @Nullable Object observed) {
    if (!condition) {
      throw new ScenarioAssertionException(message, expected, observed);
    }
  }
}
