package ai.eloquent.minotaur;

/**
 * A reportable scenario failure: the cluster under test did something it shouldn't have, or failed
 * to do something it should have, in the time it was given.
 *
 * @see DeadlineExceededException
 * @see ScenarioAssertionException
 */
public class ScenarioFailedException extends RuntimeException {

  public ScenarioFailedException(String message) {
    super(message);
  }

  public ScenarioFailedException(String message, Throwable cause) {
    super(message, cause);
  }
}
