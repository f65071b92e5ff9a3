package ai.eloquent.minotaur;

import ai.eloquent.minotaur.util.TimerUtils;

import javax.annotation.Nullable;
import java.time.Duration;
import java.util.Optional;

/**
 * We waited for the cluster to converge (or to serve a read-your-writes check) and it did not
 * get there before the overall deadline. This indicates the protocol under test failed to converge,
 * or regressed on liveness.
 */
public class DeadlineExceededException extends ScenarioFailedException {

  /** What we were waiting for. */
  public final String description;

  /** How long we waited, in total. */
  public final Duration waited;

  /** How many times we queried the cluster. */
  public final int attempts;

  /** The last value we observed, if any query succeeded at all. */
  @Nullable
  private final Object lastObserved;


  public DeadlineExceededException(String description, Duration waited, int attempts,
                                   @Nullable Object lastObserved, @Nullable Throwable lastError) {
    super(description + ": not satisfied after " + TimerUtils.formatDuration(waited) + " (" + attempts + " attempts; last observed "
        + (lastObserved == null ? "nothing" : lastObserved) + ")", lastError);
    this.description = description;
    this.waited = waited;
    this.attempts = attempts;
    this.lastObserved = lastObserved;
  }


  /**
   * The last value observed before we gave up.
   */
  public Optional<Object> lastObserved() {
    return Optional.ofNullable(lastObserved);
  }
}
