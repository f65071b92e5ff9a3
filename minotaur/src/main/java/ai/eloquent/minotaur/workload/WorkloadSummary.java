package ai.eloquent.minotaur.workload;

import ai.eloquent.minotaur.util.TimerUtils;

import java.time.Duration;

/**
 * What a finished workload batch did.
 */
public final class WorkloadSummary {

  /** The name of the batch, for logs. */
  public final String name;

  /** How the batch ended. */
  public final WorkloadHandle.State state;

  /** Operations that completed successfully. */
  public final long succeeded;

  /** Operations that failed transiently, and were swallowed. */
  public final long transientFailures;

  /** How long the batch ran for. */
  public final Duration elapsed;


  public WorkloadSummary(String name, WorkloadHandle.State state, long succeeded, long transientFailures, Duration elapsed) {
    this.name = name;
    this.state = state;
    this.succeeded = succeeded;
    this.transientFailures = transientFailures;
    this.elapsed = elapsed;
  }


  /**
   * Every operation that ran to completion, successfully or not.
   */
  public long issued() {
    return succeeded + transientFailures;
  }


  /** {@inheritDoc} */
  @Override
  public String toString() {
    return "WorkloadSummary(" + name + ": " + state + ", " + succeeded + " ok, " + transientFailures
        + " transient failures in " + TimerUtils.formatDuration(elapsed) + ")";
  }
}
