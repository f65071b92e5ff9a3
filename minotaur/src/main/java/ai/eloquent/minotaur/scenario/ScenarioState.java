package ai.eloquent.minotaur.scenario;

import javax.annotation.Nullable;

/**
 * The phases of a view change scenario. A run moves forward through these (possibly skipping some),
 * except that a chained scenario may go from a converged view back to crashing the next primary.
 * Any phase may end in {@link #FAILED}.
 */
public enum ScenarioState {
  /** Every replica is running. */
  ALL_UP,
  /** Known data has been written, and the cluster confirmed to be in the initial view. */
  BASELINE_WRITTEN,
  /** The primary (and whatever else the scenario calls for) has been crashed. */
  PRIMARY_CRASHED,
  /** Client traffic is being injected to trip the replicas' liveness timers. */
  WORKLOAD_INJECTING,
  /** A surviving replica reached the expected view. */
  VIEW_CONVERGED,
  /** The cluster was shown to be live (or correctly stalled) in the new view. Terminal success. */
  POST_CONVERGENCE_VERIFIED,
  /** Some assertion failed or some deadline passed. Terminal failure. */
  FAILED,
  ;


  /**
   * Whether a run in this state (or in no state yet, if null) may move to the given state.
   */
  public static boolean canTransition(@Nullable ScenarioState from, ScenarioState to) {
    if (from == null) {
      return to == ALL_UP || to == FAILED;
    }
    if (from == FAILED) {
      return false;
    }
    if (to == FAILED) {
      return true;
    }
    if (to == PRIMARY_CRASHED && (from == VIEW_CONVERGED || from == POST_CONVERGENCE_VERIFIED)) {
      return true;  // the next round of a chained scenario
    }
    return to.ordinal() > from.ordinal();
  }
}
