package ai.eloquent.minotaur.scenario;

/**
 * A listener for scenario progress, e.g. to feed a dashboard or to collect timings.
 */
@FunctionalInterface
public interface ScenarioListener {
  /**
   * Register that a scenario moved from one phase to another.
   *
   * @param scenario The name of the scenario.
   * @param from The phase we left, or null if the run just started.
   * @param to The phase we entered.
   * @param elapsedMillis The time since the run started.
   */
  void onTransition(String scenario, ScenarioState from, ScenarioState to, long elapsedMillis);
}
