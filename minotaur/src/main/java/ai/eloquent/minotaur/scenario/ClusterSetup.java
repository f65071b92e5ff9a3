package ai.eloquent.minotaur.scenario;

/**
 * The first stage of a {@link Scenario}: bring the cluster into the shape the scenario body expects.
 */
@FunctionalInterface
public interface ClusterSetup {

  /**
   * Prepare the cluster. On success, the run should be in {@link ScenarioState#ALL_UP}.
   */
  void prepare(ScenarioOrchestrator orchestrator, ScenarioRun run) throws Exception;


  /**
   * The standard setup: start every replica, and check they all came up.
   */
  static ClusterSetup startAll() {
    return (orchestrator, run) -> {
      orchestrator.startAll();
      run.transition(ScenarioState.ALL_UP);
    };
  }
}
