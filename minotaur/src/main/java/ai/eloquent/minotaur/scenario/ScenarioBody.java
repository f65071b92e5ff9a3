package ai.eloquent.minotaur.scenario;

/**
 * The body of a {@link Scenario}: crash things, wait for the cluster to recover, and assert it did so correctly.
 * A body must leave the run in {@link ScenarioState#POST_CONVERGENCE_VERIFIED}.
 */
@FunctionalInterface
public interface ScenarioBody {

  void execute(ScenarioOrchestrator orchestrator, ScenarioRun run) throws Exception;
}
