package ai.eloquent.minotaur.scenario;

/**
 * A check run after a scenario body has completed successfully.
 * A failed verification fails the scenario, even though the body itself passed.
 */
@FunctionalInterface
public interface Verification {

  /**
   * Check whatever this verification checks.
   *
   * @throws ai.eloquent.minotaur.ScenarioAssertionException If the check failed.
   */
  void verify(ScenarioOrchestrator orchestrator, ScenarioRun run) throws Exception;


  /**
   * Check that the history of tracked operations the scenario sent is linearizable.
   */
  static Verification linearizability() {
    return (orchestrator, run) -> orchestrator.tracker().verify();
  }
}
