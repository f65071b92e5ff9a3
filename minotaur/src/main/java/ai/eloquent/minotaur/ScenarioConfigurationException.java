package ai.eloquent.minotaur;

/**
 * The scenario we were asked to run cannot be run meaningfully against this cluster: we were asked to
 * crash more replicas than there are eligible, or the cluster sizing doesn't meet the scenario's
 * preconditions. This is thrown before any replica is touched.
 */
public class ScenarioConfigurationException extends IllegalStateException {

  public ScenarioConfigurationException(String message) {
    super(message);
  }
}
