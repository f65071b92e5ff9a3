package ai.eloquent.minotaur.scenario;

import ai.eloquent.minotaur.util.TimerUtils;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import java.time.Duration;
import java.util.Optional;

/**
 * What a successful scenario run did.
 */
public final class ScenarioResult {

  /** The name of the scenario. */
  public final String name;

  /** Every phase the run went through, in order. */
  public final ImmutableList<ScenarioState> states;

  /** Every replica the run crashed at some point, in the order they were crashed. */
  public final ImmutableSet<Integer> crashed;

  /** The last view the run saw the cluster converge on, if it waited for one. */
  public final Optional<Long> finalView;

  /** How long the run took. */
  public final Duration elapsed;


  public ScenarioResult(String name, ImmutableList<ScenarioState> states, ImmutableSet<Integer> crashed,
                        Optional<Long> finalView, Duration elapsed) {
    this.name = name;
    this.states = states;
    this.crashed = crashed;
    this.finalView = finalView;
    this.elapsed = elapsed;
  }


  /**
   * The phase the run ended in.
   */
  public ScenarioState finalState() {
    return states.get(states.size() - 1);
  }


  /** {@inheritDoc} */
  @Override
  public String toString() {
    return "ScenarioResult(" + name + ": " + states + ", crashed=" + crashed
        + ", finalView=" + finalView.map(String::valueOf).orElse("?") + ", in " + TimerUtils.formatDuration(elapsed) + ")";
  }
}
