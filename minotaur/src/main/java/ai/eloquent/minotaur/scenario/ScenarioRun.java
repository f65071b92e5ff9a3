package ai.eloquent.minotaur.scenario;

import ai.eloquent.minotaur.util.HarnessClock;
import ai.eloquent.minotaur.util.TimerUtils;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.*;

/**
 * The record of a single scenario run: the phases it went through, what it crashed, and the last view it
 * saw the cluster converge on. A run is single-use, and is only ever touched from the thread driving the scenario.
 */
public class ScenarioRun {
  /**
   * An SLF4J Logger for this class.
   */
  private static final Logger log = LoggerFactory.getLogger(ScenarioRun.class);

  /** The name of the scenario. */
  public final String name;

  /** The clock we time the run on. */
  private final HarnessClock clock;

  /** When the run started. */
  private final long startTime;

  /** Who to tell about transitions. */
  private final List<ScenarioListener> listeners;

  /** Every phase so far. */
  private final List<ScenarioState> states = new ArrayList<>();

  /** Every replica crashed so far. */
  private final Set<Integer> crashed = new LinkedHashSet<>();

  /** The last converged view, if any. */
  @Nullable
  private Long lastConvergedView = null;


  ScenarioRun(String name, HarnessClock clock, List<ScenarioListener> listeners) {
    this.name = name;
    this.clock = clock;
    this.startTime = clock.now();
    this.listeners = listeners;
  }


  /**
   * The phase the run is in, or empty if it hasn't entered one yet.
   */
  public Optional<ScenarioState> state() {
    return states.isEmpty() ? Optional.empty() : Optional.of(states.get(states.size() - 1));
  }


  /**
   * Move to the next phase.
   *
   * @throws IllegalStateException If the scenario skipped backwards, which is a bug in the scenario.
   */
  public void transition(ScenarioState to) {
    @Nullable ScenarioState from = state().orElse(null);
    if (from == to) {
      return;
    }
    if (!ScenarioState.canTransition(from, to)) {
      throw new IllegalStateException("[" + name + "] illegal transition " + from + " -> " + to);
    }
    states.add(to);
    long elapsed = clock.now() - startTime;
    log.info("[{}] {} -> {} @ {}", name, from, to, TimerUtils.formatTimeDifference(elapsed));
    for (ScenarioListener listener : listeners) {
      try {
        listener.onTransition(name, from, to, elapsed);
      } catch (RuntimeException e) {
        log.warn("[{}] scenario listener threw on {} -> {}", name, from, to, e);
      }
    }
  }


  /**
   * Record that we crashed some replicas.
   */
  public void recordCrashed(Collection<Integer> replicaIds) {
    crashed.addAll(replicaIds);
  }


  /**
   * Record that a replica converged on a view.
   */
  public void recordConvergedView(long view) {
    this.lastConvergedView = view;
  }


  /**
   * The last view we saw the cluster converge on.
   */
  public Optional<Long> lastConvergedView() {
    return Optional.ofNullable(lastConvergedView);
  }


  /**
   * Every replica crashed so far.
   */
  public ImmutableSet<Integer> crashed() {
    return ImmutableSet.copyOf(crashed);
  }


  /**
   * Mark the run failed. A no-op if it already has.
   */
  void fail(Throwable cause) {
    if (state().orElse(null) != ScenarioState.FAILED) {
      log.warn("[{}] scenario failed in state {}: {}", name, state().map(Enum::name).orElse("<not started>"), cause.toString());
      transition(ScenarioState.FAILED);
    }
  }


  /**
   * Summarize a successful run.
   */
  ScenarioResult result() {
    return new ScenarioResult(name, ImmutableList.copyOf(states), crashed(), lastConvergedView(), clock.since(startTime));
  }
}
