package ai.eloquent.minotaur.scenario;

import ai.eloquent.minotaur.ClusterConfig;
import ai.eloquent.minotaur.CrashPlan;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;

import static ai.eloquent.minotaur.ScenarioAssertionException.assertEquals;
import static ai.eloquent.minotaur.ScenarioAssertionException.assertTrue;
import static ai.eloquent.minotaur.scenario.ScenarioOrchestrator.expectedViewAfter;

/**
 * The catalog of view change scenarios. Each of these crashes some replicas (always including the primary),
 * pushes client traffic at the cluster so that the survivors notice, and checks that the cluster
 * changes view correctly and stays live afterwards.
 *
 * <p>
 *   None of these hardcode the initial view: they ask the cluster for its current primary and view,
 *   and work out the expected primaries from {@link ClusterConfig#primaryOf(long)}.
 * </p>
 */
public class ViewChangeScenarios {
  /**
   * An SLF4J Logger for this class.
   */
  private static final Logger log = LoggerFactory.getLogger(ViewChangeScenarios.class);

  /** Static holder */
  private ViewChangeScenarios() {}


  /**
   * Crash the primary and send untracked writes for a window shorter than the view change timeout.
   * The cluster should change view, but nothing written while the primary was down should have been
   * committed: the last committed block must be the same before and after.
   */
  public static Scenario requestNotCommittedWhilePrimaryDown() {
    return Scenario.newBuilder("request-not-committed-while-primary-down")
        .body((o, run) -> {
          // 1. Write a baseline in the initial view
          int initialPrimary = o.currentPrimary();
          long initialView = o.currentView(initialPrimary);
          o.writeKnownValue();
          o.waitForView(initialPrimary, v -> v == initialView, "Make sure we are in the initial view before crashing the primary");
          long lastBlock = o.lastCommittedBlock();
          run.transition(ScenarioState.BASELINE_WRITTEN);

          // 2. Crash the primary
          o.crashIncludingPrimary(1, initialPrimary, Collections.emptySet());
          run.transition(ScenarioState.PRIMARY_CRASHED);

          // 3. Send writes it can't serve
          run.transition(ScenarioState.WORKLOAD_INJECTING);
          o.sendIndefiniteWrites();

          // 4. Wait for the view change
          long expectedView = expectedViewAfter(initialView, 1);
          o.waitForView(o.randomReplica(ImmutableSet.of(initialPrimary)), v -> v == expectedView,
              "Make sure view change has been triggered");
          run.transition(ScenarioState.VIEW_CONVERGED);

          // 5. Nothing should have been committed
          assertEquals("Make sure no block was written while the primary was down", lastBlock, o.lastCommittedBlock());
          run.transition(ScenarioState.POST_CONVERGENCE_VERIFIED);
        })
        .build();
  }


  /**
   * The most basic view change: only the primary is down.
   */
  public static Scenario singleViewChangePrimaryDown() {
    return consecutiveFailedPrimaries("single-view-change-primary-down", 1);
  }


  /**
   * The skip-view scenario: both the primary and the next primary are down. The first view change
   * can't complete, so the replicas' timers expire again and they move straight to {@code v + 2}.
   */
  public static Scenario skipViewCurrentAndNextPrimariesDown() {
    return Scenario.newBuilder("skip-view-current-and-next-primaries-down")
        .requires(config -> config.f >= 2, "f >= 2, to crash two primaries")
        .verifying(Verification.linearizability())
        .body(consecutiveFailedPrimariesBody(2))
        .build();
  }


  /**
   * Crash the primaries of {@code k} consecutive views at once, and check the cluster lands on
   * exactly {@code v + k}. Beyond {@code k = 2} this is an extrapolation: we log a warning when it runs.
   */
  public static Scenario consecutiveFailedPrimaries(int k) {
    return consecutiveFailedPrimaries(k + "-consecutive-primaries-down", k);
  }


  /** @see #consecutiveFailedPrimaries(int) */
  private static Scenario consecutiveFailedPrimaries(String name, int k) {
    if (k < 1) {
      throw new IllegalArgumentException("Must crash at least one primary: " + k);
    }
    return Scenario.newBuilder(name)
        .requires(config -> k < config.n, "fewer than n consecutive primaries crashed")
        .requires(config -> config.n - k >= config.progressQuorum(), "the survivors of " + k + " crashes to form a progress quorum")
        .verifying(Verification.linearizability())
        .body(consecutiveFailedPrimariesBody(k))
        .build();
  }


  /**
   * The body shared by every consecutive-primaries scenario.
   */
  private static ScenarioBody consecutiveFailedPrimariesBody(int k) {
    return (o, run) -> {
      // 1. Check the initial view is stable under load
      int initialPrimary = o.currentPrimary();
      long initialView = o.currentView(initialPrimary);
      long expectedFinalView = expectedViewAfter(initialView, k);
      o.sendRandomWrites();
      o.waitForView(initialPrimary, v -> v == initialView, "Make sure we are in the initial view before crashing the primary");
      run.transition(ScenarioState.BASELINE_WRITTEN);

      // 2. Crash the primaries
      CrashPlan crashed = o.crashConsecutivePrimaries(initialView, k);
      run.transition(ScenarioState.PRIMARY_CRASHED);

      // 3. Trip the view change timers
      run.transition(ScenarioState.WORKLOAD_INJECTING);
      o.sendRandomWrites();

      // 4. Wait for the cluster to land on v + k
      o.waitForView(o.randomReplica(crashed.asSet()), v -> v == expectedFinalView, "Make sure view change has been triggered");
      run.transition(ScenarioState.VIEW_CONVERGED);

      // 5. Check the cluster is live in the new view
      o.waitForReadYourWrites();
      o.runConcurrentOps(o.timings.postConvergenceOps);
      run.transition(ScenarioState.POST_CONVERGENCE_VERIFIED);
    };
  }


  /**
   * Crash {@code f} replicas, including the primary but not the next primary, and check for a single view change.
   */
  public static Scenario singleViewChangeWithFReplicasDown() {
    return Scenario.newBuilder("single-view-change-with-f-replicas-down")
        .requires(config -> config.f >= 1, "f >= 1")
        .requires(config -> config.n - config.f >= config.progressQuorum(), "n - f >= 2f + 2c + 1")
        .verifying(Verification.linearizability())
        .body((o, run) -> {
          ClusterConfig config = o.config();
          int initialPrimary = o.currentPrimary();
          long initialView = o.currentView(initialPrimary);
          long expectedView = expectedViewAfter(initialView, 1);
          int expectedNextPrimary = config.primaryOf(expectedView);

          // 1. Crash f replicas, sparing the next primary
          CrashPlan crashed = o.crashIncludingPrimary(config.f, initialPrimary, ImmutableSet.of(expectedNextPrimary));
          assertTrue("Make sure the next primary was not crashed", !crashed.contains(expectedNextPrimary),
              "not " + expectedNextPrimary, crashed);
          int live = o.controller.liveCount();
          assertTrue("Make sure enough replicas are up to allow a successful view change",
              live >= config.progressQuorum(), ">= " + config.progressQuorum(), live);
          run.transition(ScenarioState.PRIMARY_CRASHED);

          // 2. Trip the view change timers
          run.transition(ScenarioState.WORKLOAD_INJECTING);
          o.sendRandomWrites();

          // 3. Wait for the view change
          o.waitForView(o.randomReplica(crashed.asSet()), v -> v == expectedView, "Make sure view change has been triggered");
          run.transition(ScenarioState.VIEW_CONVERGED);

          // 4. Check the cluster is live
          o.waitForReadYourWrites();
          o.runConcurrentOps(o.timings.postConvergenceOps);
          run.transition(ScenarioState.POST_CONVERGENCE_VERIFIED);
        })
        .build();
  }


  /**
   * A replica that was down for a view change should catch up on the new view once it's restarted.
   * Needs {@code f >= 2}, since for a while both the primary and the lagging replica are down.
   */
  public static Scenario crashedReplicaCatchesUpAfterViewChange() {
    return Scenario.newBuilder("crashed-replica-catches-up-after-view-change")
        .requires(config -> config.f >= 2, "f >= 2, to have the primary and another replica down at once")
        .verifying(Verification.linearizability())
        .body((o, run) -> {
          ScenarioTimings timings = o.timings;
          int initialPrimary = o.currentPrimary();
          long initialView = o.currentView(initialPrimary);
          long expectedView = expectedViewAfter(initialView, 1);
          int expectedNextPrimary = o.config().primaryOf(expectedView);

          // 1. Warm up, and pick the replica that will miss the view change
          o.runConcurrentOps(timings.warmupOps);
          int unstableReplica = o.randomReplica(ImmutableSet.of(initialPrimary, expectedNextPrimary));
          o.waitForView(unstableReplica, v -> v == initialView, "Make sure the unstable replica works in the initial view");
          run.transition(ScenarioState.BASELINE_WRITTEN);

          // 2. Crash it, then the primary
          log.info("Crashing replica {} before the view change", unstableReplica);
          o.crash(unstableReplica);
          o.crashIncludingPrimary(1, initialPrimary, ImmutableSet.of(expectedNextPrimary));
          run.transition(ScenarioState.PRIMARY_CRASHED);

          // 3. Trip the view change
          run.transition(ScenarioState.WORKLOAD_INJECTING);
          o.sendRandomWrites();
          o.waitForView(o.randomReplica(ImmutableSet.of(initialPrimary, unstableReplica)), v -> v == expectedView,
              "Make sure view change has been triggered");
          run.transition(ScenarioState.VIEW_CONVERGED);

          // 4. Bring the unstable replica back, and check it joins the new view
          o.settle(timings.viewChangeSettleDelay, "for the active window to be rebuilt after the view change");
          o.restart(unstableReplica);
          o.runConcurrentOps(timings.warmupOps);
          o.waitForView(unstableReplica, v -> v == expectedView, "Make sure the unstable replica works in the new view");
          run.transition(ScenarioState.POST_CONVERGENCE_VERIFIED);
        })
        .build();
  }


  /**
   * Restart replicas after a view change: the old primary, and a random non-primary.
   * Both should end up in the new view (or a later one).
   */
  public static Scenario restartReplicaAfterViewChange() {
    return Scenario.newBuilder("restart-replica-after-view-change")
        .requires(config -> config.n - 1 >= config.progressQuorum(), "n - 1 >= 2f + 2c + 1")
        .verifying(Verification.linearizability())
        .body((o, run) -> {
          ScenarioTimings timings = o.timings;
          int initialPrimary = o.currentPrimary();
          long initialView = o.currentView(initialPrimary);
          long expectedView = expectedViewAfter(initialView, 1);

          // 1. Warm up
          o.runConcurrentOps(timings.warmupOps);
          run.transition(ScenarioState.BASELINE_WRITTEN);

          // 2. Crash the primary and trip the view change
          o.crashIncludingPrimary(1, initialPrimary, Collections.emptySet());
          run.transition(ScenarioState.PRIMARY_CRASHED);
          run.transition(ScenarioState.WORKLOAD_INJECTING);
          o.sendRandomWrites();
          o.waitForView(o.randomReplica(ImmutableSet.of(initialPrimary)), v -> v == expectedView, "Make sure a view change is triggered");
          run.transition(ScenarioState.VIEW_CONVERGED);
          int currentPrimary = o.config().primaryOf(expectedView);

          // 3. Bring back the old primary, and restart some other replica
          o.restart(initialPrimary);
          o.settle(timings.viewChangeSettleDelay, "for the active window to be rebuilt after the view change");
          int unstableReplica = o.randomReplica(ImmutableSet.of(currentPrimary, initialPrimary));
          log.info("Restarting replica {} after the view change", unstableReplica);
          o.bounce(unstableReplica);
          o.settle(timings.restartSettleDelay, "for replica " + unstableReplica + " to come back up");

          // 4. Both should work in the new view. A later view is fine too: a restarted replica
          //    may trigger another view change on its way back
          o.runConcurrentOps(timings.warmupOps);
          o.waitForView(unstableReplica, v -> v >= expectedView, "Make sure the unstable replica works in the new view");
          o.waitForView(initialPrimary, v -> v >= expectedView, "Make sure the initial primary activates the new view");
          run.transition(ScenarioState.POST_CONVERGENCE_VERIFIED);
        })
        .build();
  }


  /**
   * A chain of view changes, each crashing {@code c + 1} replicas (the primary among them) so that the
   * fast path is unavailable. Needs {@code c < f}: a view change needs {@code 2f + 2c + 1} live replicas,
   * and we take {@code c + 1} down.
   *
   * @param rounds The number of view changes.
   * @param verifySlowPath If true, check at the end that the slow path committed more than the fast path.
   *                       This depends on how much traffic the fast path served before the first crash,
   *                       so it is not a reliable check on every deployment.
   */
  public static Scenario chainedViewChangesSlowPath(int rounds, boolean verifySlowPath) {
    if (rounds < 1) {
      throw new IllegalArgumentException("Need at least one round: " + rounds);
    }
    return Scenario.newBuilder("chained-view-changes-slow-path")
        .requires(config -> config.c < config.f, "c < f")
        .requires(config -> config.n - config.c - 1 >= config.progressQuorum(), "n - (c + 1) >= 2f + 2c + 1")
        .verifying(Verification.linearizability())
        .body((o, run) -> {
          ClusterConfig config = o.config();
          long view = o.currentView(o.currentPrimary());

          for (int round = 0; round < rounds; ++round) {
            // 1. Crash c + 1 replicas, including the primary
            assertEquals("Make sure all replicas are up at the start of round " + round, config.n, o.controller.liveCount());
            long nextView = expectedViewAfter(view, 1);
            int expectedNextPrimary = config.primaryOf(nextView);
            CrashPlan crashed = o.crashIncludingPrimary(config.c + 1, config.primaryOf(view), ImmutableSet.of(expectedNextPrimary));
            assertTrue("Make sure the next primary was not crashed", !crashed.contains(expectedNextPrimary),
                "not " + expectedNextPrimary, crashed);
            run.transition(ScenarioState.PRIMARY_CRASHED);

            // 2. Trip the view change
            run.transition(ScenarioState.WORKLOAD_INJECTING);
            o.sendRandomWrites();
            int stableReplica = o.randomReplica(crashed.asSet());
            view = o.waitForView(stableReplica, v -> v >= nextView, "Make sure a view change has been triggered");
            run.transition(ScenarioState.VIEW_CONVERGED);

            // 3. Bring everyone back for the next round
            o.restore(crashed);
          }

          // 4. Check the chain settled
          long finalView = view;
          int finalPrimary = config.primaryOf(finalView);
          o.waitForReadYourWrites();
          o.waitForViewOnEach(o.controller.liveReplicas(Collections.emptySet()), v -> v >= finalView,
              "Make sure all ongoing view changes have completed");
          o.waitForReadYourWrites();
          if (verifySlowPath) {
            o.waitForSlowPathPrevalent(finalPrimary);
          }
          run.transition(ScenarioState.POST_CONVERGENCE_VERIFIED);
        })
        .build();
  }


  /**
   * Every scenario in the catalog, in a sensible order to run them in. Scenarios that don't fit the
   * cluster at hand will refuse to run; filter them with {@link Scenario#unmetRequirement(ClusterConfig)}.
   */
  public static ImmutableList<Scenario> all() {
    return ImmutableList.of(
        requestNotCommittedWhilePrimaryDown(),
        singleViewChangePrimaryDown(),
        singleViewChangeWithFReplicasDown(),
        crashedReplicaCatchesUpAfterViewChange(),
        restartReplicaAfterViewChange(),
        chainedViewChangesSlowPath(2, false),
        skipViewCurrentAndNextPrimariesDown()
    );
  }
}
