package ai.eloquent.minotaur.scenario;

import ai.eloquent.minotaur.ClusterConfig;
import ai.eloquent.minotaur.HarnessMetrics;
import ai.eloquent.minotaur.ScenarioAssertionException;
import ai.eloquent.minotaur.ScenarioConfigurationException;
import ai.eloquent.minotaur.ScenarioFailedException;
import ai.eloquent.minotaur.WithLocalBftCluster;
import com.google.common.collect.ImmutableList;
import org.junit.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.Assert.*;

/**
 * Test {@link Scenario}, and how {@link ScenarioOrchestrator#run(Scenario)} runs its stages.
 */
public class ScenarioTest extends WithLocalBftCluster {

  /** A body that does nothing but declare success. */
  private static final ScenarioBody TRIVIAL_BODY = (o, run) -> run.transition(ScenarioState.POST_CONVERGENCE_VERIFIED);


  @Test
  public void stagesRunInOrder() {
    List<String> stages = new ArrayList<>();
    Scenario scenario = Scenario.newBuilder("ordered")
        .setup((o, run) -> {
          stages.add("setup");
          ClusterSetup.startAll().prepare(o, run);
        })
        .body((o, run) -> {
          stages.add("body");
          TRIVIAL_BODY.execute(o, run);
        })
        .verifying((o, run) -> stages.add("verify 1"))
        .verifying((o, run) -> stages.add("verify 2"))
        .build();
    ScenarioResult result = orchestrator.run(scenario);
    assertEquals(ImmutableList.of("setup", "body", "verify 1", "verify 2"), stages);
    assertEquals(ImmutableList.of(ScenarioState.ALL_UP, ScenarioState.POST_CONVERGENCE_VERIFIED), result.states);
    assertEquals(ScenarioState.POST_CONVERGENCE_VERIFIED, result.finalState());
    assertEquals(4, cluster.liveCount());
  }


  /**
   * A scenario that can't run against this cluster must fail before touching it.
   */
  @Test
  public void unmetRequirementTouchesNothing() {
    List<String> stages = new ArrayList<>();
    Scenario scenario = Scenario.newBuilder("needs-f-2")
        .requires(config -> config.n >= 4, "n >= 4")
        .requires(config -> config.f >= 2, "f >= 2")
        .setup((o, run) -> stages.add("setup"))
        .body(TRIVIAL_BODY)
        .build();
    assertEquals(Optional.of("f >= 2"), scenario.unmetRequirement(new ClusterConfig(4, 1, 0)));
    assertEquals(Optional.empty(), scenario.unmetRequirement(new ClusterConfig(7, 2, 0)));
    try {
      orchestrator.run(scenario);
      fail("Should not run on f = 1");
    } catch (ScenarioConfigurationException e) {
      assertTrue(e.getMessage(), e.getMessage().contains("f >= 2"));
    }
    assertTrue("Setup should not have run", stages.isEmpty());
    assertEquals("No replica should have been started", 0, cluster.liveCount());
    assertTrue(HarnessMetrics.SCENARIO_RUNS.labels("needs-f-2", "misconfigured").get() >= 1.0);
  }


  @Test
  public void bodyMustFinishVerified() {
    List<ScenarioState> seen = new ArrayList<>();
    Scenario scenario = Scenario.newBuilder("unfinished")
        .body((o, run) -> run.transition(ScenarioState.BASELINE_WRITTEN))
        .build();
    try (ScenarioOrchestrator listening = ScenarioOrchestrator.newBuilder()
        .controller(cluster).client(cluster).tracker(tracker).timings(FAST_TIMINGS).seed(1L)
        .listener((name, from, to, elapsed) -> seen.add(to))
        .build()) {
      listening.run(scenario);
      fail("A body that doesn't finish verified is a broken scenario");
    } catch (IllegalStateException e) {
      assertTrue(e.getMessage(), e.getMessage().contains("BASELINE_WRITTEN"));
    }
    assertEquals(ImmutableList.of(ScenarioState.ALL_UP, ScenarioState.BASELINE_WRITTEN, ScenarioState.FAILED), seen);
  }


  @Test
  public void failedVerificationFailsScenario() {
    Scenario scenario = Scenario.newBuilder("bad-history")
        .body(TRIVIAL_BODY)
        .verifying((o, run) -> {
          throw new ScenarioAssertionException("history", "linearizable", "not linearizable");
        })
        .build();
    try {
      orchestrator.run(scenario);
      fail("The verification should have failed the scenario");
    } catch (ScenarioAssertionException e) {
      assertEquals("linearizable", e.expected);
      assertEquals("not linearizable", e.observed);
    }
  }


  @Test
  public void checkedExceptionsAreWrapped() {
    Scenario scenario = Scenario.newBuilder("io-trouble")
        .body((o, run) -> {
          throw new IOException("disk full");
        })
        .build();
    try {
      orchestrator.run(scenario);
      fail("Should have failed");
    } catch (ScenarioFailedException e) {
      assertTrue(e.getCause() instanceof IOException);
    }
  }


  @Test
  public void illegalTransitionFails() {
    Scenario scenario = Scenario.newBuilder("backwards")
        .body((o, run) -> {
          run.transition(ScenarioState.VIEW_CONVERGED);
          run.transition(ScenarioState.WORKLOAD_INJECTING);
        })
        .build();
    try {
      orchestrator.run(scenario);
      fail("Going backwards is a bug in the scenario");
    } catch (IllegalStateException e) {
      assertTrue(e.getMessage(), e.getMessage().contains("illegal transition"));
    }
  }


  /**
   * An orchestrator has exclusive use of its cluster.
   */
  @Test
  public void oneScenarioAtATime() {
    Scenario inner = Scenario.newBuilder("inner").body(TRIVIAL_BODY).build();
    Scenario outer = Scenario.newBuilder("outer")
        .body((o, run) -> {
          try {
            o.run(inner);
            fail("Should not be able to run a scenario inside another");
          } catch (IllegalStateException expected) {
            run.transition(ScenarioState.POST_CONVERGENCE_VERIFIED);
          }
        })
        .build();
    orchestrator.run(outer);
    // ...and once it's done, the next one can run
    assertEquals(ScenarioState.POST_CONVERGENCE_VERIFIED, orchestrator.run(inner).finalState());
  }


  @Test(expected = IllegalStateException.class)
  public void needsABody() {
    Scenario.newBuilder("empty").build();
  }


  @Test
  public void linearizabilityVerificationUsesTracker() {
    Scenario scenario = Scenario.newBuilder("tracked")
        .body(TRIVIAL_BODY)
        .verifying(Verification.linearizability())
        .build();
    orchestrator.run(scenario);
    assertEquals(1, tracker.verifyCount.get());
  }
}
