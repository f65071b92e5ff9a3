package ai.eloquent.minotaur.scenario;

import ai.eloquent.minotaur.*;
import ai.eloquent.minotaur.util.MockHarnessClock;
import ai.eloquent.minotaur.workload.KeyValue;
import ai.eloquent.minotaur.workload.WorkloadHandle;
import ai.eloquent.minotaur.workload.WorkloadSummary;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.junit.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static org.junit.Assert.*;

/**
 * Test the primitive steps of {@link ScenarioOrchestrator}, against a local cluster.
 */
public class ScenarioOrchestratorTest extends WithLocalBftCluster {

  @Test
  public void expectedViewAfter() {
    assertEquals(1, ScenarioOrchestrator.expectedViewAfter(0, 1));
    assertEquals("Skip-view: two primaries down is two views", 2, ScenarioOrchestrator.expectedViewAfter(0, 2));
    assertEquals(8, ScenarioOrchestrator.expectedViewAfter(5, 3));
    try {
      ScenarioOrchestrator.expectedViewAfter(0, 0);
      fail("No crash, no view change");
    } catch (IllegalArgumentException ignored) {}
  }


  @Test
  public void startAll() {
    orchestrator.startAll();
    assertEquals(4, cluster.liveCount());
    assertEquals(0, orchestrator.currentPrimary());
    assertEquals(0L, orchestrator.currentView(2));
  }


  /**
   * Crashing enough replicas to lose the progress quorum is a configuration error,
   * and must be caught before anything is stopped.
   */
  @Test
  public void crashChecksQuorumFirst() {
    orchestrator.startAll();
    try {
      orchestrator.crashIncludingPrimary(2, 0, ImmutableSet.of(1));
      fail("n=4, f=1 can't lose two replicas");
    } catch (ScenarioConfigurationException e) {
      assertTrue(e.getMessage(), e.getMessage().contains("needs 3"));
    }
    assertEquals("Nothing should have been stopped", 4, cluster.liveCount());

    try {
      orchestrator.crashConsecutivePrimaries(0, 2);
      fail("n=4, f=1 can't lose two primaries");
    } catch (ScenarioConfigurationException ignored) {}
    assertEquals("Nothing should have been stopped", 4, cluster.liveCount());
  }


  @Test
  public void crashAndRestore() {
    orchestrator.startAll();
    CrashPlan plan = orchestrator.crashIncludingPrimary(1, 0, Collections.emptySet());
    assertEquals(Collections.singletonList(0), plan.replicas);
    assertFalse(cluster.isRunning(0));
    orchestrator.restore(plan);
    assertTrue(cluster.isRunning(0));
  }


  /**
   * A replica's view must never go backwards while we watch it.
   */
  @Test
  public void viewMonotonicity() {
    orchestrator.startAll();
    assertEquals(0L, orchestrator.waitForView(1, v -> v == 0L, "initial view"));
    cluster.forceView(1, 5);
    assertEquals(5L, orchestrator.waitForView(1, v -> v == 5L, "jumped ahead"));
    cluster.forceView(1, 3);
    try {
      orchestrator.waitForView(1, v -> v >= 0L, "went back");
      fail("The view went backwards");
    } catch (ScenarioAssertionException e) {
      assertEquals(">= 5", e.expected);
      assertEquals(3L, e.observed);
    }
  }


  /**
   * A restarted replica starts over: it may report an older view while it catches up.
   */
  @Test
  public void restartForgetsViewHistory() {
    orchestrator.startAll();
    cluster.forceView(2, 5);
    orchestrator.waitForView(2, v -> v == 5L, "jumped ahead");
    orchestrator.bounce(2);
    cluster.forceView(2, 3);
    assertEquals(3L, orchestrator.waitForView(2, v -> v == 3L, "after restart"));
  }


  @Test
  public void waitForViewTimesOut() {
    try (ScenarioOrchestrator impatient = ScenarioOrchestrator.newBuilder()
        .controller(cluster).client(cluster).tracker(tracker).seed(1L)
        .timings(FAST_TIMINGS.toBuilder().viewChangeTimeout(Duration.ofMillis(300)).build())
        .build()) {
      impatient.startAll();
      impatient.waitForView(1, v -> v == 7L, "a view nobody is moving to");
      fail("Should have run out of time");
    } catch (DeadlineExceededException e) {
      assertEquals(0L, e.lastObserved().orElse(null));
    }
  }


  @Test
  public void waitForViewOnEach() {
    orchestrator.startAll();
    assertEquals(ImmutableMap.of(1, 0L, 3, 0L), orchestrator.waitForViewOnEach(Arrays.asList(1, 3), v -> v == 0L, "initial view"));
  }


  @Test
  public void randomReplicaRespectsExclusions() {
    orchestrator.startAll();
    cluster.stop(3);
    for (int i = 0; i < 50; ++i) {
      int replica = orchestrator.randomReplica(ImmutableSet.of(0));
      assertTrue("Picked " + replica, replica == 1 || replica == 2);
    }
    try {
      orchestrator.randomReplica(ImmutableSet.of(0, 1, 2));
      fail("Nothing left to pick");
    } catch (ScenarioConfigurationException ignored) {}
  }


  @Test
  public void writeKnownValue() throws Exception {
    orchestrator.startAll();
    KeyValue kv = orchestrator.writeKnownValue();
    assertEquals(Optional.of(kv.value), cluster.read(kv.key));
  }


  @Test
  public void assertReadableCatchesWrongData() {
    orchestrator.startAll();
    cluster.sneakWrite("k1", "not-v1");
    try {
      orchestrator.assertReadable(new KeyValue("k1", "v1"));
      fail("Read back the wrong value");
    } catch (ScenarioAssertionException e) {
      assertEquals(Optional.of("v1"), e.expected);
      assertEquals(Optional.of("not-v1"), e.observed);
    }
  }


  /**
   * With the primary down, the first read-your-writes attempts fail. They should be retried until
   * the view change goes through.
   */
  @Test
  public void readYourWritesRetriesThroughViewChange() {
    orchestrator.startAll();
    orchestrator.crashIncludingPrimary(1, 0, Collections.emptySet());
    orchestrator.waitForReadYourWrites();
    assertEquals(1L, cluster.agreedView());
    assertTrue("Some attempts should have failed", cluster.rejectedRequests() > 0);
  }


  /**
   * A workload window against a down primary fails every operation, and that's fine.
   */
  @Test
  public void sendRandomWritesSwallowsFailures() {
    orchestrator.startAll();
    orchestrator.crashIncludingPrimary(1, 0, Collections.emptySet());
    WorkloadSummary summary = orchestrator.sendRandomWrites();
    assertEquals(WorkloadHandle.State.CANCELLED, summary.state);
    assertEquals(0, summary.succeeded);
  }


  @Test
  public void slowPathPrevalentWithReplicaDown() {
    orchestrator.startAll();
    orchestrator.crash(3);
    orchestrator.runConcurrentOps(20);
    CommitPathCounts counts = orchestrator.waitForSlowPathPrevalent(0);
    assertEquals(0, counts.fastPath);
    assertTrue(counts.slowPath > 0);
  }


  @Test
  public void settleUsesTheClock() {
    MockHarnessClock clock = new MockHarnessClock();
    try (ScenarioOrchestrator virtual = ScenarioOrchestrator.newBuilder()
        .controller(cluster).client(cluster).tracker(tracker).seed(1L).clock(clock)
        .build()) {
      virtual.settle(Duration.ofMinutes(10), "for nothing in particular");
      assertEquals(600000L, clock.now());
    }
  }


  /**
   * Start a fresh cluster, push some writes through it, and then draw replicas.
   */
  private static List<Integer> replicaDrawsAfterWorkload(long seed) {
    LocalBftCluster fresh = new LocalBftCluster(new ClusterConfig(7, 2, 0), VIEW_CHANGE_TIMEOUT_MILLIS, 20, 100);
    LocalLinearizabilityTracker freshTracker = new LocalLinearizabilityTracker(fresh, seed);
    try (ScenarioOrchestrator replay = ScenarioOrchestrator.newBuilder()
        .controller(fresh).client(fresh).tracker(freshTracker).timings(FAST_TIMINGS).seed(seed)
        .build()) {
      replay.startAll();
      replay.writeKnownValue();
      WorkloadSummary summary = replay.sendIndefiniteWrites();
      assertTrue("Some writes should have gone through", summary.succeeded > 0);
      List<Integer> draws = new ArrayList<>();
      for (int i = 0; i < 12; ++i) {
        draws.add(replay.randomReplica(Collections.emptySet()));
      }
      return draws;
    } finally {
      freshTracker.stop();
    }
  }


  /**
   * However much traffic the workload sent, the replicas a seed picks must stay the same.
   */
  @Test
  public void seedReplaysReplicaChoicesAcrossWorkloads() {
    assertEquals(replicaDrawsAfterWorkload(7L), replicaDrawsAfterWorkload(7L));
  }


  @Test(expected = IllegalStateException.class)
  public void builderNeedsCollaborators() {
    ScenarioOrchestrator.newBuilder().controller(cluster).build();
  }
}
