package ai.eloquent.minotaur.workload;

import ai.eloquent.minotaur.ClusterConfig;
import ai.eloquent.minotaur.LocalBftCluster;
import ai.eloquent.minotaur.LocalLinearizabilityTracker;
import ai.eloquent.minotaur.util.RealHarnessClock;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.time.Duration;
import java.util.Optional;
import java.util.Random;

import static org.junit.Assert.*;

/**
 * Test {@link WorkloadGenerator}.
 */
public class WorkloadGeneratorTest {

  private LocalBftCluster cluster;

  private LocalLinearizabilityTracker tracker;


  @Before
  public void mkCluster() {
    cluster = new LocalBftCluster(new ClusterConfig(4, 1, 0), 200, 5, 0);
    cluster.startAll();
    tracker = new LocalLinearizabilityTracker(cluster, 7L);
  }


  @After
  public void killCluster() {
    tracker.stop();
  }


  private WorkloadGenerator writes(long seed) {
    return WorkloadGenerator.writes(cluster, new Random(seed), RealHarnessClock.INSTANCE, Duration.ofSeconds(1));
  }


  @Test
  public void issueOneWritesKnownValue() throws Exception {
    KeyValue kv = writes(1L).issueOne();
    assertTrue(kv.key.startsWith("key-"));
    assertEquals(Optional.of(kv.value), cluster.read(kv.key));
    assertEquals(1, cluster.lastCommittedBlock());
  }


  /**
   * Keys and values come from the injected random source, so a seed reproduces them.
   */
  @Test
  public void seededValuesAreReproducible() throws Exception {
    assertEquals(writes(99L).issueOne(), writes(99L).issueOne());
    assertNotEquals(writes(99L).issueOne(), writes(100L).issueOne());
  }


  @Test
  public void runBoundedEndsCancelled() throws Exception {
    WorkloadSummary summary = writes(1L).runBounded(Duration.ofMillis(50), 2);
    assertEquals(WorkloadHandle.State.CANCELLED, summary.state);
    assertTrue(summary.succeeded > 0);
    assertEquals(summary.succeeded, cluster.lastCommittedBlock());
  }


  /**
   * With the primary down, every write fails. That's still a normal end to the window.
   */
  @Test
  public void runBoundedWithPrimaryDown() {
    cluster.stop(0);
    WorkloadSummary summary = writes(1L).runBounded(Duration.ofMillis(50), 2);
    assertEquals(WorkloadHandle.State.CANCELLED, summary.state);
    assertEquals(0, summary.succeeded);
    assertTrue(summary.transientFailures > 0);
  }


  @Test
  public void trackedBatchGoesThroughTracker() {
    WorkloadGenerator tracked = WorkloadGenerator.tracked(tracker, cluster, new Random(1L), RealHarnessClock.INSTANCE, Duration.ofSeconds(1));
    WorkloadSummary summary = tracked.inject(10, 2).join(Duration.ofSeconds(10), Duration.ofSeconds(1));
    assertEquals(WorkloadHandle.State.COMPLETED, summary.state);
    assertEquals(10, summary.succeeded);
    assertEquals(10, tracker.completed.get());
  }
}
