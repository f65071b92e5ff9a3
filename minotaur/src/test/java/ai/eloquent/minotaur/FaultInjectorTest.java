package ai.eloquent.minotaur;

import com.google.common.collect.ImmutableSet;
import org.junit.Test;

import java.util.*;

import static org.junit.Assert.*;

/**
 * Test {@link FaultInjector}.
 */
public class FaultInjectorTest {

  /** The cluster sizings we check the planner against. */
  private static final ClusterConfig[] CONFIGS = new ClusterConfig[]{
      new ClusterConfig(4, 1, 0),
      new ClusterConfig(6, 1, 1),
      new ClusterConfig(7, 2, 0),
      new ClusterConfig(9, 2, 1),
      new ClusterConfig(10, 3, 0),
      new ClusterConfig(13, 4, 0),
  };


  /** A local cluster with every replica up. Nothing about its timers matters here. */
  private static LocalBftCluster allUp(ClusterConfig config) {
    LocalBftCluster cluster = new LocalBftCluster(config, 1000, 1, 0);
    cluster.startAll();
    return cluster;
  }


  /**
   * For many seeds and sizings: the plan has exactly the requested size, always includes the primary,
   * never includes a protected replica, and (when the crash count is within bounds) leaves a progress quorum.
   */
  @Test
  public void planProperties() {
    for (ClusterConfig config : CONFIGS) {
      LocalBftCluster cluster = allUp(config);
      for (long seed = 0; seed < 200; ++seed) {
        FaultInjector injector = new FaultInjector(new Random(seed));
        Random r = new Random(seed * 31 + 7);
        int primary = r.nextInt(config.n);
        int nextPrimary = (primary + 1) % config.n;
        Set<Integer> protectedReplicas = ImmutableSet.of(nextPrimary);
        int crashCount = 1 + r.nextInt(config.n - 1);

        CrashPlan plan = injector.plan(cluster, crashCount, primary, protectedReplicas);

        assertEquals("Wrong size plan for " + config + " seed " + seed, crashCount, plan.size());
        assertEquals("The primary always goes first", Integer.valueOf(primary), plan.replicas.get(0));
        assertFalse("Crashed a protected replica: " + plan, plan.contains(nextPrimary));
        for (int replica : plan.replicas) {
          assertTrue(config.isReplica(replica));
        }
        if (crashCount <= config.maxCrashesPreservingProgress()) {
          assertTrue("Should leave a progress quorum", config.n - plan.size() >= config.progressQuorum());
        }
      }
    }
  }


  /**
   * Planning is pure: the cluster should be untouched.
   */
  @Test
  public void planDoesNotCrash() {
    LocalBftCluster cluster = allUp(new ClusterConfig(7, 2, 0));
    new FaultInjector(new Random(1)).plan(cluster, 2, 0, Collections.emptySet());
    assertEquals(7, cluster.liveCount());
  }


  @Test
  public void planCrashStops() {
    LocalBftCluster cluster = allUp(new ClusterConfig(7, 2, 0));
    CrashPlan plan = new FaultInjector(new Random(1)).planCrash(cluster, 2, 0, ImmutableSet.of(1));
    assertEquals(5, cluster.liveCount());
    for (int replica : plan.replicas) {
      assertFalse(cluster.isRunning(replica));
    }
    assertTrue(cluster.isRunning(1));
  }


  /**
   * The same seed should give the same plan.
   */
  @Test
  public void reproducible() {
    LocalBftCluster cluster = allUp(new ClusterConfig(13, 4, 0));
    CrashPlan first = new FaultInjector(new Random(1234)).plan(cluster, 4, 0, ImmutableSet.of(1));
    CrashPlan second = new FaultInjector(new Random(1234)).plan(cluster, 4, 0, ImmutableSet.of(1));
    assertEquals(first, second);
  }


  /**
   * Across seeds, every eligible replica should get picked at some point.
   */
  @Test
  public void drawsFromWholePool() {
    LocalBftCluster cluster = allUp(new ClusterConfig(7, 2, 0));
    Set<Integer> seen = new HashSet<>();
    for (long seed = 0; seed < 100; ++seed) {
      seen.addAll(new FaultInjector(new Random(seed)).plan(cluster, 2, 0, ImmutableSet.of(1)).replicas);
    }
    assertEquals(ImmutableSet.of(0, 2, 3, 4, 5, 6), seen);
  }


  /**
   * Replicas that are already down aren't candidates.
   */
  @Test
  public void onlyCrashesLiveReplicas() {
    LocalBftCluster cluster = allUp(new ClusterConfig(7, 2, 0));
    cluster.stop(3);
    cluster.stop(4);
    for (long seed = 0; seed < 50; ++seed) {
      CrashPlan plan = new FaultInjector(new Random(seed)).plan(cluster, 3, 0, ImmutableSet.of(1));
      assertFalse(plan.containsAny(Arrays.asList(3, 4)));
    }
  }


  /**
   * Asking for more than the pool holds must fail loudly, not under-crash.
   */
  @Test(expected = ScenarioConfigurationException.class)
  public void poolTooSmall() {
    LocalBftCluster cluster = allUp(new ClusterConfig(4, 1, 0));
    new FaultInjector(new Random(1)).plan(cluster, 4, 0, ImmutableSet.of(1));
  }


  @Test(expected = IllegalArgumentException.class)
  public void primaryCannotBeProtected() {
    new FaultInjector(new Random(1)).plan(allUp(new ClusterConfig(4, 1, 0)), 1, 0, ImmutableSet.of(0));
  }


  @Test(expected = IllegalArgumentException.class)
  public void mustCrashSomething() {
    new FaultInjector(new Random(1)).plan(allUp(new ClusterConfig(4, 1, 0)), 0, 0, Collections.emptySet());
  }


  @Test
  public void consecutivePrimaries() {
    ClusterConfig config = new ClusterConfig(7, 2, 0);
    assertEquals(Arrays.asList(0, 1), FaultInjector.consecutivePrimaries(config, 0, 2).replicas);
    assertEquals(Arrays.asList(6, 0, 1), FaultInjector.consecutivePrimaries(config, 6, 3).replicas);
    assertEquals(Collections.singletonList(3), FaultInjector.consecutivePrimaries(config, 10, 1).replicas);
  }


  @Test(expected = ScenarioConfigurationException.class)
  public void consecutivePrimariesNotEveryone() {
    FaultInjector.consecutivePrimaries(new ClusterConfig(4, 1, 0), 0, 4);
  }


  @Test
  public void restore() {
    LocalBftCluster cluster = allUp(new ClusterConfig(7, 2, 0));
    FaultInjector injector = new FaultInjector(new Random(1));
    CrashPlan plan = injector.planCrash(cluster, 2, 0, Collections.emptySet());
    cluster.start(plan.replicas.get(1));  // one came back on its own
    injector.restore(cluster, plan);
    assertEquals(7, cluster.liveCount());
  }
}
