package ai.eloquent.minotaur;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Chooses which replicas to crash, and crashes them.
 *
 * <p>
 *   This is a stateless planner: all it carries between calls is its source of randomness, which is
 *   injected so that a scenario run can be replayed from its seed. It does <b>not</b> know which
 *   quorum a scenario needs to survive the crash; checking that is the caller's job, and the caller
 *   should do it on the {@link CrashPlan} before calling {@link #apply(ReplicaClusterController, CrashPlan)}.
 * </p>
 */
public class FaultInjector {
  /**
   * An SLF4J Logger for this class.
   */
  private static final Logger log = LoggerFactory.getLogger(FaultInjector.class);

  /** The source of randomness for picking crash candidates. */
  private final Random random;


  /** Create a fault injector with an explicit source of randomness. */
  public FaultInjector(Random random) {
    this.random = random;
  }


  /**
   * Plan a crash of {@code crashCount} replicas that always includes {@code primary} and never touches
   * anything in {@code protectedReplicas}. The remaining {@code crashCount - 1} replicas are drawn uniformly
   * at random, without replacement, from the running replicas that are neither protected nor the primary.
   *
   * @param controller The cluster, used to find the running replicas.
   * @param crashCount The exact number of replicas to crash. At least 1.
   * @param primary The current primary, which is always crashed.
   * @param protectedReplicas Replicas that must survive, typically the expected next primary.
   *
   * @return The plan. Nothing has been crashed yet.
   *
   * @throws ScenarioConfigurationException If there aren't enough eligible replicas to crash.
   */
  public CrashPlan plan(ReplicaClusterController controller, int crashCount, int primary, Set<Integer> protectedReplicas) {
    // 1. Check preconditions
    if (crashCount < 1) {
      throw new IllegalArgumentException("Must crash at least one replica (the primary); asked for " + crashCount);
    }
    if (protectedReplicas.contains(primary)) {
      throw new IllegalArgumentException("The primary " + primary + " cannot be both crashed and protected: " + protectedReplicas);
    }
    if (!controller.config().isReplica(primary)) {
      throw new IllegalArgumentException("No such replica: " + primary + " in " + controller.config());
    }

    // 2. Build the candidate pool
    Set<Integer> excluded = new HashSet<>(protectedReplicas);
    excluded.add(primary);
    List<Integer> candidates = new ArrayList<>(controller.liveReplicas(excluded));
    if (candidates.size() < crashCount - 1) {
      throw new ScenarioConfigurationException("Asked to crash " + crashCount + " replicas including primary " + primary
          + ", but only " + candidates.size() + " other live replicas are eligible " + candidates + " (protected: " + protectedReplicas + ")");
    }

    // 3. Shuffle, then take
    Collections.shuffle(candidates, random);
    List<Integer> toCrash = new ArrayList<>(crashCount);
    toCrash.add(primary);
    toCrash.addAll(candidates.subList(0, crashCount - 1));
    return new CrashPlan(toCrash);
  }


  /**
   * Stop every replica in the plan.
   */
  public void apply(ReplicaClusterController controller, CrashPlan plan) {
    log.info("Crashing replicas {}", plan.replicas);
    for (int replicaId : plan.replicas) {
      controller.stop(replicaId);
    }
  }


  /**
   * Plan a crash and carry it out.
   *
   * @see #plan(ReplicaClusterController, int, int, Set)
   * @see #apply(ReplicaClusterController, CrashPlan)
   */
  public CrashPlan planCrash(ReplicaClusterController controller, int crashCount, int primary, Set<Integer> protectedReplicas) {
    CrashPlan plan = plan(controller, crashCount, primary, protectedReplicas);
    apply(controller, plan);
    return plan;
  }


  /**
   * The primaries of {@code k} consecutive views starting at {@code initialView}. Crashing all of these
   * forces the cluster to skip from {@code initialView} straight to {@code initialView + k}.
   *
   * @param config The cluster sizing, for the view to primary mapping.
   * @param initialView The current view.
   * @param k The number of consecutive primaries to take down. Between 1 and {@code n - 1}.
   */
  public static CrashPlan consecutivePrimaries(ClusterConfig config, long initialView, int k) {
    if (k < 1 || k >= config.n) {
      throw new ScenarioConfigurationException("Cannot crash " + k + " consecutive primaries in " + config);
    }
    List<Integer> primaries = new ArrayList<>(k);
    for (int i = 0; i < k; ++i) {
      primaries.add(config.primaryOf(initialView + i));
    }
    return new CrashPlan(primaries);
  }


  /**
   * Restart every replica in the plan that isn't already running.
   */
  public void restore(ReplicaClusterController controller, CrashPlan plan) {
    log.info("Restarting replicas {}", plan.replicas);
    for (int replicaId : plan.replicas) {
      if (!controller.isRunning(replicaId)) {
        controller.start(replicaId);
      }
    }
  }
}
