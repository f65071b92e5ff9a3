package ai.eloquent.minotaur.scenario;

import ai.eloquent.minotaur.*;
import ai.eloquent.minotaur.util.HarnessClock;
import ai.eloquent.minotaur.util.RealHarnessClock;
import ai.eloquent.minotaur.util.TimerUtils;
import ai.eloquent.minotaur.workload.KeyValue;
import ai.eloquent.minotaur.workload.WorkloadGenerator;
import ai.eloquent.minotaur.workload.WorkloadSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Predicate;

/**
 * Runs {@link Scenario}s against a cluster, and provides the primitive steps scenario bodies are made of:
 * crashing replicas, injecting client traffic, and waiting for views and reads to converge.
 *
 * <p>
 *   An orchestrator has exclusive use of its cluster. Only one scenario runs at a time, and nothing else
 *   should start or stop replicas while one does.
 * </p>
 *
 * <p>
 *   Every view observed through {@link #waitForView(int, Predicate, String)} (and friends) is checked
 *   against the last view observed on the same replica: a replica's view must never go backwards while
 *   it stays up. Restarting a replica forgets what we saw of it.
 * </p>
 */
public class ScenarioOrchestrator implements AutoCloseable {
  /**
   * An SLF4J Logger for this class.
   */
  private static final Logger log = LoggerFactory.getLogger(ScenarioOrchestrator.class);

  /** The cluster we're running against. */
  public final ReplicaClusterController controller;

  /** The client we send known writes and reads through. */
  private final BftClient client;

  /** The tracker that checks the history of tracked operations. */
  private final LinearizabilityTracker tracker;

  /** The timing parameters of every run. */
  public final ScenarioTimings timings;

  /** The seed of {@link #random}, logged so that a failed run can be replayed. */
  public final long seed;

  /**
   * The randomness behind crash plans and replica choices. Only the scenario thread draws from it,
   * so its draws follow from {@link #seed} alone.
   */
  private final Random random;

  /**
   * The randomness behind workload keys and values. Workers draw from it concurrently, in an order
   * that depends on timing, so it must never be shared with {@link #random}.
   */
  private final Random workloadRandom;

  /** The clock every deadline and sleep is measured on. */
  private final HarnessClock clock;

  /** Who to tell about scenario transitions. */
  private final List<ScenarioListener> listeners;

  /** Chooses crash sets. */
  private final FaultInjector faultInjector;

  /** Polls the cluster for convergence. */
  private final ConvergencePoller poller;

  /** Untracked writes. */
  private final WorkloadGenerator writes;

  /** Writes through the linearizability tracker. */
  private final WorkloadGenerator trackedOps;

  /** The last view we saw on each replica, for the monotonicity check. */
  private final Map<Integer, Long> lastObservedView = new ConcurrentHashMap<>();

  /** Whether a scenario is running right now. */
  private final AtomicBoolean running = new AtomicBoolean(false);

  /** The scenario that's running right now, if any. */
  @Nullable
  private volatile ScenarioRun activeRun = null;


  private ScenarioOrchestrator(Builder b, long seed) {
    this.controller = b.controller;
    this.client = b.client;
    this.tracker = b.tracker;
    this.timings = b.timings;
    this.seed = seed;
    this.random = new Random(seed);
    this.workloadRandom = new Random(workloadSeed(seed));
    this.clock = b.clock;
    this.listeners = Collections.unmodifiableList(new ArrayList<>(b.listeners));
    this.faultInjector = new FaultInjector(random);
    this.poller = new ConvergencePoller(clock, timings.pollInterval);
    this.writes = WorkloadGenerator.writes(client, workloadRandom, clock, timings.workloadJoinGrace);
    this.trackedOps = WorkloadGenerator.tracked(tracker, client, workloadRandom, clock, timings.workloadJoinGrace);
  }


  /** The seed of the workload randomness, derived from the orchestrator's seed. */
  static long workloadSeed(long seed) {
    return seed * 31 + 1;
  }


  /**
   * Run a scenario to completion.
   *
   * @return What the scenario did, if it passed.
   *
   * @throws ScenarioConfigurationException If the scenario cannot be run against this cluster. Nothing was touched.
   * @throws ScenarioFailedException If the scenario failed. Checked exceptions from a stage are wrapped in one of these.
   * @throws IllegalStateException If another scenario is already running on this orchestrator.
   */
  public ScenarioResult run(Scenario scenario) {
    // 1. Check requirements, before we touch the cluster
    Optional<String> unmet = scenario.unmetRequirement(controller.config());
    if (unmet.isPresent()) {
      HarnessMetrics.SCENARIO_RUNS.labels(scenario.name, "misconfigured").inc();
      throw new ScenarioConfigurationException("Scenario '" + scenario.name + "' cannot run against "
          + controller.config() + ": requires " + unmet.get());
    }
    if (!running.compareAndSet(false, true)) {
      throw new IllegalStateException("Cannot run scenario '" + scenario.name + "': another scenario is already running");
    }

    ScenarioRun run = new ScenarioRun(scenario.name, clock, listeners);
    activeRun = run;
    lastObservedView.clear();
    log.info("Running scenario '{}' against {} (seed {})", scenario.name, controller.config(), seed);
    try {
      // 2. Setup
      scenario.setup.prepare(this, run);
      // 3. Body
      scenario.body.execute(this, run);
      ScenarioState endState = run.state().orElse(null);
      if (endState != ScenarioState.POST_CONVERGENCE_VERIFIED) {
        throw new IllegalStateException("Scenario '" + scenario.name + "' body finished in state " + endState
            + " rather than " + ScenarioState.POST_CONVERGENCE_VERIFIED);
      }
      // 4. Verifications
      for (Verification verification : scenario.verifications) {
        verification.verify(this, run);
      }
      ScenarioResult result = run.result();
      HarnessMetrics.SCENARIO_RUNS.labels(scenario.name, "passed").inc();
      log.info("Scenario passed: {}", result);
      return result;
    } catch (RuntimeException | Error e) {
      recordFailure(scenario, run, e);
      throw e;
    } catch (Exception e) {
      recordFailure(scenario, run, e);
      throw new ScenarioFailedException("Scenario '" + scenario.name + "' failed", e);
    } finally {
      activeRun = null;
      running.set(false);
    }
  }


  /**
   * Mark a run as failed, and count it.
   */
  private void recordFailure(Scenario scenario, ScenarioRun run, Throwable t) {
    HarnessMetrics.SCENARIO_RUNS.labels(scenario.name,
        t instanceof ScenarioConfigurationException ? "misconfigured" : "failed").inc();
    run.fail(t);
  }


  //
  // Cluster control
  //


  /**
   * Start every replica, and check they all came up.
   *
   * @throws ScenarioAssertionException If some replica is not running afterwards.
   */
  public void startAll() {
    controller.startAll();
    lastObservedView.clear();
    ScenarioAssertionException.assertEquals("Make sure all replicas are up initially", controller.config().n, controller.liveCount());
  }


  /**
   * Crash {@code count} replicas including {@code primary}, never touching the protected replicas.
   * Before anything is stopped, we check that the survivors will still form a progress quorum.
   *
   * @return The replicas crashed.
   *
   * @throws ScenarioConfigurationException If there aren't enough replicas to crash, or if crashing them
   *                                        would leave fewer than {@code 2f + 2c + 1} replicas running.
   */
  public CrashPlan crashIncludingPrimary(int count, int primary, Set<Integer> protectedReplicas) {
    CrashPlan plan = faultInjector.plan(controller, count, primary, protectedReplicas);
    return crash(plan);
  }


  /**
   * Crash the primaries of {@code k} consecutive views, starting at {@code initialView}.
   *
   * @return The replicas crashed.
   *
   * @throws ScenarioConfigurationException If crashing them would leave fewer than {@code 2f + 2c + 1} replicas running.
   */
  public CrashPlan crashConsecutivePrimaries(long initialView, int k) {
    if (k > 2) {
      log.warn("Crashing {} consecutive primaries: skipping more than two views at once has not been verified against the protocol", k);
    }
    return crash(FaultInjector.consecutivePrimaries(controller.config(), initialView, k));
  }


  /**
   * Carry out a crash plan, after checking the survivors can still make progress.
   */
  private CrashPlan crash(CrashPlan plan) {
    int crashingLive = (int) plan.replicas.stream().filter(controller::isRunning).count();
    int survivors = controller.liveCount() - crashingLive;
    int quorum = controller.config().progressQuorum();
    if (survivors < quorum) {
      throw new ScenarioConfigurationException("Crashing " + plan + " would leave " + survivors
          + " live replicas; " + controller.config() + " needs " + quorum + " to make progress");
    }
    faultInjector.apply(controller, plan);
    for (int replicaId : plan.replicas) {
      lastObservedView.remove(replicaId);
    }
    ScenarioRun run = activeRun;
    if (run != null) {
      run.recordCrashed(plan.replicas);
    }
    return plan;
  }


  /**
   * Crash a single replica. Unlike {@link #crashIncludingPrimary(int, int, Set)}, this doesn't check quorums:
   * the caller is deliberately taking a replica out of the picture.
   */
  public void crash(int replicaId) {
    log.info("Crashing replica {}", replicaId);
    controller.stop(replicaId);
    lastObservedView.remove(replicaId);
    ScenarioRun run = activeRun;
    if (run != null) {
      run.recordCrashed(Collections.singleton(replicaId));
    }
  }


  /**
   * Start a replica that was crashed.
   */
  public void restart(int replicaId) {
    log.info("Starting replica {}", replicaId);
    controller.start(replicaId);
    lastObservedView.remove(replicaId);
  }


  /**
   * Restart every replica in a crash plan that isn't running.
   */
  public void restore(CrashPlan plan) {
    faultInjector.restore(controller, plan);
    for (int replicaId : plan.replicas) {
      lastObservedView.remove(replicaId);
    }
  }


  /**
   * Stop and immediately start a running replica.
   */
  public void bounce(int replicaId) {
    log.info("Restarting replica {}", replicaId);
    controller.stop(replicaId);
    controller.start(replicaId);
    lastObservedView.remove(replicaId);
  }


  //
  // Workload
  //


  /**
   * Send tracked operations for the configured workload window, to trip the replicas' view change timers.
   * Running out the window is the normal outcome.
   */
  public WorkloadSummary sendRandomWrites() {
    return trackedOps.runBounded(timings.workloadWindow, timings.workloadIntensity);
  }


  /**
   * Like {@link #sendRandomWrites()}, but with untracked writes.
   */
  public WorkloadSummary sendIndefiniteWrites() {
    return writes.runBounded(timings.workloadWindow, timings.workloadIntensity);
  }


  /**
   * Send a batch of tracked operations and wait for them all to resolve.
   *
   * @throws ScenarioFailedException If the batch could not make progress.
   */
  public void runConcurrentOps(int count) {
    log.info("Running {} concurrent tracked operations", count);
    try {
      tracker.runConcurrentOps(count);
    } catch (TransientObservationException e) {
      throw new ScenarioFailedException("Could not run " + count + " concurrent operations", e);
    }
  }


  /**
   * Write a random key and value, and check that we can read it back.
   *
   * @return The key and value written.
   *
   * @throws ScenarioFailedException If the write did not go through.
   * @throws ScenarioAssertionException If we read back something other than what we wrote.
   */
  public KeyValue writeKnownValue() {
    KeyValue kv;
    try {
      kv = writes.issueOne();
    } catch (TransientObservationException e) {
      throw new ScenarioFailedException("Could not write a known value", e);
    }
    assertReadable(kv);
    return kv;
  }


  /**
   * Check that a key holds the given value.
   *
   * @throws ScenarioAssertionException If it holds anything else.
   * @throws DeadlineExceededException If the cluster couldn't serve the read in time.
   */
  public void assertReadable(KeyValue kv) {
    Optional<String> value = poller.waitFor("read " + kv.key, v -> true, () -> client.read(kv.key),
        timings.readYourWritesAttemptTimeout, timings.readYourWritesTimeout);
    ScenarioAssertionException.assertEquals("Make sure the write of " + kv.key + " was executed", Optional.of(kv.value), value);
  }


  //
  // Observation
  //


  /**
   * Ask the cluster for its current primary, retrying transient failures.
   */
  public int currentPrimary() {
    return poller.waitFor("current primary", p -> true, controller::currentPrimary, timings.perPollTimeout, timings.viewChangeTimeout);
  }


  /**
   * Ask a replica for its current view, retrying transient failures.
   */
  public long currentView(int replicaId) {
    return poller.waitFor("[replica " + replicaId + "] current view", v -> true, () -> observeView(replicaId),
        timings.perPollTimeout, timings.viewChangeTimeout);
  }


  /**
   * Ask the cluster for the id of its last committed block, retrying transient failures.
   */
  public long lastCommittedBlock() {
    return poller.waitFor("last committed block", b -> true, client::lastCommittedBlock,
        timings.perPollTimeout, timings.viewChangeTimeout);
  }


  /**
   * Query a replica's view, and check it hasn't gone backwards.
   */
  private long observeView(int replicaId) throws TransientObservationException {
    long view = controller.currentView(replicaId);
    lastObservedView.compute(replicaId, (id, previous) -> {
      if (previous != null && view < previous) {
        throw new ScenarioAssertionException("View of replica " + id + " went backwards", ">= " + previous, view);
      }
      return view;
    });
    return view;
  }


  /**
   * Wait for a replica to reach a view satisfying the predicate.
   *
   * @return The view it reached.
   *
   * @throws DeadlineExceededException If it didn't within the view change timeout.
   * @throws ScenarioAssertionException If its view went backwards while we were watching.
   */
  public long waitForView(int replicaId, Predicate<Long> expected, String description) {
    long view = poller.waitFor("[replica " + replicaId + "] " + description, expected, () -> observeView(replicaId),
        timings.perPollTimeout, timings.viewChangeTimeout);
    ScenarioRun run = activeRun;
    if (run != null) {
      run.recordConvergedView(view);
    }
    return view;
  }


  /**
   * Wait, in parallel, for each of the given replicas to reach a view satisfying the predicate.
   *
   * @return The view each replica reached.
   *
   * @see #waitForView(int, Predicate, String)
   */
  public Map<Integer, Long> waitForViewOnEach(Collection<Integer> replicaIds, Predicate<Long> expected, String description) {
    Map<Integer, Long> views = poller.waitForEach(description, replicaIds, expected,
        replicaId -> () -> observeView(replicaId), timings.perPollTimeout, timings.viewChangeTimeout);
    ScenarioRun run = activeRun;
    if (run != null && !views.isEmpty()) {
      run.recordConvergedView(Collections.max(views.values()));
    }
    return views;
  }


  /**
   * Retry a tracked write-then-read until it succeeds. Each attempt gets its own short timeout,
   * and failed attempts are retried until the (much longer) overall timeout.
   *
   * @throws DeadlineExceededException If no attempt succeeded in time.
   */
  public void waitForReadYourWrites() {
    poller.waitFor("read your writes", Boolean.TRUE::equals, () -> {
      tracker.trackedReadYourWrites();
      return Boolean.TRUE;
    }, timings.readYourWritesAttemptTimeout, timings.readYourWritesTimeout);
  }


  /**
   * Wait for the slow commit path to have committed more requests than the fast path on the given replica.
   */
  public CommitPathCounts waitForSlowPathPrevalent(int replicaId) {
    return poller.waitFor("[replica " + replicaId + "] slow path prevalent", CommitPathCounts::slowPathPrevalent,
        () -> controller.commitPaths(replicaId), timings.perPollTimeout, timings.viewChangeTimeout);
  }


  /**
   * Wait a fixed amount of time for the cluster to settle. This isn't a protocol guarantee,
   * just a test parameter.
   *
   * @param duration How long to wait.
   * @param reason What we're waiting for, for the logs.
   */
  public void settle(Duration duration, String reason) {
    log.info("Waiting {} {}", TimerUtils.formatDuration(duration), reason);
    clock.sleep(duration);
  }


  /**
   * The view the cluster should converge on after the primaries of {@code k} consecutive views
   * starting at {@code initialView} crash.
   */
  public static long expectedViewAfter(long initialView, int k) {
    if (initialView < 0) {
      throw new IllegalArgumentException("Views are non-negative: " + initialView);
    }
    if (k < 1) {
      throw new IllegalArgumentException("At least one primary must have crashed to expect a view change: " + k);
    }
    return initialView + k;
  }


  /**
   * A uniformly random running replica, other than the excluded ones.
   *
   * @throws ScenarioConfigurationException If there is no such replica.
   */
  public int randomReplica(Set<Integer> excluding) {
    List<Integer> candidates = controller.liveReplicas(excluding);
    if (candidates.isEmpty()) {
      throw new ScenarioConfigurationException("No live replica to choose from, excluding " + excluding);
    }
    return candidates.get(random.nextInt(candidates.size()));
  }


  /** The cluster sizing. */
  public ClusterConfig config() {
    return controller.config();
  }


  /** The linearizability tracker. */
  public LinearizabilityTracker tracker() {
    return tracker;
  }


  /** The client. */
  public BftClient client() {
    return client;
  }


  /**
   * Stop the poller's threads.
   */
  @Override
  public void close() {
    poller.close();
  }


  /** Create a new builder. */
  public static Builder newBuilder() {
    return new Builder();
  }


  /**
   * A builder for an orchestrator. The controller, client and tracker are mandatory.
   */
  public static class Builder {
    @Nullable
    private ReplicaClusterController controller = null;
    @Nullable
    private BftClient client = null;
    @Nullable
    private LinearizabilityTracker tracker = null;
    private ScenarioTimings timings = ScenarioTimings.DEFAULT;
    @Nullable
    private Long seed = null;
    private HarnessClock clock = RealHarnessClock.INSTANCE;
    private final List<ScenarioListener> listeners = new ArrayList<>();

    private Builder() {}

    public Builder controller(ReplicaClusterController controller) {
      this.controller = controller;
      return this;
    }

    public Builder client(BftClient client) {
      this.client = client;
      return this;
    }

    public Builder tracker(LinearizabilityTracker tracker) {
      this.tracker = tracker;
      return this;
    }

    public Builder timings(ScenarioTimings timings) {
      this.timings = timings;
      return this;
    }

    /** Fix the random seed, to replay a run. If not set, a seed is chosen and logged. */
    public Builder seed(long seed) {
      this.seed = seed;
      return this;
    }

    public Builder clock(HarnessClock clock) {
      this.clock = clock;
      return this;
    }

    public Builder listener(ScenarioListener listener) {
      this.listeners.add(listener);
      return this;
    }

    public ScenarioOrchestrator build() {
      if (controller == null || client == null || tracker == null) {
        throw new IllegalStateException("An orchestrator needs a controller, a client, and a tracker");
      }
      long actualSeed = seed != null ? seed : new Random().nextLong();
      if (seed == null) {
        log.info("No seed given; using random seed {}", actualSeed);
      }
      return new ScenarioOrchestrator(this, actualSeed);
    }
  }
}
