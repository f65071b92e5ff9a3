package ai.eloquent.minotaur.scenario;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.time.Duration;

/**
 * The tunable timing parameters of a scenario run. None of these are protocol guarantees; they are
 * test parameters, sized for a cluster whose view change timeout is on the order of 10 seconds.
 * Tests against faster (e.g., simulated) clusters should scale them down.
 */
public final class ScenarioTimings {
  /**
   * An SLF4J Logger for this class.
   */
  private static final Logger log = LoggerFactory.getLogger(ScenarioTimings.class);

  /** The defaults. */
  public static final ScenarioTimings DEFAULT = newBuilder().build();

  /** How long to inject writes for while the primary is down. */
  public final Duration workloadWindow;

  /** How many writes to keep in flight during the workload window. */
  public final int workloadIntensity;

  /** How long in-flight workload operations get to resolve once their window closes. */
  public final Duration workloadJoinGrace;

  /** The fixed pause between two polls of the cluster. */
  public final Duration pollInterval;

  /** How long a single poll may take before we abandon it. */
  public final Duration perPollTimeout;

  /** How long we wait for a replica to reach an expected view. */
  public final Duration viewChangeTimeout;

  /** How long a single read-your-writes attempt may take. */
  public final Duration readYourWritesAttemptTimeout;

  /** How long we keep retrying read-your-writes before failing the scenario. */
  public final Duration readYourWritesTimeout;

  /** How long to let the cluster settle after a view change before exercising a replica that was down. */
  public final Duration viewChangeSettleDelay;

  /** How long to let a restarted replica settle before exercising it. */
  public final Duration restartSettleDelay;

  /** The number of tracked operations in a warm-up batch. */
  public final int warmupOps;

  /** The number of tracked operations we run to check the cluster is live in a new view. */
  public final int postConvergenceOps;


  private ScenarioTimings(Builder b) {
    this.workloadWindow = b.workloadWindow;
    this.workloadIntensity = b.workloadIntensity;
    this.workloadJoinGrace = b.workloadJoinGrace;
    this.pollInterval = b.pollInterval;
    this.perPollTimeout = b.perPollTimeout;
    this.viewChangeTimeout = b.viewChangeTimeout;
    this.readYourWritesAttemptTimeout = b.readYourWritesAttemptTimeout;
    this.readYourWritesTimeout = b.readYourWritesTimeout;
    this.viewChangeSettleDelay = b.viewChangeSettleDelay;
    this.restartSettleDelay = b.restartSettleDelay;
    this.warmupOps = b.warmupOps;
    this.postConvergenceOps = b.postConvergenceOps;
  }


  /**
   * Read the timings from the environment. Every field can be overridden by a system property
   * {@code minotaur.<field>} or, failing that, an environment variable {@code MINOTAUR_<FIELD>}; for example
   * {@code -Dminotaur.viewChangeTimeout=60000} or {@code MINOTAUR_VIEWCHANGETIMEOUT=60000}.
   * Durations are in milliseconds.
   */
  public static ScenarioTimings fromEnvironment() {
    ScenarioTimings d = DEFAULT;
    ScenarioTimings timings = newBuilder()
        .workloadWindow(readMillis("workloadWindow", d.workloadWindow))
        .workloadIntensity(readInt("workloadIntensity", d.workloadIntensity))
        .workloadJoinGrace(readMillis("workloadJoinGrace", d.workloadJoinGrace))
        .pollInterval(readMillis("pollInterval", d.pollInterval))
        .perPollTimeout(readMillis("perPollTimeout", d.perPollTimeout))
        .viewChangeTimeout(readMillis("viewChangeTimeout", d.viewChangeTimeout))
        .readYourWritesAttemptTimeout(readMillis("readYourWritesAttemptTimeout", d.readYourWritesAttemptTimeout))
        .readYourWritesTimeout(readMillis("readYourWritesTimeout", d.readYourWritesTimeout))
        .viewChangeSettleDelay(readMillis("viewChangeSettleDelay", d.viewChangeSettleDelay))
        .restartSettleDelay(readMillis("restartSettleDelay", d.restartSettleDelay))
        .warmupOps(readInt("warmupOps", d.warmupOps))
        .postConvergenceOps(readInt("postConvergenceOps", d.postConvergenceOps))
        .build();
    log.info("Using scenario timings: {}", timings);
    return timings;
  }


  /** Look up a setting, system property first. */
  @Nullable
  private static String read(String name) {
    String value = System.getProperty("minotaur." + name);
    if (value == null) {
      value = System.getenv("MINOTAUR_" + name.toUpperCase());
    }
    return value == null ? null : value.trim();
  }


  /** Read a duration setting, in milliseconds. */
  private static Duration readMillis(String name, Duration defaultValue) {
    return Duration.ofMillis(readInt(name, (int) defaultValue.toMillis()));
  }


  /** Read an integer setting. */
  private static int readInt(String name, int defaultValue) {
    String value = read(name);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new IllegalStateException("Could not parse scenario timing '" + name + "' = '" + value + "'", e);
    }
  }


  /**
   * A builder pre-populated with these timings.
   */
  public Builder toBuilder() {
    return newBuilder()
        .workloadWindow(workloadWindow)
        .workloadIntensity(workloadIntensity)
        .workloadJoinGrace(workloadJoinGrace)
        .pollInterval(pollInterval)
        .perPollTimeout(perPollTimeout)
        .viewChangeTimeout(viewChangeTimeout)
        .readYourWritesAttemptTimeout(readYourWritesAttemptTimeout)
        .readYourWritesTimeout(readYourWritesTimeout)
        .viewChangeSettleDelay(viewChangeSettleDelay)
        .restartSettleDelay(restartSettleDelay)
        .warmupOps(warmupOps)
        .postConvergenceOps(postConvergenceOps);
  }


  /** Create a builder with the default timings. */
  public static Builder newBuilder() {
    return new Builder();
  }


  /**
   * A builder for scenario timings.
   */
  public static class Builder {
    private Duration workloadWindow = Duration.ofSeconds(1);
    private int workloadIntensity = 1;
    private Duration workloadJoinGrace = Duration.ofSeconds(10);
    private Duration pollInterval = Duration.ofMillis(200);
    private Duration perPollTimeout = Duration.ofSeconds(5);
    private Duration viewChangeTimeout = Duration.ofSeconds(30);
    private Duration readYourWritesAttemptTimeout = Duration.ofSeconds(5);
    private Duration readYourWritesTimeout = Duration.ofSeconds(60);
    private Duration viewChangeSettleDelay = Duration.ofSeconds(10);
    private Duration restartSettleDelay = Duration.ofSeconds(5);
    private int warmupOps = 50;
    private int postConvergenceOps = 100;

    public Builder workloadWindow(Duration workloadWindow) {
      this.workloadWindow = workloadWindow;
      return this;
    }

    public Builder workloadIntensity(int workloadIntensity) {
      this.workloadIntensity = workloadIntensity;
      return this;
    }

    public Builder workloadJoinGrace(Duration workloadJoinGrace) {
      this.workloadJoinGrace = workloadJoinGrace;
      return this;
    }

    public Builder pollInterval(Duration pollInterval) {
      this.pollInterval = pollInterval;
      return this;
    }

    public Builder perPollTimeout(Duration perPollTimeout) {
      this.perPollTimeout = perPollTimeout;
      return this;
    }

    public Builder viewChangeTimeout(Duration viewChangeTimeout) {
      this.viewChangeTimeout = viewChangeTimeout;
      return this;
    }

    public Builder readYourWritesAttemptTimeout(Duration readYourWritesAttemptTimeout) {
      this.readYourWritesAttemptTimeout = readYourWritesAttemptTimeout;
      return this;
    }

    public Builder readYourWritesTimeout(Duration readYourWritesTimeout) {
      this.readYourWritesTimeout = readYourWritesTimeout;
      return this;
    }

    public Builder viewChangeSettleDelay(Duration viewChangeSettleDelay) {
      this.viewChangeSettleDelay = viewChangeSettleDelay;
      return this;
    }

    public Builder restartSettleDelay(Duration restartSettleDelay) {
      this.restartSettleDelay = restartSettleDelay;
      return this;
    }

    public Builder warmupOps(int warmupOps) {
      this.warmupOps = warmupOps;
      return this;
    }

    public Builder postConvergenceOps(int postConvergenceOps) {
      this.postConvergenceOps = postConvergenceOps;
      return this;
    }

    public ScenarioTimings build() {
      if (workloadIntensity < 1) {
        throw new IllegalArgumentException("Workload intensity must be at least 1: " + workloadIntensity);
      }
      if (pollInterval.isNegative() || pollInterval.isZero()) {
        throw new IllegalArgumentException("Poll interval must be positive: " + pollInterval);
      }
      if (pollInterval.compareTo(viewChangeTimeout) >= 0) {
        throw new IllegalArgumentException("Poll interval " + pollInterval + " should be well below the view change timeout " + viewChangeTimeout);
      }
      return new ScenarioTimings(this);
    }
  }


  /** {@inheritDoc} */
  @Override
  public String toString() {
    return "ScenarioTimings(" +
        "workloadWindow=" + workloadWindow.toMillis() + "ms" +
        ", workloadIntensity=" + workloadIntensity +
        ", workloadJoinGrace=" + workloadJoinGrace.toMillis() + "ms" +
        ", pollInterval=" + pollInterval.toMillis() + "ms" +
        ", perPollTimeout=" + perPollTimeout.toMillis() + "ms" +
        ", viewChangeTimeout=" + viewChangeTimeout.toMillis() + "ms" +
        ", readYourWritesAttemptTimeout=" + readYourWritesAttemptTimeout.toMillis() + "ms" +
        ", readYourWritesTimeout=" + readYourWritesTimeout.toMillis() + "ms" +
        ", viewChangeSettleDelay=" + viewChangeSettleDelay.toMillis() + "ms" +
        ", restartSettleDelay=" + restartSettleDelay.toMillis() + "ms" +
        ", warmupOps=" + warmupOps +
        ", postConvergenceOps=" + postConvergenceOps +
        ")";
  }
}
