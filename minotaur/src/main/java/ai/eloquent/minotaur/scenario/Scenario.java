package ai.eloquent.minotaur.scenario;

import ai.eloquent.minotaur.ClusterConfig;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * A named, runnable scenario, composed of independent stages:
 *
 * <ol>
 *   <li>A set of requirements on the cluster sizing. If any fails, the scenario is not run at all.</li>
 *   <li>A {@link ClusterSetup}, which brings the cluster up.</li>
 *   <li>The {@link ScenarioBody} proper.</li>
 *   <li>Any number of {@link Verification}s, run in order once the body has passed.</li>
 * </ol>
 *
 * Scenarios are immutable, and are run with {@link ScenarioOrchestrator#run(Scenario)}.
 */
public class Scenario {

  /** A single requirement on the cluster a scenario runs against. */
  static class Requirement {
    final Predicate<ClusterConfig> predicate;
    final String reason;

    Requirement(Predicate<ClusterConfig> predicate, String reason) {
      this.predicate = predicate;
      this.reason = reason;
    }
  }

  /** The name of the scenario, for logs and metrics. */
  public final String name;

  /** The requirements the cluster must meet. */
  private final ImmutableList<Requirement> requirements;

  /** The setup stage. */
  public final ClusterSetup setup;

  /** The body. */
  public final ScenarioBody body;

  /** The verifications to run after the body. */
  public final ImmutableList<Verification> verifications;


  private Scenario(Builder b) {
    this.name = b.name;
    this.requirements = ImmutableList.copyOf(b.requirements);
    this.setup = b.setup;
    this.body = b.body;
    this.verifications = ImmutableList.copyOf(b.verifications);
  }


  /**
   * Check whether this scenario can be run against the given cluster.
   *
   * @return The reason it can't, or empty if it can.
   */
  public Optional<String> unmetRequirement(ClusterConfig config) {
    for (Requirement requirement : requirements) {
      if (!requirement.predicate.test(config)) {
        return Optional.of(requirement.reason);
      }
    }
    return Optional.empty();
  }


  /** Start building a scenario with the given name. */
  public static Builder newBuilder(String name) {
    return new Builder(name);
  }


  /**
   * A builder for scenarios. Only the body is mandatory: the setup defaults to
   * {@link ClusterSetup#startAll()}, and there are no requirements or verifications by default.
   */
  public static class Builder {
    private final String name;
    private final List<Requirement> requirements = new ArrayList<>();
    private ClusterSetup setup = ClusterSetup.startAll();
    @Nullable
    private ScenarioBody body = null;
    private final List<Verification> verifications = new ArrayList<>();

    private Builder(String name) {
      this.name = name;
    }

    /**
     * Only run against clusters satisfying the predicate. Requirements accumulate.
     *
     * @param reason A description of the requirement, reported when it is not met.
     */
    public Builder requires(Predicate<ClusterConfig> predicate, String reason) {
      this.requirements.add(new Requirement(predicate, reason));
      return this;
    }

    public Builder setup(ClusterSetup setup) {
      this.setup = setup;
      return this;
    }

    /** Add a verification. Verifications run in the order they were added. */
    public Builder verifying(Verification verification) {
      this.verifications.add(verification);
      return this;
    }

    public Builder body(ScenarioBody body) {
      this.body = body;
      return this;
    }

    public Scenario build() {
      if (body == null) {
        throw new IllegalStateException("Scenario '" + name + "' has no body");
      }
      return new Scenario(this);
    }
  }


  /** {@inheritDoc} */
  @Override
  public String toString() {
    return "Scenario(" + name + ")";
  }
}
