package ai.eloquent.minotaur;

import io.prometheus.client.Counter;

/**
 * The Prometheus metrics the harness exports. These are registered once, on the default registry,
 * and labelled by outcome so a dashboard can tell expected fault-window noise apart from real errors.
 */
public final class HarnessMetrics {

  /** Static holder */
  private HarnessMetrics() {}

  /** Every attempt the convergence poller makes, by outcome. */
  public static final Counter POLL_ATTEMPTS = Counter.build()
      .name("minotaur_poll_attempts_total")
      .help("Convergence poll attempts, by outcome")
      .labelNames("outcome")
      .register();

  /** Every operation a workload batch issues, by outcome. */
  public static final Counter WORKLOAD_OPERATIONS = Counter.build()
      .name("minotaur_workload_operations_total")
      .help("Workload operations issued against the cluster, by outcome")
      .labelNames("outcome")
      .register();

  /** Every scenario run, by scenario name and outcome. */
  public static final Counter SCENARIO_RUNS = Counter.build()
      .name("minotaur_scenario_runs_total")
      .help("Scenario runs, by scenario and outcome")
      .labelNames("scenario", "outcome")
      .register();
}
