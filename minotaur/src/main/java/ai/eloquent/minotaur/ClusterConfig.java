package ai.eloquent.minotaur;

import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.Objects;

/**
 * The sizing parameters of the BFT cluster under test.
 * This is immutable for the lifetime of a scenario run.
 *
 * <ul>
 *   <li>{@link #n}: the total number of replicas.</li>
 *   <li>{@link #f}: the maximum number of faulty (Byzantine or crashed) replicas the cluster tolerates.</li>
 *   <li>{@link #c}: the maximum number of slow replicas the fast commit path tolerates.</li>
 * </ul>
 *
 * The deployment is expected to satisfy {@code n >= 3f + 2c + 1}. We don't enforce it here,
 * since the cluster under test is what it is, but {@link #satisfiesSizingPrecondition()} lets
 * a scenario refuse to run against a cluster where its arithmetic would be meaningless.
 */
public final class ClusterConfig {
  /**
   * An SLF4J Logger for this class.
   */
  private static final Logger log = LoggerFactory.getLogger(ClusterConfig.class);

  /** The total number of replicas. */
  public final int n;

  /** The maximum number of faulty replicas tolerated. */
  public final int f;

  /** The maximum number of slow replicas tolerated. */
  public final int c;


  /** Create a new cluster config. */
  public ClusterConfig(int n, int f, int c) {
    if (n < 1) {
      throw new IllegalArgumentException("A cluster needs at least one replica (n=" + n + ")");
    }
    if (f < 0 || c < 0) {
      throw new IllegalArgumentException("Fault tolerances cannot be negative (f=" + f + ", c=" + c + ")");
    }
    this.n = n;
    this.f = f;
    this.c = c;
  }


  /**
   * Read the cluster config from the environment: first the {@code minotaur.n}, {@code minotaur.f} and
   * {@code minotaur.c} system properties, then the {@code MINOTAUR_N}, {@code MINOTAUR_F} and
   * {@code MINOTAUR_C} environment variables. {@code c} defaults to 0. If {@code f} is not given, we
   * take the largest {@code f} the cluster size admits with the given {@code c}.
   */
  public static ClusterConfig fromEnvironment() {
    int n = readInt("n", -1);
    if (n < 0) {
      throw new IllegalStateException("No cluster size configured; set -Dminotaur.n or MINOTAUR_N");
    }
    int c = readInt("c", 0);
    int f = readInt("f", Math.max(0, (n - 1 - 2 * c) / 3));
    ClusterConfig config = new ClusterConfig(n, f, c);
    log.info("Using cluster config from the environment: {}", config);
    return config;
  }


  /** Read a single integer setting, system property first. */
  private static int readInt(String name, int defaultValue) {
    @Nullable String value = System.getProperty("minotaur." + name);
    if (value == null) {
      value = System.getenv("MINOTAUR_" + name.toUpperCase());
    }
    if (value == null) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalStateException("Could not parse cluster setting '" + name + "' = '" + value + "'", e);
    }
  }


  /**
   * The number of live replicas needed for the cluster to make progress (and to complete a view change):
   * {@code 2f + 2c + 1}.
   */
  public int progressQuorum() {
    return 2 * f + 2 * c + 1;
  }


  /**
   * The largest number of replicas we can have down at once and still expect progress.
   */
  public int maxCrashesPreservingProgress() {
    return Math.max(0, n - progressQuorum());
  }


  /**
   * The replica that is expected to be primary in the given view.
   */
  public int primaryOf(long view) {
    if (view < 0) {
      throw new IllegalArgumentException("Views are non-negative: " + view);
    }
    return (int) (view % n);
  }


  /**
   * Whether this is a legal BFT deployment: {@code n >= 3f + 2c + 1}.
   */
  public boolean satisfiesSizingPrecondition() {
    return n >= 3 * f + 2 * c + 1;
  }


  /**
   * Every replica id in the cluster, {@code [0, n)}.
   */
  public ImmutableList<Integer> allReplicas() {
    ImmutableList.Builder<Integer> ids = ImmutableList.builder();
    for (int i = 0; i < n; ++i) {
      ids.add(i);
    }
    return ids.build();
  }


  /**
   * Whether the given id names a replica of this cluster.
   */
  public boolean isReplica(int replicaId) {
    return replicaId >= 0 && replicaId < n;
  }


  /** {@inheritDoc} */
  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    ClusterConfig that = (ClusterConfig) o;
    return n == that.n && f == that.f && c == that.c;
  }


  /** {@inheritDoc} */
  @Override
  public int hashCode() {
    return Objects.hash(n, f, c);
  }


  /** {@inheritDoc} */
  @Override
  public String toString() {
    return "ClusterConfig(n=" + n + ", f=" + f + ", c=" + c + ")";
  }
}
