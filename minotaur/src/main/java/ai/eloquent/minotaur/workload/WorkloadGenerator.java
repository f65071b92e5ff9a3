package ai.eloquent.minotaur.workload;

import ai.eloquent.minotaur.BftClient;
import ai.eloquent.minotaur.LinearizabilityTracker;
import ai.eloquent.minotaur.TransientObservationException;
import ai.eloquent.minotaur.util.HarnessClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives client traffic at the cluster.
 *
 * <p>
 *   Traffic comes in two shapes. A single known write ({@link #issueOne()}) establishes a baseline we can
 *   read back later. A batch ({@link #injectIndefinitely(int)}, {@link #inject(long, int)},
 *   {@link #runBounded(Duration, int)}) keeps a fixed number of operations in flight, mostly to trip the
 *   replicas' liveness timers while a primary is down; individual failures in a batch are expected and swallowed.
 * </p>
 */
public class WorkloadGenerator {
  /**
   * An SLF4J Logger for this class.
   */
  private static final Logger log = LoggerFactory.getLogger(WorkloadGenerator.class);

  /** The client for known writes. */
  private final BftClient client;

  /** The operation every batch worker issues. */
  private final WorkloadOperation operation;

  /** The source of keys and values. Seeded by the scenario. */
  private final Random random;

  /** The clock batches are measured on. */
  private final HarnessClock clock;

  /** How long a cancelled batch's in-flight operations get to resolve. */
  private final Duration joinGrace;

  /** A counter for naming batches in logs. */
  private final AtomicInteger batchCount = new AtomicInteger(0);


  /**
   * Create a generator whose batches issue the given operation.
   *
   * @param client The client for {@link #issueOne()}.
   * @param operation The operation batch workers issue.
   * @param random The source of keys and values.
   * @param clock The clock to measure batches on.
   * @param joinGrace How long a cancelled batch's in-flight operations get to resolve.
   */
  public WorkloadGenerator(BftClient client, WorkloadOperation operation, Random random, HarnessClock clock, Duration joinGrace) {
    this.client = client;
    this.operation = operation;
    this.random = random;
    this.clock = clock;
    this.joinGrace = joinGrace;
  }


  /**
   * A generator whose batches write random keys through the client.
   */
  public static WorkloadGenerator writes(BftClient client, Random random, HarnessClock clock, Duration joinGrace) {
    KeySpace keys = new KeySpace(random);
    return new WorkloadGenerator(client, () -> {
      KeyValue kv = keys.next();
      client.write(kv.key, kv.value);
    }, random, clock, joinGrace);
  }


  /**
   * A generator whose batches send operations through a linearizability tracker, so that they end up in
   * its history.
   */
  public static WorkloadGenerator tracked(LinearizabilityTracker tracker, BftClient client, Random random,
                                          HarnessClock clock, Duration joinGrace) {
    return new WorkloadGenerator(client, tracker::sendTrackedOp, random, clock, joinGrace);
  }


  /**
   * Write a single random key and value, and wait for it to commit.
   *
   * @return The key and value written.
   *
   * @throws TransientObservationException If the write did not go through.
   */
  public KeyValue issueOne() throws TransientObservationException {
    KeyValue kv = new KeySpace(random).next();
    client.write(kv.key, kv.value);
    log.info("Wrote known value {}", kv);
    return kv;
  }


  /**
   * Start a batch that keeps {@code intensity} operations in flight until it is cancelled.
   *
   * @param intensity The number of concurrent operations.
   *
   * @return The running batch. The caller owns it.
   */
  public WorkloadHandle injectIndefinitely(int intensity) {
    return new WorkloadHandle("unbounded-" + batchCount.incrementAndGet(), operation, intensity, Long.MAX_VALUE, clock);
  }


  /**
   * Start a batch of exactly {@code count} operations, {@code intensity} at a time.
   *
   * @param count The number of operations to issue.
   * @param intensity The number of concurrent operations.
   *
   * @return The running batch. The caller owns it.
   */
  public WorkloadHandle inject(long count, int intensity) {
    return new WorkloadHandle("batch-" + batchCount.incrementAndGet(), operation, intensity, count, clock);
  }


  /**
   * Keep {@code intensity} operations in flight for {@code window}, then cancel and wait for the batch to stop.
   * Running out the window is the normal way for this to end, not an error.
   *
   * @param window How long to inject for.
   * @param intensity The number of concurrent operations.
   *
   * @return What the batch did.
   */
  public WorkloadSummary runBounded(Duration window, int intensity) {
    WorkloadHandle handle = injectIndefinitely(intensity);
    log.info("Injecting workload '{}' for {}ms at intensity {}", handle.name, window.toMillis(), intensity);
    return handle.join(window, joinGrace);
  }


  /**
   * Random keys and values. Keys are drawn from a small space so that batches overwrite each other's keys
   * now and then.
   */
  static class KeySpace {
    /** The number of distinct keys. */
    static final int SIZE = 1024;

    private final Random random;

    KeySpace(Random random) {
      this.random = random;
    }

    KeyValue next() {
      String key = String.format("key-%04d", random.nextInt(SIZE));
      String value = String.format("value-%016x", random.nextLong());
      return new KeyValue(key, value);
    }
  }
}
