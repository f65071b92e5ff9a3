package ai.eloquent.minotaur.workload;

import ai.eloquent.minotaur.HarnessMetrics;
import ai.eloquent.minotaur.TransientObservationException;
import ai.eloquent.minotaur.util.HarnessClock;
import ai.eloquent.minotaur.util.RuntimeInterruptedException;
import ai.eloquent.minotaur.util.TimerUtils;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * An in-flight batch of concurrent client operations.
 *
 * <p>
 *   A handle is created running, and ends up {@link State#CANCELLED cancelled}, {@link State#COMPLETED completed}
 *   or {@link State#FAILED failed}. It is never restarted. Whoever created it owns it, and must
 *   {@linkplain #cancelAndJoin(Duration) cancel and join} it (or {@linkplain #close() close} it) before moving on,
 *   so that no operation from one phase of a scenario leaks into the next.
 * </p>
 *
 * <p>
 *   Operations that fail with a {@link TransientObservationException} are counted and swallowed: we expect
 *   them while a fault is in effect. Any other exception fails the batch: the remaining workers stop,
 *   and the exception is rethrown from {@link #join(Duration, Duration)}.
 * </p>
 *
 * <p>
 *   Cancellation is cooperative. Cancelling stops workers from starting new operations, and in-flight
 *   operations are left to finish (or fail) on their own. Only if they haven't within the join grace period
 *   do we interrupt them.
 * </p>
 */
public class WorkloadHandle implements AutoCloseable {
  /**
   * An SLF4J Logger for this class.
   */
  private static final Logger log = LoggerFactory.getLogger(WorkloadHandle.class);

  /** The lifecycle of a handle. */
  public enum State {
    /** Workers are issuing operations. */
    RUNNING,
    /** We were cancelled, and every worker has stopped. */
    CANCELLED,
    /** We issued every operation we were asked to, and every worker has stopped. */
    COMPLETED,
    /** An operation failed with a non-transient error, and every worker has stopped. */
    FAILED,
  }

  /** The grace period {@link #close()} gives in-flight operations. */
  public static final Duration DEFAULT_CLOSE_GRACE = Duration.ofSeconds(10);

  /** The name of this batch, for logs. */
  public final String name;

  /** The number of concurrent workers. */
  public final int intensity;

  /** The clock we measure elapsed time on. */
  private final HarnessClock clock;

  /** When the batch started, on {@link #clock}. */
  private final long startTime;

  /** The workers. */
  private final ExecutorService workers;

  /** Set once someone asks us to stop. */
  private final AtomicBoolean cancelRequested = new AtomicBoolean(false);

  /** The number of operations left to start. {@link Long#MAX_VALUE} for an unbounded batch. */
  private final AtomicLong permits;

  /** Operations that succeeded. */
  private final AtomicLong succeeded = new AtomicLong(0);

  /** Operations that failed transiently. */
  private final AtomicLong transientFailures = new AtomicLong(0);

  /** The first non-transient error, if any. */
  private final AtomicReference<Throwable> error = new AtomicReference<>(null);

  /** The summary, once we've joined. */
  @Nullable
  private volatile WorkloadSummary summary = null;


  /**
   * Start a batch.
   *
   * @param name The name of the batch, for logs and thread names.
   * @param operation The operation every worker issues in a loop.
   * @param intensity The number of concurrent workers, i.e., the maximum number of operations in flight at once.
   * @param count The total number of operations to issue, or {@link Long#MAX_VALUE} to run until cancelled.
   * @param clock The clock to measure the batch on.
   */
  WorkloadHandle(String name, WorkloadOperation operation, int intensity, long count, HarnessClock clock) {
    if (intensity < 1) {
      throw new IllegalArgumentException("Workload intensity must be at least 1: " + intensity);
    }
    if (count < 0) {
      throw new IllegalArgumentException("Cannot issue a negative number of operations: " + count);
    }
    this.name = name;
    this.intensity = intensity;
    this.clock = clock;
    this.permits = new AtomicLong(count);
    this.startTime = clock.now();
    this.workers = Executors.newFixedThreadPool(intensity, new ThreadFactoryBuilder()
        .setNameFormat("minotaur-workload-" + name + "-%d")
        .setDaemon(true)
        .setUncaughtExceptionHandler((t, e) -> log.warn("Uncaught exception on thread " + t.getName(), e))
        .build());
    for (int i = 0; i < intensity; ++i) {
      this.workers.execute(() -> work(operation));
    }
    this.workers.shutdown();  // no new tasks; lets us await termination
    log.debug("Started workload '{}' with {} workers", name, intensity);
  }


  /**
   * The body of a single worker.
   */
  private void work(WorkloadOperation operation) {
    while (!cancelRequested.get() && !Thread.currentThread().isInterrupted() && takePermit()) {
      try {
        operation.issue();
        succeeded.incrementAndGet();
        HarnessMetrics.WORKLOAD_OPERATIONS.labels("ok").inc();
      } catch (TransientObservationException e) {
        transientFailures.incrementAndGet();
        HarnessMetrics.WORKLOAD_OPERATIONS.labels("transient_failure").inc();
        log.debug("[{}] operation failed transiently: {}", name, e.getMessage());
      } catch (RuntimeInterruptedException e) {
        if (cancelRequested.get()) {
          log.debug("[{}] in-flight operation interrupted after cancellation", name);
        } else {
          fail(e);
        }
        return;
      } catch (RuntimeException | Error e) {
        fail(e);
        return;
      }
    }
  }


  /**
   * Take one operation off the budget, if any are left.
   */
  private boolean takePermit() {
    while (true) {
      long left = permits.get();
      if (left <= 0) {
        return false;
      }
      if (left == Long.MAX_VALUE || permits.compareAndSet(left, left - 1)) {
        return true;
      }
    }
  }


  /**
   * Record a non-transient failure, and stop every worker.
   */
  private void fail(Throwable t) {
    HarnessMetrics.WORKLOAD_OPERATIONS.labels("error").inc();
    if (error.compareAndSet(null, t)) {
      log.warn("[{}] workload operation failed with a non-transient error; stopping the batch", name, t);
    } else {
      log.warn("[{}] additional non-transient workload error", name, t);
    }
    permits.set(0);
  }


  /**
   * The current state of the batch.
   */
  public State state() {
    if (!workers.isTerminated()) {
      return State.RUNNING;
    } else if (error.get() != null) {
      return State.FAILED;
    } else if (cancelRequested.get()) {
      return State.CANCELLED;
    } else {
      return State.COMPLETED;
    }
  }


  /**
   * Ask every worker to stop after its current operation. This does not wait.
   */
  public void cancel() {
    if (cancelRequested.compareAndSet(false, true)) {
      log.debug("[{}] cancelled after {}", name, TimerUtils.formatTimeSince(clock, startTime));
    }
  }


  /**
   * Wait for the batch to finish on its own, cancelling it if it hasn't by the timeout.
   *
   * @param timeout How long to let the batch run before cancelling it, on the wall clock.
   * @param grace Once cancelled, how long in-flight operations get before we interrupt them
   *              (and, failing that, how long interrupted operations get to notice). Also on the wall clock,
   *              whatever clock the handle reports elapsed time on.
   *
   * @return What the batch did.
   *
   * @throws IllegalStateException If some worker is still running after it was cancelled and interrupted.
   *                               This means a client operation is ignoring both its own timeout and interrupts.
   * @throws RuntimeException The first non-transient error an operation threw, if any did.
   */
  public WorkloadSummary join(Duration timeout, Duration grace) {
    WorkloadSummary result = this.summary;
    if (result == null) {
      synchronized (this) {
        result = this.summary;
        if (result == null) {
          // 1. Let the batch run
          if (!awaitWorkers(timeout)) {
            // 2. Cancel, and give in-flight operations a chance to resolve
            cancel();
            if (!awaitWorkers(grace)) {
              // 3. Escalate to interrupts
              log.warn("[{}] workers still running {} after cancellation; interrupting them", name, TimerUtils.formatDuration(grace));
              workers.shutdownNow();
              if (!awaitWorkers(grace)) {
                throw new IllegalStateException("Workload '" + name + "' leaked running operations after cancellation");
              }
            }
          }
          result = new WorkloadSummary(name, state(), succeeded.get(), transientFailures.get(), clock.since(startTime));
          this.summary = result;
          log.info("Finished workload: {}", result);
        }
      }
    }

    // 4. Surface non-transient failures
    Throwable t = error.get();
    if (t instanceof RuntimeException) {
      throw (RuntimeException) t;
    } else if (t instanceof Error) {
      throw (Error) t;
    }
    return result;
  }


  /**
   * Cancel the batch and wait for it to stop.
   *
   * @see #join(Duration, Duration)
   */
  public WorkloadSummary cancelAndJoin(Duration grace) {
    cancel();
    return join(Duration.ZERO, grace);
  }


  /**
   * Wait for all the workers to finish.
   *
   * @return True if they have.
   */
  private boolean awaitWorkers(Duration timeout) {
    try {
      return workers.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      cancel();
      workers.shutdownNow();
      throw new RuntimeInterruptedException("Interrupted while joining workload '" + name + "'", e);
    }
  }


  /**
   * Cancel and join with the {@linkplain #DEFAULT_CLOSE_GRACE default grace period}.
   * This is what makes a handle safe to scope with try-with-resources.
   */
  @Override
  public void close() {
    cancelAndJoin(DEFAULT_CLOSE_GRACE);
  }
}
