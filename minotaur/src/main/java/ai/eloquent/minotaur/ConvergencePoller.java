package ai.eloquent.minotaur;

import ai.eloquent.minotaur.util.HarnessClock;
import ai.eloquent.minotaur.util.RuntimeInterruptedException;
import ai.eloquent.minotaur.util.TimerUtils;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.*;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Repeatedly observes some piece of cluster state until it satisfies a predicate, or until we run out of time.
 *
 * <p>
 *   The cluster is expected to be partially unavailable while we poll it (that's the point: we're waiting
 *   for it to recover from a fault we injected). So a single query that times out, or that fails with a
 *   {@link TransientObservationException}, just means "not converged yet" and we try again after a fixed
 *   {@linkplain #pollInterval poll interval}. Only running out the overall deadline is a failure, reported as a
 *   {@link DeadlineExceededException}. Any other exception from a query is a bug, and is rethrown as-is.
 * </p>
 */
public class ConvergencePoller implements AutoCloseable {
  /**
   * An SLF4J Logger for this class.
   */
  private static final Logger log = LoggerFactory.getLogger(ConvergencePoller.class);

  /** How often, in [clock] milliseconds, to log that we're still waiting. */
  private static final long PROGRESS_LOG_INTERVAL = 5000;

  /** The clock deadlines and sleeps are measured on. */
  private final HarnessClock clock;

  /** The fixed pause between two attempts. */
  public final Duration pollInterval;

  /** The pool queries run on, so that we can abandon one that hangs. */
  private final ExecutorService pool;


  /**
   * Create a new poller.
   *
   * @param clock The clock to measure deadlines on.
   * @param pollInterval The pause between attempts. Should be small relative to the deadlines used.
   */
  public ConvergencePoller(HarnessClock clock, Duration pollInterval) {
    this.clock = clock;
    this.pollInterval = pollInterval;
    this.pool = Executors.newCachedThreadPool(new ThreadFactoryBuilder()
        .setNameFormat("minotaur-poll-%d")
        .setDaemon(true)
        .setUncaughtExceptionHandler((t, e) -> log.warn("Uncaught exception on thread " + t.getName(), e))
        .build());
  }


  /**
   * @see #waitFor(String, Predicate, ReplicaQuery, Duration, Deadline)
   */
  public <T> T waitFor(String description, Predicate<? super T> predicate, ReplicaQuery<T> query,
                       Duration perPollTimeout, Duration overallTimeout) {
    return waitFor(description, predicate, query, perPollTimeout, Deadline.after(clock, overallTimeout));
  }


  /**
   * Poll until the predicate holds on a queried value.
   *
   * @param description What we are waiting for, for logs and failure messages.
   * @param predicate The convergence condition. This must be a pure function of the observed value.
   * @param query The observation to make on every attempt.
   * @param perPollTimeout How long a single query may take before we abandon it and count the attempt as not converged.
   *                       This is waited out on the wall clock, and then charged to the poller's clock.
   * @param deadline When to give up.
   *
   * @return The first observed value that satisfied the predicate.
   *
   * @throws DeadlineExceededException If the deadline passed without the predicate holding.
   * @throws RuntimeInterruptedException If we were interrupted while waiting.
   */
  public <T> T waitFor(String description, Predicate<? super T> predicate, ReplicaQuery<T> query,
                       Duration perPollTimeout, Deadline deadline) {
    int attempts = 0;
    @Nullable T lastObserved = null;
    @Nullable Throwable lastError = null;
    long lastProgressLog = clock.now();
    while (true) {
      // 1. Run one attempt, bounded by the per-poll timeout (and by what's left of the deadline)
      attempts += 1;
      long attemptMillis = Math.max(1, deadline.min(perPollTimeout).toMillis());
      long attemptStart = clock.now();
      Future<T> future = pool.submit((Callable<T>) query::query);
      try {
        T value = future.get(attemptMillis, TimeUnit.MILLISECONDS);
        lastObserved = value;
        if (predicate.test(value)) {
          HarnessMetrics.POLL_ATTEMPTS.labels("converged").inc();
          log.info("{}: converged on {} after {} ({} attempts)", description, value, TimerUtils.formatDuration(deadline.elapsed()), attempts);
          return value;
        }
        HarnessMetrics.POLL_ATTEMPTS.labels("not_converged").inc();
        log.debug("{}: observed {}; not converged yet", description, value);
      } catch (TimeoutException e) {
        // 2.a. The query hung; abandon it
        future.cancel(true);
        lastError = e;
        // The wait above was on the wall clock; make sure our clock saw it too, so a hung query eats into the deadline
        long charged = clock.now() - attemptStart;
        if (charged < attemptMillis) {
          clock.sleep(attemptMillis - charged);
        }
        HarnessMetrics.POLL_ATTEMPTS.labels("attempt_timeout").inc();
        log.debug("{}: attempt {} timed out after {}ms", description, attempts, attemptMillis);
      } catch (ExecutionException e) {
        // 2.b. The query failed. Only transient errors are retried
        Throwable cause = e.getCause();
        if (cause instanceof TransientObservationException) {
          lastError = cause;
          HarnessMetrics.POLL_ATTEMPTS.labels("transient_failure").inc();
          log.debug("{}: attempt {} failed transiently: {}", description, attempts, cause.getMessage());
        } else if (cause instanceof RuntimeException) {
          throw (RuntimeException) cause;
        } else if (cause instanceof Error) {
          throw (Error) cause;
        } else {
          throw new IllegalStateException(description + ": query threw an unexpected checked exception", cause);
        }
      } catch (InterruptedException e) {
        future.cancel(true);
        Thread.currentThread().interrupt();
        throw new RuntimeInterruptedException("Interrupted while waiting for: " + description, e);
      }

      // 3. Check the deadline
      if (deadline.isExpired()) {
        break;
      }
      if (clock.now() - lastProgressLog >= PROGRESS_LOG_INTERVAL) {
        lastProgressLog = clock.now();
        log.info("{}: still waiting after {} ({} attempts, last observed {})",
            description, TimerUtils.formatDuration(deadline.elapsed()), attempts, lastObserved);
      }

      // 4. Wait a bit before trying again
      clock.sleep(deadline.min(pollInterval));
      if (deadline.isExpired()) {
        break;
      }
    }
    log.warn("{}: giving up after {} ({} attempts, last observed {})",
        description, TimerUtils.formatDuration(deadline.elapsed()), attempts, lastObserved);
    throw new DeadlineExceededException(description, deadline.elapsed(), attempts, lastObserved, lastError);
  }


  /**
   * Wait for a replica to reach a view satisfying the given predicate.
   *
   * @return The view the replica converged on.
   */
  public long waitForView(ReplicaClusterController controller, int replicaId, Predicate<Long> expected,
                          String description, Duration perPollTimeout, Duration overallTimeout) {
    return waitFor("[replica " + replicaId + "] " + description, expected,
        () -> controller.currentView(replicaId), perPollTimeout, overallTimeout);
  }


  /**
   * Wait, in parallel, for every one of the given replicas to reach a view satisfying the predicate.
   * All replicas share the same deadline.
   *
   * @return The view each replica converged on.
   *
   * @throws DeadlineExceededException If any replica failed to converge in time.
   */
  public Map<Integer, Long> waitForViewOnEach(ReplicaClusterController controller, Collection<Integer> replicaIds,
                                              Predicate<Long> expected, String description,
                                              Duration perPollTimeout, Duration overallTimeout) {
    return waitForEach(description, replicaIds, expected, replicaId -> () -> controller.currentView(replicaId),
        perPollTimeout, overallTimeout);
  }


  /**
   * Poll a query per replica, in parallel, until the predicate holds on every one of them.
   * All replicas share the same deadline.
   *
   * @param description What we are waiting for.
   * @param replicaIds The replicas to poll.
   * @param predicate The convergence condition, applied to each replica's observations separately.
   * @param queryFor The query to poll, for a given replica.
   * @param perPollTimeout How long a single query may take.
   * @param overallTimeout How long to wait for every replica to converge.
   *
   * @return The value each replica converged on, in the order the replicas were given.
   *
   * @throws DeadlineExceededException If any replica failed to converge in time.
   */
  public <T> Map<Integer, T> waitForEach(String description, Collection<Integer> replicaIds,
                                         Predicate<? super T> predicate, Function<Integer, ReplicaQuery<T>> queryFor,
                                         Duration perPollTimeout, Duration overallTimeout) {
    Deadline deadline = Deadline.after(clock, overallTimeout);
    Map<Integer, Future<T>> waits = new LinkedHashMap<>();
    for (int replicaId : replicaIds) {
      ReplicaQuery<T> query = queryFor.apply(replicaId);
      waits.put(replicaId, pool.submit(() -> waitFor("[replica " + replicaId + "] " + description, predicate,
          query, perPollTimeout, deadline)));
    }
    Map<Integer, T> values = new LinkedHashMap<>();
    try {
      for (Map.Entry<Integer, Future<T>> entry : waits.entrySet()) {
        try {
          values.put(entry.getKey(), entry.getValue().get());
        } catch (ExecutionException e) {
          Throwable cause = e.getCause();
          if (cause instanceof RuntimeException) {
            throw (RuntimeException) cause;
          } else if (cause instanceof Error) {
            throw (Error) cause;
          }
          throw new IllegalStateException(description + ": unexpected failure waiting on replica " + entry.getKey(), cause);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          throw new RuntimeInterruptedException("Interrupted while waiting for: " + description, e);
        }
      }
    } finally {
      // If one replica failed, don't leave the others polling in the background
      waits.values().forEach(future -> future.cancel(true));
    }
    return values;
  }


  /**
   * Stop the query pool. Abandoned queries are interrupted.
   */
  @Override
  public void close() {
    pool.shutdownNow();
  }
}
