package ai.eloquent.minotaur;

import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * The lifecycle and introspection handle on a running cluster of replica processes.
 * This owns the live replica set: nothing else in the harness starts or stops replicas.
 *
 * <p>
 *   All calls are synchronous. Process control is idempotent where it can be: stopping a stopped
 *   replica is a no-op, but starting a running replica is an error. Introspection calls must tolerate
 *   an unreachable replica by throwing {@link TransientObservationException}, never by taking down
 *   the harness.
 * </p>
 */
public interface ReplicaClusterController {

  /**
   * The sizing of the cluster this controller manages.
   */
  ClusterConfig config();


  /**
   * Start a replica.
   *
   * @param replicaId The replica to start.
   *
   * @throws IllegalStateException If the replica is already running.
   */
  void start(int replicaId);


  /**
   * Stop (crash) a replica. A no-op if it is already stopped.
   *
   * @param replicaId The replica to stop.
   */
  void stop(int replicaId);


  /**
   * Whether the given replica's process is currently running.
   */
  boolean isRunning(int replicaId);


  /**
   * Start every replica that isn't already running.
   */
  default void startAll() {
    for (int replicaId : allReplicas(Collections.emptySet())) {
      if (!isRunning(replicaId)) {
        start(replicaId);
      }
    }
  }


  /**
   * The running replicas, in ascending order of id.
   *
   * @param excluding Replicas to leave out of the result, whether or not they are running.
   */
  List<Integer> liveReplicas(Set<Integer> excluding);


  /**
   * Every configured replica, running or not, in ascending order of id.
   *
   * @param excluding Replicas to leave out of the result.
   */
  List<Integer> allReplicas(Set<Integer> excluding);


  /**
   * The number of running replicas.
   */
  default int liveCount() {
    return liveReplicas(Collections.emptySet()).size();
  }


  /**
   * Ask a replica which view it is currently in.
   *
   * @throws TransientObservationException If the replica could not be reached.
   */
  long currentView(int replicaId) throws TransientObservationException;


  /**
   * Ask the cluster which replica it considers the current primary.
   *
   * @throws TransientObservationException If no replica could answer.
   */
  int currentPrimary() throws TransientObservationException;


  /**
   * Ask a replica how many requests it has committed on the fast path versus the slow path.
   *
   * @throws TransientObservationException If the replica could not be reached.
   */
  CommitPathCounts commitPaths(int replicaId) throws TransientObservationException;
}
