package ai.eloquent.minotaur;

/**
 * An operation generator that records the history of everything it sends and can later check that
 * history for linearizability. How it checks is opaque to us: we only care whether operations
 * and the final verification succeed.
 */
public interface LinearizabilityTracker {

  /**
   * Send a single tracked operation (a read or a write) and record its outcome.
   *
   * @throws TransientObservationException If the operation timed out or was rejected.
   */
  void sendTrackedOp() throws TransientObservationException;


  /**
   * Send a batch of tracked operations concurrently and wait for all of them to resolve.
   *
   * @param count The number of operations to send.
   *
   * @throws TransientObservationException If the batch could not make progress at all.
   */
  void runConcurrentOps(int count) throws TransientObservationException;


  /**
   * Write a fresh value and read it back, both tracked.
   *
   * @throws TransientObservationException If either request failed, or the read didn't return the write.
   */
  void trackedReadYourWrites() throws TransientObservationException;


  /**
   * Check the recorded history.
   *
   * @throws ScenarioAssertionException If the history is not linearizable.
   */
  void verify();
}
