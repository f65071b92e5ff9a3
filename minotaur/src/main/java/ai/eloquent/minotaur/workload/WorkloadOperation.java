package ai.eloquent.minotaur.workload;

import ai.eloquent.minotaur.TransientObservationException;

/**
 * One client operation against the cluster, issued over and over by a workload batch.
 */
@FunctionalInterface
public interface WorkloadOperation {

  /**
   * Issue the operation and wait for it to resolve.
   *
   * @throws TransientObservationException If the operation failed in a way we expect during a fault
   *                                       (a timeout against a crashed primary, say). These don't stop the batch.
   */
  void issue() throws TransientObservationException;
}
