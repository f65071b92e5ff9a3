package ai.eloquent.minotaur;

/**
 * A single observation of cluster state, which may fail transiently.
 * Queries are run repeatedly by the {@link ConvergencePoller}, so they should not have side effects
 * beyond the request itself.
 *
 * @param <T> The type of the observed value.
 */
@FunctionalInterface
public interface ReplicaQuery<T> {

  /**
   * Run the query.
   *
   * @throws TransientObservationException If the cluster could not answer right now.
   */
  T query() throws TransientObservationException;
}
