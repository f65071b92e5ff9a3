package ai.eloquent.minotaur;

import java.util.Optional;

/**
 * The client side of the key-value protocol spoken by the replicas.
 * The encoding of requests and replies is the client's business; the harness only needs to know
 * whether a request succeeded and what it returned.
 */
public interface BftClient {

  /**
   * Write a value, waiting until it is committed.
   *
   * @throws TransientObservationException If the request timed out or the cluster could not serve it.
   */
  void write(String key, String value) throws TransientObservationException;


  /**
   * Read the latest committed value of a key.
   *
   * @return The value, or empty if the key was never written.
   *
   * @throws TransientObservationException If the request timed out or the cluster could not serve it.
   */
  Optional<String> read(String key) throws TransientObservationException;


  /**
   * Read the id of the last committed block. If this doesn't move, nothing was committed.
   *
   * @throws TransientObservationException If the request timed out or the cluster could not serve it.
   */
  long lastCommittedBlock() throws TransientObservationException;
}
