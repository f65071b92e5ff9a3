package ai.eloquent.minotaur;

/**
 * A failure we expect to see while a fault is in effect: a replica that is down doesn't answer,
 * a request sent while there is no working primary times out, and so on.
 * This is the only category of error the harness ever retries or swallows.
 */
public class TransientObservationException extends Exception {

  /** The replica we were talking to, if the failure is specific to one. -1 otherwise. */
  public final int replicaId;


  /** Create a transient error not tied to a particular replica. */
  public TransientObservationException(String message) {
    this(message, -1, null);
  }


  /** Create a transient error not tied to a particular replica. */
  public TransientObservationException(String message, Throwable cause) {
    this(message, -1, cause);
  }


  /** Create a transient error talking to a particular replica. */
  public TransientObservationException(String message, int replicaId, Throwable cause) {
    super(message, cause);
    this.replicaId = replicaId;
  }
}
