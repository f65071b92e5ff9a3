package ai.eloquent.minotaur;

/**
 * A snapshot of how many requests a replica has committed on each commit path.
 * The fast path needs all but {@code c} replicas; once more than {@code c} are down,
 * commits should fall back to the slow path.
 */
public final class CommitPathCounts {

  /** Requests committed on the fast path. */
  public final long fastPath;

  /** Requests committed on the slow path. */
  public final long slowPath;


  public CommitPathCounts(long fastPath, long slowPath) {
    this.fastPath = fastPath;
    this.slowPath = slowPath;
  }


  /**
   * Whether the slow path has committed strictly more requests than the fast path.
   */
  public boolean slowPathPrevalent() {
    return slowPath > fastPath;
  }


  /** {@inheritDoc} */
  @Override
  public String toString() {
    return "CommitPathCounts(fast=" + fastPath + ", slow=" + slowPath + ")";
  }
}
