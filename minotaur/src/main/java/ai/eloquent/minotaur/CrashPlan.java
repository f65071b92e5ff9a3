package ai.eloquent.minotaur;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import java.util.Collection;
import java.util.List;

/**
 * An ordered set of replicas to crash together. The order is the order they were chosen in;
 * from the protocol's point of view the crashes are simultaneous.
 */
public final class CrashPlan {

  /** The replicas to crash, in the order they were chosen. No duplicates. */
  public final ImmutableList<Integer> replicas;


  public CrashPlan(List<Integer> replicas) {
    this.replicas = ImmutableList.copyOf(replicas);
    if (ImmutableSet.copyOf(replicas).size() != replicas.size()) {
      throw new IllegalArgumentException("A crash plan cannot name a replica twice: " + replicas);
    }
  }


  /**
   * The number of replicas this plan crashes.
   */
  public int size() {
    return replicas.size();
  }


  /**
   * Whether this plan crashes the given replica.
   */
  public boolean contains(int replicaId) {
    return replicas.contains(replicaId);
  }


  /**
   * Whether this plan crashes any of the given replicas.
   */
  public boolean containsAny(Collection<Integer> replicaIds) {
    return replicaIds.stream().anyMatch(replicas::contains);
  }


  /**
   * The crashed replicas as an (insertion-ordered) set.
   */
  public ImmutableSet<Integer> asSet() {
    return ImmutableSet.copyOf(replicas);
  }


  /** {@inheritDoc} */
  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    return replicas.equals(((CrashPlan) o).replicas);
  }


  /** {@inheritDoc} */
  @Override
  public int hashCode() {
    return replicas.hashCode();
  }


  /** {@inheritDoc} */
  @Override
  public String toString() {
    return "CrashPlan" + replicas;
  }
}
