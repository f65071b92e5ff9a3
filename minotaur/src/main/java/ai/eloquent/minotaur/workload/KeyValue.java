package ai.eloquent.minotaur.workload;

import java.util.Objects;

/**
 * A key and the value written to it.
 */
public final class KeyValue {

  public final String key;

  public final String value;


  public KeyValue(String key, String value) {
    this.key = Objects.requireNonNull(key);
    this.value = Objects.requireNonNull(value);
  }


  /** {@inheritDoc} */
  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    KeyValue that = (KeyValue) o;
    return key.equals(that.key) && value.equals(that.value);
  }


  /** {@inheritDoc} */
  @Override
  public int hashCode() {
    return Objects.hash(key, value);
  }


  /** {@inheritDoc} */
  @Override
  public String toString() {
    return key + "=" + value;
  }
}
