package datadog.api.client;

import java.util.Objects;

/** A query parameter. Names may repeat. */
public final class Pair {
  private final String name;
  private final String value;

  public Pair(String name, String value) {
    this.name = name;
    this.value = value;
  }

  public String getName() {
    return name;
  }

  public String getValue() {
    return value;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Pair)) {
      return false;
    }
    Pair pair = (Pair) o;
    return name.equals(pair.name) && Objects.equals(value, pair.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, value);
  }

  @Override
  public String toString() {
    return name + "=" + value;
  }
}
