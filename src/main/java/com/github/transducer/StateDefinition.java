package com.github.transducer;

import java.util.Objects;

/**
 * Configuration-level description of a state.
 */
public final class StateDefinition {
  private final String name;
  private final boolean isFinal;

  public StateDefinition(final String name, final boolean isFinal) {
    this.name = name;
    this.isFinal = isFinal;
  }

  public String getName() {
    return name;
  }

  public boolean isFinal() {
    return isFinal;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof StateDefinition)) {
      return false;
    }
    StateDefinition other = (StateDefinition) o;
    return isFinal == other.isFinal && Objects.equals(name, other.name);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, isFinal);
  }

  @Override
  public String toString() {
    return "(" + name + ", " + isFinal + ")";
  }
}
