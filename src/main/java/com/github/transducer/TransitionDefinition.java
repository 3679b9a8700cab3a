package com.github.transducer;

import java.util.Objects;
import java.util.Optional;

/**
 * Configuration-level description of a transition. States are referenced by name and the pattern
 * is kept as source text; both are resolved and compiled when the {@link AutomatonTable} is built.
 * A null or empty label means the transition is unlabeled.
 */
public final class TransitionDefinition {
  private final String fromState;
  private final String pattern;
  private final String toState;
  private final Optional<String> label;

  public TransitionDefinition(final String fromState, final String pattern, final String toState,
      final Optional<String> label) {
    this.fromState = fromState;
    this.pattern = pattern;
    this.toState = toState;
    // an empty label is no label
    this.label = label == null ? Optional.empty() : label.filter(value -> !value.isEmpty());
  }

  public String getFromState() {
    return fromState;
  }

  public String getPattern() {
    return pattern;
  }

  public String getToState() {
    return toState;
  }

  public Optional<String> getLabel() {
    return label;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TransitionDefinition)) {
      return false;
    }
    TransitionDefinition other = (TransitionDefinition) o;
    return Objects.equals(fromState, other.fromState) && Objects.equals(pattern, other.pattern)
        && Objects.equals(toState, other.toState) && Objects.equals(label, other.label);
  }

  @Override
  public int hashCode() {
    return Objects.hash(fromState, pattern, toState, label);
  }

  @Override
  public String toString() {
    final StringBuilder builder = new StringBuilder("(").append(fromState).append(", ")
        .append(pattern).append(", ").append(toState);
    if (label.isPresent()) {
      builder.append(", ").append(label.get());
    }
    return builder.append(")").toString();
  }
}
