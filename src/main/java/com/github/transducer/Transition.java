package com.github.transducer;

import java.util.Optional;
import java.util.regex.Pattern;

import com.github.transducer.TransducerException.Code;

/**
 * Immutable rule guarding a move between two states. The pattern has to match the whole token,
 * a substring or prefix match is not enough.
 */
public final class Transition {
  private final State fromState;
  private final Pattern pattern;
  private final State toState;
  private final Optional<String> label;

  Transition(final State fromState, final Pattern pattern, final State toState,
      final Optional<String> label) throws TransducerException {
    if (fromState == null || toState == null) {
      throw new TransducerException(Code.UNRESOLVED_STATE);
    }
    if (pattern == null) {
      throw new TransducerException(Code.INVALID_PATTERN);
    }
    this.fromState = fromState;
    this.pattern = pattern;
    this.toState = toState;
    this.label = label == null ? Optional.empty() : label;
  }

  boolean accepts(final String token) {
    return pattern.matcher(token).matches();
  }

  public State getFromState() {
    return fromState;
  }

  public Pattern getPattern() {
    return pattern;
  }

  public State getToState() {
    return toState;
  }

  public Optional<String> getLabel() {
    return label;
  }

  @Override
  public String toString() {
    return "Transition [fromState=" + fromState.getName() + ", pattern=" + pattern.pattern()
        + ", toState=" + toState.getName() + ", label=" + label.orElse(null) + "]";
  }
}
