package com.github.transducer;

import java.util.Optional;

/**
 * This object encapsulates the result of matching a single token against the outgoing transitions
 * of a {@link State}.
 *
 * Successful matches carry the target state and the label of the winning transition, which may be
 * absent. Failed matches report {@link #isSuccessful()} as false and carry neither.
 *
 * Users should not try to sub-class and extend this, it would serve little purpose.
 */
public final class MatchResult {
  private static final MatchResult NO_MATCH = new MatchResult(null, Optional.empty());

  private final State nextState;
  private final Optional<String> label;

  private MatchResult(final State nextState, final Optional<String> label) {
    this.nextState = nextState;
    this.label = label;
  }

  static MatchResult matched(final State nextState, final Optional<String> label) {
    return new MatchResult(nextState, label);
  }

  public static MatchResult noMatch() {
    return NO_MATCH;
  }

  public boolean isSuccessful() {
    return nextState != null;
  }

  public State getNextState() {
    return nextState;
  }

  public Optional<String> getLabel() {
    return label;
  }

  @Override
  public String toString() {
    return "MatchResult [nextState=" + (nextState == null ? null : nextState.getName())
        + ", label=" + label.orElse(null) + ", successful=" + isSuccessful() + "]";
  }
}
