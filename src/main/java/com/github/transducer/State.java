package com.github.transducer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

import com.github.transducer.TransducerException.Code;

/**
 * A named node of the automaton holding its outgoing transitions in declaration order. Declaration
 * order is match priority: the first transition whose pattern fully matches a token wins and no
 * other alternative is ever explored.
 *
 * The final flag is carried over from configuration but the run loop never reads it. Reaching a
 * final state neither terminates matching nor forces a flush.
 */
public final class State {
  // auto-generated
  private final String id = UUID.randomUUID().toString();

  private final String name;
  private final boolean isFinal;

  // only appended to while the owning AutomatonTable is being built
  private final List<Transition> transitions = new ArrayList<>();

  State(final String name, final boolean isFinal) throws TransducerException {
    if (name == null || name.trim().isEmpty()) {
      throw new TransducerException(Code.INVALID_STATE_NAME,
          Code.INVALID_STATE_NAME.getDescription() + ": " + name);
    }
    this.name = name.trim();
    this.isFinal = isFinal;
  }

  void addTransition(final Transition transition) {
    transitions.add(transition);
  }

  /**
   * Find the first transition, in declaration order, whose pattern matches the entire token.
   * Returns {@link MatchResult#noMatch()} if none does.
   */
  public MatchResult matchToken(final String token) {
    for (final Transition transition : transitions) {
      if (transition.accepts(token)) {
        return MatchResult.matched(transition.getToState(), transition.getLabel());
      }
    }
    return MatchResult.noMatch();
  }

  public String getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public boolean isFinal() {
    return isFinal;
  }

  public List<Transition> getTransitions() {
    return Collections.unmodifiableList(transitions);
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + ((id == null) ? 0 : id.hashCode());
    result = prime * result + ((name == null) ? 0 : name.hashCode());
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null) {
      return false;
    }
    if (getClass() != obj.getClass()) {
      return false;
    }
    State other = (State) obj;
    if (id == null) {
      if (other.id != null) {
        return false;
      }
    } else if (!id.equals(other.id)) {
      return false;
    }
    if (name == null) {
      if (other.name != null) {
        return false;
      }
    } else if (!name.equals(other.name)) {
      return false;
    }
    return true;
  }

  @Override
  public String toString() {
    return "State [name=" + name + ", isFinal=" + isFinal + "]";
  }
}
