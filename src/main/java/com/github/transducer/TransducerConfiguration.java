package com.github.transducer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * This class encapsulates the declarative data a transducer is built from: the ordered states, the
 * name of the initial state and the ordered transitions. Use the
 * {@code TransducerConfigurationBuilder} to build it.
 *
 * Notes:<br>
 * 1. once built, a configuration is immutable. States and transitions can only be added through
 * the builder.<br>
 * 2. {@link #validate()} only checks the shape of the data. Resolving state names and compiling
 * patterns happens when an {@link AutomatonTable} is built from it.<br>
 * 3. if no {@link CursorMode} is set, {@link CursorMode#RESET_PER_CALL} is used.<br>
 */
public final class TransducerConfiguration {
  private final String initialState;
  private final List<StateDefinition> states;
  private final List<TransitionDefinition> transitions;
  private final CursorMode cursorMode;

  public String getInitialState() {
    return initialState;
  }

  public List<StateDefinition> getStates() {
    return states;
  }

  public List<TransitionDefinition> getTransitions() {
    return transitions;
  }

  public CursorMode getCursorMode() {
    return cursorMode;
  }

  public final static class TransducerConfigurationBuilder {
    private String initialState;
    private final List<StateDefinition> states = new ArrayList<>();
    private final List<TransitionDefinition> transitions = new ArrayList<>();
    private CursorMode cursorMode = CursorMode.RESET_PER_CALL;

    public static TransducerConfigurationBuilder newBuilder() {
      return new TransducerConfigurationBuilder();
    }

    public TransducerConfigurationBuilder initialState(final String initialState) {
      this.initialState = initialState;
      return this;
    }

    public TransducerConfigurationBuilder addState(final String name) {
      return addState(name, false);
    }

    public TransducerConfigurationBuilder addState(final String name, final boolean isFinal) {
      states.add(new StateDefinition(name, isFinal));
      return this;
    }

    public TransducerConfigurationBuilder addTransition(final String fromState,
        final String pattern, final String toState) {
      transitions.add(new TransitionDefinition(fromState, pattern, toState, Optional.empty()));
      return this;
    }

    public TransducerConfigurationBuilder addTransition(final String fromState,
        final String pattern, final String toState, final String label) {
      transitions
          .add(new TransitionDefinition(fromState, pattern, toState, Optional.ofNullable(label)));
      return this;
    }

    public TransducerConfigurationBuilder cursorMode(final CursorMode cursorMode) {
      this.cursorMode = cursorMode;
      return this;
    }

    public TransducerConfiguration build() throws TransducerException {
      final TransducerConfiguration config =
          new TransducerConfiguration(initialState, states, transitions, cursorMode);
      config.validate();
      return config;
    }

    private TransducerConfigurationBuilder() {}
  }

  private void validate() throws TransducerException {
    StringBuilder messages = new StringBuilder();
    if (initialState == null || initialState.trim().isEmpty()) {
      messages.append("Initial state cannot be null or blank. ");
    }
    if (states.isEmpty()) {
      messages.append("At least one state must be declared. ");
    }
    if (cursorMode == null) {
      messages.append("CursorMode cannot be null. ");
    }
    for (final TransitionDefinition transition : transitions) {
      if (transition.getFromState() == null || transition.getToState() == null) {
        messages.append("Transition endpoints cannot be null: ").append(transition).append(". ");
      }
    }
    if (messages.length() > 0) {
      throw new TransducerException(TransducerException.Code.INVALID_CONFIGURATION,
          messages.toString().trim());
    }
  }

  @Override
  public String toString() {
    return "TransducerConfiguration [states=" + states + ", initialState=" + initialState
        + ", transitions=" + transitions + ", cursorMode=" + cursorMode + "]";
  }

  private TransducerConfiguration(final String initialState, final List<StateDefinition> states,
      final List<TransitionDefinition> transitions, final CursorMode cursorMode) {
    this.initialState = initialState;
    this.states = Collections.unmodifiableList(new ArrayList<>(states));
    this.transitions = Collections.unmodifiableList(new ArrayList<>(transitions));
    this.cursorMode = cursorMode;
  }

}
