package com.github.transducer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.transducer.TransducerException.Code;

/**
 * The full set of states plus the designated initial state, built once from a
 * {@link TransducerConfiguration}.
 *
 * Notes for users:<br>
 * 1. every state name referenced by a transition or as the initial state must be declared, and
 * every pattern must compile. Either failure aborts construction, nothing is deferred to matching
 * time.<br>
 *
 * 2. transitions keep their declaration order within each state.<br>
 *
 * 3. the table is read-only once built and may be shared by any number of transducers, each with
 * its own cursor.<br>
 */
public final class AutomatonTable {
  private static final Logger logger = LogManager.getLogger(AutomatonTable.class.getSimpleName());

  // patterns are compiled with unicode aware \d, \s, \w and case classes
  static final int patternFlags = Pattern.UNICODE_CHARACTER_CLASS;

  private final TransducerConfiguration configuration;
  // K=state.name, V=state, in declaration order
  private final Map<String, State> states;
  private final State initialState;

  private AutomatonTable(final TransducerConfiguration configuration,
      final Map<String, State> states, final State initialState) {
    this.configuration = configuration;
    this.states = Collections.unmodifiableMap(states);
    this.initialState = initialState;
  }

  public static AutomatonTable from(final TransducerConfiguration configuration)
      throws TransducerException {
    if (configuration == null) {
      throw new TransducerException(Code.INVALID_CONFIGURATION, "Configuration cannot be null");
    }
    try {
      // 1. one state per definition
      final Map<String, State> states = new LinkedHashMap<>();
      for (final StateDefinition definition : configuration.getStates()) {
        final State state = new State(definition.getName(), definition.isFinal());
        if (states.putIfAbsent(state.getName(), state) != null) {
          throw new TransducerException(Code.DUPLICATE_STATE,
              "State declared more than once: " + state.getName());
        }
      }

      // 2. initial state
      final State initialState = resolve(states, configuration.getInitialState(), "initial state");

      // 3. transitions, in declaration order
      int transitionCount = 0;
      for (final TransitionDefinition definition : configuration.getTransitions()) {
        final State fromState = resolve(states, definition.getFromState(), "fromState");
        final State toState = resolve(states, definition.getToState(), "toState");
        final Pattern pattern = compile(definition.getPattern());
        fromState.addTransition(new Transition(fromState, pattern, toState, definition.getLabel()));
        transitionCount++;
      }

      final AutomatonTable table = new AutomatonTable(configuration, states, initialState);
      logger.info(String.format("Built automaton table with %d states and %d transitions, start:%s",
          states.size(), transitionCount, initialState.getName()));
      return table;
    } catch (TransducerException problem) {
      logger.error("Failed to build automaton table from " + configuration, problem);
      throw problem;
    }
  }

  private static State resolve(final Map<String, State> states, final String name,
      final String role) throws TransducerException {
    final State state = name == null ? null : states.get(name.trim());
    if (state == null) {
      throw new TransducerException(Code.UNRESOLVED_STATE,
          String.format("Unresolved %s '%s', declared states are %s", role, name,
              states.keySet()));
    }
    return state;
  }

  private static Pattern compile(final String regex) throws TransducerException {
    if (regex == null) {
      throw new TransducerException(Code.INVALID_PATTERN, "Transition pattern cannot be null");
    }
    try {
      return Pattern.compile(regex, patternFlags);
    } catch (PatternSyntaxException syntaxProblem) {
      throw new TransducerException(Code.INVALID_PATTERN,
          "Failed to compile transition pattern: " + regex, syntaxProblem);
    }
  }

  public State getInitialState() {
    return initialState;
  }

  /**
   * Lookup a state by its name. Returns null if no such state was declared.
   */
  public State getState(final String name) {
    return states.get(name);
  }

  public List<State> getStates() {
    return Collections.unmodifiableList(new ArrayList<>(states.values()));
  }

  public TransducerConfiguration getConfiguration() {
    return configuration;
  }

  @Override
  public String toString() {
    final StringBuilder builder = new StringBuilder("AutomatonTable [initialState=")
        .append(initialState.getName()).append(", states=");
    for (final State state : states.values()) {
      builder.append("\n    ").append(state);
      for (final Transition transition : state.getTransitions()) {
        builder.append("\n        ").append(transition);
      }
    }
    return builder.append("]").toString();
  }
}
