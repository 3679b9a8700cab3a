package com.github.transducer;

/**
 * This represents how a transducer treats its cursor between separate calls to
 * {@link Transducer#processText(String)}.
 */
public enum CursorMode {
  // reset the cursor to the initial state with an empty buffer at the start of every call. Results
  // of a call never depend on earlier calls.
  RESET_PER_CALL,
  // keep the current state and also any unlabeled partial buffer from the previous call, so "John"
  // then "Smith" yields ("John Smith", PERSON) rather than ("Smith", PERSON). Only a failed match or
  // an explicit Transducer.reset() puts the cursor back at the initial state.
  CARRY_OVER;
}
