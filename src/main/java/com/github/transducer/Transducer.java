package com.github.transducer;

import java.util.List;

/**
 * A finite state transducer extracting labeled spans from free text. Text is split into
 * whitespace-delimited tokens and every token drives one move of a cursor through an
 * {@link AutomatonTable}, each move guarded by a regular expression that has to match the whole
 * token.
 *
 * Notes for users:<br>
 * 1. the automaton table is read-only and may be shared by many transducers. The cursor (current
 * state, buffered tokens, pending label) belongs to exactly one transducer.<br>
 *
 * 2. calls on the same transducer are guarded by its cursor lock and fail if it cannot be acquired
 * in time. Use one transducer per thread for parallel processing, built on a shared table.<br>
 *
 * 3. a failed match flushes the buffered span if it carries a label, resets the cursor to the
 * initial state and retries the same token exactly once. If the retry fails too, the token is
 * dropped.<br>
 *
 * 4. the behaviour of the cursor between separate calls is set by the configured
 * {@link CursorMode}.<br>
 */
public interface Transducer {

  /**
   * Tokenize the input and run it through the automaton. Returns the emitted spans in input order.
   * Input that matches nothing, is empty, blank or null yields an empty list.
   */
  List<LabeledSpan> processText(final String input) throws TransducerException;

  /**
   * Run the named kind of processing on the input. Only "NER" is supported, which is the same as
   * {@link #processText(String)}.
   */
  List<LabeledSpan> process(final String processType, final String input)
      throws TransducerException;

  /**
   * Put the cursor back at the initial state with an empty buffer and no pending label.
   */
  void reset() throws TransducerException;

  State readCurrentState() throws TransducerException;

  /**
   * Tokens buffered by the cursor since the last flush.
   */
  List<String> readBuffer() throws TransducerException;

  String getId();

  AutomatonTable getTable();

  TransducerStatistics getStatistics();

  /**
   * A simple builder to let users use fluent APIs to build transducers. Either a configuration or
   * an already built table must be supplied; a table wins if both are.
   */
  public final static class TransducerBuilder {
    private TransducerConfiguration config;
    private AutomatonTable table;

    public static TransducerBuilder newBuilder() {
      return new TransducerBuilder();
    }

    public TransducerBuilder config(final TransducerConfiguration config) {
      this.config = config;
      return this;
    }

    public TransducerBuilder table(final AutomatonTable table) {
      this.table = table;
      return this;
    }

    public Transducer build() throws TransducerException {
      if (table == null) {
        table = AutomatonTable.from(config);
      }
      return new TransducerImpl(table);
    }

    private TransducerBuilder() {}
  }

}
