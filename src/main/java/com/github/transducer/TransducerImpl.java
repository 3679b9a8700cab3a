package com.github.transducer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock.ReadLock;
import java.util.concurrent.locks.ReentrantReadWriteLock.WriteLock;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.transducer.TransducerException.Code;

/**
 * Token loop driving a {@link Cursor} through a shared {@link AutomatonTable}.
 *
 * Per token, starting from the current state:<br>
 * 1. on a match, move to the target state, buffer the token and, if the transition is labeled,
 * overwrite the pending label.<br>
 * 2. on no match, emit the buffer if it carries a label, reset the cursor and retry the same token
 * once against the initial state. A failed retry drops the token.<br>
 * 3. after the last token, emit the buffer if it carries a label.<br>
 *
 * Final states are never consulted.
 *
 * @see Transducer
 */
final class TransducerImpl implements Transducer {
  private static final Logger logger = LogManager.getLogger(TransducerImpl.class.getSimpleName());

  private final String transducerId = UUID.randomUUID().toString();

  private final static long lockAcquisitionMillis = 100L;

  private final AutomatonTable table;
  private final CursorMode cursorMode;
  private final Cursor cursor;
  private final TransducerStatistics stats = new TransducerStatistics();

  private final ReentrantReadWriteLock cursorSuperLock = new ReentrantReadWriteLock(true);
  private final WriteLock cursorWriteLock = cursorSuperLock.writeLock();
  private final ReadLock cursorReadLock = cursorSuperLock.readLock();

  TransducerImpl(final AutomatonTable table) throws TransducerException {
    if (table == null) {
      throw new TransducerException(Code.INVALID_CONFIGURATION, "Automaton table cannot be null");
    }
    this.table = table;
    this.cursorMode = table.getConfiguration().getCursorMode();
    this.cursor = new Cursor(table.getInitialState());
    stats.transducerId = transducerId;
    logInfo(transducerId, "Bound transducer to table with start:"
        + table.getInitialState().getName() + ", cursorMode:" + cursorMode);
  }

  @Override
  public List<LabeledSpan> processText(final String input) throws TransducerException {
    final List<String> tokens = Tokenizer.tokenize(input);
    acquire(cursorWriteLock, "process text");
    try {
      if (cursorMode == CursorMode.RESET_PER_CALL) {
        cursor.reset(table.getInitialState());
      }
      final List<LabeledSpan> spans = run(tokens);
      stats.textsProcessed++;
      stats.lastProcessedTimeMillis = System.currentTimeMillis();
      logDebug(transducerId, String.format("Processed %d tokens into %d spans", tokens.size(),
          spans.size()));
      return spans;
    } finally {
      cursorWriteLock.unlock();
    }
  }

  @Override
  public List<LabeledSpan> process(final String processType, final String input)
      throws TransducerException {
    switch (ProcessType.fromName(processType)) {
      case NER:
        return processText(input);
      default:
        throw new TransducerException(Code.UNSUPPORTED_PROCESS,
            "Unsupported process type: " + processType);
    }
  }

  private List<LabeledSpan> run(final List<String> tokens) {
    final List<LabeledSpan> spans = new ArrayList<>();
    for (final String token : tokens) {
      stats.tokensProcessed++;
      MatchResult result = cursor.currentState.matchToken(token);
      if (result.isSuccessful()) {
        stats.tokenMatches++;
        cursor.advance(token, result);
        continue;
      }

      // flush what we have, then give the token one more chance from the initial state
      if (!emit(spans) && !cursor.buffer.isEmpty()) {
        stats.discardedBuffers++;
        logDebug(transducerId, "Discarded unlabeled buffer " + cursor.buffer + " at "
            + cursor.currentState.getName());
      }
      cursor.reset(table.getInitialState());
      stats.retries++;
      result = cursor.currentState.matchToken(token);
      if (result.isSuccessful()) {
        stats.retryMatches++;
        cursor.advance(token, result);
      } else {
        stats.droppedTokens++;
        logDebug(transducerId, "Dropped token '" + token + "'");
      }
    }
    if (emit(spans)) {
      cursor.clearBuffer();
    }
    return spans;
  }

  /**
   * Emits the buffer as a span iff it is non-empty and carries a label. The cursor is left as is.
   */
  private boolean emit(final List<LabeledSpan> spans) {
    if (cursor.buffer.isEmpty() || !cursor.pendingLabel.isPresent()) {
      return false;
    }
    final LabeledSpan span =
        LabeledSpan.of(String.join(" ", cursor.buffer), cursor.pendingLabel.get());
    spans.add(span);
    stats.emittedSpans++;
    logDebug(transducerId, "Emitted " + span);
    return true;
  }

  @Override
  public void reset() throws TransducerException {
    acquire(cursorWriteLock, "reset cursor");
    try {
      cursor.reset(table.getInitialState());
      logDebug(transducerId, "Reset cursor to " + table.getInitialState().getName());
    } finally {
      cursorWriteLock.unlock();
    }
  }

  @Override
  public State readCurrentState() throws TransducerException {
    acquire(cursorReadLock, "read current state");
    try {
      return cursor.currentState;
    } finally {
      cursorReadLock.unlock();
    }
  }

  @Override
  public List<String> readBuffer() throws TransducerException {
    acquire(cursorReadLock, "read buffer");
    try {
      return Collections.unmodifiableList(new ArrayList<>(cursor.buffer));
    } finally {
      cursorReadLock.unlock();
    }
  }

  // exposed for tests exercising contended and interrupted lock acquisition
  ReentrantReadWriteLock getCursorLock() {
    return cursorSuperLock;
  }

  @Override
  public String getId() {
    return transducerId;
  }

  @Override
  public AutomatonTable getTable() {
    return table;
  }

  @Override
  public TransducerStatistics getStatistics() {
    return stats;
  }

  @Override
  public String toString() {
    return "Transducer [id=" + transducerId + ", cursorMode=" + cursorMode + ", "
        + table.getConfiguration() + "]";
  }

  private void acquire(final Lock lock, final String operation) throws TransducerException {
    try {
      if (!lock.tryLock(lockAcquisitionMillis, TimeUnit.MILLISECONDS)) {
        throw new TransducerException(Code.OPERATION_LOCK_ACQUISITION_FAILURE,
            "Timed out while trying to " + operation);
      }
    } catch (InterruptedException exception) {
      Thread.currentThread().interrupt();
      throw new TransducerException(Code.OPERATION_LOCK_ACQUISITION_FAILURE, exception);
    }
  }

  private static void logInfo(final String transducerId, final String message) {
    logger.info(new StringBuilder().append("[t:").append(transducerId).append("] ")
        .append(message).toString());
  }

  private static void logDebug(final String transducerId, final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[t:").append(transducerId).append("] ")
          .append(message).toString());
    }
  }

  /**
   * The mutable per-run state: current state, tokens consumed since the last flush and the label of
   * the last labeled transition crossed since then. Only touched under the cursor write lock.
   */
  final static class Cursor {
    private State currentState;
    private final List<String> buffer = new ArrayList<>();
    private Optional<String> pendingLabel = Optional.empty();

    private Cursor(final State initialState) {
      this.currentState = initialState;
    }

    private void advance(final String token, final MatchResult result) {
      currentState = result.getNextState();
      buffer.add(token);
      if (result.getLabel().isPresent()) {
        pendingLabel = result.getLabel();
      }
    }

    private void clearBuffer() {
      buffer.clear();
      pendingLabel = Optional.empty();
    }

    private void reset(final State initialState) {
      currentState = initialState;
      clearBuffer();
    }
  }
}
