package com.github.transducer;

/**
 * Simple statistics holder for a transducer. Counters are only updated under the transducer's
 * cursor lock.
 */
public final class TransducerStatistics {
  private final long startMillis = System.currentTimeMillis();
  String transducerId;
  int textsProcessed;
  long tokensProcessed;
  long tokenMatches;
  long retries;
  long retryMatches;
  long droppedTokens;
  long emittedSpans;
  // partial paths flushed without ever crossing a labeled transition
  long discardedBuffers;
  long lastProcessedTimeMillis;

  public String getTransducerId() {
    return transducerId;
  }

  public int getTextsProcessed() {
    return textsProcessed;
  }

  public long getTokensProcessed() {
    return tokensProcessed;
  }

  public long getTokenMatches() {
    return tokenMatches;
  }

  public long getRetries() {
    return retries;
  }

  public long getRetryMatches() {
    return retryMatches;
  }

  public long getDroppedTokens() {
    return droppedTokens;
  }

  public long getEmittedSpans() {
    return emittedSpans;
  }

  public long getDiscardedBuffers() {
    return discardedBuffers;
  }

  public long getLastProcessedTimeMillis() {
    return lastProcessedTimeMillis;
  }

  public long getAliveTimeMillis() {
    return System.currentTimeMillis() - startMillis;
  }

  @Override
  public String toString() {
    return "TransducerStatistics [transducerId=" + transducerId + ", textsProcessed="
        + textsProcessed + ", tokensProcessed=" + tokensProcessed + ", tokenMatches="
        + tokenMatches + ", retries=" + retries + ", retryMatches=" + retryMatches
        + ", droppedTokens=" + droppedTokens + ", emittedSpans=" + emittedSpans
        + ", discardedBuffers=" + discardedBuffers + ", aliveTimeMillis=" + getAliveTimeMillis()
        + "]";
  }

}
