package com.github.transducer;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.junit.Test;

import com.github.transducer.Transducer.TransducerBuilder;
import com.github.transducer.TransducerConfiguration.TransducerConfigurationBuilder;
import com.github.transducer.TransducerException.Code;

/**
 * Tests to maintain the sanity and correctness of the token loop.
 */
public class TransducerTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  private static final Logger logger = LogManager.getLogger(TransducerTest.class.getSimpleName());

  @Test
  public void testEmail() throws TransducerException {
    final Transducer transducer = referenceTransducer();
    assertEquals(spans(LabeledSpan.of("john@example.com", "EMAIL")),
        transducer.processText("john@example.com"));
  }

  @Test
  public void testPhoneNumber() throws TransducerException {
    final Transducer transducer = referenceTransducer();
    assertEquals(spans(LabeledSpan.of("06209876543", "PHONE_NUMBER")),
        transducer.processText("06209876543"));
  }

  @Test
  public void testPrice() throws TransducerException {
    final Transducer transducer = referenceTransducer();
    assertEquals(spans(LabeledSpan.of("100 forint", "PRICE")),
        transducer.processText("100 forint"));
  }

  @Test
  public void testNothingMatches() throws TransducerException {
    final Transducer transducer = referenceTransducer();
    assertEquals(Collections.emptyList(), transducer.processText("###"));

    // one failed match, one failed retry, token gone
    final TransducerStatistics stats = transducer.getStatistics();
    assertEquals(1L, stats.getTokensProcessed());
    assertEquals(1L, stats.getRetries());
    assertEquals(0L, stats.getRetryMatches());
    assertEquals(1L, stats.getDroppedTokens());
    assertEquals(ReferenceConfiguration.INITIAL_STATE, transducer.readCurrentState().getName());
  }

  @Test
  public void testUnlabeledPrefixIsDiscarded() throws TransducerException {
    final Transducer transducer = referenceTransducer();
    // "Contact" only crosses an unlabeled person transition, "today" matches nothing
    assertEquals(spans(LabeledSpan.of("john@example.com", "EMAIL")),
        transducer.processText("Contact john@example.com today"));
    final TransducerStatistics stats = transducer.getStatistics();
    assertEquals(1L, stats.getDiscardedBuffers());
    assertEquals(1L, stats.getEmittedSpans());
    assertEquals(1L, stats.getDroppedTokens());
  }

  @Test
  public void testPersonName() throws TransducerException {
    final Transducer transducer = referenceTransducer();
    assertEquals(spans(LabeledSpan.of("Meet John Smith", "PERSON")),
        transducer.processText("Meet John Smith today"));
    assertEquals(spans(LabeledSpan.of("Árpád Éva", "PERSON")),
        transducer.processText("Árpád Éva"));
  }

  @Test
  public void testMultipleSpansKeepInputOrder() throws TransducerException {
    final Transducer transducer = referenceTransducer();
    assertEquals(
        spans(LabeledSpan.of("100 EUR", "PRICE"), LabeledSpan.of("5 dollars", "PRICE")),
        transducer.processText("100 EUR and 5 dollars"));
    assertEquals(
        spans(LabeledSpan.of("06209876543", "PHONE_NUMBER"),
            LabeledSpan.of("john@example.com", "EMAIL")),
        transducer.processText("Call 06209876543 or john@example.com."));
    assertEquals(
        spans(LabeledSpan.of("john@example.com", "EMAIL"), LabeledSpan.of("100 forint", "PRICE")),
        transducer.processText("john@example.com ### 100 forint"));
  }

  @Test
  public void testDatesAndUrls() throws TransducerException {
    final Transducer transducer = referenceTransducer();
    assertEquals(spans(LabeledSpan.of("2024-01-15", "DATE")),
        transducer.processText("2024-01-15"));
    assertEquals(spans(LabeledSpan.of("12/25/2024", "DATE")),
        transducer.processText("12/25/2024"));
    // trailing dot is trimmed, internal dots are not
    assertEquals(spans(LabeledSpan.of("2024.01.15", "DATE")),
        transducer.processText("2024.01.15."));
    assertEquals(spans(LabeledSpan.of("https://example.com/docs", "URL")),
        transducer.processText("Visit https://example.com/docs."));
  }

  @Test
  public void testUnlabeledPathIsNeverEmitted() throws TransducerException {
    final Transducer transducer = referenceTransducer();
    // q_number is only reachable through an unlabeled transition
    assertEquals(Collections.emptyList(), transducer.processText("42"));
    assertEquals(Collections.emptyList(), transducer.processText("42 apples"));
    assertEquals(Collections.emptyList(), transducer.processText("Contact"));
  }

  @Test
  public void testRetryStartsNewSpan() throws TransducerException {
    final Transducer transducer = referenceTransducer();
    // the phone number fails as a currency, then starts over at q0
    assertEquals(spans(LabeledSpan.of("06209876543", "PHONE_NUMBER")),
        transducer.processText("100 06209876543"));
    final TransducerStatistics stats = transducer.getStatistics();
    assertEquals(1L, stats.getRetries());
    assertEquals(1L, stats.getRetryMatches());
    assertEquals(0L, stats.getDroppedTokens());
    assertEquals(1L, stats.getDiscardedBuffers());
  }

  @Test
  public void testSingleRetryPerFailure() throws TransducerException {
    final Transducer transducer = referenceTransducer();
    assertEquals(Collections.emptyList(), transducer.processText("### %%% ###"));
    final TransducerStatistics stats = transducer.getStatistics();
    assertEquals(3L, stats.getTokensProcessed());
    assertEquals(3L, stats.getRetries());
    assertEquals(3L, stats.getDroppedTokens());
  }

  @Test
  public void testEmptyTokensAreProcessed() throws TransducerException {
    final Transducer transducer = referenceTransducer();
    assertEquals(spans(LabeledSpan.of("john@example.com", "EMAIL")),
        transducer.processText("john@example.com ..."));
    final TransducerStatistics stats = transducer.getStatistics();
    assertEquals(2L, stats.getTokensProcessed());
    assertEquals(1L, stats.getDroppedTokens());
  }

  @Test
  public void testEmptyInput() throws TransducerException {
    final Transducer transducer = referenceTransducer();
    assertEquals(Collections.emptyList(), transducer.processText(""));
    assertEquals(Collections.emptyList(), transducer.processText(" \t\n "));
    assertEquals(Collections.emptyList(), transducer.processText(null));
    assertEquals(0L, transducer.getStatistics().getTokensProcessed());
    assertEquals(3, transducer.getStatistics().getTextsProcessed());
  }

  @Test
  public void testLaterLabelSupersedesEarlierOne() throws TransducerException {
    final TransducerConfiguration config = TransducerConfigurationBuilder.newBuilder()
        .initialState("s0").addState("s0").addState("s1").addState("s2").addState("s3")
        .addTransition("s0", "a", "s1", "A").addTransition("s1", "b", "s2")
        .addTransition("s2", "c", "s3", "C").build();
    final Transducer transducer = TransducerBuilder.newBuilder().config(config).build();

    // unlabeled transitions keep the pending label
    assertEquals(spans(LabeledSpan.of("a b", "A")), transducer.processText("a b"));
    assertEquals(spans(LabeledSpan.of("a b c", "C")), transducer.processText("a b c"));
  }

  @Test
  public void testFinalStateDoesNotStopMatching() throws TransducerException {
    final TransducerConfiguration config = TransducerConfigurationBuilder.newBuilder()
        .initialState("s0").addState("s0", false).addState("done", true)
        .addTransition("s0", "x", "done", "X").addTransition("done", "y", "done", "X").build();
    final Transducer transducer = TransducerBuilder.newBuilder().config(config).build();

    assertEquals(spans(LabeledSpan.of("x y y", "X")), transducer.processText("x y y"));
    assertTrue(transducer.readCurrentState().isFinal());
  }

  @Test
  public void testDeterminism() throws TransducerException {
    final AutomatonTable table = AutomatonTable.from(ReferenceConfiguration.create());
    final String text = "Meet John Smith on 2024-01-15, pay 100 EUR to john@example.com or "
        + "call +36201234567. See https://example.com ###";
    final Transducer first = TransducerBuilder.newBuilder().table(table).build();
    final Transducer second = TransducerBuilder.newBuilder().table(table).build();
    assertNotEquals(first.getId(), second.getId());
    final List<LabeledSpan> expected = first.processText(text);
    assertEquals(expected, second.processText(text));
    assertEquals(expected, first.processText(text));
  }

  @Test
  public void testCursorResetPerCall() throws TransducerException {
    final Transducer transducer = referenceTransducer();
    assertEquals(Collections.emptyList(), transducer.processText("John"));
    assertEquals(Arrays.asList("John"), transducer.readBuffer());
    // a fresh call starts over, "Smith" alone never crosses a labeled transition
    assertEquals(Collections.emptyList(), transducer.processText("Smith"));
  }

  @Test
  public void testCursorCarryOver() throws TransducerException {
    final TransducerConfiguration config =
        ReferenceConfiguration.newBuilder().cursorMode(CursorMode.CARRY_OVER).build();
    final Transducer transducer = TransducerBuilder.newBuilder().config(config).build();

    assertEquals(Collections.emptyList(), transducer.processText("John"));
    assertEquals("q1_person", transducer.readCurrentState().getName());
    assertEquals(Arrays.asList("John"), transducer.readBuffer());

    assertEquals(spans(LabeledSpan.of("John Smith", "PERSON")), transducer.processText("Smith"));
    // emitted at end of input: buffer cleared, state kept
    assertEquals(Collections.emptyList(), transducer.readBuffer());
    assertEquals("q1_person", transducer.readCurrentState().getName());

    transducer.reset();
    assertSame(transducer.getTable().getInitialState(), transducer.readCurrentState());
    assertEquals(Collections.emptyList(), transducer.processText("Smith"));
  }

  @Test
  public void testProcessDispatch() throws TransducerException {
    final Transducer transducer = referenceTransducer();
    assertEquals(transducer.processText("100 forint"), transducer.process("NER", "100 forint"));
    try {
      transducer.process("POS", "100 forint");
      fail("POS is not a supported process type");
    } catch (TransducerException expected) {
      assertEquals(Code.UNSUPPORTED_PROCESS, expected.getCode());
    }
    try {
      transducer.process(null, "100 forint");
      fail("null is not a supported process type");
    } catch (TransducerException expected) {
      assertEquals(Code.UNSUPPORTED_PROCESS, expected.getCode());
    }
  }

  @Test
  public void testExtendedReferenceConfiguration() throws TransducerException {
    final TransducerConfiguration config = ReferenceConfiguration.newBuilder()
        .addState("q_hashtag", true).addTransition("q0", "#\\w+", "q_hashtag", "HASHTAG").build();
    final Transducer transducer = TransducerBuilder.newBuilder().config(config).build();
    assertEquals(spans(LabeledSpan.of("#java", "HASHTAG")), transducer.processText("#java"));
  }

  @Test
  public void testBuildWithoutConfiguration() {
    try {
      TransducerBuilder.newBuilder().build();
      fail("A transducer needs a configuration or a table");
    } catch (TransducerException expected) {
      assertEquals(Code.INVALID_CONFIGURATION, expected.getCode());
    }
  }

  @Test
  public void testSharedTableThreadSafety() throws Exception {
    final AutomatonTable table = AutomatonTable.from(ReferenceConfiguration.create());
    final String text = "Contact Anna Kovacs at anna@example.hu or 06301234567 before 2024-03-01";
    final List<LabeledSpan> expected =
        spans(LabeledSpan.of("Contact Anna Kovacs", "PERSON"),
            LabeledSpan.of("anna@example.hu", "EMAIL"),
            LabeledSpan.of("06301234567", "PHONE_NUMBER"),
            LabeledSpan.of("2024-03-01", "DATE"));

    final AtomicInteger successes = new AtomicInteger();
    final AtomicInteger failures = new AtomicInteger();
    final Runnable worker = new Runnable() {
      @Override
      public void run() {
        try {
          final Transducer transducer = TransducerBuilder.newBuilder().table(table).build();
          for (int iter = 0; iter < 100; iter++) {
            if (expected.equals(transducer.processText(text))) {
              successes.incrementAndGet();
            } else {
              failures.incrementAndGet();
            }
          }
          logger.info(transducer.getStatistics().toString());
        } catch (TransducerException problem) {
          logger.error("worker encountered an issue", problem);
          failures.incrementAndGet();
        }
      }
    };

    int workerCount = 5;
    final List<Thread> workers = new ArrayList<>(workerCount);
    for (int iter = 0; iter < workerCount; iter++) {
      workers.add(new Thread(worker, "test-transducer-worker-" + iter));
    }
    for (final Thread thread : workers) {
      thread.start();
    }
    for (final Thread thread : workers) {
      thread.join();
    }

    assertEquals(workerCount * 100, successes.get());
    assertEquals(0, failures.get());
  }

  @Test
  public void testEmptyLabelIsNoLabel() throws TransducerException {
    assertFalse(new TransitionDefinition("q0", "a", "q1", Optional.of("")).getLabel().isPresent());

    final Transducer transducer = TransducerBuilder.newBuilder()
        .config(TransducerConfigurationBuilder.newBuilder().initialState("q0").addState("q0")
            .addState("q1").addTransition("q0", "a", "q1", "").build())
        .build();
    assertEquals(Collections.emptyList(), transducer.processText("a"));
  }

  @Test
  public void testCursorLockContention() throws Exception {
    final TransducerImpl transducer = (TransducerImpl) referenceTransducer();
    final CountDownLatch held = new CountDownLatch(1);
    final CountDownLatch release = new CountDownLatch(1);
    final Thread holder = new Thread(new Runnable() {
      @Override
      public void run() {
        transducer.getCursorLock().writeLock().lock();
        try {
          held.countDown();
          release.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException interrupted) {
          Thread.currentThread().interrupt();
        } finally {
          transducer.getCursorLock().writeLock().unlock();
        }
      }
    }, "test-transducer-lock-holder");
    holder.start();
    try {
      assertTrue(held.await(5, TimeUnit.SECONDS));
      try {
        transducer.processText("john@example.com");
        fail("Expected the cursor lock to be unavailable");
      } catch (TransducerException expected) {
        assertEquals(Code.OPERATION_LOCK_ACQUISITION_FAILURE, expected.getCode());
      }

      // an interrupted caller fails the same way and keeps its interrupt flag
      Thread.currentThread().interrupt();
      try {
        transducer.processText("john@example.com");
        fail("Expected the interrupted lock acquisition to fail");
      } catch (TransducerException expected) {
        assertEquals(Code.OPERATION_LOCK_ACQUISITION_FAILURE, expected.getCode());
        assertTrue(expected.getCause() instanceof InterruptedException);
      }
      assertTrue(Thread.interrupted());
    } finally {
      Thread.interrupted();
      release.countDown();
      holder.join();
    }

    assertEquals(spans(LabeledSpan.of("john@example.com", "EMAIL")),
        transducer.processText("john@example.com"));
  }

  static Transducer referenceTransducer() throws TransducerException {
    return TransducerBuilder.newBuilder().config(ReferenceConfiguration.create()).build();
  }

  private static List<LabeledSpan> spans(final LabeledSpan... spans) {
    return Arrays.asList(spans);
  }

}
