package org.danilorossi.mailmind.classifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.danilorossi.mailmind.helpers.RetryPolicy;
import org.danilorossi.mailmind.helpers.ShutdownSignal;
import org.danilorossi.mailmind.model.Account;
import org.danilorossi.mailmind.model.Category;
import org.danilorossi.mailmind.model.MessageRef;
import org.danilorossi.mailmind.model.RoutingDecision;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.invocation.InvocationOnMock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CategorizationDispatcherTest {

  @Mock private Classifier classifier;

  private ShutdownSignal shutdown;
  private Account account;

  @BeforeEach
  void setUp() {
    shutdown = new ShutdownSignal();
    account =
        Account.builder()
            .name("work")
            .host("imap.example.com")
            .username("me@example.com")
            .categories(
                List.of(
                    Category.builder().name("INBOX").build(),
                    Category.builder().name("Newsletter").folder("News").build(),
                    Category.builder().name("Bills").build()))
            .build();
  }

  private CategorizationDispatcher dispatcher(
      final int batchSize, final int batchAttempts, final int messageAttempts) {
    return new CategorizationDispatcher(
        classifier,
        batchSize,
        policy(batchAttempts),
        policy(messageAttempts),
        4,
        shutdown);
  }

  private static RetryPolicy policy(final int attempts) {
    return RetryPolicy.builder().maxAttempts(attempts).initialDelay(Duration.ZERO).build();
  }

  /** Il soggetto dell'email è la categoria che il classificatore finto restituisce. */
  private static MessageText text(final long uid, final String subject) {
    MessageRef ref =
        MessageRef.builder()
            .accountName("work")
            .folder("INBOX")
            .uid(uid)
            .messageId("<" + uid + "@example.com>")
            .sender("someone@example.com")
            .subject(subject)
            .date(Instant.parse("2024-01-01T00:00:00Z"))
            .fingerprint("fp-" + uid)
            .build();
    return new MessageText(ref, "corpo " + uid);
  }

  private static List<ClassificationResult> echoSubjects(final InvocationOnMock inv) {
    List<MessageText> batch = inv.getArgument(1);
    List<ClassificationResult> out = new ArrayList<>();
    for (MessageText m : batch)
      out.add(
          ClassificationResult.builder()
              .categoryName(m.getRef().getSubject())
              .confidence(90)
              .rationale("ok")
              .build());
    return out;
  }

  @Test
  @DisplayName("Le decisioni seguono l'ordine degli input, anche su più gruppi")
  void testOrderPreservedAcrossChunks() throws Exception {
    when(classifier.classify(anyList(), anyList()))
        .thenAnswer(CategorizationDispatcherTest::echoSubjects);
    List<MessageText> inputs =
        List.of(
            text(1, "Bills"),
            text(2, "Newsletter"),
            text(3, "INBOX"),
            text(4, "Bills"),
            text(5, "Newsletter"));

    List<RoutingDecision> out = dispatcher(2, 1, 1).classify(account, inputs);

    assertThat(out)
        .extracting(RoutingDecision::getFingerprint)
        .containsExactly("fp-1", "fp-2", "fp-3", "fp-4", "fp-5");
    assertThat(out)
        .extracting(d -> d.getCategory().getName())
        .containsExactly("Bills", "Newsletter", "INBOX", "Bills", "Newsletter");
    verify(classifier, times(3)).classify(anyList(), anyList());
  }

  @Test
  @DisplayName("Nome categoria restituito in minuscolo: abbinato senza distinzione")
  void testCategoryMatchIsCaseInsensitive() throws Exception {
    when(classifier.classify(anyList(), anyList()))
        .thenReturn(List.of(ClassificationResult.builder().categoryName(" newsletter ").build()));

    RoutingDecision d = dispatcher(10, 1, 1).classify(account, List.of(text(1, "x"))).get(0);

    assertThat(d.isFailed()).isFalse();
    assertThat(d.getCategory().targetFolder("INBOX")).isEqualTo("News");
  }

  @Test
  @DisplayName("Categoria sconosciuta: decisione fallita, nessun ritentativo")
  void testUnknownCategoryFails() throws Exception {
    when(classifier.classify(anyList(), anyList()))
        .thenAnswer(CategorizationDispatcherTest::echoSubjects);

    List<RoutingDecision> out =
        dispatcher(10, 3, 2).classify(account, List.of(text(1, "Spam"), text(2, "Bills")));

    assertThat(out.get(0).isFailed()).isTrue();
    assertThat(out.get(0).getFailureReason()).contains("Spam");
    assertThat(out.get(0).getCategory()).isNull();
    assertThat(out.get(1).isFailed()).isFalse();
    verify(classifier, times(1)).classify(anyList(), anyList());
  }

  @Test
  @DisplayName("Gruppo in errore: tentativi di gruppo, poi una email alla volta")
  void testBatchThenSingleRetries() throws Exception {
    when(classifier.classify(anyList(), anyList()))
        .thenAnswer(
            inv -> {
              List<MessageText> batch = inv.getArgument(1);
              if (batch.size() > 1) throw new ClassificationException("timeout");
              return echoSubjects(inv);
            });

    List<RoutingDecision> out =
        dispatcher(10, 2, 2)
            .classify(account, List.of(text(1, "Bills"), text(2, "INBOX"), text(3, "Newsletter")));

    assertThat(out).noneMatch(RoutingDecision::isFailed);
    assertThat(out)
        .extracting(d -> d.getCategory().getName())
        .containsExactly("Bills", "INBOX", "Newsletter");
    verify(classifier, times(2)).classify(anyList(), argThat(b -> b.size() == 3));
    verify(classifier, times(3)).classify(anyList(), argThat(b -> b.size() == 1));
  }

  @Test
  @DisplayName("Numero di risultati diverso dal gruppo: trattato come fallimento")
  void testResultCountMismatch() throws Exception {
    when(classifier.classify(anyList(), anyList()))
        .thenReturn(List.of(ClassificationResult.builder().categoryName("Bills").build()));

    List<RoutingDecision> out =
        dispatcher(10, 1, 1).classify(account, List.of(text(1, "a"), text(2, "b")));

    // il gruppo fallisce, le singole email ricevono un risultato ciascuna
    assertThat(out).noneMatch(RoutingDecision::isFailed);
    verify(classifier, times(3)).classify(anyList(), anyList());
  }

  @Test
  @DisplayName("Gruppo di una sola email: solo i tentativi di gruppo")
  void testSingleMessageChunkSkipsSecondTier() throws Exception {
    when(classifier.classify(anyList(), anyList()))
        .thenThrow(new ClassificationException("servizio giù"));

    List<RoutingDecision> out = dispatcher(10, 3, 5).classify(account, List.of(text(1, "x")));

    assertThat(out).singleElement().matches(RoutingDecision::isFailed);
    verify(classifier, times(3)).classify(anyList(), anyList());
  }

  @Test
  @DisplayName("Errori non controllati del classificatore vengono ritentati")
  void testRuntimeExceptionRetried() throws Exception {
    when(classifier.classify(anyList(), anyList()))
        .thenThrow(new IllegalStateException("boom"))
        .thenAnswer(CategorizationDispatcherTest::echoSubjects);

    List<RoutingDecision> out = dispatcher(10, 2, 1).classify(account, List.of(text(1, "Bills")));

    assertThat(out.get(0).isFailed()).isFalse();
  }

  @Test
  @DisplayName("Arresto richiesto: nessuna chiamata, tutte le decisioni fallite")
  void testShutdownAbortsClassification() {
    shutdown.request();

    List<RoutingDecision> out =
        dispatcher(10, 3, 3).classify(account, List.of(text(1, "Bills"), text(2, "INBOX")));

    assertThat(out).hasSize(2).allMatch(RoutingDecision::isFailed);
    verifyNoInteractions(classifier);
  }

  @Test
  @DisplayName("Le chiamate contemporanee rispettano maxConcurrentRequests")
  void testConcurrencyLimit() throws Exception {
    AtomicInteger inFlight = new AtomicInteger();
    AtomicInteger peak = new AtomicInteger();
    when(classifier.classify(anyList(), anyList()))
        .thenAnswer(
            inv -> {
              peak.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
              Thread.sleep(30);
              inFlight.decrementAndGet();
              return echoSubjects(inv);
            });
    CategorizationDispatcher d =
        new CategorizationDispatcher(classifier, 10, policy(1), policy(1), 2, shutdown);

    ExecutorService pool = Executors.newFixedThreadPool(6);
    CountDownLatch go = new CountDownLatch(1);
    List<Future<List<RoutingDecision>>> futures = new ArrayList<>();
    for (int i = 0; i < 6; i++) {
      final long uid = i;
      futures.add(
          pool.submit(
              () -> {
                go.await();
                return d.classify(account, List.of(text(uid, "Bills")));
              }));
    }
    go.countDown();
    for (Future<List<RoutingDecision>> f : futures)
      assertThat(f.get(5, TimeUnit.SECONDS)).noneMatch(RoutingDecision::isFailed);
    pool.shutdown();

    assertThat(peak.get()).isBetween(1, 2);
  }

  @Test
  @DisplayName("Parametri non validi rifiutati dal costruttore")
  void testInvalidParameters() {
    assertThatThrownBy(
            () -> new CategorizationDispatcher(classifier, 0, policy(1), policy(1), 1, shutdown))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(
            () -> new CategorizationDispatcher(classifier, 5, policy(1), policy(1), 0, shutdown))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
