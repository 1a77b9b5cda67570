package org.danilorossi.mailmind.classifier;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Semaphore;
import lombok.NonNull;
import lombok.extern.java.Log;
import lombok.val;
import org.danilorossi.mailmind.helpers.LangUtils;
import org.danilorossi.mailmind.helpers.LogConfigurator;
import org.danilorossi.mailmind.helpers.RetryPolicy;
import org.danilorossi.mailmind.helpers.ShutdownSignal;
import org.danilorossi.mailmind.model.Account;
import org.danilorossi.mailmind.model.ProcessingOptions;
import org.danilorossi.mailmind.model.RoutingDecision;

/**
 * Classifica le email a gruppi e traduce i risultati in {@link RoutingDecision}.
 *
 * <p>Ritentativi su due livelli: prima l'intero gruppo secondo batchPolicy, poi ogni email da sola
 * secondo messagePolicy, così un messaggio problematico non blocca gli altri. Una categoria che
 * l'account non conosce è un fallimento: il messaggio non viene spostato.
 *
 * <p>Condiviso fra tutti i worker; le chiamate contemporanee al servizio sono limitate da un
 * semaforo.
 */
@Log
public class CategorizationDispatcher {

  static {
    LogConfigurator.configLog(log);
  }

  private final Classifier classifier;
  private final int batchSize;
  private final RetryPolicy batchPolicy;
  private final RetryPolicy messagePolicy;
  private final Semaphore permits;
  private final ShutdownSignal shutdown;

  public CategorizationDispatcher(
      @NonNull final Classifier classifier,
      final int batchSize,
      @NonNull final RetryPolicy batchPolicy,
      @NonNull final RetryPolicy messagePolicy,
      final int maxConcurrentRequests,
      @NonNull final ShutdownSignal shutdown) {
    if (batchSize <= 0) throw new IllegalArgumentException("batchSize must be > 0");
    if (maxConcurrentRequests <= 0)
      throw new IllegalArgumentException("maxConcurrentRequests must be > 0");
    this.classifier = classifier;
    this.batchSize = batchSize;
    this.batchPolicy = batchPolicy;
    this.messagePolicy = messagePolicy;
    this.permits = new Semaphore(maxConcurrentRequests, true);
    this.shutdown = shutdown;
  }

  public static CategorizationDispatcher fromOptions(
      @NonNull final Classifier classifier,
      @NonNull final ProcessingOptions options,
      @NonNull final ShutdownSignal shutdown) {
    return new CategorizationDispatcher(
        classifier,
        options.getBatchSize(),
        options.batchPolicy(),
        options.messagePolicy(),
        options.getMaxConcurrentRequests(),
        shutdown);
  }

  /** Una decisione per ogni input, nello stesso ordine. */
  public List<RoutingDecision> classify(
      @NonNull final Account account, @NonNull final List<MessageText> inputs) {
    val out = new ArrayList<RoutingDecision>(inputs.size());
    for (int from = 0; from < inputs.size(); from += batchSize) {
      val chunk = inputs.subList(from, Math.min(inputs.size(), from + batchSize));
      out.addAll(classifyChunk(account, chunk));
    }
    return out;
  }

  private List<RoutingDecision> classifyChunk(
      @NonNull final Account account, @NonNull final List<MessageText> chunk) {
    val results = attempt(account, chunk, batchPolicy);
    if (results != null) return toDecisions(account, chunk, results);

    if (chunk.size() > 1)
      LangUtils.warn(
          log,
          "[{}] Gruppo di {} email non classificato: ritento una email alla volta.",
          account.getName(),
          chunk.size());

    val out = new ArrayList<RoutingDecision>(chunk.size());
    for (val m : chunk) {
      val single = chunk.size() == 1 ? null : attempt(account, List.of(m), messagePolicy);
      if (single != null) {
        out.addAll(toDecisions(account, List.of(m), single));
      } else {
        LangUtils.warn(
            log,
            "[{}] Classificazione fallita per UID {} ({}).",
            account.getName(),
            m.getRef().getUid(),
            LangUtils.abbreviate(m.getRef().getSubject(), 60));
        out.add(RoutingDecision.failed(m.getRef().getFingerprint(), "classificazione fallita"));
      }
    }
    return out;
  }

  /** Risultati allineati al gruppo; null a tentativi esauriti o durante l'arresto. */
  private List<ClassificationResult> attempt(
      @NonNull final Account account,
      @NonNull final List<MessageText> batch,
      @NonNull final RetryPolicy policy) {
    int failures = 0;
    while (!shutdown.isRequested()) {
      try {
        val results = call(account, batch);
        if (results != null && results.size() == batch.size()) return results;
        throw new ClassificationException(
            LangUtils.s(
                "attesi {} risultati, ricevuti {}",
                batch.size(),
                results == null ? 0 : results.size()));
      } catch (ClassificationException | RuntimeException e) {
        failures++;
        LangUtils.warn(
            log,
            "[{}] Tentativo {} di classificazione ({} email) fallito: {}",
            account.getName(),
            failures,
            batch.size(),
            LangUtils.exMsg(e));
        if (!policy.canRetry(failures)) return null;
        if (shutdown.await(policy.delayAfter(failures))) return null;
      } catch (InterruptedException ie) {
        Thread.currentThread().interrupt();
        return null;
      }
    }
    return null;
  }

  private List<ClassificationResult> call(
      @NonNull final Account account, @NonNull final List<MessageText> batch)
      throws ClassificationException, InterruptedException {
    permits.acquire();
    try {
      return classifier.classify(account.getCategories(), batch);
    } finally {
      permits.release();
    }
  }

  private static List<RoutingDecision> toDecisions(
      @NonNull final Account account,
      @NonNull final List<MessageText> batch,
      @NonNull final List<ClassificationResult> results) {
    val out = new ArrayList<RoutingDecision>(batch.size());
    for (int i = 0; i < batch.size(); i++) {
      val ref = batch.get(i).getRef();
      val r = results.get(i);
      val category = r == null ? null : account.findCategory(r.getCategoryName());
      if (category == null) {
        val name = r == null ? null : r.getCategoryName();
        LangUtils.warn(
            log,
            "[{}] UID {}: categoria sconosciuta '{}', il messaggio resta dov'è.",
            account.getName(),
            ref.getUid(),
            name);
        out.add(RoutingDecision.failed(ref.getFingerprint(), "categoria sconosciuta: " + name));
      } else {
        out.add(
            RoutingDecision.routed(
                ref.getFingerprint(), category, r.getConfidence(), r.getRationale()));
      }
    }
    return out;
  }
}
