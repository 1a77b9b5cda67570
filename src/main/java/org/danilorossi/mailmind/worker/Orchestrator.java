package org.danilorossi.mailmind.worker;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.java.Log;
import lombok.val;
import org.danilorossi.mailmind.classifier.CategorizationDispatcher;
import org.danilorossi.mailmind.db.FingerprintStore;
import org.danilorossi.mailmind.db.StorageException;
import org.danilorossi.mailmind.helpers.LangUtils;
import org.danilorossi.mailmind.helpers.LogConfigurator;
import org.danilorossi.mailmind.helpers.ShutdownSignal;
import org.danilorossi.mailmind.imap.MailboxConnectionFactory;
import org.danilorossi.mailmind.model.Account;
import org.danilorossi.mailmind.model.ProcessingOptions;

/**
 * Avvia un {@link AccountWorker} per account, ciascuno nel proprio thread. I worker condividono
 * solo l'archivio delle impronte, il dispatcher e il segnale di arresto.
 */
@Log
public class Orchestrator {

  static {
    LogConfigurator.configLog(log);
  }

  private final FingerprintStore store;
  private final ProcessingOptions options;
  @Getter private final ShutdownSignal shutdown;
  @Getter private final List<AccountWorker> workers = new ArrayList<>();
  private final List<Thread> threads = new ArrayList<>();

  public Orchestrator(
      @NonNull final List<Account> accounts,
      @NonNull final ProcessingOptions options,
      @NonNull final FingerprintStore store,
      @NonNull final CategorizationDispatcher dispatcher,
      @NonNull final MailboxConnectionFactory connections,
      @NonNull final ShutdownSignal shutdown,
      @NonNull final Clock clock) {
    this.store = store;
    this.options = options;
    this.shutdown = shutdown;
    for (val a : accounts)
      workers.add(
          new AccountWorker(
              a, connections.create(a), store, dispatcher, options, shutdown, clock));
  }

  /** Pulizia iniziale dell'archivio (se configurata) e avvio dei thread. */
  public synchronized void start() {
    if (!threads.isEmpty()) throw new IllegalStateException("Orchestrator already started");
    if (options.getPruneAfterDays() > 0) {
      try {
        store.prune(options.getPruneAfterDays(), null);
      } catch (StorageException e) {
        LangUtils.warn(log, "Pulizia iniziale non riuscita: {}", LangUtils.rootCauseMsg(e));
      }
    }

    for (val w : workers) {
      val t = new Thread(w, "worker-" + w.getAccount().getName());
      threads.add(t);
      t.start();
    }
    LangUtils.info(
        log,
        "Avviati {} worker{}{}.",
        workers.size(),
        options.isDryRun() ? " (dry-run)" : "",
        options.isOnce() ? " (passata singola)" : "");
  }

  /** Chiede l'arresto a tutti i worker e sblocca le attese IDLE. Non attende. */
  public void shutdown() {
    if (shutdown.isRequested()) return;
    LangUtils.info(log, "Arresto richiesto: fermo {} worker.", workers.size());
    shutdown.request();
    workers.forEach(AccountWorker::wakeUp);
  }

  /** Attende la fine di tutti i worker. */
  public void awaitTermination() throws InterruptedException {
    for (val t : snapshot()) t.join();
  }

  /** Come {@link #awaitTermination()} ma con limite; true se tutti i worker sono fermi. */
  public boolean awaitTermination(@NonNull final Duration timeout) throws InterruptedException {
    val deadline = System.nanoTime() + timeout.toNanos();
    for (val t : snapshot()) {
      val left = deadline - System.nanoTime();
      if (left <= 0) break;
      t.join(Math.max(1, left / 1_000_000));
    }
    return snapshot().stream().noneMatch(Thread::isAlive);
  }

  private synchronized List<Thread> snapshot() {
    return List.copyOf(threads);
  }

  public RunReport report() {
    return RunReport.of(workers);
  }
}
