package org.danilorossi.mailmind.worker;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.java.Log;
import lombok.val;
import org.danilorossi.mailmind.classifier.CategorizationDispatcher;
import org.danilorossi.mailmind.classifier.MessageText;
import org.danilorossi.mailmind.db.FingerprintStore;
import org.danilorossi.mailmind.db.StorageException;
import org.danilorossi.mailmind.helpers.LangUtils;
import org.danilorossi.mailmind.helpers.LogConfigurator;
import org.danilorossi.mailmind.helpers.MailUtils;
import org.danilorossi.mailmind.helpers.RetryPolicy;
import org.danilorossi.mailmind.helpers.ShutdownSignal;
import org.danilorossi.mailmind.imap.AuthException;
import org.danilorossi.mailmind.imap.IdleOutcome;
import org.danilorossi.mailmind.imap.MailConnectionException;
import org.danilorossi.mailmind.imap.MailboxConnection;
import org.danilorossi.mailmind.model.Account;
import org.danilorossi.mailmind.model.MessageRef;
import org.danilorossi.mailmind.model.ProcessingOptions;
import org.danilorossi.mailmind.model.RoutingDecision;

/**
 * Ciclo di vita di un account: connessione, svuotamento dell'arretrato, attesa IDLE, di nuovo
 * svuotamento. Gira in un thread dedicato.
 *
 * <p>Per ogni messaggio l'impronta viene registrata solo dopo lo spostamento riuscito. In dry-run
 * non si sposta e non si registra nulla.
 *
 * <p>Errori di connessione: riconnessione con attesa esponenziale limitata. Credenziali rifiutate
 * o account non valido: il worker si ferma. Archivio non disponibile: pausa e nuovo tentativo.
 */
@Log
public class AccountWorker implements Runnable {

  static {
    LogConfigurator.configLog(log);
  }

  @Getter private final Account account;
  private final MailboxConnection conn;
  private final FingerprintStore store;
  private final CategorizationDispatcher dispatcher;
  private final ProcessingOptions options;
  private final ShutdownSignal shutdown;
  private final Clock clock;
  private final RetryPolicy reconnectPolicy;

  @Getter private volatile WorkerState state = WorkerState.DISCONNECTED;
  private final List<WorkerState> transitions = new CopyOnWriteArrayList<>();

  /** Motivo dell'arresto definitivo; null se il worker si è fermato per richiesta esterna. */
  @Getter private volatile String fatalReason;

  @Getter private volatile boolean everConnected;

  // contatori
  private final AtomicInteger moved = new AtomicInteger();
  private final AtomicInteger leftInPlace = new AtomicInteger();
  private final AtomicInteger failed = new AtomicInteger();
  private final AtomicInteger dryRun = new AtomicInteger();
  private final AtomicInteger vanished = new AtomicInteger();

  public AccountWorker(
      @NonNull final Account account,
      @NonNull final MailboxConnection conn,
      @NonNull final FingerprintStore store,
      @NonNull final CategorizationDispatcher dispatcher,
      @NonNull final ProcessingOptions options,
      @NonNull final ShutdownSignal shutdown,
      @NonNull final Clock clock) {
    this.account = account;
    this.conn = conn;
    this.store = store;
    this.dispatcher = dispatcher;
    this.options = options;
    this.shutdown = shutdown;
    this.clock = clock;
    this.reconnectPolicy = options.reconnectPolicy();
  }

  @Override
  public void run() {
    try {
      account.validate();
    } catch (IllegalArgumentException e) {
      fatal("Configurazione non valida: " + e.getMessage(), e);
      transition(WorkerState.STOPPED);
      return;
    }

    int reconnectFailures = 0;
    try {
      while (!shutdown.isRequested()) {
        transition(WorkerState.CONNECTING);
        try {
          conn.connect();
          everConnected = true;
          reconnectFailures = 0;
          if (!connected()) break;
        } catch (AuthException e) {
          fatal(e.getMessage(), e);
          break;
        } catch (IllegalArgumentException e) {
          fatal("Configurazione non valida: " + e.getMessage(), e);
          break;
        } catch (MailConnectionException e) {
          LangUtils.warn(log, "[{}] {}", account.getName(), e.getMessage());
          if (options.isOnce()) {
            fatal(e.getMessage(), e);
            break;
          }
        } catch (RuntimeException e) {
          LangUtils.err(log, "[{}] Errore inatteso: {}", e, account.getName(), LangUtils.exMsg(e));
          if (options.isOnce()) {
            fatal(LangUtils.exMsg(e), e);
            break;
          }
        }

        conn.close();
        transition(WorkerState.DISCONNECTED);
        if (shutdown.isRequested()) break;

        reconnectFailures++;
        val delay = reconnectPolicy.delayAfter(reconnectFailures);
        LangUtils.info(
            log,
            "[{}] Riconnessione tra {} s (tentativo {}).",
            account.getName(),
            delay.toSeconds(),
            reconnectFailures);
        if (shutdown.await(delay)) break;
      }
    } finally {
      conn.close();
      transition(WorkerState.STOPPED);
      LangUtils.info(log, "[{}] Worker fermato. {}", account.getName(), summary());
    }
  }

  /** Svuota e attende finché la connessione regge; false = il worker deve fermarsi. */
  private boolean connected() throws MailConnectionException {
    while (true) {
      transition(WorkerState.DRAINING);
      drainUntilStored();
      if (shutdown.isRequested() || options.isOnce()) return false;

      transition(WorkerState.IDLING);
      val outcome = conn.awaitNotification(options.idleTimeout());
      if (shutdown.isRequested()) return false;
      if (outcome == IdleOutcome.CLOSED)
        throw new MailConnectionException(
            LangUtils.s("[{}] Connessione chiusa dal server durante l'attesa", account.getName()));
    }
  }

  /** Archivio non disponibile: si ferma il ciclo e si riprova sulla stessa connessione. */
  private void drainUntilStored() throws MailConnectionException {
    while (true) {
      try {
        drain();
        return;
      } catch (StorageException e) {
        LangUtils.err(
            log,
            "[{}] Archivio impronte non disponibile, nuovo tentativo tra {} s: {}",
            account.getName(),
            options.storageRetryDelay().toSeconds(),
            LangUtils.rootCauseMsg(e));
        if (shutdown.await(options.storageRetryDelay())) return;
      }
    }
  }

  /**
   * Elenca ed elabora finché non restano messaggi da gestire. I messaggi già tentati in questo
   * ciclo (falliti o in dry-run) non vengono rielencati fino al ciclo successivo.
   */
  void drain() throws MailConnectionException {
    final Set<String> attempted = new HashSet<>();
    while (!shutdown.isRequested()) {
      val refs =
          conn.listUnhandled(
              fp -> attempted.contains(fp) || store.has(fp), options.getMaxMessagesPerRun());
      if (refs.isEmpty()) return;
      LangUtils.info(log, "[{}] {} messaggi da elaborare.", account.getName(), refs.size());

      val batchSize = options.getBatchSize();
      for (int from = 0; from < refs.size() && !shutdown.isRequested(); from += batchSize) {
        processBatch(refs.subList(from, Math.min(refs.size(), from + batchSize)), attempted);
      }
    }
  }

  private void processBatch(
      @NonNull final List<MessageRef> batch, @NonNull final Set<String> attempted)
      throws MailConnectionException {
    val inputs = new ArrayList<MessageText>(batch.size());
    for (val ref : batch) {
      if (shutdown.isRequested()) break;
      attempted.add(ref.getFingerprint());
      if (store.has(ref.getFingerprint())) continue; // registrato nel frattempo
      val body = conn.fetchBody(ref);
      if (body == null) {
        vanished.incrementAndGet();
        continue;
      }
      inputs.add(new MessageText(ref, body));
    }
    if (inputs.isEmpty()) return;

    // da qui il gruppo viene completato anche se arriva l'arresto
    val decisions = dispatcher.classify(account, inputs);
    for (int i = 0; i < inputs.size(); i++) apply(inputs.get(i).getRef(), decisions.get(i));
  }

  private void apply(@NonNull final MessageRef ref, @NonNull final RoutingDecision d)
      throws MailConnectionException {
    if (d.isFailed()) {
      failed.incrementAndGet();
      LangUtils.info(
          log,
          "[{}] UID {} lasciato in '{}': {}",
          account.getName(),
          ref.getUid(),
          ref.getFolder(),
          d.getFailureReason());
      return;
    }

    val target = d.getCategory().targetFolder(ref.getFolder());
    if (options.isDryRun()) {
      dryRun.incrementAndGet();
      LangUtils.info(
          log,
          "[{}] [dry-run] '{}' da {} -> {} ({}%, {})",
          account.getName(),
          LangUtils.abbreviate(ref.getSubject(), 60),
          ref.getSender(),
          target,
          d.getConfidence(),
          LangUtils.abbreviate(d.getRationale(), 120));
      return;
    }

    if (!conn.move(ref, target)) {
      vanished.incrementAndGet();
      return;
    }
    store.record(ref.getFingerprint(), account.getName(), clock.instant());

    if (MailUtils.sameFolder(ref.getFolder(), target)) leftInPlace.incrementAndGet();
    else moved.incrementAndGet();
    LangUtils.info(
        log,
        "[{}] '{}' -> {} ({}%)",
        account.getName(),
        LangUtils.abbreviate(ref.getSubject(), 60),
        target,
        d.getConfidence());
  }

  /** Sblocca subito un'attesa IDLE; chiamato dall'orchestratore all'arresto. */
  public void wakeUp() {
    conn.wakeUp();
  }

  private void fatal(final String reason, final Throwable cause) {
    fatalReason = reason;
    LangUtils.err(
        log, "[{}] Errore definitivo, account fermato: {}", cause, account.getName(), reason);
  }

  private void transition(@NonNull final WorkerState next) {
    if (state == next) return;
    LangUtils.debug(log, "[{}] {} -> {}", account.getName(), state, next);
    state = next;
    transitions.add(next);
  }

  /** Sequenza degli stati attraversati, dal primo cambio. */
  public List<WorkerState> getTransitions() {
    return List.copyOf(transitions);
  }

  public int getMoved() {
    return moved.get();
  }

  public int getLeftInPlace() {
    return leftInPlace.get();
  }

  public int getFailed() {
    return failed.get();
  }

  public int getDryRun() {
    return dryRun.get();
  }

  public int getVanished() {
    return vanished.get();
  }

  public String summary() {
    return LangUtils.s(
        "spostati={} invariati={} falliti={} dry-run={} spariti={}",
        moved.get(),
        leftInPlace.get(),
        failed.get(),
        dryRun.get(),
        vanished.get());
  }
}
