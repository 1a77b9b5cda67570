package org.danilorossi.mailmind.imap;

import com.sun.mail.imap.IMAPFolder;
import com.sun.mail.imap.IMAPStore;
import jakarta.mail.AuthenticationFailedException;
import jakarta.mail.FetchProfile;
import jakarta.mail.Flags;
import jakarta.mail.FolderClosedException;
import jakarta.mail.Message;
import jakarta.mail.MessageRemovedException;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.StoreClosedException;
import jakarta.mail.UIDFolder;
import jakarta.mail.event.MessageCountAdapter;
import jakarta.mail.event.MessageCountEvent;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Predicate;
import lombok.NonNull;
import lombok.extern.java.Log;
import lombok.val;
import org.danilorossi.mailmind.db.Fingerprints;
import org.danilorossi.mailmind.helpers.LangUtils;
import org.danilorossi.mailmind.helpers.LogConfigurator;
import org.danilorossi.mailmind.helpers.MailTextExtractor;
import org.danilorossi.mailmind.helpers.MailUtils;
import org.danilorossi.mailmind.model.Account;
import org.danilorossi.mailmind.model.FingerprintMode;
import org.danilorossi.mailmind.model.MessageRef;
import org.danilorossi.mailmind.model.ProcessingOptions;

/**
 * {@link MailboxConnection} su Jakarta Mail.
 *
 * <p>L'attesa usa IMAP IDLE sulla prima cartella sorgente. Per interrompere un IDLE in corso da un
 * altro thread basta un comando qualunque sulla stessa cartella (Jakarta Mail manda DONE prima di
 * eseguirlo): il watchdog e {@link #wakeUp()} inviano un NOOP, ripetuto ogni {@link
 * #ABORT_RETRY} finché l'IDLE non è terminato. Un NOOP arrivato prima che IDLE parta non lo
 * interrompe.
 *
 * <p>Senza MOVE lo spostamento è COPY + {@code \Deleted} ed EXPUNGE per UID (UIDPLUS). Senza
 * UIDPLUS l'originale resta marcato {@code \Deleted} e l'elenco lo ignora.
 */
@Log
public class ImapMailboxConnection implements MailboxConnection {

  static {
    LogConfigurator.configLog(log);
  }

  /** Messaggi per singolo FETCH durante l'elenco. */
  static final int FETCH_CHUNK = 200;

  /** Intervallo di polling per i server senza IDLE. */
  static final Duration POLL_INTERVAL = Duration.ofSeconds(30);

  /** Ripetizione del NOOP di interruzione finché IDLE non termina. */
  static final Duration ABORT_RETRY = Duration.ofSeconds(1);

  /** Apertura dello store: sostituibile nei test. */
  @FunctionalInterface
  interface StoreProvider {
    IMAPStore open(Properties props, String protocol) throws MessagingException;
  }

  private static final StoreProvider DEFAULT_PROVIDER =
      (props, protocol) -> (IMAPStore) Session.getInstance(props).getStore(protocol);

  private final Account account;
  private final ProcessingOptions options;
  private final StoreProvider storeProvider;

  private volatile IMAPStore store;
  private final Map<String, IMAPFolder> folders = new LinkedHashMap<>();
  private volatile IMAPFolder idleFolder;

  private final AtomicBoolean newMail = new AtomicBoolean(false);
  private final AtomicBoolean wakeRequested = new AtomicBoolean(false);
  private final Object pollLock = new Object();
  private ScheduledExecutorService watchdog;

  private final Object idleLock = new Object();
  private boolean idling; // guarded by idleLock
  private ScheduledFuture<?> wakeAbort; // guarded by idleLock

  public ImapMailboxConnection(
      @NonNull final Account account, @NonNull final ProcessingOptions options) {
    this(account, options, DEFAULT_PROVIDER);
  }

  ImapMailboxConnection(
      @NonNull final Account account,
      @NonNull final ProcessingOptions options,
      @NonNull final StoreProvider storeProvider) {
    this.account = account;
    this.options = options;
    this.storeProvider = storeProvider;
  }

  public static MailboxConnectionFactory factory(@NonNull final ProcessingOptions options) {
    return account -> new ImapMailboxConnection(account, options);
  }

  // ---------------------------------------------------------------- connessione

  @Override
  public void connect() throws AuthException, MailConnectionException {
    close();
    val props = account.toProperties(options.idleTimeout());
    try {
      val s = storeProvider.open(props, account.getStoreProtocol());
      s.connect(account.getHost(), account.getPort(), account.getUsername(), account.getPassword());
      store = s;
      LangUtils.info(
          log, "[{}] Connesso a {}:{}.", account.getName(), account.getHost(), account.getPort());

      for (val name : account.getFolders()) {
        val f = (IMAPFolder) s.getFolder(name);
        if (!f.exists())
          throw new MailConnectionException(
              LangUtils.s("[{}] La cartella sorgente '{}' non esiste", account.getName(), name));
        MailUtils.ensureOpenRW(f);
        folders.put(name, f);
      }

      val first = folders.get(account.getFolders().get(0));
      first.addMessageCountListener(
          new MessageCountAdapter() {
            @Override
            public void messagesAdded(final MessageCountEvent e) {
              newMail.set(true);
            }
          });
      idleFolder = first;
    } catch (AuthenticationFailedException e) {
      close();
      throw new AuthException(
          LangUtils.s("[{}] Credenziali rifiutate: {}", account.getName(), LangUtils.exMsg(e)), e);
    } catch (MessagingException e) {
      close();
      throw new MailConnectionException(
          LangUtils.s("[{}] Connessione fallita: {}", account.getName(), LangUtils.exMsg(e)), e);
    } catch (MailConnectionException e) {
      close();
      throw e;
    }
  }

  @Override
  public boolean isConnected() {
    val s = store;
    return s != null && s.isConnected();
  }

  private IMAPFolder folder(@NonNull final String name) throws MailConnectionException {
    val f = folders.get(name);
    if (f == null || !f.isOpen())
      throw new MailConnectionException(
          LangUtils.s("[{}] Cartella '{}' non aperta", account.getName(), name));
    return f;
  }

  // ---------------------------------------------------------------- elenco e lettura

  @Override
  public List<MessageRef> listUnhandled(@NonNull final Predicate<String> isKnown, final int limit)
      throws MailConnectionException {
    val out = new ArrayList<MessageRef>();
    val mode = options.fingerprint();
    for (val name : account.getFolders()) {
      val f = folder(name);
      try {
        val all = f.getMessages();
        for (int from = 0; from < all.length; from += FETCH_CHUNK) {
          val chunk = Arrays.copyOfRange(all, from, Math.min(all.length, from + FETCH_CHUNK));
          f.fetch(chunk, fetchProfile());
          for (val m : chunk) {
            if (m.isExpunged()) continue;
            final MessageRef ref;
            try {
              if (m.isSet(Flags.Flag.DELETED)) continue; // in attesa di EXPUNGE
              ref = toRef(account, name, f.getUID(m), m, mode);
            } catch (MessageRemovedException gone) {
              continue;
            }
            if (isKnown.test(ref.getFingerprint())) continue;
            out.add(ref);
            if (limit > 0 && out.size() >= limit) return out;
          }
        }
      } catch (MessagingException e) {
        throw connectionLost("elenco di '" + name + "'", e);
      }
    }
    return out;
  }

  private static FetchProfile fetchProfile() {
    val fp = new FetchProfile();
    fp.add(UIDFolder.FetchProfileItem.UID);
    fp.add(FetchProfile.Item.ENVELOPE);
    fp.add(FetchProfile.Item.FLAGS);
    fp.add("Message-ID");
    return fp;
  }

  /** Riferimento leggero al messaggio con la sua impronta. */
  static MessageRef toRef(
      @NonNull final Account account,
      @NonNull final String folder,
      final long uid,
      @NonNull final Message m,
      @NonNull final FingerprintMode mode)
      throws MessagingException {
    val messageId = MailUtils.messageId(m);
    val sender = MailUtils.firstSender(m);
    val subject = MailUtils.safeSubject(m);
    val date = MailUtils.messageDate(m);
    return MessageRef.builder()
        .accountName(account.getName())
        .folder(folder)
        .uid(uid)
        .messageId(messageId)
        .sender(sender)
        .subject(subject)
        .date(date)
        .fingerprint(Fingerprints.of(mode, account.getName(), messageId, sender, subject, date))
        .build();
  }

  @Override
  public String fetchBody(@NonNull final MessageRef ref) throws MailConnectionException {
    val f = folder(ref.getFolder());
    try {
      val m = f.getMessageByUID(ref.getUid());
      if (m == null || m.isExpunged() || m.isSet(Flags.Flag.DELETED)) return null;
      return MailTextExtractor.extractText(m);
    } catch (MessageRemovedException gone) {
      return null;
    } catch (MessagingException e) {
      throw connectionLost("lettura UID " + ref.getUid(), e);
    }
  }

  // ---------------------------------------------------------------- spostamento

  @Override
  public boolean move(@NonNull final MessageRef ref, @NonNull final String targetFolder)
      throws MailConnectionException {
    if (MailUtils.sameFolder(ref.getFolder(), targetFolder)) return true;
    val src = folder(ref.getFolder());
    try {
      val m = src.getMessageByUID(ref.getUid());
      if (m == null || m.isExpunged() || m.isSet(Flags.Flag.DELETED)) {
        LangUtils.info(
            log,
            "[{}] UID {} non più presente in '{}': nessuno spostamento.",
            account.getName(),
            ref.getUid(),
            ref.getFolder());
        return false;
      }
      val dst = MailUtils.ensureFolderExists(store, targetFolder);
      val msgs = new Message[] {m};
      if (store.hasCapability("MOVE")) {
        src.moveMessages(msgs, dst);
      } else {
        src.copyMessages(msgs, dst);
        m.setFlag(Flags.Flag.DELETED, true);
        // mai EXPUNGE dell'intera cartella
        if (store.hasCapability("UIDPLUS")) src.expunge(msgs);
        else
          LangUtils.debug(
              log,
              "[{}] Server senza UIDPLUS: UID {} resta marcato \\Deleted in '{}'.",
              account.getName(),
              ref.getUid(),
              ref.getFolder());
      }
      LangUtils.debug(
          log,
          "[{}] UID {} spostato da '{}' a '{}'.",
          account.getName(),
          ref.getUid(),
          ref.getFolder(),
          targetFolder);
      return true;
    } catch (MessageRemovedException gone) {
      return false;
    } catch (MessagingException e) {
      throw connectionLost("spostamento UID " + ref.getUid() + " in '" + targetFolder + "'", e);
    }
  }

  // ---------------------------------------------------------------- attesa

  @Override
  public IdleOutcome awaitNotification(@NonNull final Duration timeout)
      throws MailConnectionException {
    val f = idleFolder;
    if (f == null || !f.isOpen() || !isConnected()) return IdleOutcome.CLOSED;
    try {
      val outcome = store.hasCapability("IDLE") ? idle(f, timeout) : poll(f, timeout);
      LangUtils.debug(log, "[{}] Attesa terminata: {}.", account.getName(), outcome);
      return outcome;
    } catch (FolderClosedException | StoreClosedException e) {
      LangUtils.warn(
          log, "[{}] Connessione chiusa dal server: {}", account.getName(), e.getMessage());
      return IdleOutcome.CLOSED;
    } catch (MessagingException e) {
      throw connectionLost("attesa", e);
    } finally {
      wakeRequested.set(false);
    }
  }

  private IdleOutcome idle(@NonNull final IMAPFolder f, @NonNull final Duration timeout)
      throws MessagingException {
    val deadline = System.nanoTime() + timeout.toNanos();
    val before = f.getMessageCount();
    newMail.set(false);

    val timedOut = new AtomicBoolean(false);
    val timer =
        watchdog()
            .scheduleWithFixedDelay(
                () -> {
                  timedOut.set(true);
                  abortIdle(f);
                },
                timeout.toMillis(),
                ABORT_RETRY.toMillis(),
                TimeUnit.MILLISECONDS);
    synchronized (idleLock) {
      idling = true;
    }
    try {
      while (!wakeRequested.get() && !timedOut.get() && System.nanoTime() < deadline) {
        f.idle(true); // ritorna alla prima risposta non richiesta o a IDLE interrotto
        if (!f.isOpen()) return IdleOutcome.CLOSED;
        if (newMail.get() || f.getMessageCount() > before) return IdleOutcome.NEW_MESSAGE;
      }
    } finally {
      timer.cancel(false);
      synchronized (idleLock) {
        idling = false;
        if (wakeAbort != null) {
          wakeAbort.cancel(false);
          wakeAbort = null;
        }
      }
    }
    if (!f.isOpen()) return IdleOutcome.CLOSED;
    return (newMail.get() || f.getMessageCount() > before)
        ? IdleOutcome.NEW_MESSAGE
        : IdleOutcome.TIMED_OUT;
  }

  private IdleOutcome poll(@NonNull final IMAPFolder f, @NonNull final Duration timeout)
      throws MessagingException {
    val deadline = System.nanoTime() + timeout.toNanos();
    val before = f.getMessageCount();
    while (!wakeRequested.get()) {
      val left = deadline - System.nanoTime();
      if (left <= 0) break;
      val step = Math.min(POLL_INTERVAL.toNanos(), left);
      synchronized (pollLock) {
        try {
          if (!wakeRequested.get()) TimeUnit.NANOSECONDS.timedWait(pollLock, step);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          return IdleOutcome.TIMED_OUT;
        }
      }
      noop(f);
      if (!f.isOpen()) return IdleOutcome.CLOSED;
      if (f.getMessageCount() > before) return IdleOutcome.NEW_MESSAGE;
    }
    return IdleOutcome.TIMED_OUT;
  }

  @Override
  public void wakeUp() {
    wakeRequested.set(true);
    synchronized (pollLock) {
      pollLock.notifyAll();
    }
    val f = idleFolder;
    if (f == null) return;
    synchronized (idleLock) {
      // idle() controlla wakeRequested dopo aver impostato idling: se qui idling è false,
      // l'attesa non è ancora iniziata (e uscirà subito) oppure è già finita
      if (idling && wakeAbort == null)
        wakeAbort =
            watchdog()
                .scheduleWithFixedDelay(
                    () -> abortIdle(f), 0, ABORT_RETRY.toMillis(), TimeUnit.MILLISECONDS);
    }
  }

  private void abortIdle(@NonNull final IMAPFolder f) {
    try {
      if (f.isOpen()) noop(f);
    } catch (MessagingException | RuntimeException e) {
      LangUtils.debug(log, "[{}] Interruzione IDLE: {}", account.getName(), LangUtils.exMsg(e));
    }
  }

  private static void noop(@NonNull final IMAPFolder f) throws MessagingException {
    f.doCommand(
        p -> {
          p.noop();
          return null;
        });
  }

  private synchronized ScheduledExecutorService watchdog() {
    if (watchdog == null || watchdog.isShutdown()) {
      watchdog =
          Executors.newSingleThreadScheduledExecutor(
              r -> {
                val t = new Thread(r, "idle-watchdog-" + account.getName());
                t.setDaemon(true);
                return t;
              });
    }
    return watchdog;
  }

  // ---------------------------------------------------------------- chiusura

  private MailConnectionException connectionLost(final String what, final MessagingException e) {
    return new MailConnectionException(
        LangUtils.s("[{}] Errore durante {}: {}", account.getName(), what, LangUtils.exMsg(e)), e);
  }

  @Override
  public void close() {
    idleFolder = null;
    for (val f : folders.values()) {
      try {
        if (f.isOpen()) f.close(false);
      } catch (MessagingException | RuntimeException e) {
        LangUtils.debug(
            log,
            "[{}] Chiusura cartella {}: {}",
            account.getName(),
            f.getFullName(),
            LangUtils.exMsg(e));
      }
    }
    folders.clear();

    val s = store;
    store = null;
    if (s != null) {
      try {
        s.close();
      } catch (MessagingException | RuntimeException e) {
        LangUtils.debug(log, "[{}] Chiusura store: {}", account.getName(), LangUtils.exMsg(e));
      }
    }

    synchronized (this) {
      if (watchdog != null) {
        watchdog.shutdownNow();
        watchdog = null;
      }
    }
  }
}
