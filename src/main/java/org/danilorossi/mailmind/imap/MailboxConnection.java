package org.danilorossi.mailmind.imap;

import java.time.Duration;
import java.util.List;
import java.util.function.Predicate;
import org.danilorossi.mailmind.model.MessageRef;

/**
 * Sessione verso la casella di un account. Una istanza appartiene a un solo worker; l'unico metodo
 * chiamabile da altri thread è {@link #wakeUp()}.
 *
 * <p>Qualsiasi {@link MailConnectionException} invalida la connessione: prima di altre operazioni
 * va richiamato {@link #connect()}.
 */
public interface MailboxConnection extends AutoCloseable {

  /** Autentica e apre le cartelle sorgente. */
  void connect() throws AuthException, MailConnectionException;

  boolean isConnected();

  /**
   * Messaggi presenti nelle cartelle sorgente, in ordine server, la cui impronta non è nota.
   * Non scarica i corpi.
   *
   * @param isKnown impronte da escludere
   * @param limit numero massimo di risultati; 0 = nessun limite
   */
  List<MessageRef> listUnhandled(Predicate<String> isKnown, int limit)
      throws MailConnectionException;

  /** Testo del messaggio per la classificazione, oppure null se il messaggio non c'è più. */
  String fetchBody(MessageRef ref) throws MailConnectionException;

  /**
   * Sposta il messaggio in targetFolder senza toccare flag o contenuto. Se la destinazione è la
   * cartella corrente non fa nulla.
   *
   * @return false se il messaggio non è più nella cartella sorgente
   */
  boolean move(MessageRef ref, String targetFolder) throws MailConnectionException;

  /** Blocca fino a nuova posta, scadenza del timeout, chiusura dal server o {@link #wakeUp()}. */
  IdleOutcome awaitNotification(Duration timeout) throws MailConnectionException;

  /** Interrompe subito un'eventuale {@link #awaitNotification}; sicuro da qualunque thread. */
  void wakeUp();

  @Override
  void close();
}
