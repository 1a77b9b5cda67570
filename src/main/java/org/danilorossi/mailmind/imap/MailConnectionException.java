package org.danilorossi.mailmind.imap;

/** Errore transitorio di rete o di protocollo. Dopo questo errore la connessione va rifatta. */
public class MailConnectionException extends Exception {

  public MailConnectionException(final String message) {
    super(message);
  }

  public MailConnectionException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
