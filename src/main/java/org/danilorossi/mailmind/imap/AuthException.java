package org.danilorossi.mailmind.imap;

/** Credenziali rifiutate dal server: non si ritenta in automatico. */
public class AuthException extends Exception {

  public AuthException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
