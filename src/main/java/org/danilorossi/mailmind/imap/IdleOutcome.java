package org.danilorossi.mailmind.imap;

/** Esito di un'attesa di notifica sulla casella. */
public enum IdleOutcome {
  NEW_MESSAGE,
  TIMED_OUT,
  CLOSED
}
