package org.danilorossi.mailmind.helpers;

import jakarta.mail.Address;
import jakarta.mail.Folder;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Store;
import jakarta.mail.internet.InternetAddress;
import java.time.Instant;
import lombok.NonNull;
import lombok.experimental.UtilityClass;
import lombok.val;

@UtilityClass
public final class MailUtils {

  public static void ensureOpenRW(@NonNull final Folder f) throws MessagingException {
    if (f.isOpen() && f.getMode() == Folder.READ_WRITE) return;
    if (f.isOpen()) f.close(false);
    f.open(Folder.READ_WRITE);
  }

  /** Restituisce la cartella, creandola se manca (non la apre). */
  public static Folder ensureFolderExists(
      @NonNull final Store store, @NonNull final String folderName) throws MessagingException {
    val f = store.getFolder(folderName);
    if (!f.exists() && !f.create(Folder.HOLDS_MESSAGES)) {
      throw new MessagingException("Impossibile creare la cartella: " + folderName);
    }
    return f;
  }

  public static String safeSubject(@NonNull final Message m) {
    try {
      return LangUtils.nz(m.getSubject());
    } catch (MessagingException e) {
      return "(no-subject)";
    }
  }

  /** Primo mittente come "Nome <indirizzo>" o solo indirizzo; "" se assente. */
  public static String firstSender(@NonNull final Message m) throws MessagingException {
    final Address[] from = m.getFrom();
    if (from == null || from.length == 0 || from[0] == null) return "";
    if (from[0] instanceof InternetAddress ia) return LangUtils.nz(ia.toUnicodeString());
    return LangUtils.nz(from[0].toString());
  }

  /** Header Message-ID (primo valore) o "" se assente. */
  public static String messageId(@NonNull final Message m) throws MessagingException {
    val ids = m.getHeader("Message-ID");
    return (ids == null || ids.length == 0) ? "" : LangUtils.nz(ids[0]);
  }

  /** Data di invio, altrimenti di ricezione; null se il server non la fornisce. */
  public static Instant messageDate(@NonNull final Message m) throws MessagingException {
    val sent = m.getSentDate();
    if (sent != null) return sent.toInstant();
    val received = m.getReceivedDate();
    return received != null ? received.toInstant() : null;
  }

  /** Stessa cartella IMAP; INBOX è insensibile alle maiuscole. */
  public static boolean sameFolder(final String a, final String b) {
    if (a == null || b == null) return false;
    val x = a.trim();
    val y = b.trim();
    if ("INBOX".equalsIgnoreCase(x) && "INBOX".equalsIgnoreCase(y)) return true;
    return x.equals(y);
  }
}
