package org.danilorossi.mailmind.db;

/** Archivio delle impronte non disponibile (I/O). Transitoria per il worker che la riceve. */
public class StorageException extends RuntimeException {

  public StorageException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
