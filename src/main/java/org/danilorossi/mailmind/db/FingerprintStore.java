package org.danilorossi.mailmind.db;

import java.time.Instant;
import java.util.List;
import org.danilorossi.mailmind.model.ProcessedRecord;

/**
 * Registro durevole dei messaggi già instradati, condiviso da tutti i worker. Le scritture sono
 * serializzate; una impronta registrata è subito visibile a ogni lettore. I metodi lanciano
 * {@link StorageException} se l'archivio non è disponibile.
 *
 * <p>accountFilter null = tutti gli account.
 */
public interface FingerprintStore extends AutoCloseable {

  boolean has(String fingerprint);

  /** Idempotente: ritorna false se l'impronta era già presente. */
  boolean record(String fingerprint, String account, Instant processedAt);

  /** Elimina i record più vecchi di maxAgeDays giorni; ritorna quanti. */
  int prune(int maxAgeDays, String accountFilter);

  /** Elimina tutti i record (dell'account, se indicato); ritorna quanti. */
  int reset(String accountFilter);

  /** Sequenza pigra e riavviabile, dal più recente. */
  Iterable<ProcessedRecord> list(String accountFilter);

  int count(String accountFilter);

  List<String> accounts();

  @Override
  void close();
}
