package org.danilorossi.mailmind.model;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Riga del journal: messaggio già instradato. Scritta una volta, mai aggiornata. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProcessedRecord {

  private String fingerprint;
  private String account;
  private long processedAtEpochMs;

  public Instant processedAt() {
    return Instant.ofEpochMilli(processedAtEpochMs);
  }

  /** True se la riga letta dal journal ha i campi obbligatori. */
  public boolean isComplete() {
    return fingerprint != null && !fingerprint.isBlank() && account != null;
  }
}
