package org.danilorossi.mailmind.model;

import java.time.Instant;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Metadati minimi di un messaggio nella casella: sufficienti per l'impronta, per il prompt e per
 * recuperare il testo tramite (folder, uid).
 */
@Value
@Builder
public class MessageRef {
  @NonNull String accountName;
  @NonNull String folder;
  long uid;
  @Builder.Default String messageId = "";
  @Builder.Default String sender = "";
  @Builder.Default String subject = "";
  Instant date; // può mancare
  @NonNull String fingerprint;
}
