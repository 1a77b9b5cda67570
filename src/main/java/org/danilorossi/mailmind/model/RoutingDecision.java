package org.danilorossi.mailmind.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Esito della classificazione di un messaggio. Se failureReason è valorizzato la classificazione
 * è fallita: il messaggio resta dov'è e non viene registrato.
 */
@Value
@Builder
public class RoutingDecision {
  @NonNull String fingerprint;
  Category category;
  int confidence;
  @Builder.Default String rationale = "";
  String failureReason;

  public boolean isFailed() {
    return failureReason != null;
  }

  public static RoutingDecision routed(
      final String fingerprint, final Category category, final int confidence, final String why) {
    return RoutingDecision.builder()
        .fingerprint(fingerprint)
        .category(category)
        .confidence(confidence)
        .rationale(why == null ? "" : why)
        .build();
  }

  public static RoutingDecision failed(final String fingerprint, final String reason) {
    return RoutingDecision.builder()
        .fingerprint(fingerprint)
        .failureReason(reason == null ? "classificazione fallita" : reason)
        .build();
  }
}
