package org.danilorossi.mailmind.classifier;

import lombok.Builder;
import lombok.Value;

/** Risposta grezza del classificatore per una email. */
@Value
@Builder
public class ClassificationResult {
  String categoryName; // null se la risposta non lo conteneva
  int confidence;
  @Builder.Default String rationale = "";
}
