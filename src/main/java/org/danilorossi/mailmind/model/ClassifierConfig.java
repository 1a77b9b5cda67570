package org.danilorossi.mailmind.model;

import lombok.*;
import lombok.experimental.Accessors;

/** Servizio di classificazione compatibile OpenAI (chat completions). */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Accessors(chain = true)
public class ClassifierConfig {

  @Builder.Default private String baseUrl = "https://api.openai.com/v1";

  /** Se vuota si usa la variabile d'ambiente OPENAI_API_KEY. */
  private String apiKey;

  @Builder.Default private String model = "gpt-4o-mini";

  @Builder.Default private double temperature = 0.7;

  @Builder.Default private int maxTokens = 1000;

  /** Caratteri di corpo inviati per ogni email. */
  @Builder.Default private int maxBodyChars = 1000;

  /** ms */
  @Builder.Default private int connectTimeoutMillis = 10_000;

  /** ms */
  @Builder.Default private int requestTimeoutMillis = 120_000;
}
