package org.danilorossi.mailmind.model;

import java.time.Duration;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;
import org.danilorossi.mailmind.helpers.LangUtils;
import org.danilorossi.mailmind.helpers.RetryPolicy;

/** Opzioni di elaborazione globali (sezione "options" di mailmind.json). */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Accessors(chain = true)
public class ProcessingOptions {

  @Builder.Default private int batchSize = 10;

  /** Messaggi elencati per passata di svuotamento; 0 = nessun limite. */
  @Builder.Default private int maxMessagesPerRun = 100;

  @Builder.Default private int idleTimeoutSeconds = 300;

  @Builder.Default private int reconnectBaseDelaySeconds = 60;
  @Builder.Default private int reconnectMaxDelaySeconds = 300;

  @Builder.Default private int batchMaxAttempts = 3;
  @Builder.Default private long batchRetryDelayMillis = 2_000L;
  @Builder.Default private int messageMaxAttempts = 2;

  @Builder.Default private int storageRetryDelaySeconds = 10;

  /** Richieste contemporanee al classificatore, condivise fra tutti gli account. */
  @Builder.Default private int maxConcurrentRequests = 4;

  /** Pulizia all'avvio dei record più vecchi di N giorni; 0 = disattivata. */
  @Builder.Default private int pruneAfterDays = 30;

  @Builder.Default private String fingerprintMode = FingerprintMode.MESSAGE_ID.name();

  @Builder.Default private boolean dryRun = false;

  /** Una sola passata per account, senza IDLE. */
  @Builder.Default private boolean once = false;

  public Duration idleTimeout() {
    return Duration.ofSeconds(idleTimeoutSeconds);
  }

  public Duration storageRetryDelay() {
    return Duration.ofSeconds(storageRetryDelaySeconds);
  }

  public FingerprintMode fingerprint() {
    return FingerprintMode.parse(fingerprintMode);
  }

  /** Riconnessione: esponenziale, limitata, senza numero massimo di tentativi. */
  public RetryPolicy reconnectPolicy() {
    return RetryPolicy.builder()
        .maxAttempts(0)
        .initialDelay(Duration.ofSeconds(reconnectBaseDelaySeconds))
        .maxDelay(Duration.ofSeconds(Math.max(reconnectBaseDelaySeconds, reconnectMaxDelaySeconds)))
        .build();
  }

  public RetryPolicy batchPolicy() {
    return RetryPolicy.builder()
        .maxAttempts(Math.max(1, batchMaxAttempts))
        .initialDelay(Duration.ofMillis(batchRetryDelayMillis))
        .maxDelay(Duration.ofMillis(batchRetryDelayMillis * 8))
        .build();
  }

  public RetryPolicy messagePolicy() {
    return RetryPolicy.builder()
        .maxAttempts(Math.max(1, messageMaxAttempts))
        .initialDelay(Duration.ofMillis(batchRetryDelayMillis))
        .maxDelay(Duration.ofMillis(batchRetryDelayMillis * 4))
        .build();
  }

  public void validate() throws IllegalArgumentException {
    if (batchSize <= 0)
      throw new IllegalArgumentException(LangUtils.s("batchSize must be > 0: {}", batchSize));
    if (idleTimeoutSeconds <= 0)
      throw new IllegalArgumentException(
          LangUtils.s("idleTimeoutSeconds must be > 0: {}", idleTimeoutSeconds));
    if (maxMessagesPerRun < 0)
      throw new IllegalArgumentException("maxMessagesPerRun must be >= 0");
    if (maxConcurrentRequests <= 0)
      throw new IllegalArgumentException("maxConcurrentRequests must be > 0");
    if (reconnectBaseDelaySeconds < 0 || storageRetryDelaySeconds < 0 || batchRetryDelayMillis < 0)
      throw new IllegalArgumentException("retry delays must be >= 0");
  }
}
