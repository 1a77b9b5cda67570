package org.danilorossi.mailmind.helpers;

import java.time.Duration;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.val;

/**
 * Politica di ritentativo con attesa esponenziale limitata. maxAttempts = 0 significa tentativi
 * illimitati (usato per la riconnessione IMAP).
 */
@Value
@Builder
public class RetryPolicy {

  @Builder.Default int maxAttempts = 3;
  @Builder.Default @NonNull Duration initialDelay = Duration.ofSeconds(1);
  @Builder.Default double multiplier = 2.0;
  @Builder.Default @NonNull Duration maxDelay = Duration.ofMinutes(5);

  public static RetryPolicy none() {
    return RetryPolicy.builder().maxAttempts(1).initialDelay(Duration.ZERO).build();
  }

  /** True se dopo failures tentativi falliti ne è consentito un altro. */
  public boolean canRetry(final int failures) {
    return maxAttempts <= 0 || failures < maxAttempts;
  }

  /** Attesa prima del tentativo successivo al fallimento numero failures (1-based). */
  public Duration delayAfter(final int failures) {
    if (failures <= 0 || initialDelay.isZero()) return Duration.ZERO;
    val capMs = maxDelay.toMillis();
    double ms = initialDelay.toMillis();
    for (int i = 1; i < failures && ms < capMs; i++) ms *= multiplier;
    return Duration.ofMillis((long) Math.min(ms, capMs));
  }
}
