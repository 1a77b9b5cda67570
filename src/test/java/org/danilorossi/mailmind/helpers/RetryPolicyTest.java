package org.danilorossi.mailmind.helpers;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RetryPolicyTest {

  @Test
  @DisplayName("Attesa esponenziale limitata da maxDelay")
  void testExponentialCapped() {
    RetryPolicy p =
        RetryPolicy.builder()
            .maxAttempts(0)
            .initialDelay(Duration.ofSeconds(60))
            .maxDelay(Duration.ofSeconds(300))
            .build();

    assertThat(p.delayAfter(1)).isEqualTo(Duration.ofSeconds(60));
    assertThat(p.delayAfter(2)).isEqualTo(Duration.ofSeconds(120));
    assertThat(p.delayAfter(3)).isEqualTo(Duration.ofSeconds(240));
    assertThat(p.delayAfter(4)).isEqualTo(Duration.ofSeconds(300));
    assertThat(p.delayAfter(50)).isEqualTo(Duration.ofSeconds(300));
  }

  @Test
  @DisplayName("maxAttempts = 0: tentativi illimitati")
  void testUnlimited() {
    RetryPolicy p = RetryPolicy.builder().maxAttempts(0).build();

    assertThat(p.canRetry(1_000)).isTrue();
  }

  @Test
  @DisplayName("maxAttempts = 3: due ritentativi dopo il primo fallimento")
  void testLimited() {
    RetryPolicy p = RetryPolicy.builder().maxAttempts(3).build();

    assertThat(p.canRetry(1)).isTrue();
    assertThat(p.canRetry(2)).isTrue();
    assertThat(p.canRetry(3)).isFalse();
    assertThat(RetryPolicy.none().canRetry(1)).isFalse();
  }

  @Test
  @DisplayName("Attesa iniziale zero: nessuna attesa")
  void testZeroDelay() {
    RetryPolicy p = RetryPolicy.builder().initialDelay(Duration.ZERO).build();

    assertThat(p.delayAfter(5)).isZero();
    assertThat(p.delayAfter(0)).isZero();
  }
}
