package org.danilorossi.mailmind.helpers;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ShutdownSignalTest {

  @Test
  @DisplayName("await scade senza richiesta di arresto")
  void testAwaitTimesOut() {
    ShutdownSignal s = new ShutdownSignal();

    assertThat(s.await(Duration.ofMillis(20))).isFalse();
    assertThat(s.await(Duration.ZERO)).isFalse();
    assertThat(s.isRequested()).isFalse();
  }

  @Test
  @DisplayName("request sblocca chi è in attesa")
  void testRequestWakesWaiter() throws Exception {
    ShutdownSignal s = new ShutdownSignal();
    boolean[] woke = new boolean[1];
    Thread t = new Thread(() -> woke[0] = s.await(Duration.ofMinutes(5)));
    t.start();

    s.request();
    t.join(5_000);

    assertThat(t.isAlive()).isFalse();
    assertThat(woke[0]).isTrue();
    assertThat(s.await(Duration.ofMinutes(5))).isTrue();
  }
}
