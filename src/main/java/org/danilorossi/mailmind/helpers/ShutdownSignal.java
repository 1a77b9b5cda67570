package org.danilorossi.mailmind.helpers;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import lombok.NonNull;

/** Segnale di arresto cooperativo condiviso fra orchestratore, worker e dispatcher. */
public final class ShutdownSignal {

  private final CountDownLatch latch = new CountDownLatch(1);

  public void request() {
    latch.countDown();
  }

  public boolean isRequested() {
    return latch.getCount() == 0;
  }

  /**
   * Attende al massimo d. Ritorna true se nel frattempo è stato richiesto l'arresto (anche per
   * interruzione del thread).
   */
  public boolean await(@NonNull final Duration d) {
    if (d.isZero() || d.isNegative()) return isRequested();
    try {
      return latch.await(d.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      return true;
    }
  }
}
