package org.danilorossi.mailmind.helpers;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SingleInstanceLockTest {

  @TempDir Path tmp;

  @Test
  @DisplayName("Seconda acquisizione rifiutata finché la prima non viene rilasciata")
  void testExclusive() throws Exception {
    Path lockFile = tmp.resolve("mailmind.lock");

    try (SingleInstanceLock first = SingleInstanceLock.acquire(lockFile)) {
      assertThat(Files.readString(lockFile)).contains("pid=");
      assertThatThrownBy(() -> SingleInstanceLock.acquire(lockFile))
          .isInstanceOf(SingleInstanceLock.AlreadyRunningException.class);
    }

    assertThat(Files.exists(lockFile)).isFalse();
    try (SingleInstanceLock again = SingleInstanceLock.acquire(lockFile)) {
      assertThat(Files.exists(lockFile)).isTrue();
    }
  }
}
