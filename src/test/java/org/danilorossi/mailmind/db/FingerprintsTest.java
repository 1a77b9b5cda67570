package org.danilorossi.mailmind.db;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import org.danilorossi.mailmind.model.FingerprintMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class FingerprintsTest {

  private static final Instant DATE = Instant.parse("2024-02-10T08:00:00Z");

  @Test
  @DisplayName("Stessi metadati, stessa impronta esadecimale di 64 caratteri")
  void testDeterministic() {
    String a = Fingerprints.of(FingerprintMode.MESSAGE_ID, "work", "<1@x>", "a@x", "ciao", DATE);
    String b = Fingerprints.of(FingerprintMode.MESSAGE_ID, "work", "<1@x>", "a@x", "ciao", DATE);

    assertThat(a).isEqualTo(b).hasSize(64).matches("[0-9a-f]+");
  }

  @Test
  @DisplayName("MESSAGE_ID: conta solo il Message-ID")
  void testMessageIdMode() {
    String a = Fingerprints.of(FingerprintMode.MESSAGE_ID, "work", "<1@x>", "a@x", "ciao", DATE);
    String b =
        Fingerprints.of(FingerprintMode.MESSAGE_ID, "work", "<1@x>", "b@x", "Re: ciao", null);

    assertThat(a).isEqualTo(b);
  }

  @Test
  @DisplayName("MESSAGE_ID senza Message-ID: si usano mittente, oggetto e data")
  void testMessageIdModeFallback() {
    String a = Fingerprints.of(FingerprintMode.MESSAGE_ID, "work", null, "a@x", "ciao", DATE);
    String b = Fingerprints.of(FingerprintMode.MESSAGE_ID, "work", "", "a@x", "ciao", DATE);
    String c = Fingerprints.of(FingerprintMode.MESSAGE_ID, "work", null, "a@x", "altro", DATE);

    assertThat(a).isEqualTo(b).isNotEqualTo(c);
  }

  @Test
  @DisplayName("COMPOSITE: mittente e oggetto cambiano l'impronta")
  void testCompositeMode() {
    String a = Fingerprints.of(FingerprintMode.COMPOSITE, "work", "<1@x>", "a@x", "ciao", DATE);
    String b = Fingerprints.of(FingerprintMode.COMPOSITE, "work", "<1@x>", "b@x", "ciao", DATE);

    assertThat(a).isNotEqualTo(b);
  }

  @Test
  @DisplayName("COMPOSITE: spostare ':' tra mittente e oggetto cambia l'impronta")
  void testCompositeFieldBoundaries() {
    String a = Fingerprints.of(FingerprintMode.COMPOSITE, "work", "", "a:b", "c", DATE);
    String b = Fingerprints.of(FingerprintMode.COMPOSITE, "work", "", "a", "b:c", DATE);
    String c = Fingerprints.of(FingerprintMode.MESSAGE_ID, "work", null, "a:b", "c", DATE);
    String d = Fingerprints.of(FingerprintMode.MESSAGE_ID, "work", null, "a", "b:c", DATE);

    assertThat(a).isNotEqualTo(b);
    assertThat(c).isNotEqualTo(d);
  }

  @Test
  @DisplayName("Lo stesso messaggio su due account ha impronte diverse")
  void testAccountScoped() {
    String a = Fingerprints.of(FingerprintMode.MESSAGE_ID, "work", "<1@x>", "", "", null);
    String b = Fingerprints.of(FingerprintMode.MESSAGE_ID, "home", "<1@x>", "", "", null);

    assertThat(a).isNotEqualTo(b);
  }
}
