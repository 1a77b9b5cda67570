package org.danilorossi.mailmind.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.List;
import java.util.Properties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AccountTest {

  private static Account.AccountBuilder valid() {
    return Account.builder()
        .name("work")
        .host("imap.example.com")
        .username("me@example.com")
        .categories(
            List.of(
                Category.builder().name("INBOX").build(),
                Category.builder().name("Newsletter").folder("Promo/News").build(),
                Category.builder().name("Fatture").build()));
  }

  @Test
  @DisplayName("Account valido: nessuna eccezione")
  void testValid() {
    valid().build().validate();
  }

  @Test
  @DisplayName("Campi obbligatori e categorie verificati")
  void testInvalid() {
    assertThatThrownBy(() -> valid().host(" ").build().validate())
        .hasMessageContaining("host");
    assertThatThrownBy(() -> valid().port(0).build().validate())
        .hasMessageContaining("port");
    assertThatThrownBy(() -> valid().folders(List.of()).build().validate())
        .hasMessageContaining("folders");
    assertThatThrownBy(() -> valid().categories(List.of()).build().validate())
        .hasMessageContaining("no categories");
    assertThatThrownBy(
            () ->
                valid()
                    .categories(
                        List.of(
                            Category.builder().name("News").build(),
                            Category.builder().name("news").build()))
                    .build()
                    .validate())
        .hasMessageContaining("duplicate");
  }

  @Test
  @DisplayName("findCategory ignora maiuscole e spazi")
  void testFindCategory() {
    Account a = valid().build();

    assertThat(a.findCategory(" NEWSLETTER ").getName()).isEqualTo("Newsletter");
    assertThat(a.findCategory("spam")).isNull();
    assertThat(a.findCategory(null)).isNull();
  }

  @Test
  @DisplayName("targetFolder: INBOX resta nella sorgente, cartella vuota = nome categoria")
  void testTargetFolder() {
    Account a = valid().build();

    assertThat(a.findCategory("inbox").targetFolder("Clienti")).isEqualTo("Clienti");
    assertThat(a.findCategory("newsletter").targetFolder("INBOX")).isEqualTo("Promo/News");
    assertThat(a.findCategory("fatture").targetFolder("INBOX")).isEqualTo("Fatture");
  }

  @Test
  @DisplayName("Proprietà Jakarta Mail: IMAPS, PEEK e read timeout oltre l'attesa IDLE")
  void testToProperties() {
    Properties p = valid().build().toProperties(Duration.ofMinutes(5));

    assertThat(p.getProperty("mail.imaps.host")).isEqualTo("imap.example.com");
    assertThat(p.getProperty("mail.imaps.ssl.enable")).isEqualTo("true");
    assertThat(p.getProperty("mail.imaps.peek")).isEqualTo("true");
    assertThat(Long.parseLong(p.getProperty("mail.imaps.timeout"))).isGreaterThan(300_000L);
  }

  @Test
  @DisplayName("ssl=false: protocollo imap con STARTTLS")
  void testStartTls() {
    Account a = valid().ssl(false).port(143).build();

    assertThat(a.getStoreProtocol()).isEqualTo("imap");
    assertThat(a.toProperties(Duration.ofMinutes(1)).getProperty("mail.imap.starttls.enable"))
        .isEqualTo("true");
  }

  @Test
  @DisplayName("withSingleFolder restringe le cartelle sorgente")
  void testWithSingleFolder() {
    Account a = valid().folders(List.of("INBOX", "Clienti")).build();

    assertThat(a.withSingleFolder("Clienti").getFolders()).containsExactly("Clienti");
    assertThat(a.getFolders()).containsExactly("INBOX", "Clienti");
  }

  @Test
  @DisplayName("AppConfig: nomi account duplicati rifiutati")
  void testAppConfigDuplicateAccounts() {
    AppConfig cfg =
        AppConfig.builder()
            .accounts(List.of(valid().build(), valid().name("WORK").build()))
            .build();

    assertThatThrownBy(cfg::validate)
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Duplicate");
  }

  @Test
  @DisplayName("FingerprintMode.parse tollera maiuscole e trattini")
  void testFingerprintModeParse() {
    assertThat(FingerprintMode.parse("composite")).isEqualTo(FingerprintMode.COMPOSITE);
    assertThat(FingerprintMode.parse("message-id")).isEqualTo(FingerprintMode.MESSAGE_ID);
    assertThat(FingerprintMode.parse(null)).isEqualTo(FingerprintMode.MESSAGE_ID);
  }
}
