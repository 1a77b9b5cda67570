package org.danilorossi.mailmind;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.danilorossi.mailmind.classifier.Classifier;
import org.danilorossi.mailmind.db.JsonFingerprintStore;
import org.danilorossi.mailmind.imap.AuthException;
import org.danilorossi.mailmind.imap.MailboxConnection;
import org.danilorossi.mailmind.model.Account;
import org.danilorossi.mailmind.model.AppConfig;
import org.danilorossi.mailmind.model.Category;
import org.danilorossi.mailmind.model.ProcessingOptions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MailMindTest {

  private static final Instant NOW = Instant.parse("2024-06-01T00:00:00Z");

  @TempDir Path tmp;

  private JsonFingerprintStore store;
  private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
  private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
  private String previousHome;

  @BeforeEach
  void setUp() {
    store =
        new JsonFingerprintStore(tmp.resolve("state.jsonl"), Clock.fixed(NOW, ZoneOffset.UTC));
    previousHome = System.getProperty("mailmind.home");
    System.setProperty("mailmind.home", tmp.resolve("home").toString());
  }

  @AfterEach
  void tearDown() {
    store.close();
    if (previousHome == null) System.clearProperty("mailmind.home");
    else System.setProperty("mailmind.home", previousHome);
  }

  private String output() {
    return buffer.toString(StandardCharsets.UTF_8);
  }

  private static Account account(final String name, final String... folders) {
    return Account.builder()
        .name(name)
        .host("imap." + name + ".example.com")
        .username(name)
        .folders(List.of(folders))
        .categories(List.of(Category.builder().name("INBOX").build()))
        .build();
  }

  private static AppConfig config(final Account... accounts) {
    return AppConfig.builder()
        .accounts(List.of(accounts))
        .options(
            ProcessingOptions.builder()
                .reconnectBaseDelaySeconds(0)
                .pruneAfterDays(0)
                .once(true)
                .build())
        .build();
  }

  @Test
  @DisplayName("selectAccounts: filtro per nome e cartella singola")
  void testSelectAccounts() {
    AppConfig cfg = config(account("work", "INBOX", "Clienti"), account("home", "INBOX"));

    assertThat(MailMind.selectAccounts(cfg, null, null)).hasSize(2);
    List<Account> work = MailMind.selectAccounts(cfg, "WORK", "Clienti");
    assertThat(work).singleElement().extracting(Account::getFolders).isEqualTo(List.of("Clienti"));
    assertThatThrownBy(() -> MailMind.selectAccounts(cfg, "office", null))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("office");
  }

  @Test
  @DisplayName("-state view: riepilogo per account e righe dal più recente")
  void testViewState() {
    store.record("aaa", "work", NOW.minus(Duration.ofDays(2)));
    store.record("bbb", "home", NOW.minus(Duration.ofDays(1)));

    int code = MailMind.viewState(store, null, out);

    assertThat(code).isEqualTo(MailMind.EXIT_OK);
    assertThat(output())
        .contains("Email elaborate: 2")
        .contains("  home: 1")
        .contains("  work: 1");
    assertThat(output().indexOf("bbb")).isLessThan(output().indexOf("aaa"));
  }

  @Test
  @DisplayName("-state clean: rimuove i record oltre i giorni indicati")
  void testManageStateClean() {
    store.record("old", "work", NOW.minus(Duration.ofDays(40)));
    store.record("new", "work", NOW.minus(Duration.ofDays(1)));

    int code = MailMind.manageState(store, CliArgs.parse("-state", "clean", "-days", "30"), out);

    assertThat(code).isEqualTo(MailMind.EXIT_OK);
    assertThat(store.has("old")).isFalse();
    assertThat(store.has("new")).isTrue();
    assertThat(output()).contains("Rimossi 1 record");
  }

  @Test
  @DisplayName("-state reset -account: svuota solo quell'account")
  void testManageStateReset() {
    store.record("w", "work", NOW);
    store.record("h", "home", NOW);

    MailMind.manageState(store, CliArgs.parse("-state", "reset", "-account", "work"), out);

    assertThat(store.has("w")).isFalse();
    assertThat(store.has("h")).isTrue();
    assertThat(output()).contains("account work");
  }

  @Test
  @DisplayName("Nessun account riesce a partire: codice di uscita 1")
  void testMonitorAllFailed() throws Exception {
    MailboxConnection conn = mock(MailboxConnection.class);
    doThrow(new AuthException("credenziali rifiutate", null)).when(conn).connect();
    Classifier classifier = mock(Classifier.class);

    int code =
        MailMind.monitor(
            List.of(account("work", "INBOX"), account("home", "INBOX")),
            config(account("work", "INBOX")),
            classifier,
            a -> conn);

    assertThat(code).isEqualTo(MailMind.EXIT_ALL_FAILED);
  }

  @Test
  @DisplayName("Passata singola su casella vuota: codice di uscita 0")
  void testMonitorOnceEmptyMailbox() throws Exception {
    MailboxConnection conn = mock(MailboxConnection.class);
    when(conn.listUnhandled(any(), anyInt())).thenReturn(List.of());
    Classifier classifier = mock(Classifier.class);

    int code =
        MailMind.monitor(
            List.of(account("work", "INBOX")),
            config(account("work", "INBOX")),
            classifier,
            a -> conn);

    assertThat(code).isEqualTo(MailMind.EXIT_OK);
  }

  @Test
  @DisplayName("Opzione sconosciuta: codice di uscita 2")
  void testRunUsageError() {
    assertThat(MailMind.run(new String[] {"-nonesiste"})).isEqualTo(MailMind.EXIT_USAGE);
    assertThat(MailMind.run(new String[] {"-help"})).isEqualTo(MailMind.EXIT_OK);
  }
}
