package org.danilorossi.mailmind;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import lombok.NonNull;
import lombok.extern.java.Log;
import lombok.val;
import org.danilorossi.mailmind.classifier.CategorizationDispatcher;
import org.danilorossi.mailmind.classifier.Classifier;
import org.danilorossi.mailmind.classifier.OpenAiClassifier;
import org.danilorossi.mailmind.db.FingerprintStore;
import org.danilorossi.mailmind.db.JsonDb;
import org.danilorossi.mailmind.db.JsonFingerprintStore;
import org.danilorossi.mailmind.db.StorageException;
import org.danilorossi.mailmind.helpers.FileSystemUtils;
import org.danilorossi.mailmind.helpers.LangUtils;
import org.danilorossi.mailmind.helpers.LogConfigurator;
import org.danilorossi.mailmind.helpers.ShutdownSignal;
import org.danilorossi.mailmind.helpers.SingleInstanceLock;
import org.danilorossi.mailmind.helpers.SingleInstanceLock.AlreadyRunningException;
import org.danilorossi.mailmind.imap.ImapMailboxConnection;
import org.danilorossi.mailmind.imap.MailboxConnectionFactory;
import org.danilorossi.mailmind.model.Account;
import org.danilorossi.mailmind.model.AppConfig;
import org.danilorossi.mailmind.model.Category;
import org.danilorossi.mailmind.tui.ConsoleTUI;
import org.danilorossi.mailmind.worker.Orchestrator;

/** Punto di ingresso: monitoraggio delle caselle oppure gestione dell'archivio delle impronte. */
@Log
public class MailMind {

  static {
    LogConfigurator.configLog(log);
  }

  public static final int EXIT_OK = 0;
  public static final int EXIT_ALL_FAILED = 1;
  public static final int EXIT_USAGE = 2;
  public static final int EXIT_ALREADY_RUNNING = 3;

  private static final DateTimeFormatter TS =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneId.systemDefault());

  public static void main(String[] args) {
    System.exit(run(args));
  }

  static int run(final String[] args) {
    final CliArgs cli;
    try {
      cli = CliArgs.parse(args);
    } catch (IllegalArgumentException e) {
      System.err.println(e.getMessage());
      printUsage(System.err);
      return EXIT_USAGE;
    }
    if (cli.isHelp()) {
      printUsage(System.out);
      return EXIT_OK;
    }

    // la sola consultazione non scrive nulla: niente lock
    if ("view".equals(cli.getStateCommand())) return viewState(cli, System.out);

    try (val ignored = SingleInstanceLock.acquire()) {
      LangUtils.info(log, "Lock acquisito su {}", SingleInstanceLock.defaultLockPath());
      if (cli.isStateMode()) return manageState(cli, System.out);
      if (cli.isTui()) return runTui();
      return runMonitor(cli);
    } catch (AlreadyRunningException busy) {
      LangUtils.warn(log, "MailMind già in esecuzione: {}", busy.getMessage());
      System.err.println("MailMind è già in esecuzione.");
      return EXIT_ALREADY_RUNNING;
    } catch (IOException e) {
      LangUtils.err(log, "Errore: {}", e, LangUtils.exMsg(e));
      System.err.println("Errore: " + LangUtils.exMsg(e));
      return EXIT_USAGE;
    }
  }

  private static void printUsage(@NonNull final PrintStream out) {
    out.println("Utilizzo: java -jar mailmind.jar [opzioni]");
    out.println("Opzioni:");
    out.println("  -help                 Mostra questo messaggio di aiuto");
    out.println("  -config <file>        File di configurazione (predefinito data/mailmind.json)");
    out.println("  -account <nome>       Elabora solo questo account");
    out.println("  -folder <cartella>    Monitora solo questa cartella sorgente");
    out.println("  -dry-run              Classifica senza spostare né registrare");
    out.println("  -once                 Una sola passata, senza attesa IDLE");
    out.println("  -state view|clean|reset  Gestione delle email elaborate (con -account)");
    out.println("  -days <n>             Con -state clean: conserva gli ultimi n giorni (30)");
    out.println("  -tui                  Console testuale dello stato");
    out.println("  (nessuna)             Monitora tutte le caselle configurate");
  }

  // ---------------------------------------------------------------- stato

  private static FingerprintStore openStore() {
    return new JsonFingerprintStore(FileSystemUtils.getProcessedJournal());
  }

  static int viewState(@NonNull final CliArgs cli, @NonNull final PrintStream out) {
    try (val store = openStore()) {
      return viewState(store, cli.getAccount(), out);
    } catch (StorageException e) {
      System.err.println("Archivio non leggibile: " + LangUtils.rootCauseMsg(e));
      return EXIT_USAGE;
    }
  }

  static int viewState(
      @NonNull final FingerprintStore store, final String account, @NonNull final PrintStream out) {
    val accounts = account == null ? store.accounts() : List.of(account);
    out.println(LangUtils.s("Email elaborate: {}", store.count(account)));
    for (val a : accounts) out.println(LangUtils.s("  {}: {}", a, store.count(a)));
    out.println();
    for (val r : store.list(account))
      out.println(
          LangUtils.s(
              "{}  {}  {}", TS.format(r.processedAt()), r.getAccount(), r.getFingerprint()));
    return EXIT_OK;
  }

  static int manageState(@NonNull final CliArgs cli, @NonNull final PrintStream out) {
    try (val store = openStore()) {
      return manageState(store, cli, out);
    } catch (StorageException e) {
      System.err.println("Archivio non disponibile: " + LangUtils.rootCauseMsg(e));
      return EXIT_USAGE;
    }
  }

  static int manageState(
      @NonNull final FingerprintStore store,
      @NonNull final CliArgs cli,
      @NonNull final PrintStream out) {
    val scope = cli.getAccount() == null ? "tutti gli account" : "account " + cli.getAccount();
    switch (cli.getStateCommand()) {
      case "clean" -> {
        val days = cli.getDays() == null ? 30 : cli.getDays();
        val removed = store.prune(days, cli.getAccount());
        out.println(
            LangUtils.s(
                "Rimossi {} record più vecchi di {} giorni ({}).", removed, days, scope));
      }
      case "reset" -> {
        val removed = store.reset(cli.getAccount());
        out.println(LangUtils.s("Rimossi {} record ({}).", removed, scope));
      }
      default -> {
        return viewState(store, cli.getAccount(), out);
      }
    }
    return EXIT_OK;
  }

  private static int runTui() throws IOException {
    try (val store = openStore()) {
      new ConsoleTUI(store).start();
    }
    return EXIT_OK;
  }

  // ---------------------------------------------------------------- monitoraggio

  private static int runMonitor(@NonNull final CliArgs cli) throws IOException {
    val configFile =
        cli.getConfigPath() == null
            ? FileSystemUtils.getConfigJson()
            : Paths.get(cli.getConfigPath()).toAbsolutePath().normalize();

    final AppConfig config;
    try {
      config = JsonDb.config(configFile).load();
    } catch (NoSuchFileException missing) {
      writeTemplate(configFile);
      return EXIT_USAGE;
    } catch (IllegalArgumentException e) {
      System.err.println("Configurazione non valida: " + e.getMessage());
      return EXIT_USAGE;
    }

    final List<Account> accounts;
    try {
      accounts = selectAccounts(config, cli.getAccount(), cli.getFolder());
    } catch (IllegalArgumentException e) {
      System.err.println(e.getMessage());
      return EXIT_USAGE;
    }

    val options = config.getOptions();
    if (cli.isDryRun()) options.setDryRun(true);
    if (cli.isOnce()) options.setOnce(true);

    final Classifier classifier;
    try {
      classifier = new OpenAiClassifier(config.getClassifier());
    } catch (IllegalArgumentException e) {
      System.err.println(e.getMessage());
      return EXIT_USAGE;
    }

    return monitor(accounts, config, classifier, ImapMailboxConnection.factory(options));
  }

  static int monitor(
      @NonNull final List<Account> accounts,
      @NonNull final AppConfig config,
      @NonNull final Classifier classifier,
      @NonNull final MailboxConnectionFactory connections) {
    val options = config.getOptions();
    val shutdown = new ShutdownSignal();
    try (val store = openStore()) {
      val dispatcher = CategorizationDispatcher.fromOptions(classifier, options, shutdown);
      val orchestrator =
          new Orchestrator(
              accounts, options, store, dispatcher, connections, shutdown, Clock.systemUTC());

      val hook =
          new Thread(
              () -> {
                orchestrator.shutdown();
                try {
                  orchestrator.awaitTermination(Duration.ofSeconds(30));
                } catch (InterruptedException ie) {
                  Thread.currentThread().interrupt();
                }
              },
              "mailmind-shutdown");
      Runtime.getRuntime().addShutdownHook(hook);

      orchestrator.start();
      try {
        orchestrator.awaitTermination();
      } catch (InterruptedException ie) {
        Thread.currentThread().interrupt();
        orchestrator.shutdown();
      }

      try {
        Runtime.getRuntime().removeShutdownHook(hook);
      } catch (IllegalStateException closing) {
        LangUtils.debug(log, "JVM in chiusura, hook di arresto già in esecuzione.");
      }

      val report = orchestrator.report();
      LangUtils.info(log, "Esecuzione terminata: {}", report.describe());
      System.out.println(report.describe());
      return report.exitCode();
    }
  }

  /** Account da monitorare, filtrati per nome e limitati a una cartella se richiesto. */
  static List<Account> selectAccounts(
      @NonNull final AppConfig config, final String accountName, final String folder)
      throws IllegalArgumentException {
    val out = new ArrayList<Account>();
    for (val a : config.getAccounts()) {
      if (accountName != null && !accountName.equalsIgnoreCase(LangUtils.nz(a.getName()).trim()))
        continue;
      out.add(folder == null ? a : a.withSingleFolder(folder));
    }
    if (out.isEmpty())
      throw new IllegalArgumentException(
          LangUtils.s("Account '{}' non presente nella configurazione", accountName));
    return out;
  }

  /** Scrive un file di esempio da completare e spiega cosa fare. */
  private static void writeTemplate(@NonNull final Path configFile) throws IOException {
    val sample =
        AppConfig.builder()
            .accounts(
                new ArrayList<>(
                    List.of(
                        Account.builder()
                            .name("personale")
                            .host("imap.example.com")
                            .username("me@example.com")
                            .password("")
                            .categories(
                                new ArrayList<>(
                                    List.of(
                                        Category.builder()
                                            .name(Category.INBOX)
                                            .description("Email personali e importanti")
                                            .build(),
                                        Category.builder()
                                            .name("NEWSLETTER")
                                            .description("Newsletter e comunicazioni periodiche")
                                            .folder("Newsletter")
                                            .build(),
                                        Category.builder()
                                            .name("FATTURE")
                                            .description("Fatture, ricevute e pagamenti")
                                            .folder("Fatture")
                                            .build())))
                            .build())))
            .build();
    JsonDb.config(configFile).save(sample);
    LangUtils.warn(log, "Configurazione assente: creato un esempio in {}", configFile);
    System.err.println(
        "Configurazione non trovata. Creato un file di esempio da completare: " + configFile);
  }
}
