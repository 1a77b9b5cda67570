package org.danilorossi.mailmind.db;

import static java.nio.file.StandardOpenOption.APPEND;
import static java.nio.file.StandardOpenOption.CREATE;
import static java.nio.file.StandardOpenOption.WRITE;

import com.google.gson.JsonParseException;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.stream.Stream;
import lombok.Getter;
import lombok.NonNull;
import lombok.Synchronized;
import lombok.extern.java.Log;
import lombok.val;
import org.danilorossi.mailmind.helpers.FileSystemUtils;
import org.danilorossi.mailmind.helpers.LangUtils;
import org.danilorossi.mailmind.helpers.LogConfigurator;
import org.danilorossi.mailmind.model.ProcessedRecord;

/**
 * Archivio delle impronte su journal JSON Lines (un {@link ProcessedRecord} per riga).
 *
 * <p>record() accoda la riga e forza il flush su disco prima di aggiornare l'indice in memoria:
 * quando ritorna, has() è vero da qualunque thread. prune() e reset() riscrivono il journal in
 * modo atomico (tmp + move). Le scritture passano tutte da writeLock, le letture vanno
 * sull'indice concorrente e vedono solo record completi.
 */
@Log
public class JsonFingerprintStore implements FingerprintStore {

  static {
    LogConfigurator.configLog(log);
  }

  /** Apertura del canale di append: sostituibile nei test. */
  @FunctionalInterface
  interface ChannelOpener {
    FileChannel open(Path journal) throws IOException;
  }

  private static final ChannelOpener DEFAULT_OPENER =
      p -> FileChannel.open(p, CREATE, WRITE, APPEND);

  private final Object writeLock = new Object();

  @Getter private final Path journal;
  private final Clock clock;
  private final Map<String, ProcessedRecord> index = new ConcurrentHashMap<>();
  private final ChannelOpener opener;

  private FileChannel appender; // aperto alla prima scrittura
  private boolean needsNewline; // coda troncata da un crash o da un append fallito

  public JsonFingerprintStore(@NonNull final Path journal) {
    this(journal, Clock.systemUTC());
  }

  public JsonFingerprintStore(@NonNull final Path journal, @NonNull final Clock clock) {
    this(journal, clock, DEFAULT_OPENER);
  }

  JsonFingerprintStore(
      @NonNull final Path journal,
      @NonNull final Clock clock,
      @NonNull final ChannelOpener opener) {
    this.journal = journal.toAbsolutePath().normalize();
    this.clock = clock;
    this.opener = opener;
    load();
  }

  private void load() {
    if (!Files.exists(journal)) {
      LangUtils.info(log, "Journal {} assente: archivio vuoto.", journal);
      return;
    }
    int lineNo = 0;
    int skipped = 0;
    try (final Stream<String> lines = Files.lines(journal, StandardCharsets.UTF_8)) {
      for (val line : (Iterable<String>) lines::iterator) {
        lineNo++;
        if (line.isBlank()) continue;
        try {
          val rec = JsonDb.lineGson().fromJson(line, ProcessedRecord.class);
          if (rec == null || !rec.isComplete()) {
            skipped++;
            continue;
          }
          index.putIfAbsent(rec.getFingerprint(), rec);
        } catch (JsonParseException ex) {
          skipped++;
          LangUtils.warn(
              log, "Riga {} del journal non valida, ignorata: {}", lineNo, ex.getMessage());
        }
      }
      needsNewline = !endsWithNewline(journal);
    } catch (IOException | RuntimeException e) {
      throw new StorageException(LangUtils.s("Impossibile leggere il journal {}", journal), e);
    }
    LangUtils.info(
        log, "Caricati {} record da {} ({} righe ignorate).", index.size(), journal, skipped);
  }

  private static boolean endsWithNewline(@NonNull final Path file) throws IOException {
    try (val raf = new RandomAccessFile(file.toFile(), "r")) {
      if (raf.length() == 0) return true;
      raf.seek(raf.length() - 1);
      return raf.read() == '\n';
    }
  }

  @Override
  public boolean has(@NonNull final String fingerprint) {
    return index.containsKey(fingerprint);
  }

  @Override
  @Synchronized("writeLock")
  public boolean record(
      @NonNull final String fingerprint,
      @NonNull final String account,
      @NonNull final Instant processedAt) {
    if (index.containsKey(fingerprint)) return false;
    val rec =
        ProcessedRecord.builder()
            .fingerprint(fingerprint)
            .account(account)
            .processedAtEpochMs(processedAt.toEpochMilli())
            .build();
    append(JsonDb.lineGson().toJson(rec));
    index.put(fingerprint, rec);
    return true;
  }

  private void append(@NonNull final String jsonLine) {
    try {
      if (appender == null) {
        FileSystemUtils.ensureDir(journal.getParent());
        appender = opener.open(journal);
      }
      val line = (needsNewline ? "\n" : "") + jsonLine + "\n";
      val buf = ByteBuffer.wrap(line.getBytes(StandardCharsets.UTF_8));
      while (buf.hasRemaining()) appender.write(buf);
      appender.force(false);
      needsNewline = false;
    } catch (IOException e) {
      // la riga può essere rimasta a metà: la prossima parte da una riga nuova
      needsNewline = true;
      closeAppender();
      throw new StorageException(LangUtils.s("Scrittura journal {} fallita", journal), e);
    }
  }

  @Override
  @Synchronized("writeLock")
  public int prune(final int maxAgeDays, final String accountFilter) {
    if (maxAgeDays < 0) throw new IllegalArgumentException("maxAgeDays must be >= 0");
    val cutoff = clock.instant().minus(Duration.ofDays(maxAgeDays)).toEpochMilli();
    val removed =
        removeWhere(r -> matches(r, accountFilter) && r.getProcessedAtEpochMs() < cutoff);
    LangUtils.info(
        log,
        "Pulizia: rimossi {} record più vecchi di {} giorni (account: {}).",
        removed,
        maxAgeDays,
        accountFilter == null ? "tutti" : accountFilter);
    return removed;
  }

  @Override
  @Synchronized("writeLock")
  public int reset(final String accountFilter) {
    val removed = removeWhere(r -> matches(r, accountFilter));
    LangUtils.info(
        log,
        "Reset: rimossi {} record (account: {}).",
        removed,
        accountFilter == null ? "tutti" : accountFilter);
    return removed;
  }

  /** Riscrive il journal senza i record che soddisfano p; l'indice cambia solo a file scritto. */
  private int removeWhere(@NonNull final Predicate<ProcessedRecord> p) {
    val doomed = index.values().stream().filter(p).map(ProcessedRecord::getFingerprint).toList();
    if (doomed.isEmpty()) return 0;

    final Set<String> doomedSet = new HashSet<>(doomed);
    val sb = new StringBuilder();
    index.values().stream()
        .filter(r -> !doomedSet.contains(r.getFingerprint()))
        .sorted(Comparator.comparingLong(ProcessedRecord::getProcessedAtEpochMs))
        .forEach(r -> sb.append(JsonDb.lineGson().toJson(r)).append('\n'));

    closeAppender();
    try {
      FileSystemUtils.writeUtf8Atomic(journal, sb.toString());
    } catch (IOException e) {
      throw new StorageException(LangUtils.s("Riscrittura journal {} fallita", journal), e);
    }
    needsNewline = false;
    doomed.forEach(index::remove);
    return doomed.size();
  }

  private static boolean matches(@NonNull final ProcessedRecord r, final String accountFilter) {
    return accountFilter == null || Objects.equals(r.getAccount(), accountFilter);
  }

  @Override
  public Iterable<ProcessedRecord> list(final String accountFilter) {
    return () ->
        index.values().stream()
            .filter(r -> matches(r, accountFilter))
            .sorted(Comparator.comparingLong(ProcessedRecord::getProcessedAtEpochMs).reversed())
            .iterator();
  }

  @Override
  public int count(final String accountFilter) {
    if (accountFilter == null) return index.size();
    return (int) index.values().stream().filter(r -> matches(r, accountFilter)).count();
  }

  @Override
  public List<String> accounts() {
    return index.values().stream().map(ProcessedRecord::getAccount).distinct().sorted().toList();
  }

  @Override
  @Synchronized("writeLock")
  public void close() {
    closeAppender();
  }

  private void closeAppender() {
    if (appender == null) return;
    try {
      appender.close();
    } catch (IOException e) {
      LangUtils.warn(log, "Chiusura journal {}: {}", journal, LangUtils.exMsg(e));
    } finally {
      appender = null;
    }
  }
}
