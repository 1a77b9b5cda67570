package org.danilorossi.mailmind.helpers;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.lang.management.ManagementFactory;
import java.nio.ByteBuffer;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.java.Log;
import lombok.val;

/**
 * Lock di processo su un file sotto data/: impedisce che due istanze scrivano lo stesso journal
 * delle email elaborate.
 */
@Log
public final class SingleInstanceLock implements AutoCloseable {

  static {
    LogConfigurator.configLog(log);
  }

  @Getter private final Path lockPath;
  private final RandomAccessFile file;
  private final FileLock lock;
  private final Thread shutdownHook;

  private SingleInstanceLock(
      @NonNull final Path lockPath,
      @NonNull final RandomAccessFile file,
      @NonNull final FileLock lock,
      @NonNull final Thread shutdownHook) {
    this.lockPath = lockPath;
    this.file = file;
    this.lock = lock;
    this.shutdownHook = shutdownHook;
  }

  /** Lock esclusivo non bloccante sul percorso predefinito. */
  public static SingleInstanceLock acquire() throws IOException {
    return acquire(defaultLockPath());
  }

  /**
   * Prova ad acquisire un lock esclusivo (non bloccante). Se è già detenuto lancia
   * AlreadyRunningException con la nota scritta dal proprietario.
   */
  public static SingleInstanceLock acquire(@NonNull final Path lockPath) throws IOException {
    FileSystemUtils.ensureDir(lockPath.toAbsolutePath().getParent());
    val raf = new RandomAccessFile(lockPath.toFile(), "rw");
    FileLock fl;
    try {
      fl = raf.getChannel().tryLock(); // non-blocking
    } catch (OverlappingFileLockException heldHere) {
      fl = null; // già detenuto da questa stessa JVM
    } catch (IOException | RuntimeException e) {
      raf.close();
      throw e;
    }
    if (fl == null) {
      raf.close();
      throw new AlreadyRunningException("Lock held. Info: " + readNote(lockPath));
    }

    // Lock ottenuto: scriviamo nota informativa
    val ch = raf.getChannel();
    ch.truncate(0);
    ch.write(ByteBuffer.wrap(buildLockNote().getBytes(StandardCharsets.UTF_8)));
    ch.force(true);

    final FileLock held = fl;
    val hook = new Thread(() -> release(held, raf, lockPath), "single-instance-lock-shutdown");
    Runtime.getRuntime().addShutdownHook(hook);
    return new SingleInstanceLock(lockPath, raf, held, hook);
  }

  /** Percorso predefinito del lockfile sotto data/. */
  public static Path defaultLockPath() {
    // Consente override con -Dmailmind.lock=nomefile.lock (sempre dentro data/)
    val override = System.getProperty("mailmind.lock", "");
    val fileName = (!LangUtils.empty(override)) ? override : FileSystemUtils.LOCK_FILENAME;
    return FileSystemUtils.getDataPath(fileName);
  }

  private static String readNote(@NonNull final Path lockPath) {
    try {
      return FileSystemUtils.readUtf8(lockPath).trim();
    } catch (IOException e) {
      return "(nota non leggibile)";
    }
  }

  private static String buildLockNote() {
    return LangUtils.s(
        "pid={} startedAt={} cmd={}",
        ProcessHandle.current().pid(),
        Instant.now(),
        ManagementFactory.getRuntimeMXBean().getInputArguments());
  }

  private static void release(
      @NonNull final FileLock fl, @NonNull final RandomAccessFile raf, @NonNull final Path path) {
    try {
      if (fl.isValid()) fl.release();
      raf.close();
      Files.deleteIfExists(path);
    } catch (IOException e) {
      LangUtils.warn(log, "Rilascio lock {} incompleto: {}", path, LangUtils.exMsg(e));
    }
  }

  @Override
  public void close() {
    try {
      Runtime.getRuntime().removeShutdownHook(shutdownHook);
    } catch (IllegalStateException __) {
      // shutdown già in corso: ci pensa l'hook
      return;
    }
    release(lock, file, lockPath);
  }

  /** Lanciata quando è già in esecuzione un'altra istanza. */
  public static final class AlreadyRunningException extends IOException {
    public AlreadyRunningException(final String msg) {
      super(msg);
    }
  }
}
