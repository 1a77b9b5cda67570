package org.danilorossi.mailmind.db;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import lombok.Getter;
import lombok.NonNull;
import lombok.Synchronized;
import lombok.extern.java.Log;
import org.danilorossi.mailmind.helpers.FileSystemUtils;
import org.danilorossi.mailmind.helpers.LangUtils;
import org.danilorossi.mailmind.helpers.LogConfigurator;
import org.danilorossi.mailmind.model.AppConfig;

/**
 * Persistenza su file JSON: configurazione (mailmind.json) e istanze Gson condivise.
 *
 * <p>Il journal delle impronte usa {@link #lineGson()} (una riga per record), i file di
 * configurazione {@link #gson()} (pretty printing).
 */
@Log
public class JsonDb {

  private static final Gson GSON =
      new GsonBuilder().setPrettyPrinting().serializeNulls().disableHtmlEscaping().create();

  private static final Gson LINE_GSON = new GsonBuilder().disableHtmlEscaping().create();

  static {
    LogConfigurator.configLog(log);
  }

  public static Gson gson() {
    return GSON;
  }

  public static Gson lineGson() {
    return LINE_GSON;
  }

  /** Scrive un oggetto su file JSON in maniera atomica (tmp + move). */
  static <T> void writeAtomic(@NonNull final Path file, @NonNull final T payload)
      throws IOException {
    try {
      FileSystemUtils.writeUtf8Atomic(file, gson().toJson(payload));
    } catch (IOException | RuntimeException ex) {
      LangUtils.err(log, "Errore scrittura {}: {}", ex, file, LangUtils.rootCauseMsg(ex));
      throw ex;
    }
  }

  public static ConfigStore config(@NonNull final Path file) {
    return new ConfigStore(file);
  }

  public static ConfigStore config() {
    return config(FileSystemUtils.getConfigJson());
  }

  /** File singolo: configurazione dell'applicazione. */
  public static class ConfigStore {
    private static final Object CONFIG_LOCK = new Object();

    @Getter private final Path file;

    ConfigStore(@NonNull final Path file) {
      this.file = file;
    }

    public boolean exists() {
      return Files.exists(file);
    }

    /**
     * Carica e valida la configurazione. File mancante o malformato = errore.
     */
    @Synchronized("CONFIG_LOCK")
    public AppConfig load() throws IOException {
      if (!Files.exists(file)) throw new NoSuchFileException(file.toString());
      final AppConfig cfg;
      try {
        cfg = gson().fromJson(FileSystemUtils.readUtf8(file), AppConfig.class);
      } catch (JsonParseException ex) {
        throw new IOException(
            LangUtils.s("Configurazione {} non valida: {}", file, LangUtils.rootCauseMsg(ex)), ex);
      }
      if (cfg == null) throw new IOException(LangUtils.s("Configurazione {} vuota", file));
      cfg.validate();
      LangUtils.info(
          log, "Configurazione caricata da {}: {} account.", file, cfg.getAccounts().size());
      return cfg;
    }

    @Synchronized("CONFIG_LOCK")
    public void save(@NonNull final AppConfig cfg) throws IOException {
      writeAtomic(file, cfg);
    }
  }
}
