package org.danilorossi.mailmind.helpers;

import java.io.IOException;
import java.util.HashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;
import lombok.NonNull;
import lombok.experimental.UtilityClass;
import lombok.val;

/**
 * Configurazione centralizzata di java.util.logging: file a rotazione sotto data/ ed eco
 * opzionale su console (-DLOG_CONSOLE=true, utile in container).
 */
@UtilityClass
public class LogConfigurator {

  protected static final String LOG_FILE = "mailmind.log";
  private static final Handler LOG_HANDLER;
  private static final Handler CONSOLE_HANDLER;
  private static final AtomicBoolean ONCE = new AtomicBoolean(false);

  static {
    Handler handler;
    try {
      handler =
          new FileHandler(
              FileSystemUtils.getDataFile(LOG_FILE).getAbsolutePath(),
              1_000_000,
              5,
              true); // 1MB, 5 file
    } catch (IOException | RuntimeException ex) {
      System.err.println(
          LangUtils.s(
              "Impossibile aprire il file di log, uso la console: {}", LangUtils.exMsg(ex)));
      handler = new ConsoleHandler();
    }
    handler.setFormatter(new SimpleFormatter());
    try {
      handler.setEncoding("UTF-8");
    } catch (Exception __) {
      // encoding di default della piattaforma
    }
    LOG_HANDLER = handler;

    if (Boolean.parseBoolean(System.getProperty("LOG_CONSOLE", "false"))
        && !(handler instanceof ConsoleHandler)) {
      CONSOLE_HANDLER = new ConsoleHandler();
      CONSOLE_HANDLER.setFormatter(new SimpleFormatter());
      CONSOLE_HANDLER.setLevel(Level.ALL);
    } else {
      CONSOLE_HANDLER = null;
    }

    Runtime.getRuntime()
        .addShutdownHook(
            new Thread(
                () -> {
                  LOG_HANDLER.flush();
                  LOG_HANDLER.close();
                },
                "log-shutdown"));
  }

  public static void configLog(@NonNull final Logger logger) {
    // rimuove eventuali handler già presenti
    for (val h : logger.getHandlers()) logger.removeHandler(h);
    logger.addHandler(LOG_HANDLER);
    if (CONSOLE_HANDLER != null) logger.addHandler(CONSOLE_HANDLER);
    logger.setLevel(resolveLogLevel(System.getProperty("LOG_LEVEL", "INFO")));
    logger.setUseParentHandlers(false); // Disabilita console logging predefinito
    if (ONCE.compareAndSet(false, true))
      LogManager.getLogManager().getLogger("").setLevel(logger.getLevel());
  }

  static Level resolveLogLevel(@NonNull final String levelName) {
    // Mappa friendly name → JUL Level
    val map = new HashMap<String, Level>();
    map.put("DEBUG", Level.FINE);
    map.put("TRACE", Level.FINEST);
    map.put("WARN", Level.WARNING);
    map.put("ERROR", Level.SEVERE);

    val key = levelName.trim().toUpperCase();
    if (map.containsKey(key)) return map.get(key);

    try {
      return Level.parse(key);
    } catch (IllegalArgumentException e) {
      return Level.INFO;
    }
  }
}
