package org.danilorossi.mailmind.helpers;

import java.util.logging.Level;
import java.util.logging.Logger;
import lombok.NonNull;
import lombok.experimental.UtilityClass;

@UtilityClass
public class LangUtils {

  public static boolean empty(final String s) {
    return s == null || s.isBlank();
  }

  /** null -> "" e trim. */
  public static String nz(final String s) {
    return s == null ? "" : s.trim();
  }

  public static String nullToEmpty(final String s) {
    return nullToSomething(s, "");
  }

  public static String nullToSomething(final String s, final String def) {
    return s == null ? def : s;
  }

  public static int parseIntOr(final String s, final int def) {
    try {
      return Integer.parseInt(s == null ? "" : s.trim());
    } catch (NumberFormatException ignored) {
      return def;
    }
  }

  /** Tronca a max caratteri (null -> ""). */
  public static String abbreviate(final String s, final int max) {
    if (s == null) return "";
    if (max <= 0 || s.length() <= max) return s;
    return s.substring(0, max);
  }

  public static String exMsg(@NonNull final Throwable t) {
    return empty(t.getMessage()) ? t.toString() : t.getMessage();
  }

  public static String rootCauseMsg(final Throwable t) {
    if (t == null) return "Null Throwable"; // Errore raro ma possibile
    if (t.getCause() != null && t.getCause() != t) return rootCauseMsg(t.getCause());
    return exMsg(t);
  }

  public static String s(final String format, final Object... values) {
    if (values == null || values.length == 0) return nz(format);
    return String.format(format.replace("%", "%%").replace("{}", "%s"), values);
  }

  public static void l(Logger logger, Level level, String format, Throwable t, Object... values) {
    if (logger == null || level == null) return;
    if (!logger.isLoggable(level)) return;
    final String msg = (values == null || values.length == 0) ? nz(format) : s(format, values);
    if (t == null) logger.log(level, msg);
    else logger.log(level, msg, t);
  }

  public static void l(Logger logger, Level level, String format, Object... values) {
    l(logger, level, format, null, values);
  }

  public static void info(Logger logger, String format, Object... values) {
    l(logger, Level.INFO, format, values);
  }

  public static void warn(Logger logger, String format, Object... values) {
    l(logger, Level.WARNING, format, values);
  }

  public static void err(Logger logger, String format, Object... values) {
    l(logger, Level.SEVERE, format, values);
  }

  public static void debug(Logger logger, String format, Object... values) {
    l(logger, Level.FINE, format, values);
  }

  public static void warn(Logger logger, String format, Throwable t, Object... values) {
    l(logger, Level.WARNING, format, t, values);
  }

  public static void err(Logger logger, String format, Throwable t, Object... values) {
    l(logger, Level.SEVERE, format, t, values);
  }

  public static void debug(Logger logger, String format, Throwable t, Object... values) {
    l(logger, Level.FINE, format, t, values);
  }
}
