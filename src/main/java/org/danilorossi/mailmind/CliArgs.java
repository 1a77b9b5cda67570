package org.danilorossi.mailmind;

import java.util.Locale;
import java.util.Set;
import lombok.Data;
import lombok.val;
import org.danilorossi.mailmind.helpers.LangUtils;

/** Opzioni della riga di comando. Ogni opzione accetta sia "-nome" sia "--nome". */
@Data
public class CliArgs {

  public static final Set<String> STATE_COMMANDS = Set.of("view", "clean", "reset");

  private boolean help;
  private String configPath;
  private String account;
  private String folder;
  private boolean dryRun;
  private boolean once;
  private boolean tui;
  private String stateCommand;
  private Integer days;

  public boolean isStateMode() {
    return stateCommand != null;
  }

  public static CliArgs parse(final String... args) throws IllegalArgumentException {
    val out = new CliArgs();
    if (args == null) return out;
    for (int i = 0; i < args.length; i++) {
      val arg = args[i];
      switch (normalize(arg)) {
        case "help", "h", "?" -> out.help = true;
        case "config" -> out.configPath = value(args, ++i, arg);
        case "account" -> out.account = value(args, ++i, arg);
        case "folder" -> out.folder = value(args, ++i, arg);
        case "dry-run" -> out.dryRun = true;
        case "once" -> out.once = true;
        case "tui" -> out.tui = true;
        case "state" -> {
          val cmd = value(args, ++i, arg).toLowerCase(Locale.ROOT);
          if (!STATE_COMMANDS.contains(cmd))
            throw new IllegalArgumentException(
                LangUtils.s("Comando -state sconosciuto '{}' (view, clean, reset)", cmd));
          out.stateCommand = cmd;
        }
        case "days" -> {
          val n = LangUtils.parseIntOr(value(args, ++i, arg), -1);
          if (n < 0) throw new IllegalArgumentException("-days richiede un intero >= 0");
          out.days = n;
        }
        default -> throw new IllegalArgumentException("Opzione sconosciuta: " + arg);
      }
    }
    if (out.days != null && !"clean".equals(out.stateCommand))
      throw new IllegalArgumentException("-days si usa solo con -state clean");
    return out;
  }

  private static String normalize(final String arg) {
    if (arg == null) return "";
    if ("/?".equals(arg)) return "?";
    if (arg.startsWith("--")) return arg.substring(2);
    if (arg.startsWith("-")) return arg.substring(1);
    return "\0" + arg; // argomento posizionale: mai valido
  }

  private static String value(final String[] args, final int i, final String option) {
    if (i >= args.length || LangUtils.empty(args[i]))
      throw new IllegalArgumentException("Manca il valore per " + option);
    return args[i].trim();
  }
}
