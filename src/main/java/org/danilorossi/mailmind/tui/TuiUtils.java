package org.danilorossi.mailmind.tui;

import com.googlecode.lanterna.TerminalSize;
import com.googlecode.lanterna.gui2.BasicWindow;
import com.googlecode.lanterna.gui2.Button;
import com.googlecode.lanterna.gui2.Direction;
import com.googlecode.lanterna.gui2.EmptySpace;
import com.googlecode.lanterna.gui2.Label;
import com.googlecode.lanterna.gui2.LinearLayout;
import com.googlecode.lanterna.gui2.MultiWindowTextGUI;
import com.googlecode.lanterna.gui2.Panel;
import com.googlecode.lanterna.gui2.TextBox;
import com.googlecode.lanterna.gui2.Window;
import com.googlecode.lanterna.gui2.dialogs.MessageDialog;
import com.googlecode.lanterna.gui2.dialogs.MessageDialogButton;
import com.googlecode.lanterna.gui2.table.Table;
import com.googlecode.lanterna.input.KeyType;
import java.util.List;
import java.util.regex.Pattern;
import lombok.NonNull;
import lombok.experimental.UtilityClass;
import lombok.val;
import org.danilorossi.mailmind.helpers.LangUtils;

@UtilityClass
public class TuiUtils {

  public static String chooseFromList(
      @NonNull final MultiWindowTextGUI gui,
      @NonNull final String title,
      @NonNull final List<String> items,
      final String preselect) {

    if (items.isEmpty()) {
      info(gui, "Nessun elemento disponibile.");
      return null;
    }

    val dialog = new BasicWindow(title);
    dialog.setHints(List.of(Window.Hint.CENTERED, Window.Hint.MODAL));
    dialog.setCloseWindowWithEscape(true);

    val table = new Table<String>("Elementi");
    table.setPreferredSize(new TerminalSize(50, 12));
    for (val it : items) table.getTableModel().addRow(it);
    val preIndex = preselect == null ? -1 : items.indexOf(preselect);
    if (preIndex >= 0) table.setSelectedRow(preIndex);

    val result = new String[1];
    val ok =
        new Button(
            "OK",
            () -> {
              val sel = table.getSelectedRow();
              if (sel >= 0) result[0] = items.get(sel);
              dialog.close();
            });
    val cancel = new Button("Annulla", dialog::close);
    table.setSelectAction(ok::takeFocus);

    val root = new Panel(new LinearLayout(Direction.VERTICAL));
    root.addComponent(table);
    val actions = new Panel(new LinearLayout(Direction.HORIZONTAL));
    actions.addComponent(ok);
    actions.addComponent(new EmptySpace(new TerminalSize(1, 1)));
    actions.addComponent(cancel);
    root.addComponent(new EmptySpace(new TerminalSize(0, 1)));
    root.addComponent(actions);

    dialog.setComponent(root);
    gui.addWindowAndWait(dialog);
    return result[0];
  }

  /** Chiede un intero in [min..max]; null se l'utente annulla. */
  public static Integer askInt(
      @NonNull final MultiWindowTextGUI gui,
      @NonNull final String title,
      @NonNull final String fieldLabel,
      final int initial,
      final int min,
      final int max) {
    val dialog = new BasicWindow(title);
    dialog.setHints(List.of(Window.Hint.CENTERED, Window.Hint.MODAL));
    dialog.setCloseWindowWithEscape(true);

    val tb = numericBox(String.valueOf(max).length(), String.valueOf(initial));
    val result = new Integer[1];
    val ok =
        new Button(
            "OK",
            () -> {
              if (!validateIntRange(gui, fieldLabel, tb, min, max)) return;
              result[0] = LangUtils.parseIntOr(tb.getText(), initial);
              dialog.close();
            });
    val cancel = new Button("Annulla", dialog::close);

    val root = new Panel(new LinearLayout(Direction.VERTICAL));
    val row = new Panel(new LinearLayout(Direction.HORIZONTAL));
    row.addComponent(new Label(fieldLabel + ":"));
    row.addComponent(tb);
    root.addComponent(row);
    root.addComponent(new EmptySpace(new TerminalSize(0, 1)));
    val actions = new Panel(new LinearLayout(Direction.HORIZONTAL));
    actions.addComponent(ok);
    actions.addComponent(new EmptySpace(new TerminalSize(1, 1)));
    actions.addComponent(cancel);
    root.addComponent(actions);

    dialog.setComponent(root);
    gui.addWindowAndWait(dialog);
    return result[0];
  }

  /** TextBox che accetta solo cifre (maxDigits opzionale). */
  public static TextBox numericBox(final int maxDigits, final String initial) {
    val regex =
        maxDigits > 0 ? Pattern.compile("^\\d{0," + maxDigits + "}$") : Pattern.compile("^\\d*$");

    val tb = new TextBox().setValidationPattern(regex);
    if (initial != null) tb.setText(initial);

    tb.setInputFilter(
        (interactable, key) -> {
          if (key.getKeyType() != KeyType.Character) return true; // backspace, frecce, ecc.
          if (!Character.isDigit(key.getCharacter())) return false;
          val current = ((TextBox) interactable).getText();
          return maxDigits <= 0 || current.length() < maxDigits;
        });
    return tb;
  }

  /** Valida un intero in range [min..max]. Ritorna true se valido. */
  public static boolean validateIntRange(
      @NonNull final MultiWindowTextGUI gui,
      @NonNull final String fieldLabel,
      @NonNull final TextBox tb,
      final int min,
      final int max) {
    val v = LangUtils.parseIntOr(tb.getText(), Integer.MIN_VALUE);
    if (v < min || v > max) {
      error(
          gui,
          "Valore non valido per \""
              + fieldLabel
              + "\". Range consentito: "
              + min
              + "-"
              + max
              + ".");
      tb.takeFocus();
      return false;
    }
    return true;
  }

  /** Conferma sì/no. Ritorna true se l'utente preme Yes. */
  public static boolean confirm(
      @NonNull final MultiWindowTextGUI gui,
      @NonNull final String title,
      @NonNull final String message) {
    return MessageDialog.showMessageDialog(
            gui, title, message, MessageDialogButton.Yes, MessageDialogButton.No)
        == MessageDialogButton.Yes;
  }

  public static void info(@NonNull final MultiWindowTextGUI gui, @NonNull final String msg) {
    MessageDialog.showMessageDialog(gui, "Info", msg, MessageDialogButton.OK);
  }

  public static void error(@NonNull final MultiWindowTextGUI gui, @NonNull final String msg) {
    MessageDialog.showMessageDialog(gui, "Errore", msg, MessageDialogButton.OK);
  }
}
