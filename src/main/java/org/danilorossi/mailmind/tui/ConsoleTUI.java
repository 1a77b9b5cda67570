package org.danilorossi.mailmind.tui;

import com.googlecode.lanterna.SGR;
import com.googlecode.lanterna.TerminalSize;
import com.googlecode.lanterna.TextColor;
import com.googlecode.lanterna.gui2.BasicWindow;
import com.googlecode.lanterna.gui2.DefaultWindowManager;
import com.googlecode.lanterna.gui2.Direction;
import com.googlecode.lanterna.gui2.EmptySpace;
import com.googlecode.lanterna.gui2.Label;
import com.googlecode.lanterna.gui2.LinearLayout;
import com.googlecode.lanterna.gui2.MultiWindowTextGUI;
import com.googlecode.lanterna.gui2.Panel;
import com.googlecode.lanterna.gui2.Window;
import com.googlecode.lanterna.gui2.WindowListenerAdapter;
import com.googlecode.lanterna.input.KeyStroke;
import com.googlecode.lanterna.terminal.DefaultTerminalFactory;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.NonNull;
import lombok.extern.java.Log;
import lombok.val;
import org.danilorossi.mailmind.db.FingerprintStore;
import org.danilorossi.mailmind.helpers.LogConfigurator;

/** Console testuale per consultare e ripulire l'archivio delle email elaborate. */
@Log
public class ConsoleTUI {

  static {
    LogConfigurator.configLog(log);
  }

  private final FingerprintStore store;

  public ConsoleTUI(@NonNull final FingerprintStore store) {
    this.store = store;
  }

  public void start() throws IOException {
    val terminalFactory = new DefaultTerminalFactory();
    val screen = terminalFactory.createScreen();
    try {
      screen.startScreen();
      val gui =
          new MultiWindowTextGUI(
              screen, new DefaultWindowManager(), new EmptySpace(TextColor.ANSI.BLACK));

      val window = new BasicWindow("MailMind | Stato elaborazione");
      window.setHints(List.of(Window.Hint.CENTERED));

      val root = new Panel();
      root.setLayoutManager(new LinearLayout(Direction.VERTICAL));
      root.setPreferredSize(new TerminalSize(114, 28));

      val statePanel = new StatePanel(gui, store).build();

      val footer = new Panel(new LinearLayout(Direction.HORIZONTAL));
      footer.addComponent(
          new EmptySpace(), LinearLayout.createLayoutData(LinearLayout.Alignment.Fill));
      footer.addComponent(
          new Label("F2: Account | F5: Aggiorna | F6: Pulisci | DEL: Reset | F8: Esci")
              .addStyle(SGR.BOLD));

      root.addComponent(statePanel, LinearLayout.createLayoutData(LinearLayout.Alignment.Fill));
      root.addComponent(new EmptySpace(new TerminalSize(0, 1)));
      root.addComponent(footer);

      window.setComponent(root);
      window.setCloseWindowWithEscape(true);

      window.addWindowListener(
          new WindowListenerAdapter() {
            @Override
            public void onUnhandledInput(Window basePane, KeyStroke key, AtomicBoolean handled) {
              switch (key.getKeyType()) {
                case F2 -> {
                  statePanel.chooseAccountAction();
                  handled.set(true);
                }
                case F5 -> {
                  statePanel.refreshTable();
                  handled.set(true);
                }
                case F6 -> {
                  statePanel.cleanAction();
                  handled.set(true);
                }
                case Delete -> {
                  statePanel.resetAction();
                  handled.set(true);
                }
                case F8 -> {
                  basePane.close();
                  handled.set(true);
                }
                default -> {
                  /* no-op */
                }
              }
            }
          });

      statePanel.focus();
      gui.addWindowAndWait(window);
    } finally {
      screen.stopScreen();
    }
  }
}
