package org.danilorossi.mailmind.tui;

import com.googlecode.lanterna.SGR;
import com.googlecode.lanterna.TerminalSize;
import com.googlecode.lanterna.gui2.Button;
import com.googlecode.lanterna.gui2.Direction;
import com.googlecode.lanterna.gui2.EmptySpace;
import com.googlecode.lanterna.gui2.Label;
import com.googlecode.lanterna.gui2.LinearLayout;
import com.googlecode.lanterna.gui2.MultiWindowTextGUI;
import com.googlecode.lanterna.gui2.Panel;
import com.googlecode.lanterna.gui2.table.Table;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import lombok.NonNull;
import lombok.extern.java.Log;
import lombok.val;
import org.danilorossi.mailmind.db.FingerprintStore;
import org.danilorossi.mailmind.db.StorageException;
import org.danilorossi.mailmind.helpers.LangUtils;
import org.danilorossi.mailmind.helpers.LogConfigurator;

/** Vista dell'archivio impronte: elenco, filtro per account, pulizia per età e reset. */
@Log
public class StatePanel extends Panel {

  static {
    LogConfigurator.configLog(log);
  }

  /** Righe mostrate al massimo in tabella. */
  static final int MAX_ROWS = 500;

  private static final DateTimeFormatter TS =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneId.systemDefault());

  private final MultiWindowTextGUI gui;
  private final FingerprintStore store;

  private Table<String> table;
  private Label summary;
  private String accountFilter; // null = tutti

  public StatePanel(@NonNull final MultiWindowTextGUI gui, @NonNull final FingerprintStore store) {
    this.gui = gui;
    this.store = store;
  }

  public StatePanel build() {
    setLayoutManager(new LinearLayout(Direction.VERTICAL));
    addComponent(new Label("Email elaborate").addStyle(SGR.BOLD));
    summary = new Label("");
    addComponent(summary);

    table = new Table<String>("#", "Account", "Elaborata il", "Impronta");
    table.setPreferredSize(new TerminalSize(110, 18));
    addComponent(table);
    addComponent(new EmptySpace(new TerminalSize(0, 1)));

    val actions = new Panel(new LinearLayout(Direction.HORIZONTAL));
    actions.addComponent(new Button("Account", this::chooseAccountAction));
    actions.addComponent(new EmptySpace(new TerminalSize(1, 1)));
    actions.addComponent(new Button("Aggiorna", this::refreshTable));
    actions.addComponent(new EmptySpace(new TerminalSize(1, 1)));
    actions.addComponent(new Button("Pulisci", this::cleanAction));
    actions.addComponent(new EmptySpace(new TerminalSize(1, 1)));
    actions.addComponent(new Button("Reset", this::resetAction));
    addComponent(actions);

    refreshTable();
    return this;
  }

  public void chooseAccountAction() {
    val items = new ArrayList<String>();
    items.add("(tutti)");
    items.addAll(store.accounts());
    val chosen =
        TuiUtils.chooseFromList(
            gui, "Filtra per account", items, accountFilter == null ? "(tutti)" : accountFilter);
    if (chosen == null) return;
    accountFilter = "(tutti)".equals(chosen) ? null : chosen;
    refreshTable();
  }

  public void cleanAction() {
    val days = TuiUtils.askInt(gui, "Pulizia", "Giorni da conservare", 30, 0, 36_500);
    if (days == null) return;
    try {
      val removed = store.prune(days, accountFilter);
      TuiUtils.info(gui, LangUtils.s("Rimossi {} record più vecchi di {} giorni.", removed, days));
    } catch (StorageException e) {
      TuiUtils.error(gui, "Pulizia non riuscita: " + LangUtils.rootCauseMsg(e));
    }
    refreshTable();
  }

  public void resetAction() {
    val scope = accountFilter == null ? "di tutti gli account" : "dell'account " + accountFilter;
    if (!TuiUtils.confirm(gui, "Conferma", "Eliminare tutti i record " + scope + "?")) return;
    try {
      val removed = store.reset(accountFilter);
      TuiUtils.info(gui, LangUtils.s("Rimossi {} record.", removed));
    } catch (StorageException e) {
      TuiUtils.error(gui, "Reset non riuscito: " + LangUtils.rootCauseMsg(e));
    }
    refreshTable();
  }

  public void refreshTable() {
    val prev = table.getSelectedRow();
    table.getTableModel().clear();
    int i = 0;
    for (val r : store.list(accountFilter)) {
      if (i >= MAX_ROWS) break;
      table
          .getTableModel()
          .addRow(
              String.valueOf(++i),
              LangUtils.nullToEmpty(r.getAccount()),
              TS.format(r.processedAt()),
              LangUtils.abbreviate(r.getFingerprint(), 16));
    }
    val total = store.count(accountFilter);
    summary.setText(
        LangUtils.s(
            "Account: {} | Record: {}{}",
            accountFilter == null ? "tutti" : accountFilter,
            total,
            total > MAX_ROWS ? " (mostrati i " + MAX_ROWS + " più recenti)" : ""));
    if (i > 0) table.setSelectedRow(Math.max(0, Math.min(prev, i - 1)));
    focus();
  }

  public void focus() {
    if (table == null) return;
    table.takeFocus();
  }
}
