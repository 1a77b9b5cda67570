package org.danilorossi.mailmind.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.danilorossi.mailmind.helpers.LangUtils;

@AllArgsConstructor
@NoArgsConstructor
@Getter
@Builder
@ToString
public class Category {

  public static final String INBOX = "INBOX";

  @Builder.Default private String name = "";

  /** Testo libero passato al classificatore. */
  @Builder.Default private String description = "";

  /** Cartella di destinazione; vuota = stesso nome della categoria. */
  @Builder.Default private String folder = "";

  /** La categoria INBOX lascia il messaggio dov'è. */
  public boolean isInbox() {
    return INBOX.equalsIgnoreCase(LangUtils.nz(name));
  }

  /** Cartella in cui deve finire un messaggio che oggi sta in sourceFolder. */
  public String targetFolder(final String sourceFolder) {
    if (isInbox()) return sourceFolder;
    return LangUtils.empty(folder) ? LangUtils.nz(name) : folder.trim();
  }

  void validate(final String accountName) {
    if (LangUtils.empty(name))
      throw new IllegalArgumentException(
          LangUtils.s("[{}] category name cannot be empty", accountName));
  }
}
