package org.danilorossi.mailmind.model;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Properties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import lombok.ToString;
import lombok.val;
import org.danilorossi.mailmind.helpers.LangUtils;

/** Account IMAP monitorato: parametri di connessione, cartelle sorgente e categorie. */
@AllArgsConstructor
@NoArgsConstructor
@Getter
@Builder(toBuilder = true)
@ToString(onlyExplicitlyIncluded = true)
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Account {

  @Builder.Default
  @ToString.Include(rank = 100)
  @EqualsAndHashCode.Include
  private String name = "";

  @Builder.Default
  @ToString.Include(rank = 99)
  private String host = "";

  @Builder.Default
  @ToString.Include(rank = 98)
  private int port = 993;

  @Builder.Default private String username = "";

  @Builder.Default private String password = "";

  @Builder.Default private boolean ssl = true; // IMAPS (implicit TLS)

  /** Cartelle sorgente da monitorare; la prima è quella usata per IDLE. */
  @Builder.Default private List<String> folders = new ArrayList<>(List.of("INBOX"));

  /** Categorie in ordine di configurazione. */
  @Builder.Default private List<Category> categories = new ArrayList<>();

  // Timeouts (ms) con default prudenti
  @Builder.Default private int connectionTimeoutMs = 15_000;
  @Builder.Default private int readTimeoutMs = 30_000;
  @Builder.Default private int writeTimeoutMs = 15_000;

  /** "imaps" se ssl=true, altrimenti "imap" (STARTTLS). */
  public String getStoreProtocol() {
    return ssl ? "imaps" : "imap";
  }

  public List<String> getFolders() {
    return folders == null ? List.of() : List.copyOf(folders);
  }

  public List<Category> getCategories() {
    return categories == null ? List.of() : List.copyOf(categories);
  }

  /** Categoria con quel nome (case-insensitive) oppure null. */
  public Category findCategory(final String categoryName) {
    if (LangUtils.empty(categoryName)) return null;
    val wanted = categoryName.trim();
    return getCategories().stream()
        .filter(c -> c.getName() != null && c.getName().trim().equalsIgnoreCase(wanted))
        .findFirst()
        .orElse(null);
  }

  /** Copia dell'account limitata a una sola cartella sorgente. */
  public Account withSingleFolder(@NonNull final String folder) {
    return toBuilder().folders(new ArrayList<>(List.of(folder))).build();
  }

  /**
   * Proprietà Jakarta Mail. Il read timeout deve superare l'attesa IDLE, altrimenti il socket
   * scade prima del watchdog.
   */
  public Properties toProperties(@NonNull final Duration idleTimeout) {
    validate(); // fail-fast

    val p = new Properties();
    val prefix = "mail." + getStoreProtocol();
    val readTimeout = Math.max(readTimeoutMs, idleTimeout.toMillis() + 60_000L);

    p.put(prefix + ".host", host);
    p.put(prefix + ".port", String.valueOf(port));
    p.put(prefix + ".auth", "true");
    p.put(prefix + ".ssl.enable", String.valueOf(ssl));
    p.put(prefix + ".starttls.enable", String.valueOf(!ssl));
    p.put(prefix + ".connectiontimeout", String.valueOf(connectionTimeoutMs));
    p.put(prefix + ".timeout", String.valueOf(readTimeout));
    p.put(prefix + ".writetimeout", String.valueOf(writeTimeoutMs));
    p.put(prefix + ".ssl.trust", host);
    p.put(prefix + ".partialfetch", "true");
    // BODY.PEEK: leggere il testo non deve segnare il messaggio come letto
    p.put(prefix + ".peek", "true");
    return p;
  }

  /** Validazione essenziale per errori precoci e messaggi chiari. */
  public void validate() throws IllegalArgumentException {
    if (LangUtils.empty(name)) throw new IllegalArgumentException("Account name is blank");
    if (LangUtils.empty(host))
      throw new IllegalArgumentException(LangUtils.s("[{}] IMAP host is blank", name));
    if (LangUtils.empty(username))
      throw new IllegalArgumentException(LangUtils.s("[{}] IMAP username is blank", name));
    if (port <= 0 || port > 65535)
      throw new IllegalArgumentException(LangUtils.s("[{}] IMAP port is invalid: {}", name, port));
    if (getFolders().isEmpty() || getFolders().stream().anyMatch(LangUtils::empty))
      throw new IllegalArgumentException(LangUtils.s("[{}] source folders are blank", name));
    if (getCategories().isEmpty())
      throw new IllegalArgumentException(LangUtils.s("[{}] no categories configured", name));

    val seen = new HashSet<String>();
    for (val c : getCategories()) {
      c.validate(name);
      if (!seen.add(c.getName().trim().toUpperCase()))
        throw new IllegalArgumentException(
            LangUtils.s("[{}] duplicate category name '{}'", name, c.getName()));
    }
  }
}
