package org.danilorossi.mailmind.db;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;
import lombok.NonNull;
import lombok.experimental.UtilityClass;
import lombok.val;
import org.danilorossi.mailmind.helpers.LangUtils;
import org.danilorossi.mailmind.model.FingerprintMode;

/**
 * Impronta deterministica di un messaggio: SHA-256 esadecimale dei metadati, prefissati dal nome
 * account. Funzione pura: stessi metadati, stessa impronta.
 */
@UtilityClass
public class Fingerprints {

  /** Separatore dei campi: NUL non compare negli header decodificati. */
  static final String SEP = "\0";

  public static String of(
      @NonNull final FingerprintMode mode,
      @NonNull final String account,
      final String messageId,
      final String sender,
      final String subject,
      final Instant date) {
    val id = LangUtils.nz(messageId);
    final String key;
    if (mode == FingerprintMode.MESSAGE_ID && !id.isEmpty()) {
      key = String.join(SEP, account, id);
    } else {
      key =
          String.join(
              SEP,
              account,
              id,
              LangUtils.nz(sender),
              LangUtils.nz(subject),
              date == null ? "" : String.valueOf(date.toEpochMilli()));
    }
    return sha256(key);
  }

  static String sha256(@NonNull final String s) {
    try {
      val md = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(md.digest(s.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      // obbligatorio in ogni JRE
      throw new IllegalStateException("SHA-256 non disponibile", e);
    }
  }
}
