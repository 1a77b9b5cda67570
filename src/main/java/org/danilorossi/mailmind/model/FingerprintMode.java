package org.danilorossi.mailmind.model;

import lombok.val;

/** Campi usati per calcolare l'impronta di un messaggio. */
public enum FingerprintMode {
  /** Message-ID se presente, altrimenti mittente + oggetto + data. */
  MESSAGE_ID,
  /** Sempre Message-ID + mittente + oggetto + data. */
  COMPOSITE;

  public static FingerprintMode parse(final String s) {
    if (s == null) return MESSAGE_ID;
    val n = s.trim().replace('-', '_').toUpperCase();
    return switch (n) {
      case "COMPOSITE", "FULL" -> COMPOSITE;
      default -> MESSAGE_ID;
    };
  }
}
