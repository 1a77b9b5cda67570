package org.danilorossi.mailmind.helpers;

import jakarta.mail.FolderClosedException;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Multipart;
import jakarta.mail.Part;
import jakarta.mail.StoreClosedException;
import jakarta.mail.internet.ContentType;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Locale;
import lombok.Cleanup;
import lombok.NonNull;
import lombok.experimental.UtilityClass;
import lombok.extern.java.Log;
import lombok.val;
import org.jsoup.Jsoup;

/**
 * Estrae il testo leggibile di un messaggio per il classificatore. Gli errori di parsing MIME sono
 * "soft" (parte saltata); la chiusura di cartella o store viene invece propagata perché indica
 * una connessione persa.
 */
@Log
@UtilityClass
public final class MailTextExtractor {

  static {
    LogConfigurator.configLog(log);
  }

  /** Limite di sicurezza per email patologiche. */
  public static final int MAX_OUTPUT_CHARS = 200_000;

  public static String extractText(@NonNull final Message msg) throws MessagingException {
    return extractText(msg, MAX_OUTPUT_CHARS);
  }

  public static String extractText(@NonNull final Message msg, final int maxChars)
      throws MessagingException {
    val sb = new StringBuilder(4096);
    extractPart(msg, sb, maxChars);
    return LangUtils.abbreviate(sb.toString().trim(), maxChars);
  }

  private static void extractPart(final Part part, @NonNull final StringBuilder out, final int max)
      throws MessagingException {
    if (part == null || out.length() >= max) return;
    try {
      // Allegati e risorse inline non testuali
      if (isSkippableBinary(part)) return;

      if (part.isMimeType("text/plain")) {
        appendParagraph(out, cleanText(getTextPayload(part)));
      } else if (part.isMimeType("text/html")) {
        appendParagraph(out, htmlToPlainText(getTextPayload(part)));
      } else if (part.isMimeType("multipart/alternative")) {
        if (part.getContent() instanceof Multipart mp)
          appendParagraph(out, pickFromAlternative(mp));
      } else if (part.isMimeType("multipart/*")) {
        if (part.getContent() instanceof Multipart mp) {
          for (int i = 0; i < mp.getCount(); i++) extractPart(mp.getBodyPart(i), out, max);
        }
      } else if (part.isMimeType("message/rfc822")) {
        if (part.getContent() instanceof Message nested) extractPart(nested, out, max);
      } else if (part.isMimeType("text/*")) {
        appendParagraph(out, cleanText(getTextPayload(part)));
      }
    } catch (FolderClosedException | StoreClosedException closed) {
      throw closed;
    } catch (MessagingException | IOException ex) {
      LangUtils.debug(log, "Parte MIME saltata: {}", LangUtils.exMsg(ex));
    }
  }

  private static void appendParagraph(@NonNull final StringBuilder out, final String text) {
    if (LangUtils.empty(text)) return;
    if (out.length() > 0 && out.charAt(out.length() - 1) != '\n') out.append('\n');
    out.append(text).append("\n\n");
  }

  static String cleanText(final String text) {
    if (text == null) return "";
    // NBSP e spazi/righe in eccesso
    return text.replace('\u00A0', ' ')
        .replaceAll("\\R+", "\n")
        .replaceAll("[\\t\\x0B\\f ]{2,}", " ")
        .trim();
  }

  private static Charset detectCharset(@NonNull final Part part) throws MessagingException {
    val ct = part.getContentType();
    if (ct == null) return StandardCharsets.UTF_8;
    val cs = new ContentType(ct).getParameter("charset");
    if (cs == null) return StandardCharsets.UTF_8;
    try {
      String norm = cs.trim().toLowerCase(Locale.ROOT).replace("_", "-");
      if ("utf8".equals(norm)) norm = "utf-8";
      return Charset.forName(norm);
    } catch (IllegalCharsetNameException | UnsupportedCharsetException __) {
      LangUtils.debug(log, "Charset '{}' non supportato, uso UTF-8", cs);
      return StandardCharsets.UTF_8;
    }
  }

  private static String getTextPayload(@NonNull final Part part)
      throws MessagingException, IOException {
    val content = part.getContent(); // Jakarta Mail decodifica QP/Base64
    if (content instanceof String s) return s;
    @Cleanup val is = part.getInputStream();
    return readAll(is, detectCharset(part));
  }

  static String htmlToPlainText(final String html) {
    if (LangUtils.empty(html)) return "";
    val doc = Jsoup.parse(html);
    // conserva le interruzioni logiche prima di estrarre il testo
    doc.select("br").append("\\n");
    doc.select("p, li, div, tr, h1, h2, h3, h4, h5, h6").prepend("\\n");
    return cleanText(doc.text().replace("\\n", "\n"));
  }

  /** In multipart/alternative l'ultima parte è di solito la più ricca: html, poi plain. */
  private static String pickFromAlternative(@NonNull final Multipart mp)
      throws MessagingException, IOException {
    for (int i = mp.getCount() - 1; i >= 0; i--) {
      val bp = mp.getBodyPart(i);
      if (!isSkippableBinary(bp) && bp.isMimeType("text/html"))
        return htmlToPlainText(getTextPayload(bp));
    }
    for (int i = mp.getCount() - 1; i >= 0; i--) {
      val bp = mp.getBodyPart(i);
      if (!isSkippableBinary(bp) && bp.isMimeType("text/*")) return cleanText(getTextPayload(bp));
    }
    return "";
  }

  private static boolean isSkippableBinary(@NonNull final Part p) throws MessagingException {
    val disp = p.getDisposition();
    if (disp != null && disp.equalsIgnoreCase(Part.ATTACHMENT)) return true;

    val isTextish = p.isMimeType("text/*") || p.isMimeType("message/*");
    if (!LangUtils.empty(p.getFileName()) && !isTextish) return true;

    // Content-ID marca le risorse inline (cid:)
    val cids = p.getHeader("Content-ID");
    return cids != null && cids.length > 0 && !isTextish;
  }

  private static String readAll(@NonNull final InputStream is, @NonNull final Charset cs)
      throws IOException {
    @Cleanup val bos = new ByteArrayOutputStream();
    is.transferTo(bos);
    return bos.toString(cs);
  }
}
