package org.danilorossi.mailmind.helpers;

import static org.assertj.core.api.Assertions.assertThat;

import jakarta.mail.Session;
import jakarta.mail.internet.MimeMessage;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.Properties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MailTextExtractorTest {

  private static final Session SESSION = Session.getInstance(new Properties());

  static MimeMessage parse(final String raw) throws Exception {
    byte[] bytes = raw.replace("\n", "\r\n").getBytes(StandardCharsets.UTF_8);
    return new MimeMessage(SESSION, new ByteArrayInputStream(bytes));
  }

  @Test
  @DisplayName("Testo semplice: spazi e righe vuote compattati")
  void testPlainText() throws Exception {
    MimeMessage msg =
        parse(
            "From: a@example.com\n"
                + "Subject: prova\n"
                + "Content-Type: text/plain; charset=utf-8\n"
                + "\n"
                + "Ciao    Mario,\n\n\n\nci vediamo domani.\n");

    assertThat(MailTextExtractor.extractText(msg)).isEqualTo("Ciao Mario,\nci vediamo domani.");
  }

  @Test
  @DisplayName("multipart/alternative: preferita la parte HTML")
  void testAlternativePrefersHtml() throws Exception {
    MimeMessage msg =
        parse(
            "From: a@example.com\n"
                + "Subject: offerta\n"
                + "MIME-Version: 1.0\n"
                + "Content-Type: multipart/alternative; boundary=\"b1\"\n"
                + "\n"
                + "--b1\n"
                + "Content-Type: text/plain; charset=utf-8\n"
                + "\n"
                + "versione testo\n"
                + "--b1\n"
                + "Content-Type: text/html; charset=utf-8\n"
                + "\n"
                + "<html><head><style>p{color:red}</style></head>"
                + "<body><p>Sconto del <b>50%</b></p><script>track()</script></body></html>\n"
                + "--b1--\n");

    String text = MailTextExtractor.extractText(msg);

    assertThat(text).contains("Sconto del 50%").doesNotContain("versione testo");
    assertThat(text).doesNotContain("track()").doesNotContain("color:red");
  }

  @Test
  @DisplayName("Allegati binari ignorati, parti testuali concatenate")
  void testAttachmentSkipped() throws Exception {
    MimeMessage msg =
        parse(
            "From: a@example.com\n"
                + "Subject: fattura\n"
                + "MIME-Version: 1.0\n"
                + "Content-Type: multipart/mixed; boundary=\"m1\"\n"
                + "\n"
                + "--m1\n"
                + "Content-Type: text/plain; charset=utf-8\n"
                + "\n"
                + "In allegato la fattura di marzo.\n"
                + "--m1\n"
                + "Content-Type: application/pdf; name=\"fattura.pdf\"\n"
                + "Content-Disposition: attachment; filename=\"fattura.pdf\"\n"
                + "Content-Transfer-Encoding: base64\n"
                + "\n"
                + "SlVOS1BERkNPTlRFTlQ=\n"
                + "--m1--\n");

    String text = MailTextExtractor.extractText(msg);

    assertThat(text).isEqualTo("In allegato la fattura di marzo.");
  }

  @Test
  @DisplayName("quoted-printable in ISO-8859-1 decodificato")
  void testQuotedPrintableCharset() throws Exception {
    MimeMessage msg =
        parse(
            "From: a@example.com\n"
                + "Subject: perche\n"
                + "Content-Type: text/plain; charset=iso-8859-1\n"
                + "Content-Transfer-Encoding: quoted-printable\n"
                + "\n"
                + "Perch=E9 non =E8 arrivato?\n");

    assertThat(MailTextExtractor.extractText(msg)).isEqualTo("Perché non è arrivato?");
  }

  @Test
  @DisplayName("Testo troncato al limite richiesto")
  void testMaxChars() throws Exception {
    MimeMessage msg =
        parse("Subject: lungo\nContent-Type: text/plain\n\n" + "x".repeat(500) + "\n");

    assertThat(MailTextExtractor.extractText(msg, 100)).hasSize(100);
  }

  @Test
  @DisplayName("htmlToPlainText conserva le interruzioni fra paragrafi")
  void testHtmlParagraphs() {
    String text = MailTextExtractor.htmlToPlainText("<p>Primo</p><p>Secondo<br>riga</p>");

    assertThat(text).contains("Primo").contains("Secondo").contains("riga").contains("\n");
    assertThat(MailTextExtractor.htmlToPlainText(null)).isEmpty();
  }
}
