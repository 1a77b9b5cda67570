package org.danilorossi.mailmind.classifier;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.java.Log;
import lombok.val;
import org.danilorossi.mailmind.db.JsonDb;
import org.danilorossi.mailmind.helpers.LangUtils;
import org.danilorossi.mailmind.helpers.LogConfigurator;
import org.danilorossi.mailmind.model.Category;
import org.danilorossi.mailmind.model.ClassifierConfig;

/**
 * Client minimale per un endpoint chat/completions compatibile OpenAI.
 *
 * <p>Il modello risponde con un oggetto JSON per email (category, confidence, reasoning); gli
 * oggetti vengono estratti dal testo nell'ordine in cui compaiono.
 */
@Log
public class OpenAiClassifier implements Classifier {

  static {
    LogConfigurator.configLog(log);
  }

  public static final String API_KEY_ENV = "OPENAI_API_KEY";

  /** Oggetti JSON piatti nel testo della risposta. */
  private static final Pattern JSON_OBJECT = Pattern.compile("\\{[^{}]*\\}");

  private static final DateTimeFormatter DATE_FMT =
      DateTimeFormatter.RFC_1123_DATE_TIME.withZone(ZoneOffset.UTC);

  @Getter private final ClassifierConfig config;
  private final String apiKey;
  private final HttpClient http;

  public OpenAiClassifier(@NonNull final ClassifierConfig config) {
    this(config, System.getenv(API_KEY_ENV));
  }

  OpenAiClassifier(@NonNull final ClassifierConfig config, final String envApiKey) {
    this.config = config;
    this.apiKey = !LangUtils.empty(config.getApiKey()) ? config.getApiKey().trim() : envApiKey;
    if (LangUtils.empty(apiKey))
      throw new IllegalArgumentException(
          "API key mancante: impostare classifier.apiKey o la variabile " + API_KEY_ENV);
    this.http =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofMillis(config.getConnectTimeoutMillis()))
            .build();
  }

  @Override
  public List<ClassificationResult> classify(
      @NonNull final List<Category> categories, @NonNull final List<MessageText> batch)
      throws ClassificationException {
    if (batch.isEmpty()) return List.of();

    val request =
        HttpRequest.newBuilder(endpoint())
            .timeout(Duration.ofMillis(config.getRequestTimeoutMillis()))
            .header("Content-Type", "application/json")
            .header("Authorization", "Bearer " + apiKey)
            .POST(
                HttpRequest.BodyPublishers.ofString(
                    requestBody(categories, batch), StandardCharsets.UTF_8))
            .build();

    final HttpResponse<String> resp;
    try {
      resp = http.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new ClassificationException(
          "Chiamata al classificatore fallita: " + LangUtils.exMsg(e), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ClassificationException("Chiamata al classificatore interrotta", e);
    }

    if (resp.statusCode() / 100 != 2)
      throw new ClassificationException(
          LangUtils.s(
              "Il classificatore ha risposto HTTP {}: {}",
              resp.statusCode(),
              LangUtils.abbreviate(resp.body(), 200)));

    val results = parseResults(replyContent(resp.body()));
    LangUtils.debug(log, "Classificatore: {} email, {} risultati.", batch.size(), results.size());
    return results;
  }

  private URI endpoint() {
    val base = LangUtils.nz(config.getBaseUrl()).replaceAll("/+$", "");
    return URI.create(base + "/chat/completions");
  }

  String requestBody(
      @NonNull final List<Category> categories, @NonNull final List<MessageText> batch) {
    val messages = new JsonArray();
    messages.add(message("system", systemPrompt(categories)));
    messages.add(message("user", userPrompt(batch)));

    val body = new JsonObject();
    body.addProperty("model", config.getModel());
    body.add("messages", messages);
    body.addProperty("temperature", config.getTemperature());
    body.addProperty("max_tokens", config.getMaxTokens());
    return JsonDb.lineGson().toJson(body);
  }

  private static JsonObject message(final String role, final String content) {
    val m = new JsonObject();
    m.addProperty("role", role);
    m.addProperty("content", content);
    return m;
  }

  static String systemPrompt(@NonNull final List<Category> categories) {
    val info = new JsonArray();
    for (val c : categories) {
      val o = new JsonObject();
      o.addProperty("name", c.getName());
      o.addProperty("description", c.getDescription());
      o.addProperty("folder", c.targetFolder(Category.INBOX));
      info.add(o);
    }
    val names = categories.stream().map(Category::getName).collect(Collectors.joining(", "));
    return "You are an email categorization assistant. Your task is to categorize emails into"
        + " one of the following categories:\n\n"
        + JsonDb.gson().toJson(info)
        + "\n\nFor each email, respond with a JSON object containing:\n"
        + "1. \"category\": The category name (must be one of: "
        + names
        + ")\n"
        + "2. \"confidence\": Your confidence level (0-100)\n"
        + "3. \"reasoning\": Brief explanation of your categorization\n\n"
        + "Analyze the email's subject, sender, and content to determine the most appropriate"
        + " category.\nUse the category descriptions to guide your decision.\n";
  }

  String userPrompt(@NonNull final List<MessageText> batch) {
    val sb = new StringBuilder("Categorize the following emails:\n\n");
    int i = 0;
    for (val m : batch) {
      val ref = m.getRef();
      sb.append("Email ").append(++i).append(":\n");
      sb.append("From: ").append(ref.getSender()).append('\n');
      sb.append("Subject: ").append(ref.getSubject()).append('\n');
      sb.append("Date: ")
          .append(ref.getDate() == null ? "" : DATE_FMT.format(ref.getDate()))
          .append('\n');
      sb.append("Body: ")
          .append(LangUtils.abbreviate(m.getBody(), config.getMaxBodyChars()))
          .append("\n\n");
    }
    return sb.toString();
  }

  /** Testo della prima scelta di una risposta chat/completions. */
  static String replyContent(final String responseBody) throws ClassificationException {
    try {
      val root = JsonParser.parseString(LangUtils.nz(responseBody)).getAsJsonObject();
      val choices = root.getAsJsonArray("choices");
      if (choices == null || choices.isEmpty())
        throw new ClassificationException("Risposta del classificatore senza 'choices'");
      val msg = choices.get(0).getAsJsonObject().getAsJsonObject("message");
      val content = msg == null ? null : msg.get("content");
      if (content == null || content.isJsonNull())
        throw new ClassificationException("Risposta del classificatore senza contenuto");
      return content.getAsString();
    } catch (JsonParseException | IllegalStateException | ClassCastException e) {
      throw new ClassificationException(
          "Risposta del classificatore non interpretabile: " + LangUtils.exMsg(e), e);
    }
  }

  /**
   * Un risultato per ogni oggetto JSON trovato nel testo. Un oggetto malformato produce un
   * risultato senza categoria, così l'allineamento con le email resta intatto.
   */
  static List<ClassificationResult> parseResults(final String content) {
    val out = new ArrayList<ClassificationResult>();
    val m = JSON_OBJECT.matcher(LangUtils.nz(content));
    while (m.find()) {
      try {
        val o = JsonParser.parseString(m.group()).getAsJsonObject();
        out.add(
            ClassificationResult.builder()
                .categoryName(string(o.get("category")))
                .confidence(confidence(o.get("confidence")))
                .rationale(LangUtils.nz(string(o.get("reasoning"))))
                .build());
      } catch (JsonParseException | IllegalStateException e) {
        LangUtils.warn(
            log,
            "Oggetto JSON non valido nella risposta: {}",
            LangUtils.abbreviate(m.group(), 120));
        out.add(ClassificationResult.builder().rationale("Risposta non interpretabile").build());
      }
    }
    return out;
  }

  private static String string(final JsonElement e) {
    if (e == null || e.isJsonNull() || !e.isJsonPrimitive()) return null;
    val s = e.getAsString().trim();
    return s.isEmpty() ? null : s;
  }

  private static int confidence(final JsonElement e) {
    if (e == null || e.isJsonNull() || !e.isJsonPrimitive()) return 0;
    try {
      val v = (int) Math.round(Double.parseDouble(e.getAsString().trim()));
      return Math.max(0, Math.min(100, v));
    } catch (NumberFormatException ex) {
      return 0;
    }
  }
}
