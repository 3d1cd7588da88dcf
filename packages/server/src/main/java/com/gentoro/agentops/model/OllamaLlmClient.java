package com.gentoro.agentops.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.agentops.AgentOps;
import com.gentoro.agentops.exception.LlmException;
import com.gentoro.agentops.http.OkHttpFactory;
import com.gentoro.agentops.utility.JacksonUtility;
import com.gentoro.agentops.utility.StringUtility;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.commons.configuration2.Configuration;

/**
 * Ollama implementation of {@link LlmClient} over the native {@code POST /api/chat} endpoint
 * (non-streaming).
 *
 * <p>Configuration keys: {@code baseUrl} (default {@code http://localhost:11434}), {@code model}
 * (required), {@code temperature} (default 0.3), {@code timeout-seconds} (default 300).
 */
public class OllamaLlmClient extends AbstractLlmClient {
  private static final org.slf4j.Logger log =
      com.gentoro.agentops.logging.LoggingService.getLogger(OllamaLlmClient.class);
  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

  private final OkHttpClient httpClient;

  public OllamaLlmClient(AgentOps agentOps, Configuration configuration) {
    this(
        agentOps,
        configuration,
        OkHttpFactory.create(Duration.ofSeconds(configuration.getLong("timeout-seconds", 300L))));
  }

  public OllamaLlmClient(AgentOps agentOps, Configuration configuration, OkHttpClient httpClient) {
    super(agentOps, configuration);
    this.httpClient = httpClient;
  }

  @Override
  public String runInference(List<Message> messages, InferenceEventListener listener) {
    String baseUrl = configuration.getString("baseUrl", "http://localhost:11434");
    String model = configuration.getString("model");
    if (model == null || model.isBlank()) {
      throw new LlmException("Missing 'model' for the ollama provider");
    }

    ObjectNode body = JacksonUtility.getJsonMapper().createObjectNode();
    body.put("model", model);
    body.put("stream", false);
    body.putObject("options").put("temperature", configuration.getDouble("temperature", 0.3d));
    ArrayNode msgs = body.putArray("messages");
    for (Message m : messages) {
      msgs.addObject().put("role", m.role().name().toLowerCase()).put("content", m.content());
    }

    Request request =
        new Request.Builder()
            .url(stripTrailingSlash(baseUrl) + "/api/chat")
            .post(RequestBody.create(JacksonUtility.toJson(body), JSON))
            .build();

    long start = System.currentTimeMillis();
    try (Response response = httpClient.newCall(request).execute()) {
      ResponseBody responseBody = response.body();
      String text = responseBody == null ? "" : responseBody.string();
      if (!response.isSuccessful()) {
        throw new LlmException(
            "Ollama returned HTTP %d: %s".formatted(response.code(), StringUtility.truncate(text, 500)));
      }
      JsonNode json = JacksonUtility.getJsonMapper().readTree(text);
      listener.on(EventType.ON_COMPLETION, json);
      JsonNode content = json.path("message").path("content");
      if (!content.isTextual()) {
        throw new LlmException("Ollama response has no message content");
      }
      log.debug(
          "Ollama({}) inference took {} ms, prompt tokens {}, completion tokens {}",
          model,
          System.currentTimeMillis() - start,
          json.path("prompt_eval_count").asInt(-1),
          json.path("eval_count").asInt(-1));
      listener.on(EventType.ON_END, content.asText());
      return content.asText();
    } catch (IOException e) {
      throw new LlmException("Failed to run LLM inference against " + baseUrl, e);
    }
  }

  static String stripTrailingSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
}
