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
 * {@link LlmClient} for any server speaking the OpenAI Chat Completions API ({@code POST
 * <baseUrl>/chat/completions}): OpenAI itself, vLLM, LM Studio, llama.cpp server, Ollama's
 * {@code /v1} compatibility layer.
 *
 * <p>Configuration keys: {@code baseUrl} (default {@code https://api.openai.com/v1}), {@code
 * apiKey} (optional for local servers), {@code model} (required), {@code temperature} (default
 * 0.3), {@code timeout-seconds} (default 120).
 */
public class OpenAiCompatibleLlmClient extends AbstractLlmClient {
  private static final org.slf4j.Logger log =
      com.gentoro.agentops.logging.LoggingService.getLogger(OpenAiCompatibleLlmClient.class);
  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

  private final OkHttpClient httpClient;

  public OpenAiCompatibleLlmClient(AgentOps agentOps, Configuration configuration) {
    this(
        agentOps,
        configuration,
        OkHttpFactory.create(Duration.ofSeconds(configuration.getLong("timeout-seconds", 120L))));
  }

  public OpenAiCompatibleLlmClient(
      AgentOps agentOps, Configuration configuration, OkHttpClient httpClient) {
    super(agentOps, configuration);
    this.httpClient = httpClient;
  }

  @Override
  public String runInference(List<Message> messages, InferenceEventListener listener) {
    String baseUrl = configuration.getString("baseUrl", "https://api.openai.com/v1");
    String model = configuration.getString("model");
    if (model == null || model.isBlank()) {
      throw new LlmException("Missing 'model' for the openai-compatible provider");
    }

    ObjectNode body = JacksonUtility.getJsonMapper().createObjectNode();
    body.put("model", model);
    body.put("temperature", configuration.getDouble("temperature", 0.3d));
    ArrayNode msgs = body.putArray("messages");
    for (Message m : messages) {
      msgs.addObject().put("role", m.role().name().toLowerCase()).put("content", m.content());
    }

    Request.Builder request =
        new Request.Builder()
            .url(OllamaLlmClient.stripTrailingSlash(baseUrl) + "/chat/completions")
            .post(RequestBody.create(JacksonUtility.toJson(body), JSON));
    String apiKey = configuration.getString("apiKey", null);
    if (apiKey != null && !apiKey.isBlank()) {
      request.header("Authorization", "Bearer " + apiKey.trim());
    }

    long start = System.currentTimeMillis();
    try (Response response = httpClient.newCall(request.build()).execute()) {
      ResponseBody responseBody = response.body();
      String text = responseBody == null ? "" : responseBody.string();
      if (!response.isSuccessful()) {
        throw new LlmException(
            "Chat completion returned HTTP %d: %s"
                .formatted(response.code(), StringUtility.truncate(text, 500)));
      }
      JsonNode json = JacksonUtility.getJsonMapper().readTree(text);
      listener.on(EventType.ON_COMPLETION, json);
      JsonNode content = json.path("choices").path(0).path("message").path("content");
      if (!content.isTextual()) {
        throw new LlmException("Chat completion has no message content");
      }
      log.debug(
          "Chat completion ({}) took {} ms, total tokens {}",
          model,
          System.currentTimeMillis() - start,
          json.path("usage").path("total_tokens").asInt(-1));
      listener.on(EventType.ON_END, content.asText());
      return content.asText();
    } catch (IOException e) {
      throw new LlmException("Failed to run LLM inference against " + baseUrl, e);
    }
  }
}
