package com.gentoro.agentops.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.agentops.utility.JacksonUtility;
import com.gentoro.agentops.utility.StringUtility;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads a model reply into an {@link AgentResponse}.
 *
 * <p>The structured form is a JSON object, either fenced as {@code ```json} or as the whole reply:
 *
 * <pre>
 * {
 *   "content": "text posted to the conversation",
 *   "tool_calls": [ { "name": "execute_sql_query", "arguments": { "sql": "..." } } ],
 *   "terminate": false
 * }
 * </pre>
 *
 * Anything else is taken as plain text content.
 */
public class AgentResponseParser {
  private static final org.slf4j.Logger log =
      com.gentoro.agentops.logging.LoggingService.getLogger(AgentResponseParser.class);
  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

  private final ObjectMapper mapper = JacksonUtility.getJsonMapper();

  public AgentResponse parse(String reply) {
    if (reply == null || reply.isBlank()) {
      return AgentResponse.text("");
    }
    String text = reply.trim();
    String json = StringUtility.extractSnippet(text, "json");
    if (json == null && text.startsWith("{") && text.endsWith("}")) {
      json = text;
    }
    if (json == null) {
      return AgentResponse.text(text);
    }

    JsonNode root;
    try {
      root = mapper.readTree(json);
    } catch (JsonProcessingException e) {
      log.debug("Reply looked like JSON but did not parse; treating it as text: {}", e.getMessage());
      return AgentResponse.text(text);
    }
    if (root == null || !root.isObject() || (!root.has("content") && !root.has("tool_calls"))) {
      return AgentResponse.text(text);
    }

    JsonNode contentNode = root.get("content");
    String content = contentNode == null || contentNode.isNull() ? "" : contentNode.asText();
    boolean terminate = root.path("terminate").asBoolean(false);
    return new AgentResponse(content, toolCalls(root.get("tool_calls")), terminate);
  }

  private List<ToolCall> toolCalls(JsonNode node) {
    List<ToolCall> calls = new ArrayList<>();
    if (node == null || !node.isArray()) {
      return calls;
    }
    for (JsonNode item : node) {
      String name = item.path("name").asText("");
      if (name.isBlank()) {
        log.warn("Ignoring tool call without a name: {}", item);
        continue;
      }
      calls.add(ToolCall.of(name, arguments(item.get("arguments"))));
    }
    return calls;
  }

  // Some models send arguments as a JSON-encoded string rather than an object.
  private Map<String, Object> arguments(JsonNode node) {
    if (node == null || node.isNull()) {
      return Map.of();
    }
    JsonNode value = node;
    if (node.isTextual()) {
      try {
        value = mapper.readTree(node.asText());
      } catch (JsonProcessingException e) {
        log.warn("Tool call arguments are not valid JSON: {}", node.asText());
        return Map.of();
      }
    }
    if (!value.isObject()) {
      return Map.of();
    }
    return mapper.convertValue(value, MAP_TYPE);
  }
}
