package com.gentoro.agentops.tool.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.agentops.exception.SerializationException;
import com.gentoro.agentops.exception.ToolProtocolException;
import com.gentoro.agentops.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON codec for the tool wire protocol.
 *
 * <p>Decoding is strict about the parts that matter for correlation (integral {@code id}, exactly
 * one of {@code result}/{@code error}) and lenient about the rest: {@code jsonrpc} is emitted but
 * never required, unknown members are ignored.
 */
public class ToolProtocolCodec {
  private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE =
      new TypeReference<>() {};

  private final ObjectMapper mapper;

  public ToolProtocolCodec() {
    this(JacksonUtility.getJsonMapper());
  }

  public ToolProtocolCodec(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  public String encode(ToolCallRequest request) {
    return write(request);
  }

  public String encode(ToolCallResponse response) {
    return write(response);
  }

  /**
   * Parse and validate a response envelope.
   *
   * @param endpoint used in error messages only
   * @param expectedId id of the request this body answers
   * @throws ToolProtocolException when the body is not a valid envelope for {@code expectedId}
   */
  public ToolCallResponse decodeResponse(String endpoint, String body, long expectedId) {
    if (body == null || body.isBlank()) {
      throw new ToolProtocolException(endpoint, "empty response body");
    }
    JsonNode root;
    try {
      root = mapper.readTree(body);
    } catch (JsonProcessingException e) {
      throw new ToolProtocolException(endpoint, "response is not valid JSON", e);
    }
    if (root == null || !root.isObject()) {
      throw new ToolProtocolException(endpoint, "response is not a JSON object");
    }

    JsonNode id = root.get("id");
    if (id == null || id.isNull() || !id.canConvertToLong() || !id.isIntegralNumber()) {
      throw new ToolProtocolException(endpoint, "response has no integral id");
    }
    if (id.asLong() != expectedId) {
      throw new ToolProtocolException(
          endpoint, "response id %d does not match request id %d".formatted(id.asLong(), expectedId));
    }

    JsonNode result = present(root, "result");
    JsonNode error = present(root, "error");
    if ((result == null) == (error == null)) {
      throw new ToolProtocolException(
          endpoint, "response must carry exactly one of 'result' or 'error'");
    }

    String jsonrpc = root.path("jsonrpc").isTextual() ? root.get("jsonrpc").asText() : null;
    if (error != null) {
      if (!error.isObject()
          || !error.path("code").isIntegralNumber()
          || !error.path("message").isTextual()) {
        throw new ToolProtocolException(endpoint, "'error' must hold an integer code and a message");
      }
      return new ToolCallResponse(
          jsonrpc,
          id.asLong(),
          null,
          new ToolCallResponse.Error(error.get("code").asInt(), error.get("message").asText()));
    }

    if (!result.isObject() || !result.path("content").isArray()) {
      throw new ToolProtocolException(endpoint, "'result' must hold a 'content' array");
    }
    List<ToolCallResponse.Content> content = new ArrayList<>();
    for (JsonNode part : result.get("content")) {
      if (!part.isObject()) {
        throw new ToolProtocolException(endpoint, "content entries must be objects");
      }
      String type = part.path("type").isTextual() ? part.get("type").asText() : null;
      String text = part.path("text").isTextual() ? part.get("text").asText() : null;
      content.add(new ToolCallResponse.Content(type, text));
    }
    return new ToolCallResponse(jsonrpc, id.asLong(), new ToolCallResponse.Result(content), null);
  }

  /**
   * Parse and validate a request envelope received by the tool endpoint.
   *
   * @throws EnvelopeException carrying the wire error code to reply with
   */
  public ToolCallRequest decodeRequest(String body) {
    JsonNode root;
    try {
      root = body == null ? null : mapper.readTree(body);
    } catch (JsonProcessingException e) {
      throw new EnvelopeException(ToolCallResponse.PARSE_ERROR, null, "Parse error", e);
    }
    if (root == null || !root.isObject()) {
      throw new EnvelopeException(
          ToolCallResponse.INVALID_REQUEST, null, "Invalid request: expected a JSON object");
    }

    JsonNode idNode = root.get("id");
    if (idNode == null || !idNode.isIntegralNumber() || !idNode.canConvertToLong()) {
      throw new EnvelopeException(
          ToolCallResponse.INVALID_REQUEST, null, "Invalid request: missing integral id");
    }
    long id = idNode.asLong();

    JsonNode method = root.get("method");
    if (method == null || !method.isTextual()) {
      throw new EnvelopeException(
          ToolCallResponse.INVALID_REQUEST, id, "Invalid request: missing method");
    }
    if (!ToolCallRequest.METHOD_TOOLS_CALL.equals(method.asText())) {
      throw new EnvelopeException(
          ToolCallResponse.METHOD_NOT_FOUND, id, "Method not found: " + method.asText());
    }

    JsonNode params = root.get("params");
    if (params == null || !params.isObject() || !params.path("name").isTextual()) {
      throw new EnvelopeException(
          ToolCallResponse.INVALID_PARAMS, id, "Invalid params: 'params.name' is required");
    }
    JsonNode args = params.get("arguments");
    Map<String, Object> arguments;
    if (args == null || args.isNull()) {
      arguments = Map.of();
    } else if (args.isObject()) {
      arguments = mapper.convertValue(args, MAP_TYPE);
    } else {
      throw new EnvelopeException(
          ToolCallResponse.INVALID_PARAMS, id, "Invalid params: 'arguments' must be an object");
    }

    String jsonrpc = root.path("jsonrpc").isTextual() ? root.get("jsonrpc").asText() : null;
    return new ToolCallRequest(
        jsonrpc,
        id,
        method.asText(),
        new ToolCallRequest.Params(params.get("name").asText(), arguments));
  }

  private static JsonNode present(JsonNode root, String field) {
    JsonNode n = root.get(field);
    return n == null || n.isNull() ? null : n;
  }

  private String write(Object value) {
    try {
      return mapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new SerializationException("Failed to encode tool envelope", e);
    }
  }
}
