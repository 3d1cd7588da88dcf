package com.gentoro.agentops.tool.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * Request envelope: {@code {"jsonrpc":"2.0","id":1,"method":"tools/call","params":{"name":..,
 * "arguments":{..}}}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolCallRequest(
    @JsonProperty("jsonrpc") String jsonrpc,
    @JsonProperty("id") long id,
    @JsonProperty("method") String method,
    @JsonProperty("params") Params params) {

  public static final String VERSION = "2.0";
  public static final String METHOD_TOOLS_CALL = "tools/call";

  public static ToolCallRequest toolsCall(long id, String toolName, Map<String, Object> arguments) {
    return new ToolCallRequest(
        VERSION, id, METHOD_TOOLS_CALL, new Params(toolName, arguments == null ? Map.of() : arguments));
  }

  public record Params(
      @JsonProperty("name") String name, @JsonProperty("arguments") Map<String, Object> arguments) {}
}
