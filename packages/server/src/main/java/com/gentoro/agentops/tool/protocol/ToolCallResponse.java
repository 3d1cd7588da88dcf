package com.gentoro.agentops.tool.protocol;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.stream.Collectors;

/** Response envelope carrying exactly one of {@link #result()} or {@link #error()}. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolCallResponse(
    @JsonProperty("jsonrpc") String jsonrpc,
    @JsonProperty("id") Long id,
    @JsonProperty("result") Result result,
    @JsonProperty("error") Error error) {

  public static final int PARSE_ERROR = -32700;
  public static final int INVALID_REQUEST = -32600;
  public static final int METHOD_NOT_FOUND = -32601;
  public static final int INVALID_PARAMS = -32602;
  public static final int TOOL_EXECUTION_FAILED = -32000;

  public static ToolCallResponse success(long id, String text) {
    return new ToolCallResponse(
        ToolCallRequest.VERSION, id, new Result(List.of(Content.text(text))), null);
  }

  /** Error envelope; {@code id} is null when the request id could not be read. */
  public static ToolCallResponse failure(Long id, int code, String message) {
    return new ToolCallResponse(ToolCallRequest.VERSION, id, null, new Error(code, message));
  }

  @JsonIgnore
  public boolean isError() {
    return error != null;
  }

  public record Result(@JsonProperty("content") List<Content> content) {
    /** Text parts joined with newlines; non-text parts are skipped. */
    @JsonIgnore
    public String text() {
      if (content == null) return "";
      return content.stream()
          .filter(c -> c != null && c.text() != null)
          .filter(c -> c.type() == null || "text".equals(c.type()))
          .map(Content::text)
          .collect(Collectors.joining("\n"));
    }
  }

  public record Content(@JsonProperty("type") String type, @JsonProperty("text") String text) {
    public static Content text(String text) {
      return new Content("text", text);
    }
  }

  public record Error(@JsonProperty("code") int code, @JsonProperty("message") String message) {}
}
