package com.gentoro.agentops.exception;

import java.util.Map;

/** A response arrived but is not a valid tool envelope. Treated like a transport failure. */
public class ToolProtocolException extends AgentOpsException {
  public ToolProtocolException(String endpoint, String message) {
    super(
        AgentOpsErrorCode.TOOL_PROTOCOL_ERROR,
        "Malformed response from %s: %s".formatted(endpoint, message),
        Map.of("endpoint", endpoint));
  }

  public ToolProtocolException(String endpoint, String message, Throwable cause) {
    super(
        AgentOpsErrorCode.TOOL_PROTOCOL_ERROR,
        "Malformed response from %s: %s".formatted(endpoint, message),
        Map.of("endpoint", endpoint),
        cause);
  }
}
