package com.gentoro.agentops.exception;

import java.util.Map;

/**
 * The remote tool endpoint could not be reached or did not answer in time: connection refused,
 * timeout, DNS failure, or an HTTP error without a tool envelope. The tool did not run.
 */
public class ToolTransportException extends AgentOpsException {
  public ToolTransportException(String endpoint, String message, Throwable cause) {
    super(
        AgentOpsErrorCode.TOOL_TRANSPORT_ERROR,
        "Tool endpoint %s unreachable: %s".formatted(endpoint, message),
        Map.of("endpoint", endpoint),
        cause);
  }

  public ToolTransportException(String endpoint, String message) {
    this(endpoint, message, null);
  }
}
