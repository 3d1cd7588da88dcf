package com.gentoro.agentops.exception;

import java.util.Map;

/** An agent could not produce a usable response. */
public class AgentException extends AgentOpsException {
  public AgentException(String message) {
    super(AgentOpsErrorCode.AGENT_ERROR, message);
  }

  public AgentException(String message, Throwable cause) {
    super(AgentOpsErrorCode.AGENT_ERROR, message, cause);
  }

  public AgentException(String agentName, String message, Throwable cause) {
    super(
        AgentOpsErrorCode.AGENT_ERROR,
        "Agent '%s' failed: %s".formatted(agentName, message),
        Map.of("agent", agentName),
        cause);
  }
}
