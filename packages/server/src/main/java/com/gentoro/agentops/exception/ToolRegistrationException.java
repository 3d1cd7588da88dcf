package com.gentoro.agentops.exception;

/** A tool could not be registered, or an agent references a tool that is not registered. */
public class ToolRegistrationException extends AgentOpsException {
  public ToolRegistrationException(String message) {
    super(AgentOpsErrorCode.TOOL_REGISTRATION_ERROR, message);
  }

  public ToolRegistrationException(String message, Throwable cause) {
    super(AgentOpsErrorCode.TOOL_REGISTRATION_ERROR, message, cause);
  }
}
