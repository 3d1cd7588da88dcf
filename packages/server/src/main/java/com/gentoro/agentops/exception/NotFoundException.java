package com.gentoro.agentops.exception;

/** Requested resource (prompt, tool, agent) does not exist. */
public class NotFoundException extends AgentOpsException {
  public NotFoundException(String message) {
    super(AgentOpsErrorCode.NOT_FOUND, message);
  }

  public NotFoundException(String message, Throwable cause) {
    super(AgentOpsErrorCode.NOT_FOUND, message, cause);
  }
}
