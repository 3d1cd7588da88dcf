package com.gentoro.agentops.exception;

/** Input validation failure or illegal argument. */
public class ValidationException extends AgentOpsException {
  public ValidationException(String message) {
    super(AgentOpsErrorCode.INVALID_ARGUMENT, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(AgentOpsErrorCode.INVALID_ARGUMENT, message, cause);
  }
}
