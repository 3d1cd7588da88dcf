package com.gentoro.agentops.exception;

/** Illegal or unexpected state encountered. */
public class StateException extends AgentOpsException {
  public StateException(String message) {
    super(AgentOpsErrorCode.FAILED_PRECONDITION, message);
  }

  public StateException(String message, Throwable cause) {
    super(AgentOpsErrorCode.FAILED_PRECONDITION, message, cause);
  }
}
