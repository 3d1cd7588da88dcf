package com.gentoro.agentops.exception;

/** The conversation driver hit an internal invariant violation. */
public class OrchestrationException extends AgentOpsException {
  public OrchestrationException(String message) {
    super(AgentOpsErrorCode.ORCHESTRATION_ERROR, message);
  }

  public OrchestrationException(String message, Throwable cause) {
    super(AgentOpsErrorCode.ORCHESTRATION_ERROR, message, cause);
  }
}
