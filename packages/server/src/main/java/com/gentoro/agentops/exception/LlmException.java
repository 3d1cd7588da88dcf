package com.gentoro.agentops.exception;

/** Language model invocation failed or returned an unusable payload. */
public class LlmException extends AgentOpsException {
  public LlmException(String message) {
    super(AgentOpsErrorCode.LLM_ERROR, message);
  }

  public LlmException(String message, Throwable cause) {
    super(AgentOpsErrorCode.LLM_ERROR, message, cause);
  }
}
