package com.gentoro.agentops.exception;

/** Prompt template loading or rendering failure. */
public class PromptException extends AgentOpsException {
  public PromptException(String message) {
    super(AgentOpsErrorCode.PROMPT_ERROR, message);
  }

  public PromptException(String message, Throwable cause) {
    super(AgentOpsErrorCode.PROMPT_ERROR, message, cause);
  }
}
