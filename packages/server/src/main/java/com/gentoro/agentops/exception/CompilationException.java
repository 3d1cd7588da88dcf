package com.gentoro.agentops.exception;

/** The in-memory compiler could not be driven (as opposed to a snippet failing to compile). */
public class CompilationException extends AgentOpsException {
  public CompilationException(String message) {
    super(AgentOpsErrorCode.COMPILATION_ERROR, message);
  }

  public CompilationException(String message, Throwable cause) {
    super(AgentOpsErrorCode.COMPILATION_ERROR, message, cause);
  }
}
