package com.gentoro.agentops.exception;

import java.util.List;
import java.util.Map;

/** Snippet rejected before execution: disallowed import, unparsable or uncompilable source. */
public class SandboxValidationException extends AgentOpsException {
  public SandboxValidationException(String message) {
    super(AgentOpsErrorCode.SANDBOX_VALIDATION_ERROR, message);
  }

  public SandboxValidationException(String message, List<String> rejectedImports) {
    super(
        AgentOpsErrorCode.SANDBOX_VALIDATION_ERROR,
        message,
        Map.of("rejectedImports", List.copyOf(rejectedImports)));
  }
}
