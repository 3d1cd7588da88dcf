package com.gentoro.agentops.exception;

/**
 * Canonical error codes for AgentOps. Codes are stable and suitable for logs, tool envelopes and
 * synthetic conversation messages. Prefer the most specific code that reflects the failure origin.
 */
public enum AgentOpsErrorCode {
  // Generic
  UNKNOWN,
  INVALID_ARGUMENT,
  FAILED_PRECONDITION,
  NOT_FOUND,
  ALREADY_EXISTS,
  PERMISSION_DENIED,
  CANCELLED,

  // I/O and configuration
  CONFIGURATION_ERROR,
  SERIALIZATION_ERROR,
  NETWORK_ERROR,
  DATA_STORE_ERROR,

  // Tool protocol
  TOOL_TRANSPORT_ERROR,
  TOOL_PROTOCOL_ERROR,
  TOOL_REGISTRATION_ERROR,

  // Sandbox
  SANDBOX_VALIDATION_ERROR,
  COMPILATION_ERROR,

  // Conversation
  PROMPT_ERROR,
  LLM_ERROR,
  AGENT_ERROR,
  ORCHESTRATION_ERROR,
}
