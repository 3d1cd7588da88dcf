package com.gentoro.agentops.exception;

/** JSON/YAML (de)serialization failure. */
public class SerializationException extends AgentOpsException {
  public SerializationException(String message) {
    super(AgentOpsErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(AgentOpsErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
