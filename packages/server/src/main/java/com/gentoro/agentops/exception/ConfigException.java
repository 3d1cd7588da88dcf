package com.gentoro.agentops.exception;

/** Configuration or environment related problem detected at startup or runtime. */
public class ConfigException extends AgentOpsException {
  public ConfigException(String message) {
    super(AgentOpsErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(AgentOpsErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
