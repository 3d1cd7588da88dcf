package com.gentoro.agentops.exception;

/** Network-level communication error (HTTP, sockets, timeouts). */
public class NetworkException extends AgentOpsException {
  public NetworkException(String message) {
    super(AgentOpsErrorCode.NETWORK_ERROR, message);
  }

  public NetworkException(String message, Throwable cause) {
    super(AgentOpsErrorCode.NETWORK_ERROR, message, cause);
  }
}
