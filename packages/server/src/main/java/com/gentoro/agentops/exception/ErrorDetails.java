package com.gentoro.agentops.exception;

import java.util.Map;

/**
 * Structured error information written as the body of failed HTTP responses. {@code timestamp} is
 * an ISO-8601 instant.
 */
public final class ErrorDetails {
  public final String type;
  public final String message;
  public final AgentOpsErrorCode code;
  public final Map<String, Object> context;
  public final String timestamp;

  public ErrorDetails(
      String type,
      String message,
      AgentOpsErrorCode code,
      Map<String, Object> context,
      String timestamp) {
    this.type = type;
    this.message = message;
    this.code = code;
    this.context = context;
    this.timestamp = timestamp;
  }
}
