package com.gentoro.agentops.tool.protocol;

import com.gentoro.agentops.exception.AgentOpsErrorCode;
import com.gentoro.agentops.exception.AgentOpsException;

/**
 * An incoming request envelope could not be accepted. Carries the wire error code to answer with
 * and the request id when one could be read.
 */
public class EnvelopeException extends AgentOpsException {
  private final int wireCode;
  private final Long requestId;

  public EnvelopeException(int wireCode, Long requestId, String message) {
    super(AgentOpsErrorCode.INVALID_ARGUMENT, message);
    this.wireCode = wireCode;
    this.requestId = requestId;
  }

  public EnvelopeException(int wireCode, Long requestId, String message, Throwable cause) {
    super(AgentOpsErrorCode.INVALID_ARGUMENT, message, cause);
    this.wireCode = wireCode;
    this.requestId = requestId;
  }

  public int getWireCode() {
    return wireCode;
  }

  public Long getRequestId() {
    return requestId;
  }

  public ToolCallResponse toResponse() {
    return ToolCallResponse.failure(requestId, wireCode, getMessage());
  }
}
