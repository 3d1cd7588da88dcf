package com.gentoro.agentops.tool;

import java.util.Objects;

/**
 * Value returned by every {@link ToolHandler}. A handler never reports failure by throwing; it
 * returns an error result whose {@link #output()} is the human readable explanation.
 */
public record ExecutionResult(Status status, String output, ErrorKind errorKind) {

  public enum Status {
    OK,
    ERROR
  }

  public ExecutionResult {
    Objects.requireNonNull(status, "status");
    output = output == null ? "" : output;
    if (status == Status.OK && errorKind != null) {
      throw new IllegalArgumentException("ok results carry no error kind");
    }
    if (status == Status.ERROR && errorKind == null) {
      throw new IllegalArgumentException("error results require an error kind");
    }
  }

  public static ExecutionResult ok(String output) {
    return new ExecutionResult(Status.OK, output, null);
  }

  public static ExecutionResult error(ErrorKind kind, String message) {
    return new ExecutionResult(Status.ERROR, message, kind);
  }

  public boolean isOk() {
    return status == Status.OK;
  }

  public boolean isError() {
    return status == Status.ERROR;
  }

  /** Text as posted back into the conversation; errors are prefixed with their kind. */
  public String asConversationText() {
    return isOk() ? output : "%s: %s".formatted(errorKind.label(), output);
  }
}
