package com.gentoro.agentops.tool;

/** Typed failure carried by an error {@link ExecutionResult}. */
public enum ErrorKind {
  /** Remote endpoint unreachable or timed out; the tool did not run. */
  TRANSPORT("Transport Error"),
  /** Remote endpoint answered with something that is not a tool envelope. */
  PROTOCOL("Protocol Error"),
  /** The tool ran and reported a logical failure (e.g. invalid SQL). */
  APPLICATION("Application Error"),
  /** Input rejected before running, e.g. a sandbox snippet importing a forbidden package. */
  VALIDATION("Security Error"),
  /** The handler itself failed while running. */
  EXECUTION("Execution Error"),
  TIMEOUT("Timeout Error"),
  UNKNOWN_TOOL("Unknown Tool"),
  /** The calling agent is not allowed to use the tool. */
  PERMISSION_DENIED("Permission Denied");

  private final String label;

  ErrorKind(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }
}
