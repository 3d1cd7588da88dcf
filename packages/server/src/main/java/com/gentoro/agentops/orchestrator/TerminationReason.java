package com.gentoro.agentops.orchestrator;

public enum TerminationReason {
  /** The round counter reached the configured maximum. */
  MAX_ROUNDS,
  /** An agent signalled that the conversation is complete. */
  AGENT_TERMINATED,
  NO_ELIGIBLE_SPEAKER,
  /** An agent could not produce a response. */
  AGENT_FAILURE,
  /** The turn loop itself failed. */
  ORCHESTRATION_FAILURE,
  /** The query was blank and no turn ran. */
  INVALID_QUERY;

  /** Whether the conversation ended normally. */
  public boolean isSuccessful() {
    return this == MAX_ROUNDS || this == AGENT_TERMINATED || this == NO_ELIGIBLE_SPEAKER;
  }
}
