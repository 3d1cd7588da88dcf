package com.gentoro.agentops.orchestrator;

/** Phases of one conversation, in the order the turn loop visits them. */
public enum OrchestratorState {
  IDLE,
  SELECTING_SPEAKER,
  AWAITING_AGENT_RESPONSE,
  EXECUTING_TOOLS,
  TERMINATED
}
