package com.gentoro.agentops.orchestrator.trace;

import com.gentoro.agentops.agent.ToolCall;
import com.gentoro.agentops.orchestrator.TerminationReason;
import com.gentoro.agentops.tool.ExecutionResult;

/**
 * Observer of conversation progress. Implementations should be lightweight; the orchestrator calls
 * them on the turn loop thread and ignores (after logging) any exception they throw.
 */
public interface TraceSink {

  /**
   * A completed agent turn.
   *
   * @param round 1-based round number
   * @param toolCalls number of tool calls the turn requested
   */
  void onTurn(String conversationId, int round, String agent, String content, int toolCalls);

  void onToolCall(
      String conversationId,
      int round,
      String agent,
      ToolCall call,
      ExecutionResult result,
      long latencyMs);

  void onTerminated(String conversationId, TerminationReason reason, int rounds);
}
