package com.gentoro.agentops.orchestrator.trace;

import com.gentoro.agentops.agent.ToolCall;
import com.gentoro.agentops.orchestrator.TerminationReason;
import com.gentoro.agentops.tool.ExecutionResult;

/** Used when tracing is disabled. */
public class NoOpTraceSink implements TraceSink {
  @Override
  public void onTurn(String conversationId, int round, String agent, String content, int toolCalls) {}

  @Override
  public void onToolCall(
      String conversationId,
      int round,
      String agent,
      ToolCall call,
      ExecutionResult result,
      long latencyMs) {}

  @Override
  public void onTerminated(String conversationId, TerminationReason reason, int rounds) {}
}
