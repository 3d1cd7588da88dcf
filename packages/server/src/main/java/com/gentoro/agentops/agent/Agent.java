package com.gentoro.agentops.agent;

import com.gentoro.agentops.orchestrator.Message;
import com.gentoro.agentops.tool.ExecutionResult;
import java.util.List;

/** A named conversation participant. */
public interface Agent {

  AgentDescriptor descriptor();

  default String name() {
    return descriptor().name();
  }

  /**
   * Produce this agent's next turn given the full conversation so far.
   *
   * @throws com.gentoro.agentops.exception.AgentException when no usable response can be produced
   */
  AgentResponse respond(List<Message> history);

  /**
   * Execute one of the calls this agent requested. Tools outside the agent's own set are refused
   * with {@link com.gentoro.agentops.tool.ErrorKind#PERMISSION_DENIED}.
   */
  ExecutionResult invokeTool(ToolCall call);
}
