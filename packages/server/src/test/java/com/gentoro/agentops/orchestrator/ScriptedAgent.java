package com.gentoro.agentops.orchestrator;

import com.gentoro.agentops.agent.AbstractAgent;
import com.gentoro.agentops.agent.AgentDescriptor;
import com.gentoro.agentops.agent.AgentResponse;
import com.gentoro.agentops.tool.ToolGateway;
import com.gentoro.agentops.tool.ToolRegistry;
import com.gentoro.agentops.tool.protocol.RemoteToolClient;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Agent that replays a fixed list of responses. Once the script is exhausted it keeps repeating
 * the last response. Records the history size it saw on every turn.
 */
class ScriptedAgent extends AbstractAgent {
  private final Deque<AgentResponse> script;
  private AgentResponse last;
  final List<Integer> historySizes = new ArrayList<>();

  ScriptedAgent(String name, Set<String> tools, ToolGateway gateway, AgentResponse... responses) {
    super(new AgentDescriptor(name, "Scripted agent " + name, tools), gateway);
    this.script = new ArrayDeque<>(List.of(responses));
  }

  ScriptedAgent(String name, AgentResponse... responses) {
    this(name, Set.of(), emptyGateway(), responses);
  }

  static ToolGateway emptyGateway() {
    return new ToolGateway(new ToolRegistry(), new RemoteToolClient(Duration.ofSeconds(1)));
  }

  @Override
  public AgentResponse respond(List<Message> history) {
    historySizes.add(history.size());
    if (!script.isEmpty()) {
      last = script.poll();
    }
    return last;
  }
}
