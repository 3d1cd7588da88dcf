package com.gentoro.agentops.orchestrator;

import com.gentoro.agentops.agent.Agent;
import com.gentoro.agentops.agent.AgentDescriptor;
import com.gentoro.agentops.agent.AgentResponse;
import com.gentoro.agentops.agent.ToolCall;
import com.gentoro.agentops.exception.ExceptionUtil;
import com.gentoro.agentops.exception.OrchestrationException;
import com.gentoro.agentops.exception.ValidationException;
import com.gentoro.agentops.orchestrator.trace.NoOpTraceSink;
import com.gentoro.agentops.orchestrator.trace.TraceSink;
import com.gentoro.agentops.tool.ErrorKind;
import com.gentoro.agentops.tool.ExecutionResult;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Drives a multi-agent conversation for one query.
 *
 * <p>Every call to {@link #execute(String)} seeds a fresh {@link ConversationState} with the query
 * and loops: select a speaker, obtain its response, run the tool calls it requested in order and
 * post their results back. The loop ends when the round limit is reached, an agent signals
 * termination, or no agent is eligible to speak.
 *
 * <p>{@code execute} never throws. A failing agent is recorded as a {@code system} message and
 * ends the conversation, errors included; the partial transcript is still returned. The instance holds only
 * immutable collaborators and may be shared between threads.
 */
public class Orchestrator {
  private static final org.slf4j.Logger log =
      com.gentoro.agentops.logging.LoggingService.getLogger(Orchestrator.class);

  public static final int DEFAULT_MAX_ROUNDS = 10;

  private final Map<String, Agent> agents;
  private final List<AgentDescriptor> descriptors;
  private final SpeakerSelector selector;
  private final int maxRounds;
  private final TraceSink traceSink;

  public Orchestrator(List<Agent> agents, SpeakerSelector selector, int maxRounds) {
    this(agents, selector, maxRounds, new NoOpTraceSink());
  }

  public Orchestrator(
      List<Agent> agents, SpeakerSelector selector, int maxRounds, TraceSink traceSink) {
    if (maxRounds < 1) {
      throw new ValidationException("orchestrator.max-rounds must be at least 1, got " + maxRounds);
    }
    Map<String, Agent> byName = new LinkedHashMap<>();
    List<AgentDescriptor> ds = new ArrayList<>();
    for (Agent agent : agents) {
      if (byName.putIfAbsent(agent.name(), agent) != null) {
        throw new ValidationException("Duplicate agent name: " + agent.name());
      }
      ds.add(agent.descriptor());
    }
    this.agents = Collections.unmodifiableMap(byName);
    this.descriptors = List.copyOf(ds);
    this.selector = selector;
    this.maxRounds = maxRounds;
    this.traceSink = traceSink == null ? new NoOpTraceSink() : traceSink;
  }

  public List<AgentDescriptor> descriptors() {
    return descriptors;
  }

  public OrchestrationResult execute(String query) {
    ConversationState state = new ConversationState(maxRounds);
    if (query == null || query.isBlank()) {
      log.warn("Rejected blank query");
      state.append(Message.SYSTEM, "Query must not be blank; nothing to do.", Message.Kind.SYSTEM);
      state.terminate(TerminationReason.INVALID_QUERY);
      return OrchestrationResult.from(state);
    }

    log.info("[{}] Starting conversation with {} agent(s)", state.id(), descriptors.size());
    state.append(Message.USER, query, Message.Kind.USER);
    try {
      runTurns(state);
    } catch (Throwable e) {
      log.error("[{}] Conversation failed", state.id(), e);
      if (!state.isTerminated()) {
        state.append(
            Message.SYSTEM,
            "Conversation aborted: " + ExceptionUtil.describe(e),
            Message.Kind.SYSTEM);
        state.terminate(TerminationReason.ORCHESTRATION_FAILURE);
      }
    }
    trace(() -> traceSink.onTerminated(state.id(), state.terminationReason(), state.round()));
    log.info(
        "[{}] Conversation finished after {} round(s): {}",
        state.id(),
        state.round(),
        state.terminationReason());
    return OrchestrationResult.from(state);
  }

  private void runTurns(ConversationState state) {
    while (!state.isTerminated()) {
      state.transitionTo(OrchestratorState.SELECTING_SPEAKER);
      Optional<AgentDescriptor> next = selector.select(state.messages(), descriptors);
      if (next.isEmpty()) {
        state.terminate(TerminationReason.NO_ELIGIBLE_SPEAKER);
        return;
      }
      Agent agent = agents.get(next.get().name());
      if (agent == null) {
        throw new OrchestrationException(
            "Selector returned unregistered agent " + next.get().name());
      }

      state.transitionTo(OrchestratorState.AWAITING_AGENT_RESPONSE);
      AgentResponse response;
      try {
        response = agent.respond(state.messages());
        if (response == null) {
          throw new OrchestrationException("Agent '" + agent.name() + "' returned no response");
        }
      } catch (Throwable e) {
        log.error("[{}] Agent '{}' failed", state.id(), agent.name(), e);
        state.append(
            Message.SYSTEM,
            "Agent '%s' failed: %s".formatted(agent.name(), ExceptionUtil.describe(e)),
            Message.Kind.SYSTEM);
        state.terminate(TerminationReason.AGENT_FAILURE);
        return;
      }

      List<ToolCall> calls = new ArrayList<>();
      for (ToolCall call : response.toolCalls()) {
        calls.add(call.withId(state.nextToolCallId()));
      }
      state.append(agent.name(), response.content(), calls, Message.Kind.AGENT);
      int round = state.round() + 1;
      log.debug(
          "[{}] Round {}: '{}' responded with {} tool call(s)",
          state.id(),
          round,
          agent.name(),
          calls.size());
      trace(
          () ->
              traceSink.onTurn(state.id(), round, agent.name(), response.content(), calls.size()));

      if (!calls.isEmpty()) {
        state.transitionTo(OrchestratorState.EXECUTING_TOOLS);
        for (ToolCall call : calls) {
          long start = System.currentTimeMillis();
          ExecutionResult result = invoke(agent, call);
          long latency = System.currentTimeMillis() - start;
          state.append(call.name(), result.asConversationText(), List.of(call), Message.Kind.TOOL);
          trace(() -> traceSink.onToolCall(state.id(), round, agent.name(), call, result, latency));
        }
      }
      state.completeRound();

      if (response.isTerminal()) {
        state.terminate(TerminationReason.AGENT_TERMINATED);
      } else if (state.roundsExhausted()) {
        state.terminate(TerminationReason.MAX_ROUNDS);
      }
    }
  }

  private ExecutionResult invoke(Agent agent, ToolCall call) {
    try {
      ExecutionResult result = agent.invokeTool(call);
      return result == null
          ? ExecutionResult.error(
              ErrorKind.EXECUTION, "Tool '" + call.name() + "' returned no result")
          : result;
    } catch (Exception e) {
      log.error("Tool '{}' failed for agent '{}'", call.name(), agent.name(), e);
      return ExecutionResult.error(ErrorKind.EXECUTION, ExceptionUtil.describe(e));
    }
  }

  private void trace(Runnable event) {
    try {
      event.run();
    } catch (RuntimeException e) {
      log.warn("Trace sink failed: {}", e.getMessage(), e);
    }
  }
}
