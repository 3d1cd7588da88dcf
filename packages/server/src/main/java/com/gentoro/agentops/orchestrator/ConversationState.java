package com.gentoro.agentops.orchestrator;

import com.gentoro.agentops.agent.ToolCall;
import com.gentoro.agentops.exception.OrchestrationException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Mutable state of a single conversation. Created by {@link Orchestrator#execute(String)} and
 * never shared between calls, so it needs no synchronization.
 */
public final class ConversationState {
  private static final org.slf4j.Logger log =
      com.gentoro.agentops.logging.LoggingService.getLogger(ConversationState.class);

  private final String id = UUID.randomUUID().toString();
  private final int maxRounds;
  private final List<Message> messages = new ArrayList<>();
  private int round;
  private long toolCallSequence;
  private OrchestratorState state = OrchestratorState.IDLE;
  private TerminationReason terminationReason;

  public ConversationState(int maxRounds) {
    if (maxRounds < 1) {
      throw new IllegalArgumentException("maxRounds must be at least 1, got " + maxRounds);
    }
    this.maxRounds = maxRounds;
  }

  public String id() {
    return id;
  }

  public Message append(String speaker, String content, List<ToolCall> toolCalls, Message.Kind kind) {
    if (state == OrchestratorState.TERMINATED) {
      throw new OrchestrationException("Conversation " + id + " is already terminated");
    }
    Message message = new Message(messages.size(), speaker, content, toolCalls, kind);
    messages.add(message);
    return message;
  }

  public Message append(String speaker, String content, Message.Kind kind) {
    return append(speaker, content, List.of(), kind);
  }

  /** Read-only view over the messages appended so far. */
  public List<Message> messages() {
    return Collections.unmodifiableList(messages);
  }

  public int round() {
    return round;
  }

  public int maxRounds() {
    return maxRounds;
  }

  public void completeRound() {
    if (round >= maxRounds) {
      throw new OrchestrationException(
          "Round %d exceeds the maximum of %d".formatted(round + 1, maxRounds));
    }
    round++;
  }

  public boolean roundsExhausted() {
    return round >= maxRounds;
  }

  public String nextToolCallId() {
    return "call_" + (++toolCallSequence);
  }

  public OrchestratorState state() {
    return state;
  }

  public void transitionTo(OrchestratorState next) {
    if (state == OrchestratorState.TERMINATED) {
      throw new OrchestrationException("Conversation " + id + " is already terminated");
    }
    log.trace("[{}] {} -> {}", id, state, next);
    state = next;
  }

  public void terminate(TerminationReason reason) {
    if (state == OrchestratorState.TERMINATED) {
      return;
    }
    log.trace("[{}] {} -> TERMINATED ({})", id, state, reason);
    this.terminationReason = reason;
    this.state = OrchestratorState.TERMINATED;
  }

  public boolean isTerminated() {
    return state == OrchestratorState.TERMINATED;
  }

  public TerminationReason terminationReason() {
    return terminationReason;
  }
}
