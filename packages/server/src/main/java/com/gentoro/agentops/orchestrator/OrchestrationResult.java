package com.gentoro.agentops.orchestrator;

import com.gentoro.agentops.agent.AgentResponse;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Outcome of {@link Orchestrator#execute(String)}.
 *
 * @param conversation messages with non-empty content, in insertion order
 * @param participants agents that produced at least one turn, in order of first appearance
 * @param finalAnswer last non-empty agent message without its termination marker, or empty
 */
public record OrchestrationResult(
    List<Entry> conversation,
    List<String> participants,
    TerminationReason terminationReason,
    int rounds,
    String finalAnswer) {

  public record Entry(String speaker, String content) {}

  public OrchestrationResult {
    conversation = List.copyOf(conversation);
    participants = List.copyOf(participants);
    finalAnswer = finalAnswer == null ? "" : finalAnswer;
  }

  public boolean succeeded() {
    return terminationReason != null && terminationReason.isSuccessful();
  }

  static OrchestrationResult from(ConversationState state) {
    List<Entry> conversation = new ArrayList<>();
    Set<String> participants = new LinkedHashSet<>();
    String finalAnswer = "";
    for (Message m : state.messages()) {
      if (m.kind() == Message.Kind.AGENT) {
        participants.add(m.speaker());
      }
      if (!m.hasContent()) {
        continue;
      }
      conversation.add(new Entry(m.speaker(), m.content()));
      if (m.kind() == Message.Kind.AGENT) {
        String stripped = AgentResponse.stripMarker(m.content());
        if (!stripped.isEmpty()) {
          finalAnswer = stripped;
        }
      }
    }
    return new OrchestrationResult(
        conversation,
        new ArrayList<>(participants),
        state.terminationReason(),
        state.round(),
        finalAnswer);
  }
}
