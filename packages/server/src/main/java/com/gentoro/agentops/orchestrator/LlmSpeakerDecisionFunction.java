package com.gentoro.agentops.orchestrator;

import com.gentoro.agentops.agent.AgentDescriptor;
import com.gentoro.agentops.model.LlmClient;
import com.gentoro.agentops.prompt.PromptRepository;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Asks the LLM which agent should speak next, given each agent's directive and the latest message.
 *
 * <p>Two cases are decided without a model call: an agent whose last turn requested tools is
 * forced to speak again so it reads the results, and a history without user input yields "none".
 */
public class LlmSpeakerDecisionFunction implements SpeakerDecisionFunction {
  private static final org.slf4j.Logger log =
      com.gentoro.agentops.logging.LoggingService.getLogger(LlmSpeakerDecisionFunction.class);

  public static final String SELECTION_PROMPT = "speaker-selection";
  static final String NONE = "NONE";

  private final LlmClient llmClient;
  private final PromptRepository prompts;

  public LlmSpeakerDecisionFunction(LlmClient llmClient, PromptRepository prompts) {
    this.llmClient = llmClient;
    this.prompts = prompts;
  }

  @Override
  public SpeakerChoice chooseNext(List<Message> history, List<AgentDescriptor> descriptors) {
    if (history.stream().noneMatch(m -> m.kind() == Message.Kind.USER)) {
      return SpeakerChoice.none();
    }
    Message lastAgentTurn = lastAgentTurn(history);
    if (lastAgentTurn != null && lastAgentTurn.hasToolCalls()) {
      return SpeakerChoice.forced(lastAgentTurn.speaker());
    }

    List<Map<String, Object>> agents = new ArrayList<>();
    for (AgentDescriptor d : descriptors) {
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("name", d.name());
      entry.put("directive", d.directive());
      agents.add(entry);
    }
    Message latest = history.get(history.size() - 1);
    Map<String, Object> vars = new HashMap<>();
    vars.put("agents", agents);
    vars.put("last_speaker", latest.speaker());
    vars.put("last_message", latest.content());

    List<LlmClient.Message> messages =
        prompts.get(SELECTION_PROMPT).newSession().enableAll(vars).renderMessages();
    String reply = llmClient.chat(messages);
    SpeakerChoice choice = interpret(reply, descriptors);
    log.debug("Speaker selection reply '{}' -> {}", reply, choice);
    return choice;
  }

  /**
   * Map a free-form reply to a choice. An exact name wins; otherwise the first agent name
   * mentioned in the reply is used. Unrecognized text is returned as-is so the selector can fall
   * back to round-robin.
   */
  static SpeakerChoice interpret(String reply, List<AgentDescriptor> descriptors) {
    if (reply == null || reply.isBlank()) {
      return SpeakerChoice.of("");
    }
    String token = reply.strip().replaceAll("^[^A-Za-z0-9_]+|[^A-Za-z0-9_]+$", "");
    if (token.equalsIgnoreCase(NONE)) {
      return SpeakerChoice.none();
    }
    for (AgentDescriptor d : descriptors) {
      if (d.name().equalsIgnoreCase(token)) {
        return SpeakerChoice.of(d.name());
      }
    }
    String lower = reply.toLowerCase(Locale.ROOT);
    AgentDescriptor mentioned =
        descriptors.stream()
            .filter(d -> lower.contains(d.name().toLowerCase(Locale.ROOT)))
            .min(Comparator.comparingInt(d -> lower.indexOf(d.name().toLowerCase(Locale.ROOT))))
            .orElse(null);
    return SpeakerChoice.of(mentioned == null ? token : mentioned.name());
  }

  private static Message lastAgentTurn(List<Message> history) {
    for (int i = history.size() - 1; i >= 0; i--) {
      if (history.get(i).kind() == Message.Kind.AGENT) {
        return history.get(i);
      }
    }
    return null;
  }
}
