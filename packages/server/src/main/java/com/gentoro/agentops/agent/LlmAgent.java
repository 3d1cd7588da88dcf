package com.gentoro.agentops.agent;

import com.gentoro.agentops.exception.AgentException;
import com.gentoro.agentops.model.LlmClient;
import com.gentoro.agentops.orchestrator.Message;
import com.gentoro.agentops.prompt.PromptRepository;
import com.gentoro.agentops.tool.ToolDescriptor;
import com.gentoro.agentops.tool.ToolGateway;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Agent whose turns are decided by an LLM.
 *
 * <p>Each turn renders the {@value #TURN_PROMPT} template with the agent's directive, its tool
 * catalogue and the transcript, then parses the reply with {@link AgentResponseParser}.
 */
public class LlmAgent extends AbstractAgent {
  private static final org.slf4j.Logger log =
      com.gentoro.agentops.logging.LoggingService.getLogger(LlmAgent.class);

  public static final String TURN_PROMPT = "agent-turn";

  private final LlmClient llmClient;
  private final PromptRepository prompts;
  private final AgentResponseParser parser;

  public LlmAgent(
      AgentDescriptor descriptor,
      ToolGateway gateway,
      LlmClient llmClient,
      PromptRepository prompts) {
    this(descriptor, gateway, llmClient, prompts, new AgentResponseParser());
  }

  public LlmAgent(
      AgentDescriptor descriptor,
      ToolGateway gateway,
      LlmClient llmClient,
      PromptRepository prompts,
      AgentResponseParser parser) {
    super(descriptor, gateway);
    this.llmClient = llmClient;
    this.prompts = prompts;
    this.parser = parser;
  }

  @Override
  public AgentResponse respond(List<Message> history) {
    try {
      Map<String, Object> vars = new HashMap<>();
      vars.put("agent_name", name());
      vars.put("directive", descriptor.directive());
      vars.put("tools", toolCatalogue());
      vars.put("transcript", Message.transcript(history));

      List<LlmClient.Message> messages =
          prompts.get(TURN_PROMPT).newSession().enableAll(vars).renderMessages();
      String reply = llmClient.chat(messages);
      log.trace("Agent '{}' raw reply:\n{}", name(), reply);
      return parser.parse(reply);
    } catch (AgentException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new AgentException(name(), e.getMessage(), e);
    }
  }

  private List<Map<String, Object>> toolCatalogue() {
    List<Map<String, Object>> out = new ArrayList<>();
    for (String toolName : descriptor.tools()) {
      ToolDescriptor tool = gateway.registry().find(toolName).orElse(null);
      if (tool == null) {
        continue;
      }
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("name", tool.name());
      entry.put("description", tool.description());
      entry.put("signature", tool.schema().signature());
      out.add(entry);
    }
    return out;
  }
}
