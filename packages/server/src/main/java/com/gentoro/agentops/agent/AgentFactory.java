package com.gentoro.agentops.agent;

import com.gentoro.agentops.exception.ConfigException;
import com.gentoro.agentops.exception.ToolRegistrationException;
import com.gentoro.agentops.model.LlmClient;
import com.gentoro.agentops.prompt.PromptRepository;
import com.gentoro.agentops.tool.ToolGateway;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Builds {@link LlmAgent}s from {@link AgentDefinition}s, validating their tool references. */
public class AgentFactory {
  private static final org.slf4j.Logger log =
      com.gentoro.agentops.logging.LoggingService.getLogger(AgentFactory.class);

  private final ToolGateway gateway;
  private final LlmClient llmClient;
  private final PromptRepository prompts;

  public AgentFactory(ToolGateway gateway, LlmClient llmClient, PromptRepository prompts) {
    this.gateway = gateway;
    this.llmClient = llmClient;
    this.prompts = prompts;
  }

  public Agent create(AgentDefinition definition) {
    List<String> unknown =
        definition.tools().stream().filter(t -> !gateway.registry().contains(t)).toList();
    if (!unknown.isEmpty()) {
      throw new ToolRegistrationException(
          "Agent '%s' references unknown tool(s): %s".formatted(definition.name(), unknown));
    }
    String directive =
        prompts
            .get(definition.directive())
            .newSession()
            .enableAll(Map.of("agent_name", definition.name()))
            .renderText();
    AgentDescriptor descriptor =
        new AgentDescriptor(definition.name(), directive, new LinkedHashSet<>(definition.tools()));
    log.info("Created agent '{}' with tools {}", definition.name(), definition.tools());
    return new LlmAgent(descriptor, gateway, llmClient, prompts);
  }

  /** Create every agent, in declaration order. Names must be unique. */
  public List<Agent> createAll(List<AgentDefinition> definitions) {
    Set<String> seen = new HashSet<>();
    List<Agent> agents = new ArrayList<>();
    for (AgentDefinition definition : definitions) {
      if (!seen.add(definition.name())) {
        throw new ConfigException("Duplicate agent name: " + definition.name());
      }
      agents.add(create(definition));
    }
    return agents;
  }
}
