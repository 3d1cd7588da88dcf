package com.gentoro.agentops.model;

import com.gentoro.agentops.AgentOps;
import org.apache.commons.configuration2.Configuration;

/** SPI provider for the Ollama {@link LlmClient}. */
public final class OllamaLlmClientProvider implements LlmClientProvider {
  @Override
  public String providerId() {
    return "ollama";
  }

  @Override
  public LlmClient create(AgentOps agentOps, Configuration subConfiguration) {
    return new OllamaLlmClient(agentOps, subConfiguration);
  }
}
