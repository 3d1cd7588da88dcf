package com.gentoro.agentops.model;

import com.gentoro.agentops.AgentOps;
import org.apache.commons.configuration2.Configuration;

/** SPI provider for {@link OpenAiCompatibleLlmClient}. */
public final class OpenAiCompatibleLlmClientProvider implements LlmClientProvider {
  @Override
  public String providerId() {
    return "openai-compatible";
  }

  @Override
  public LlmClient create(AgentOps agentOps, Configuration subConfiguration) {
    return new OpenAiCompatibleLlmClient(agentOps, subConfiguration);
  }
}
