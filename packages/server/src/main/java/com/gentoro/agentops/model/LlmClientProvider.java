package com.gentoro.agentops.model;

import com.gentoro.agentops.AgentOps;
import org.apache.commons.configuration2.Configuration;

/**
 * Service Provider Interface (SPI) for pluggable LLM providers.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader} and identify themselves
 * with a stable, lowercase {@link #providerId()}. Register a provider in {@code
 * META-INF/services/com.gentoro.agentops.model.LlmClientProvider}.
 */
public interface LlmClientProvider {

  String providerId();

  /**
   * @param subConfiguration provider-specific configuration subset (e.g. {@code llm.ollama.*})
   * @throws IllegalArgumentException when the configuration is invalid
   */
  LlmClient create(AgentOps agentOps, Configuration subConfiguration);
}
