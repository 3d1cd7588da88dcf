package com.gentoro.agentops.model;

import com.gentoro.agentops.AgentOps;
import com.gentoro.agentops.exception.ConfigException;
import java.util.ServiceLoader;
import org.apache.commons.configuration2.Configuration;

/** Creates {@link LlmClient} instances from configuration through the provider SPI. */
public final class LlmClientFactory {
  private LlmClientFactory() {}

  /**
   * Creates the client for the active profile under the {@code llm.*} namespace.
   *
   * <pre>
   *   llm.active-profile = local
   *   llm.local.provider = ollama
   *   llm.local.model = llama3.1
   * </pre>
   */
  public static LlmClient createProvider(AgentOps agentOps, Configuration configuration) {
    String namespace = configuration.getString("llm.active-profile", "default").trim();
    if (namespace.isEmpty() || !configuration.getKeys("llm.%s".formatted(namespace)).hasNext()) {
      throw new ConfigException("Missing llm.%s configuration".formatted(namespace));
    }
    return create(agentOps, configuration.subset("llm.%s".formatted(namespace)));
  }

  /**
   * Creates a client from a provider-specific subset configuration. Expected keys include at least
   * {@code provider} plus whatever the provider needs ({@code baseUrl}, {@code model}, {@code
   * apiKey}).
   */
  public static LlmClient create(AgentOps agentOps, Configuration subConfig) {
    String provider = subConfig.getString("provider", "");
    if (provider == null || provider.isBlank()) {
      throw new ConfigException("Missing llm.<profile>.provider");
    }
    provider = provider.trim().toLowerCase();

    for (LlmClientProvider p : ServiceLoader.load(LlmClientProvider.class)) {
      if (provider.equals(p.providerId())) {
        return p.create(agentOps, subConfig);
      }
    }
    throw new ConfigException("Unknown llm provider: " + provider);
  }
}
