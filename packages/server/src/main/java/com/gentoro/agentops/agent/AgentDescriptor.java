package com.gentoro.agentops.agent;

import com.gentoro.agentops.exception.ValidationException;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Static description of a conversation participant: a unique name, the capability directive shown
 * to the speaker selector and the model, and the tools it may call.
 */
public record AgentDescriptor(String name, String directive, Set<String> tools) {
  public AgentDescriptor {
    if (name == null || name.isBlank()) {
      throw new ValidationException("Agent name must not be blank");
    }
    directive = directive == null ? "" : directive.trim();
    tools =
        tools == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(tools));
  }

  public boolean canUse(String toolName) {
    return tools.contains(toolName);
  }
}
