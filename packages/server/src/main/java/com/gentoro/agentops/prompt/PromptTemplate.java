package com.gentoro.agentops.prompt;

import com.gentoro.agentops.model.LlmClient;
import java.util.List;
import java.util.Map;

/**
 * Immutable definition of a prompt template composed of multiple sections. Use {@link
 * PromptSession} to select sections and render.
 */
public interface PromptTemplate {
  /** Identifier of this template (e.g., "agent-turn"). */
  String id();

  List<PromptSection> sections();

  PromptSession newSession();

  /** A single prompt section (message) definition. */
  record PromptSection(LlmClient.Role role, String id, boolean enabledByDefault, String content) {}

  /** Per-render mutable context used to enable/disable sections and render output. */
  interface PromptSession {
    PromptSession enable(String sectionId, Map<String, Object> vars);

    /** Enable every section with the same variables. */
    PromptSession enableAll(Map<String, Object> vars);

    PromptSession disable(String... sectionIds);

    PromptSession clear();

    List<LlmClient.Message> renderMessages();

    String renderText();
  }
}
