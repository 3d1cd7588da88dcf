package com.gentoro.agentops.prompt;

/** Source of named {@link PromptTemplate}s, e.g. {@code agent-turn} or {@code agents/sql-specialist}. */
public interface PromptRepository {
  /**
   * @throws com.gentoro.agentops.exception.PromptException when the template is missing or invalid
   */
  PromptTemplate get(String name);
}
