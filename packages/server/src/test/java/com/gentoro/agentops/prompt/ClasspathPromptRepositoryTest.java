package com.gentoro.agentops.prompt;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.agentops.exception.NotFoundException;
import com.gentoro.agentops.exception.PromptException;
import com.gentoro.agentops.model.LlmClient;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ClasspathPromptRepositoryTest {

  private final PromptRepository repository = PromptRepositoryFactory.create("classpath:prompts");

  @Test
  void rendersAgentTurnWithTools() {
    PromptTemplate template = repository.get("agent-turn");
    assertEquals("agent-turn", template.id());
    assertEquals(2, template.sections().size());

    List<LlmClient.Message> messages =
        template
            .newSession()
            .enableAll(
                Map.of(
                    "agent_name", "SQL_Specialist",
                    "directive", "Answer with SQL.",
                    "tools",
                        List.of(
                            Map.of(
                                "name", "execute_sql_query",
                                "description", "Runs a query",
                                "signature", "(sql: string*)")),
                    "transcript", "[user] How many customers?"))
            .renderMessages();

    assertEquals(2, messages.size());
    assertEquals(LlmClient.Role.SYSTEM, messages.get(0).role());
    String system = messages.get(0).content();
    assertTrue(system.contains("You are SQL_Specialist"));
    assertTrue(system.contains("- execute_sql_query(sql: string*): Runs a query"));
    assertFalse(system.contains("You have no tools"));
    // verbatim block is emitted as-is
    assertTrue(system.contains("\"tool_calls\": [ { \"name\": \"tool_name\""));

    assertEquals(LlmClient.Role.USER, messages.get(1).role());
    assertTrue(messages.get(1).content().contains("[user] How many customers?"));
    assertTrue(messages.get(1).content().contains("It is your turn, SQL_Specialist."));
  }

  @Test
  void agentTurnWithoutTools() {
    String text =
        repository
            .get("agent-turn")
            .newSession()
            .enableAll(
                Map.of(
                    "agent_name", "Data_Analyst",
                    "directive", "Summarize.",
                    "tools", List.of(),
                    "transcript", "-"))
            .disable("transcript")
            .renderText();
    assertTrue(text.contains("You have no tools."));
    assertFalse(text.contains("It is your turn"));
  }

  @Test
  void speakerSelectionIndentsDirectives() {
    String text =
        repository
            .get("speaker-selection")
            .newSession()
            .enableAll(
                Map.of(
                    "agents",
                        List.of(
                            Map.of("name", "SQL_Specialist", "directive", "line one\nline two")),
                    "last_speaker", "user",
                    "last_message", "How many customers?"))
            .renderText();
    assertTrue(text.contains("- SQL_Specialist:"));
    assertTrue(text.contains("    line one\n    line two"));
    assertTrue(text.contains("Last speaker: user"));
    assertTrue(text.contains("\n\n"), "sections are joined by a blank line");
  }

  @Test
  void bundledAgentDirectivesLoad() {
    for (String name :
        List.of("agents/sql-specialist", "agents/data-analyst", "agents/web-researcher")) {
      String text = repository.get(name).newSession().enableAll(Map.of()).renderText();
      assertFalse(text.isBlank(), name);
    }
    assertTrue(
        repository
            .get("/agents/sql-specialist")
            .newSession()
            .enableAll(Map.of())
            .renderText()
            .contains("SQL database expert"));
  }

  @Test
  void missingVariableFailsRendering() {
    PromptTemplate.PromptSession session =
        repository.get("agent-turn").newSession().enable("transcript", Map.of("transcript", "x"));
    assertThrows(PromptException.class, session::renderMessages);
  }

  @Test
  void clearedSessionRendersNothing() {
    assertTrue(
        repository
            .get("speaker-selection")
            .newSession()
            .enableAll(Map.of())
            .clear()
            .renderMessages()
            .isEmpty());
  }

  @Test
  void templatesAreCached() {
    assertSame(repository.get("agent-turn"), repository.get("agent-turn"));
  }

  @Test
  void missingAndBlankNames() {
    assertThrows(NotFoundException.class, () -> repository.get("does-not-exist"));
    assertThrows(PromptException.class, () -> repository.get(" "));
    assertThrows(PromptException.class, () -> repository.get(null));
  }
}
