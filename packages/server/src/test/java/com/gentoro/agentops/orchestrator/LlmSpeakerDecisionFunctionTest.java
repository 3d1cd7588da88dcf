package com.gentoro.agentops.orchestrator;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.agentops.agent.AgentDescriptor;
import com.gentoro.agentops.agent.ToolCall;
import com.gentoro.agentops.model.LlmClient;
import com.gentoro.agentops.prompt.PromptRepository;
import com.gentoro.agentops.prompt.PromptRepositoryFactory;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class LlmSpeakerDecisionFunctionTest {

  private static final List<AgentDescriptor> AGENTS =
      List.of(
          new AgentDescriptor("sql_specialist", "Writes SQL against the store.", Set.of()),
          new AgentDescriptor("web_researcher", "Looks things up online.", Set.of()));

  private final PromptRepository prompts = PromptRepositoryFactory.create("classpath:prompts");

  @Test
  void interpretsExactNameIgnoringCaseAndPunctuation() {
    assertEquals(
        SpeakerChoice.of("sql_specialist"),
        LlmSpeakerDecisionFunction.interpret("  SQL_Specialist. ", AGENTS));
    assertEquals(
        SpeakerChoice.of("web_researcher"),
        LlmSpeakerDecisionFunction.interpret("**web_researcher**", AGENTS));
  }

  @Test
  void interpretsFirstMentionedName() {
    SpeakerChoice choice =
        LlmSpeakerDecisionFunction.interpret(
            "I think web_researcher should go, then sql_specialist.", AGENTS);
    assertEquals("web_researcher", choice.name());
  }

  @Test
  void interpretsNoneAndGarbage() {
    assertTrue(LlmSpeakerDecisionFunction.interpret("NONE", AGENTS).isNone());
    assertTrue(LlmSpeakerDecisionFunction.interpret("none.", AGENTS).isNone());
    assertEquals("banana", LlmSpeakerDecisionFunction.interpret("banana", AGENTS).name());
    assertEquals("", LlmSpeakerDecisionFunction.interpret("   ", AGENTS).name());
  }

  @Test
  void forcesAgentWhoseLastTurnRequestedTools() {
    AtomicInteger calls = new AtomicInteger();
    LlmClient llm =
        (messages, listener) -> {
          calls.incrementAndGet();
          return "web_researcher";
        };
    List<Message> history = new ArrayList<>();
    history.add(new Message(0, Message.USER, "How many customers?", List.of(), Message.Kind.USER));
    ToolCall call = new ToolCall("call_1", "get_database_schema", Map.of());
    history.add(new Message(1, "sql_specialist", "", List.of(call), Message.Kind.AGENT));
    history.add(new Message(2, "get_database_schema", "-- Table: customers", List.of(call), Message.Kind.TOOL));

    SpeakerChoice choice = new LlmSpeakerDecisionFunction(llm, prompts).chooseNext(history, AGENTS);

    assertEquals(SpeakerChoice.forced("sql_specialist"), choice);
    assertEquals(0, calls.get());
  }

  @Test
  void noUserMessageMeansNobodySpeaks() {
    LlmClient llm = (messages, listener) -> fail("model must not be called");
    SpeakerChoice choice = new LlmSpeakerDecisionFunction(llm, prompts).chooseNext(List.of(), AGENTS);
    assertTrue(choice.isNone());
  }

  @Test
  void rendersDirectivesIntoSelectionPrompt() {
    List<List<LlmClient.Message>> seen = new ArrayList<>();
    LlmClient llm =
        (messages, listener) -> {
          seen.add(messages);
          return "sql_specialist";
        };
    List<Message> history =
        List.of(new Message(0, Message.USER, "How many customers?", List.of(), Message.Kind.USER));

    SpeakerChoice choice = new LlmSpeakerDecisionFunction(llm, prompts).chooseNext(history, AGENTS);

    assertEquals(SpeakerChoice.of("sql_specialist"), choice);
    assertEquals(1, seen.size());
    String system = seen.get(0).get(0).content();
    assertTrue(system.contains("sql_specialist"), system);
    assertTrue(system.contains("Looks things up online."), system);
    String user = seen.get(0).get(seen.get(0).size() - 1).content();
    assertTrue(user.contains("How many customers?"), user);
  }
}
