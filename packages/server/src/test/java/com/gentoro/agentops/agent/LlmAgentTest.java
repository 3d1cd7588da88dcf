package com.gentoro.agentops.agent;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

import com.gentoro.agentops.exception.AgentException;
import com.gentoro.agentops.exception.LlmException;
import com.gentoro.agentops.model.LlmClient;
import com.gentoro.agentops.orchestrator.Message;
import com.gentoro.agentops.prompt.PromptRepository;
import com.gentoro.agentops.prompt.PromptRepositoryFactory;
import com.gentoro.agentops.tool.ExecutionResult;
import com.gentoro.agentops.tool.ToolDescriptor;
import com.gentoro.agentops.tool.ToolGateway;
import com.gentoro.agentops.tool.ToolProperty;
import com.gentoro.agentops.tool.ToolRegistry;
import com.gentoro.agentops.tool.protocol.RemoteToolClient;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class LlmAgentTest {

  private final PromptRepository prompts = PromptRepositoryFactory.create("classpath:prompts");
  private final ToolGateway gateway =
      new ToolGateway(
          new ToolRegistry()
              .register(
                  ToolDescriptor.builder()
                      .name("execute_sql_query")
                      .description("Execute a read-only SQL query")
                      .schema(ToolProperty.object(ToolProperty.string("sql", "SQL", true)))
                      .handler(args -> ExecutionResult.ok("n\n-\n200"))
                      .build()),
          new RemoteToolClient(Duration.ofSeconds(1)));

  private final List<Message> history =
      List.of(new Message(0, Message.USER, "How many customers?", List.of(), Message.Kind.USER));

  @Test
  @SuppressWarnings("unchecked")
  void rendersDirectiveToolsAndTranscript() {
    LlmClient llm = mock(LlmClient.class);
    when(llm.chat(anyList())).thenReturn("We have 200 customers. TERMINATE");
    AgentDescriptor descriptor =
        new AgentDescriptor("sql_specialist", "You write SQL.", Set.of("execute_sql_query"));

    AgentResponse response = new LlmAgent(descriptor, gateway, llm, prompts).respond(history);

    assertTrue(response.isTerminal());
    ArgumentCaptor<List<LlmClient.Message>> captor = ArgumentCaptor.forClass(List.class);
    verify(llm).chat(captor.capture());
    List<LlmClient.Message> messages = captor.getValue();
    assertEquals(LlmClient.Role.SYSTEM, messages.get(0).role());
    String system = messages.get(0).content();
    assertTrue(system.contains("You are sql_specialist"), system);
    assertTrue(system.contains("You write SQL."), system);
    assertTrue(system.contains("execute_sql_query(sql: string*)"), system);
    assertTrue(system.contains("\"tool_calls\""), system);
    String user = messages.get(messages.size() - 1).content();
    assertTrue(user.contains("[user]\nHow many customers?"), user);
  }

  @Test
  void agentWithoutToolsIsToldSo() {
    LlmClient llm = mock(LlmClient.class);
    when(llm.chat(anyList())).thenReturn("ok");
    AgentDescriptor descriptor = new AgentDescriptor("critic", "You review answers.", Set.of());

    new LlmAgent(descriptor, gateway, llm, prompts).respond(history);

    verify(llm).chat(argThat(ms -> ms.get(0).content().contains("You have no tools")));
  }

  @Test
  void modelFailureBecomesAgentException() {
    LlmClient llm = mock(LlmClient.class);
    when(llm.chat(anyList())).thenThrow(new LlmException("connection refused"));
    AgentDescriptor descriptor = new AgentDescriptor("critic", "", Set.of());

    AgentException e =
        assertThrows(
            AgentException.class, () -> new LlmAgent(descriptor, gateway, llm, prompts).respond(history));
    assertTrue(e.getMessage().startsWith("Agent 'critic' failed"), e.getMessage());
    assertInstanceOf(LlmException.class, e.getCause());
  }

  @Test
  void invokesOnlyOwnTools() {
    LlmClient llm = mock(LlmClient.class);
    LlmAgent sql =
        new LlmAgent(
            new AgentDescriptor("sql", "", Set.of("execute_sql_query")), gateway, llm, prompts);
    LlmAgent web = new LlmAgent(new AgentDescriptor("web", "", Set.of()), gateway, llm, prompts);
    ToolCall call = new ToolCall("call_1", "execute_sql_query", Map.of("sql", "SELECT 1"));

    assertEquals("n\n-\n200", sql.invokeTool(call).output());
    assertEquals(
        "Permission Denied: Agent 'web' is not allowed to call tool 'execute_sql_query'",
        web.invokeTool(call).asConversationText());
    verifyNoInteractions(llm);
  }
}
