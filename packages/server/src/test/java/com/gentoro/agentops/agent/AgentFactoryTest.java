package com.gentoro.agentops.agent;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

import com.gentoro.agentops.ConfigurationProvider;
import com.gentoro.agentops.exception.ConfigException;
import com.gentoro.agentops.exception.ToolRegistrationException;
import com.gentoro.agentops.model.LlmClient;
import com.gentoro.agentops.prompt.PromptRepositoryFactory;
import com.gentoro.agentops.tool.ExecutionResult;
import com.gentoro.agentops.tool.ToolDescriptor;
import com.gentoro.agentops.tool.ToolGateway;
import com.gentoro.agentops.tool.ToolRegistry;
import com.gentoro.agentops.tool.protocol.RemoteToolClient;
import java.time.Duration;
import java.util.List;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.Test;

class AgentFactoryTest {

  private static ToolDescriptor tool(String name) {
    return ToolDescriptor.builder()
        .name(name)
        .description(name)
        .handler(args -> ExecutionResult.ok(name))
        .build();
  }

  private final ToolGateway gateway =
      new ToolGateway(
          new ToolRegistry()
              .register(tool("get_database_schema"))
              .register(tool("execute_sql_query"))
              .register(tool("code_interpreter")),
          new RemoteToolClient(Duration.ofSeconds(1)));

  private final AgentFactory factory =
      new AgentFactory(
          gateway, mock(LlmClient.class), PromptRepositoryFactory.create("classpath:prompts"));

  @Test
  void readsDefinitionsFromYaml() {
    List<AgentDefinition> defs =
        AgentDefinition.fromConfiguration(
            ConfigurationProvider.fromYaml(
                "agents:\n"
                    + "  - name: sql_specialist\n"
                    + "    directive: agents/sql-specialist\n"
                    + "    tools: [get_database_schema, execute_sql_query]\n"
                    + "  - name: data_analyst\n"
                    + "    directive: agents/data-analyst\n"
                    + "    tools:\n"
                    + "      - code_interpreter\n"));

    assertEquals(2, defs.size());
    assertEquals(
        new AgentDefinition(
            "sql_specialist",
            "agents/sql-specialist",
            List.of("get_database_schema", "execute_sql_query")),
        defs.get(0));
    assertEquals(List.of("code_interpreter"), defs.get(1).tools());
  }

  @Test
  void bundledConfigurationDeclaresThreeAgents() {
    List<AgentDefinition> defs =
        AgentDefinition.fromConfiguration(
            new ConfigurationProvider(ConfigurationProvider.DEFAULT_LOCATION).config());
    assertEquals(
        List.of("sql_specialist", "web_researcher", "data_analyst"),
        defs.stream().map(AgentDefinition::name).toList());
  }

  @Test
  void definitionNeedsNameAndDirective() {
    assertThrows(
        ConfigException.class,
        () -> AgentDefinition.fromConfiguration(ConfigurationProvider.fromYaml("agents:\n  - directive: x\n")));
    assertThrows(
        ConfigException.class,
        () -> AgentDefinition.fromConfiguration(ConfigurationProvider.fromYaml("agents:\n  - name: a\n")));
    assertThrows(
        ConfigException.class, () -> AgentDefinition.fromConfiguration(new BaseConfiguration()));
  }

  @Test
  void createsAgentWithRenderedDirectiveAndOrderedTools() {
    Agent agent =
        factory.create(
            new AgentDefinition(
                "sql_specialist",
                "agents/sql-specialist",
                List.of("get_database_schema", "execute_sql_query")));

    assertEquals("sql_specialist", agent.name());
    assertTrue(agent.descriptor().directive().contains("SQL database expert"));
    assertEquals(
        List.of("get_database_schema", "execute_sql_query"),
        List.copyOf(agent.descriptor().tools()));
    assertInstanceOf(LlmAgent.class, agent);
  }

  @Test
  void unknownToolIsRejected() {
    ToolRegistrationException e =
        assertThrows(
            ToolRegistrationException.class,
            () ->
                factory.create(
                    new AgentDefinition("web", "agents/web-researcher", List.of("web_search"))));
    assertTrue(e.getMessage().contains("web_search"), e.getMessage());
  }

  @Test
  void duplicateNamesAreRejected() {
    AgentDefinition def = new AgentDefinition("a", "agents/data-analyst", List.of("code_interpreter"));
    assertThrows(ConfigException.class, () -> factory.createAll(List.of(def, def)));
  }
}
