package com.gentoro.agentops;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.agentops.exception.ConfigException;
import com.gentoro.agentops.tool.ToolDescriptor;
import com.gentoro.agentops.tool.ToolRegistry;
import java.net.URI;
import java.util.List;
import org.junit.jupiter.api.Test;

class AgentOpsTest {

  @Test
  void registersBuiltInTools() {
    ToolRegistry registry =
        AgentOps.createToolRegistry(
            ConfigurationProvider.fromYaml("tools:\n  endpoint: http://127.0.0.1:9999/mcp\n"));

    assertEquals(
        List.of(
            "get_database_schema",
            "execute_sql_query",
            "web_search",
            "scrape_webpage",
            "code_interpreter"),
        registry.all().stream().map(ToolDescriptor::name).toList());

    ToolDescriptor query = registry.find("execute_sql_query").orElseThrow();
    assertEquals(URI.create("http://127.0.0.1:9999/mcp"), query.remoteEndpoint().orElseThrow());
    assertTrue(query.handler().isPresent(), "local fallback stays available");
    assertFalse(registry.find("code_interpreter").orElseThrow().isRemote());
  }

  @Test
  void emptyEndpointKeepsDatabaseToolsLocal() {
    ToolRegistry registry = AgentOps.createToolRegistry(ConfigurationProvider.fromYaml("web: {}\n"));
    assertFalse(registry.find("get_database_schema").orElseThrow().isRemote());
  }

  @Test
  void invalidEndpoint() {
    assertThrows(
        ConfigException.class,
        () ->
            AgentOps.createToolRegistry(
                ConfigurationProvider.fromYaml("tools:\n  endpoint: \"http://bad host/\"\n")));
  }
}
