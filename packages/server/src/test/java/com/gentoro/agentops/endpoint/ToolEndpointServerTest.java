package com.gentoro.agentops.endpoint;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.agentops.ConfigurationProvider;
import com.gentoro.agentops.http.EmbeddedJettyServer;
import com.gentoro.agentops.http.OkHttpFactory;
import com.gentoro.agentops.sandbox.SandboxExecutor;
import com.gentoro.agentops.tool.ErrorKind;
import com.gentoro.agentops.tool.ExecutionResult;
import com.gentoro.agentops.tool.ToolDescriptor;
import com.gentoro.agentops.tool.ToolGateway;
import com.gentoro.agentops.tool.ToolRegistry;
import com.gentoro.agentops.tool.builtin.DatabaseTools;
import com.gentoro.agentops.tool.builtin.InMemoryDataStore;
import com.gentoro.agentops.tool.protocol.RemoteToolClient;
import com.gentoro.agentops.tool.protocol.ToolCallResponse;
import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ToolEndpointServerTest {

  private EmbeddedJettyServer jetty;
  private ToolEndpointServer endpoint;
  private InMemoryDataStore store;
  private volatile boolean handledInProcess;

  @BeforeEach
  void setUp() {
    store = InMemoryDataStore.customers(200);
    ToolRegistry registry =
        new ToolRegistry()
            .registerAll(new DatabaseTools(store).descriptors(null))
            .register(
                ToolDescriptor.builder()
                    .name("explode")
                    .description("always throws")
                    .servedRemotely(true)
                    .handler(
                        args -> {
                          throw new IllegalStateException("kaboom");
                        })
                    .build())
            .register(
                ToolDescriptor.builder()
                    .name("remote_only")
                    .description("no local handler")
                    .remoteEndpoint(URI.create("http://localhost:1/mcp"))
                    .servedRemotely(true)
                    .build())
            .register(new SandboxExecutor(Duration.ofSeconds(5), 1000).descriptor())
            .register(
                ToolDescriptor.builder()
                    .name("in_process")
                    .description("local only")
                    .handler(
                        args -> {
                          handledInProcess = true;
                          return ExecutionResult.ok("ran");
                        })
                    .build());
    jetty =
        new EmbeddedJettyServer(
            ConfigurationProvider.fromYaml("http:\n  port: 0\n  hostname: 127.0.0.1\n"));
    jetty.prepare();
    endpoint = new ToolEndpointServer(jetty, registry, "/mcp");
    endpoint.register();
    new HealthService(jetty, () -> Map.of("tools", 4, "status", "ignored")).register();
    jetty.start();
  }

  @AfterEach
  void tearDown() {
    jetty.close();
  }

  private static String call(long id, String tool, String argumentsJson) {
    return "{\"jsonrpc\":\"2.0\",\"id\":%d,\"method\":\"tools/call\",\"params\":{\"name\":\"%s\",\"arguments\":%s}}"
        .formatted(id, tool, argumentsJson);
  }

  @Test
  void dispatchRunsLocalHandler() {
    ToolCallResponse response =
        endpoint.dispatch(call(5, "execute_sql_query", "{\"sql\":\"SELECT COUNT(*) FROM customers\"}"));
    assertFalse(response.isError());
    assertEquals(5L, response.id());
    assertTrue(response.result().text().contains("200"));
  }

  @Test
  void dispatchErrors() {
    assertEquals(
        ToolCallResponse.INVALID_PARAMS,
        endpoint.dispatch(call(1, "no_such_tool", "{}")).error().code());
    assertEquals(
        "Unknown tool: remote_only", endpoint.dispatch(call(2, "remote_only", "{}")).error().message());

    ToolCallResponse missing = endpoint.dispatch(call(3, "execute_sql_query", "{}"));
    assertEquals(ToolCallResponse.INVALID_PARAMS, missing.error().code());
    assertEquals("Missing 'sql' parameter", missing.error().message());

    ToolCallResponse sqlError =
        endpoint.dispatch(call(4, "execute_sql_query", "{\"sql\":\"SELECT nope\"}"));
    assertEquals(ToolCallResponse.TOOL_EXECUTION_FAILED, sqlError.error().code());
    assertTrue(sqlError.error().message().startsWith("SQL Error"));

    ToolCallResponse thrown = endpoint.dispatch(call(6, "explode", "{}"));
    assertEquals(ToolCallResponse.TOOL_EXECUTION_FAILED, thrown.error().code());
    assertTrue(thrown.error().message().contains("kaboom"));

    ToolCallResponse parse = endpoint.dispatch("{{{");
    assertEquals(ToolCallResponse.PARSE_ERROR, parse.error().code());
    assertNull(parse.id());
  }

  @Test
  void onlyToolsMarkedForRemoteUseAreServed() {
    ToolCallResponse sandbox =
        endpoint.dispatch(call(7, SandboxExecutor.TOOL_NAME, "{\"code\":\"set(\\\"result\\\", 1);\"}"));
    assertEquals(ToolCallResponse.INVALID_PARAMS, sandbox.error().code());
    assertEquals("Unknown tool: " + SandboxExecutor.TOOL_NAME, sandbox.error().message());

    ToolCallResponse local = endpoint.dispatch(call(8, "in_process", "{}"));
    assertEquals(ToolCallResponse.INVALID_PARAMS, local.error().code());
    assertFalse(handledInProcess);

    assertFalse(endpoint.dispatch(call(9, DatabaseTools.SCHEMA_TOOL, "{}")).isError());
  }

  @Test
  void gatewayRoundTripOverHttp() {
    URI remote = URI.create("http://127.0.0.1:" + jetty.getPort() + "/mcp");
    InMemoryDataStore clientSide = InMemoryDataStore.customers(0);
    ToolRegistry registry =
        new ToolRegistry().registerAll(new DatabaseTools(clientSide).descriptors(remote));
    ToolGateway gateway =
        new ToolGateway(registry, new RemoteToolClient(Duration.ofSeconds(5)), true);

    ExecutionResult ok =
        gateway.call(DatabaseTools.QUERY_TOOL, Map.of("sql", "SELECT COUNT(*) FROM customers"));
    assertTrue(ok.output().contains("200"), ok.output());
    assertTrue(clientSide.executed().isEmpty(), "the remote side answered, not the fallback");
    assertEquals(List.of("SELECT COUNT(*) FROM customers"), store.executed());

    ExecutionResult appError = gateway.call(DatabaseTools.QUERY_TOOL, Map.of("sql", "SELECT nope"));
    assertEquals(ErrorKind.APPLICATION, appError.errorKind());
    assertTrue(clientSide.executed().isEmpty(), "application errors never fall back");

    assertEquals(Map.of(remote, true), gateway.probeHealth());
  }

  @Test
  void httpStatusCodes() throws IOException {
    OkHttpClient http = OkHttpFactory.create(Duration.ofSeconds(5));
    MediaType json = MediaType.get("application/json");
    String base = "http://127.0.0.1:" + jetty.getPort();

    try (Response r =
        http.newCall(
                new Request.Builder().url(base + "/mcp").post(RequestBody.create("not json", json)).build())
            .execute()) {
      assertEquals(400, r.code());
      assertTrue(r.body().string().contains("-32700"));
    }
    try (Response r =
        http.newCall(
                new Request.Builder()
                    .url(base + "/mcp")
                    .post(RequestBody.create(call(9, "no_such_tool", "{}"), json))
                    .build())
            .execute()) {
      assertEquals(200, r.code());
      assertTrue(r.body().string().contains("Unknown tool: no_such_tool"));
    }
    try (Response r = http.newCall(new Request.Builder().url(base + "/health").build()).execute()) {
      assertEquals(200, r.code());
      String body = r.body().string();
      assertTrue(body.contains("\"status\":\"healthy\""), body);
      assertTrue(body.contains("\"tools\":4"), body);
    }
  }
}
