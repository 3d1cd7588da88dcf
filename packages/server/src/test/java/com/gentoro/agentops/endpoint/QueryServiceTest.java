package com.gentoro.agentops.endpoint;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.agentops.ConfigurationProvider;
import com.gentoro.agentops.agent.AbstractAgent;
import com.gentoro.agentops.agent.AgentDescriptor;
import com.gentoro.agentops.agent.AgentResponse;
import com.gentoro.agentops.exception.AgentException;
import com.gentoro.agentops.exception.ValidationException;
import com.gentoro.agentops.http.EmbeddedJettyServer;
import com.gentoro.agentops.http.OkHttpFactory;
import com.gentoro.agentops.orchestrator.Message;
import com.gentoro.agentops.orchestrator.Orchestrator;
import com.gentoro.agentops.orchestrator.SpeakerChoice;
import com.gentoro.agentops.orchestrator.SpeakerSelector;
import com.gentoro.agentops.tool.ToolGateway;
import com.gentoro.agentops.tool.ToolRegistry;
import com.gentoro.agentops.tool.builtin.DatabaseTools;
import com.gentoro.agentops.tool.builtin.InMemoryDataStore;
import com.gentoro.agentops.tool.protocol.RemoteToolClient;
import com.gentoro.agentops.utility.JacksonUtility;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class QueryServiceTest {

  private static final MediaType JSON = MediaType.get("application/json");

  /** Repeats the latest user question; questions mentioning "fail" make it throw. */
  static class EchoAgent extends AbstractAgent {
    EchoAgent(ToolGateway gateway) {
      super(new AgentDescriptor("echo", "Repeats the question", Set.of()), gateway);
    }

    @Override
    public AgentResponse respond(List<Message> history) {
      String question = "";
      for (Message m : history) {
        if (m.kind() == Message.Kind.USER) question = m.content();
      }
      if (question.contains("fail")) {
        throw new AgentException("boom");
      }
      return AgentResponse.text("You asked: " + question + " TERMINATE");
    }
  }

  private EmbeddedJettyServer jetty;
  private OkHttpClient http;
  private String base;

  @BeforeEach
  void setUp() {
    ToolGateway gateway =
        new ToolGateway(
            new ToolRegistry()
                .registerAll(new DatabaseTools(InMemoryDataStore.customers(7)).descriptors(null)),
            new RemoteToolClient(Duration.ofSeconds(1)));
    Orchestrator orchestrator =
        new Orchestrator(
            List.of(new EchoAgent(gateway)),
            new SpeakerSelector((history, ds) -> SpeakerChoice.of("echo"), 10),
            5);

    jetty =
        new EmbeddedJettyServer(
            ConfigurationProvider.fromYaml("http:\n  port: 0\n  hostname: 127.0.0.1\n"));
    jetty.prepare();
    new QueryService(jetty, orchestrator, gateway).register();
    jetty.start();
    http = OkHttpFactory.create(Duration.ofSeconds(10));
    base = "http://127.0.0.1:" + jetty.getPort();
  }

  @AfterEach
  void tearDown() {
    jetty.close();
  }

  private Response post(String path, String body) throws IOException {
    return http.newCall(
            new Request.Builder().url(base + path).post(RequestBody.create(body, JSON)).build())
        .execute();
  }

  private static JsonNode json(Response r) throws IOException {
    return JacksonUtility.getJsonMapper().readTree(r.body().string());
  }

  @Test
  void queryReturnsTheConversation() throws IOException {
    try (Response r = post("/query", "{\"query\":\"How many customers?\"}")) {
      assertEquals(200, r.code());
      JsonNode body = json(r);
      assertEquals("You asked: How many customers?", body.get("finalAnswer").asText());
      assertEquals("AGENT_TERMINATED", body.get("terminationReason").asText());
      assertEquals(1, body.get("rounds").asInt());
      assertEquals("user", body.get("conversation").get(0).get("speaker").asText());
      assertEquals("echo", body.get("participants").get(0).asText());
    }
  }

  @Test
  void queryStatusFollowsTheOutcome() throws IOException {
    try (Response r = post("/query", "{\"query\":\"   \"}")) {
      assertEquals(400, r.code());
      assertEquals("INVALID_QUERY", json(r).get("terminationReason").asText());
    }
    try (Response r = post("/query", "{\"query\":\"please fail\"}")) {
      assertEquals(500, r.code());
      JsonNode body = json(r);
      assertEquals("AGENT_FAILURE", body.get("terminationReason").asText());
      assertTrue(body.get("conversation").get(1).get("content").asText().contains("boom"));
    }
  }

  @Test
  void malformedRequestsGetErrorDetails() throws IOException {
    try (Response r = post("/query", "not json")) {
      assertEquals(400, r.code());
      JsonNode body = json(r);
      assertEquals("ValidationException", body.get("type").asText());
      assertEquals("INVALID_ARGUMENT", body.get("code").asText());
      assertFalse(body.get("timestamp").asText().isEmpty());
    }
    try (Response r = post("/query", "{\"question\":\"wrong field\"}")) {
      assertEquals(400, r.code());
      assertEquals("Field 'query' must be a string", json(r).get("message").asText());
    }
    try (Response r = post("/chat", "{\"messages\":[]}")) {
      assertEquals(400, r.code());
      assertEquals("No messages provided", json(r).get("message").asText());
    }
  }

  @Test
  void chatAnswersTheLastMessage() throws IOException {
    String body =
        "{\"messages\":[{\"role\":\"user\",\"content\":\"first\"},"
            + "{\"role\":\"assistant\",\"content\":\"ok\"},"
            + "{\"role\":\"user\",\"content\":\"Top products?\"}]}";
    try (Response r = post("/chat", body)) {
      assertEquals(200, r.code());
      JsonNode reply = json(r);
      assertEquals("message", reply.get("type").asText());
      assertEquals("You asked: Top products?", reply.get("content").asText());
    }
    try (Response r = post("/chat", "{\"messages\":[{\"role\":\"user\",\"content\":\"fail now\"}]}")) {
      assertEquals(200, r.code());
      assertTrue(json(r).get("content").asText().contains("Agent 'echo' failed"));
    }
  }

  @Test
  void schemaComesFromTheSchemaTool() throws IOException {
    try (Response r = http.newCall(new Request.Builder().url(base + "/schema").build()).execute()) {
      assertEquals(200, r.code());
      String schema = json(r).get("schema").asText();
      assertTrue(schema.contains("-- Table: customers"), schema);
      assertTrue(schema.contains("Total rows: 7"), schema);
    }
  }

  @Test
  void lastMessageValidation() {
    assertEquals("b", QueryService.lastMessageOf("{\"messages\":[{\"content\":\"a\"},{\"content\":\"b\"}]}"));
    ValidationException empty =
        assertThrows(
            ValidationException.class,
            () -> QueryService.lastMessageOf("{\"messages\":[{\"role\":\"user\"}]}"));
    assertEquals("Empty message", empty.getMessage());
    assertThrows(ValidationException.class, () -> QueryService.lastMessageOf("[1,2]"));
    assertThrows(ValidationException.class, () -> QueryService.queryOf("{\"query\":42}"));
  }
}
