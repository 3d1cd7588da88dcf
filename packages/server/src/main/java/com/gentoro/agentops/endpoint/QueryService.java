package com.gentoro.agentops.endpoint;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.agentops.exception.DataStoreException;
import com.gentoro.agentops.exception.ExceptionUtil;
import com.gentoro.agentops.exception.ValidationException;
import com.gentoro.agentops.http.EmbeddedJettyServer;
import com.gentoro.agentops.orchestrator.OrchestrationResult;
import com.gentoro.agentops.orchestrator.Orchestrator;
import com.gentoro.agentops.orchestrator.TerminationReason;
import com.gentoro.agentops.tool.ExecutionResult;
import com.gentoro.agentops.tool.ToolGateway;
import com.gentoro.agentops.tool.builtin.DatabaseTools;
import com.gentoro.agentops.utility.JacksonUtility;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/**
 * Question answering over HTTP.
 *
 * <ul>
 *   <li>{@code POST /query} with {@code {"query": "..."}}: the {@link OrchestrationResult} as JSON.
 *       Status 200 when the conversation ended normally, 400 for a blank query and 500 when an
 *       agent or the turn loop failed (the partial transcript is still in the body);
 *   <li>{@code POST /chat} with {@code {"messages": [{"role": ..., "content": ...}]}}: answers the
 *       content of the last message and replies {@code {"type": "message", "content": ...}};
 *   <li>{@code GET /schema}: {@code {"schema": "..."}} from the schema tool.
 * </ul>
 *
 * <p>Malformed requests get a 400 with an {@link com.gentoro.agentops.exception.ErrorDetails} body.
 */
public class QueryService {
  private static final org.slf4j.Logger log =
      com.gentoro.agentops.logging.LoggingService.getLogger(QueryService.class);

  public static final String QUERY_PATH = "/query";
  public static final String CHAT_PATH = "/chat";
  public static final String SCHEMA_PATH = "/schema";

  static final String NO_ANSWER = "An error occurred while answering the question.";

  private final EmbeddedJettyServer httpServer;
  private final Orchestrator orchestrator;
  private final ToolGateway gateway;

  public QueryService(
      EmbeddedJettyServer httpServer, Orchestrator orchestrator, ToolGateway gateway) {
    this.httpServer = httpServer;
    this.orchestrator = orchestrator;
    this.gateway = gateway;
  }

  public void register() {
    httpServer.getContextHandler().addServlet(new ServletHolder(new QueryServlet()), QUERY_PATH);
    httpServer.getContextHandler().addServlet(new ServletHolder(new ChatServlet()), CHAT_PATH);
    httpServer.getContextHandler().addServlet(new ServletHolder(new SchemaServlet()), SCHEMA_PATH);
    log.info("Query endpoints registered at {}, {} and {}", QUERY_PATH, CHAT_PATH, SCHEMA_PATH);
  }

  /** The question carried by a {@code /query} body. */
  static String queryOf(String body) {
    JsonNode query = readObject(body).get("query");
    if (query == null || !query.isTextual()) {
      throw new ValidationException("Field 'query' must be a string");
    }
    return query.asText();
  }

  /** The content of the last message in a {@code /chat} body. */
  static String lastMessageOf(String body) {
    JsonNode messages = readObject(body).get("messages");
    if (messages == null || !messages.isArray() || messages.isEmpty()) {
      throw new ValidationException("No messages provided");
    }
    String content = messages.get(messages.size() - 1).path("content").asText("");
    if (content.isBlank()) {
      throw new ValidationException("Empty message");
    }
    return content;
  }

  /** Final answer, or the last transcript entry when the conversation produced none. */
  static String answerOf(OrchestrationResult result) {
    if (!result.finalAnswer().isEmpty()) {
      return result.finalAnswer();
    }
    List<OrchestrationResult.Entry> conversation = result.conversation();
    if (!result.succeeded() && !conversation.isEmpty()) {
      return conversation.get(conversation.size() - 1).content();
    }
    return NO_ANSWER;
  }

  static int statusOf(OrchestrationResult result) {
    if (result.succeeded()) return 200;
    return result.terminationReason() == TerminationReason.INVALID_QUERY ? 400 : 500;
  }

  private static JsonNode readObject(String body) {
    JsonNode node;
    try {
      node = JacksonUtility.getJsonMapper().readTree(body == null ? "" : body);
    } catch (JsonProcessingException e) {
      throw new ValidationException("Request body is not valid JSON", e);
    }
    if (node == null || !node.isObject()) {
      throw new ValidationException("Request body must be a JSON object");
    }
    return node;
  }

  private static String bodyOf(HttpServletRequest req) throws IOException {
    return req.getReader().lines().collect(Collectors.joining("\n"));
  }

  private static void write(HttpServletResponse resp, int status, Object payload)
      throws IOException {
    resp.setStatus(status);
    resp.setContentType("application/json");
    resp.setCharacterEncoding("UTF-8");
    try (PrintWriter out = resp.getWriter()) {
      out.print(JacksonUtility.toJson(payload));
    }
  }

  private class QueryServlet extends HttpServlet {
    @Override
    protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      String query;
      try {
        query = queryOf(bodyOf(req));
      } catch (ValidationException e) {
        write(resp, 400, ExceptionUtil.toErrorDetails(e));
        return;
      }
      OrchestrationResult result = orchestrator.execute(query);
      write(resp, statusOf(result), result);
    }
  }

  private class ChatServlet extends HttpServlet {
    @Override
    protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      String question;
      try {
        question = lastMessageOf(bodyOf(req));
      } catch (ValidationException e) {
        write(resp, 400, ExceptionUtil.toErrorDetails(e));
        return;
      }
      OrchestrationResult result = orchestrator.execute(question);
      Map<String, Object> payload = new LinkedHashMap<>();
      payload.put("type", "message");
      payload.put("content", answerOf(result));
      write(resp, 200, payload);
    }
  }

  private class SchemaServlet extends HttpServlet {
    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      ExecutionResult schema = gateway.call(DatabaseTools.SCHEMA_TOOL, Map.of());
      if (schema.isError()) {
        log.warn("Schema request failed: {}", schema.output());
        write(resp, 500, ExceptionUtil.toErrorDetails(new DataStoreException(schema.output())));
        return;
      }
      write(resp, 200, Map.of("schema", schema.output()));
    }
  }
}
