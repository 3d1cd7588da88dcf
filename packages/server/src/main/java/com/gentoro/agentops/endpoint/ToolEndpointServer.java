package com.gentoro.agentops.endpoint;

import com.gentoro.agentops.exception.ExceptionUtil;
import com.gentoro.agentops.http.EmbeddedJettyServer;
import com.gentoro.agentops.tool.ExecutionResult;
import com.gentoro.agentops.tool.ToolDescriptor;
import com.gentoro.agentops.tool.ToolHandler;
import com.gentoro.agentops.tool.ToolRegistry;
import com.gentoro.agentops.tool.protocol.EnvelopeException;
import com.gentoro.agentops.tool.protocol.ToolCallRequest;
import com.gentoro.agentops.tool.protocol.ToolCallResponse;
import com.gentoro.agentops.tool.protocol.ToolProtocolCodec;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.List;
import java.util.stream.Collectors;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/**
 * Hosts the local handlers of a {@link ToolRegistry} behind the tool wire protocol.
 *
 * <p>Registers a servlet at the configured path (default {@code /mcp}) on the shared Jetty context.
 * Every well-formed or malformed request is answered with an envelope:
 *
 * <ul>
 *   <li>{@code -32700}/{@code -32600}/{@code -32601} for unreadable envelopes and other methods;
 *   <li>{@code -32602} for an unknown tool, a tool not marked {@link
 *       ToolDescriptor#servedRemotely()}, or missing required arguments;
 *   <li>{@code -32000} when the handler reports or throws an error.
 * </ul>
 */
public class ToolEndpointServer {
  private static final org.slf4j.Logger log =
      com.gentoro.agentops.logging.LoggingService.getLogger(ToolEndpointServer.class);

  public static final String DEFAULT_PATH = "/mcp";

  private final EmbeddedJettyServer httpServer;
  private final ToolRegistry registry;
  private final String path;
  private final ToolProtocolCodec codec;

  public ToolEndpointServer(EmbeddedJettyServer httpServer, ToolRegistry registry, String path) {
    this(httpServer, registry, path, new ToolProtocolCodec());
  }

  public ToolEndpointServer(
      EmbeddedJettyServer httpServer, ToolRegistry registry, String path, ToolProtocolCodec codec) {
    this.httpServer = httpServer;
    this.registry = registry;
    this.path = path == null || path.isBlank() ? DEFAULT_PATH : path;
    this.codec = codec;
  }

  /** Register the servlet with the shared Jetty context handler. */
  public void register() {
    httpServer.getContextHandler().addServlet(new ServletHolder(new ToolCallServlet()), path);
    log.info(
        "Tool endpoint registered at {} serving {}",
        path,
        registry.all().stream()
            .filter(ToolDescriptor::servedRemotely)
            .map(ToolDescriptor::name)
            .collect(Collectors.joining(", ")));
  }

  public String path() {
    return path;
  }

  /** Answer one request body. Never throws; every outcome is an envelope. */
  public ToolCallResponse dispatch(String body) {
    ToolCallRequest request;
    try {
      request = codec.decodeRequest(body);
    } catch (EnvelopeException e) {
      log.debug("Rejected envelope ({}): {}", e.getWireCode(), e.getMessage());
      return e.toResponse();
    }

    long id = request.id();
    String toolName = request.params().name();
    ToolDescriptor tool = registry.find(toolName).orElse(null);
    ToolHandler handler =
        tool == null || !tool.servedRemotely() ? null : tool.handler().orElse(null);
    if (handler == null) {
      return ToolCallResponse.failure(
          id, ToolCallResponse.INVALID_PARAMS, "Unknown tool: " + toolName);
    }
    List<String> missing = tool.schema().missingRequired(request.params().arguments());
    if (!missing.isEmpty()) {
      String names = missing.stream().map(m -> "'" + m + "'").collect(Collectors.joining(", "));
      return ToolCallResponse.failure(
          id, ToolCallResponse.INVALID_PARAMS, "Missing " + names + " parameter");
    }

    try {
      ExecutionResult result = handler.handle(request.params().arguments());
      if (result == null) {
        return ToolCallResponse.failure(
            id, ToolCallResponse.TOOL_EXECUTION_FAILED, "Tool returned no result");
      }
      if (result.isError()) {
        return ToolCallResponse.failure(
            id, ToolCallResponse.TOOL_EXECUTION_FAILED, result.output());
      }
      return ToolCallResponse.success(id, result.output());
    } catch (Exception e) {
      log.error("Tool '{}' failed while serving request {}", toolName, id, e);
      return ToolCallResponse.failure(
          id, ToolCallResponse.TOOL_EXECUTION_FAILED, ExceptionUtil.describe(e));
    }
  }

  private class ToolCallServlet extends HttpServlet {
    @Override
    protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      String body = req.getReader().lines().collect(Collectors.joining("\n"));
      log.trace("Tool request: {}", body);
      ToolCallResponse response = dispatch(body);
      boolean unreadable =
          response.isError() && response.error().code() == ToolCallResponse.PARSE_ERROR;
      resp.setStatus(unreadable ? 400 : 200);
      resp.setContentType("application/json");
      resp.setCharacterEncoding("UTF-8");
      try (PrintWriter out = resp.getWriter()) {
        out.print(codec.encode(response));
      }
    }
  }
}
