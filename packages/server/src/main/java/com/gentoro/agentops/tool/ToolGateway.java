package com.gentoro.agentops.tool;

import com.gentoro.agentops.exception.AgentOpsException;
import com.gentoro.agentops.exception.ExceptionUtil;
import com.gentoro.agentops.exception.ToolProtocolException;
import com.gentoro.agentops.exception.ToolTransportException;
import com.gentoro.agentops.tool.protocol.RemoteToolClient;
import com.gentoro.agentops.tool.protocol.ToolCallRequest;
import com.gentoro.agentops.tool.protocol.ToolCallResponse;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Single entry point for invoking tools by name.
 *
 * <p>Remote tools are called over the wire protocol first. If the endpoint cannot be reached, or
 * answers with something that is not an envelope, the tool's local handler runs instead (when one
 * is registered and fallback is enabled). An error envelope is a genuine answer from the tool and
 * is returned as an {@link ErrorKind#APPLICATION} result without trying the fallback.
 *
 * <p>{@link #call} never throws.
 */
public class ToolGateway {
  private static final org.slf4j.Logger log =
      com.gentoro.agentops.logging.LoggingService.getLogger(ToolGateway.class);

  private final ToolRegistry registry;
  private final RemoteToolClient remoteClient;
  private final boolean fallbackEnabled;
  private final AtomicLong requestIds = new AtomicLong();

  public ToolGateway(ToolRegistry registry, RemoteToolClient remoteClient) {
    this(registry, remoteClient, true);
  }

  public ToolGateway(ToolRegistry registry, RemoteToolClient remoteClient, boolean useFallback) {
    this.registry = registry;
    this.remoteClient = remoteClient;
    this.fallbackEnabled = useFallback;
  }

  public ToolRegistry registry() {
    return registry;
  }

  public ExecutionResult call(String toolName, Map<String, Object> arguments) {
    Map<String, Object> args = arguments == null ? Map.of() : arguments;
    try {
      ToolDescriptor tool = registry.find(toolName).orElse(null);
      if (tool == null) {
        log.warn("Call to unknown tool '{}'", toolName);
        return ExecutionResult.error(ErrorKind.UNKNOWN_TOOL, "Tool '" + toolName + "' not found");
      }
      if (tool.isRemote()) {
        return callRemote(tool, args);
      }
      return runLocal(tool, args);
    } catch (Exception e) {
      log.error("Unexpected failure while calling tool '{}'", toolName, e);
      return ExecutionResult.error(ErrorKind.EXECUTION, ExceptionUtil.describe(e));
    }
  }

  private ExecutionResult callRemote(ToolDescriptor tool, Map<String, Object> args) {
    URI endpoint = tool.remoteEndpoint().orElseThrow();
    ToolCallRequest request =
        ToolCallRequest.toolsCall(requestIds.incrementAndGet(), tool.name(), args);
    ErrorKind kind;
    AgentOpsException failure;
    try {
      ToolCallResponse response = remoteClient.call(endpoint, request);
      if (response.isError()) {
        ToolCallResponse.Error error = response.error();
        log.debug(
            "Tool '{}' reported error {} from {}: {}",
            tool.name(),
            error.code(),
            endpoint,
            error.message());
        return ExecutionResult.error(ErrorKind.APPLICATION, error.message());
      }
      return ExecutionResult.ok(response.result().text());
    } catch (ToolTransportException e) {
      kind = ErrorKind.TRANSPORT;
      failure = e;
    } catch (ToolProtocolException e) {
      kind = ErrorKind.PROTOCOL;
      failure = e;
    }

    if (fallbackEnabled && tool.handler().isPresent()) {
      log.warn(
          "Remote call of '{}' failed ({}); using local fallback", tool.name(), failure.getMessage());
      return runLocal(tool, args);
    }
    log.error("Remote call of '{}' failed with no fallback: {}", tool.name(), failure.getMessage());
    return ExecutionResult.error(kind, failure.getMessage());
  }

  private ExecutionResult runLocal(ToolDescriptor tool, Map<String, Object> args) {
    ToolHandler handler = tool.handler().orElse(null);
    if (handler == null) {
      return ExecutionResult.error(
          ErrorKind.EXECUTION, "Tool '" + tool.name() + "' has no local implementation");
    }
    try {
      ExecutionResult result = handler.handle(args);
      if (result == null) {
        return ExecutionResult.error(
            ErrorKind.EXECUTION, "Tool '" + tool.name() + "' returned no result");
      }
      return result;
    } catch (Exception e) {
      log.error("Tool '{}' failed", tool.name(), e);
      return ExecutionResult.error(ErrorKind.EXECUTION, ExceptionUtil.describe(e));
    }
  }

  /**
   * Probe {@code GET /health} on every distinct remote endpoint.
   *
   * @return endpoint to reachability, in registration order
   */
  public Map<URI, Boolean> probeHealth() {
    Map<URI, Boolean> status = new LinkedHashMap<>();
    for (ToolDescriptor tool : registry.all()) {
      tool.remoteEndpoint()
          .ifPresent(uri -> status.computeIfAbsent(uri, remoteClient::isHealthy));
    }
    return status;
  }
}
