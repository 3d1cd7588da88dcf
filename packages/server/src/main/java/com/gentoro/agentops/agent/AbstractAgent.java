package com.gentoro.agentops.agent;

import com.gentoro.agentops.tool.ErrorKind;
import com.gentoro.agentops.tool.ExecutionResult;
import com.gentoro.agentops.tool.ToolGateway;
import java.util.Objects;

/** Shared tool plumbing: agents only reach tools through the gateway, and only their own. */
public abstract class AbstractAgent implements Agent {
  private static final org.slf4j.Logger log =
      com.gentoro.agentops.logging.LoggingService.getLogger(AbstractAgent.class);

  protected final AgentDescriptor descriptor;
  protected final ToolGateway gateway;

  protected AbstractAgent(AgentDescriptor descriptor, ToolGateway gateway) {
    this.descriptor = Objects.requireNonNull(descriptor, "descriptor");
    this.gateway = Objects.requireNonNull(gateway, "gateway");
  }

  @Override
  public AgentDescriptor descriptor() {
    return descriptor;
  }

  @Override
  public ExecutionResult invokeTool(ToolCall call) {
    if (!descriptor.canUse(call.name())) {
      log.warn("Agent '{}' attempted to call tool '{}' outside its set", name(), call.name());
      return ExecutionResult.error(
          ErrorKind.PERMISSION_DENIED,
          "Agent '%s' is not allowed to call tool '%s'".formatted(name(), call.name()));
    }
    log.trace("Agent '{}' calling tool '{}' with {}", name(), call.name(), call.arguments());
    return gateway.call(call.name(), call.arguments());
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{" + descriptor.name() + ", tools=" + descriptor.tools() + "}";
  }
}
