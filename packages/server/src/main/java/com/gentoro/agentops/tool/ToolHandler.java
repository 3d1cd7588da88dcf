package com.gentoro.agentops.tool;

import java.util.Map;

/**
 * A named, synchronous action taking structured arguments. Implementations must return an {@link
 * ExecutionResult} for every outcome; the gateway still guards against handlers that throw.
 */
@FunctionalInterface
public interface ToolHandler {
  ExecutionResult handle(Map<String, Object> arguments);
}
