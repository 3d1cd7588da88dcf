package com.gentoro.agentops.agent;

import java.util.List;

/**
 * What an agent produced for one turn.
 *
 * <p>A response is terminal when it carries the explicit {@code terminate} flag or when its
 * content ends with {@value #TERMINATION_MARKER}.
 */
public record AgentResponse(String content, List<ToolCall> toolCalls, boolean terminate) {
  public static final String TERMINATION_MARKER = "TERMINATE";

  public AgentResponse {
    content = content == null ? "" : content;
    toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
  }

  public static AgentResponse text(String content) {
    return new AgentResponse(content, List.of(), false);
  }

  public static AgentResponse withTools(String content, List<ToolCall> toolCalls) {
    return new AgentResponse(content, toolCalls, false);
  }

  public boolean hasToolCalls() {
    return !toolCalls.isEmpty();
  }

  public boolean isTerminal() {
    return terminate || endsWithMarker(content);
  }

  public static boolean endsWithMarker(String text) {
    return text != null && text.stripTrailing().endsWith(TERMINATION_MARKER);
  }

  /** {@code text} without a trailing termination marker, trimmed. */
  public static String stripMarker(String text) {
    if (text == null) return "";
    String out = text.stripTrailing();
    if (out.endsWith(TERMINATION_MARKER)) {
      out = out.substring(0, out.length() - TERMINATION_MARKER.length());
    }
    return out.trim();
  }
}
