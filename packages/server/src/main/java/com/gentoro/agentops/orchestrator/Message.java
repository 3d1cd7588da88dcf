package com.gentoro.agentops.orchestrator;

import com.gentoro.agentops.agent.ToolCall;
import com.gentoro.agentops.utility.JacksonUtility;
import java.util.List;
import java.util.Objects;

/** One immutable entry of a conversation. {@code sequence} is its insertion index. */
public record Message(
    int sequence, String speaker, String content, List<ToolCall> toolCalls, Kind kind) {

  public static final String USER = "user";
  public static final String SYSTEM = "system";

  public enum Kind {
    /** The query that seeds the conversation. */
    USER,
    AGENT,
    /** A tool result posted back into the conversation. */
    TOOL,
    /** Synthetic error or notice. */
    SYSTEM
  }

  public Message {
    Objects.requireNonNull(speaker, "speaker");
    Objects.requireNonNull(kind, "kind");
    content = content == null ? "" : content;
    toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
  }

  public boolean hasContent() {
    return !content.isBlank();
  }

  public boolean hasToolCalls() {
    return !toolCalls.isEmpty();
  }

  /**
   * Render as a transcript line block:
   *
   * <pre>
   * [sql_specialist]
   * Let me look at the schema.
   * -> call_1 get_database_schema {}
   * </pre>
   */
  public String toTranscript() {
    StringBuilder sb = new StringBuilder();
    sb.append('[').append(speaker);
    if (kind == Kind.TOOL && !toolCalls.isEmpty() && toolCalls.get(0).id() != null) {
      sb.append(" result for ").append(toolCalls.get(0).id());
    }
    sb.append("]\n");
    if (hasContent()) {
      sb.append(content.strip()).append('\n');
    }
    if (kind == Kind.AGENT) {
      for (ToolCall call : toolCalls) {
        sb.append("-> ")
            .append(call.id() == null ? "" : call.id() + " ")
            .append(call.name())
            .append(' ')
            .append(JacksonUtility.toJson(call.arguments()))
            .append('\n');
      }
    }
    return sb.toString();
  }

  public static String transcript(List<Message> history) {
    StringBuilder sb = new StringBuilder();
    for (Message m : history) {
      if (sb.length() > 0) sb.append('\n');
      sb.append(m.toTranscript());
    }
    return sb.toString();
  }
}
