package com.gentoro.agentops.agent;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A request, emitted by an agent, to invoke one tool.
 *
 * <p>{@code id} is assigned by the conversation once the call is accepted, so it is unique within
 * that conversation; calls freshly parsed from a model reply carry a null id. Arguments keep the
 * order the model wrote them in and may hold null values.
 */
public record ToolCall(String id, String name, Map<String, Object> arguments) {
  public ToolCall {
    Objects.requireNonNull(name, "name");
    arguments =
        arguments == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
  }

  public static ToolCall of(String name, Map<String, Object> arguments) {
    return new ToolCall(null, name, arguments);
  }

  public ToolCall withId(String id) {
    return new ToolCall(id, name, arguments);
  }
}
