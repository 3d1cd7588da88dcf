package com.gentoro.agentops.sandbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.agentops.utility.JacksonUtility;

/**
 * Base class of every compiled snippet. The snippet's statements become the body of {@link #run()}
 * and may only use the members declared here to talk to the host.
 */
public abstract class SandboxSnippet {
  private SandboxNamespace namespace;
  private OutputBuffer output;

  final void attach(SandboxNamespace namespace, OutputBuffer output) {
    this.namespace = namespace;
    this.output = output;
  }

  protected abstract void run() throws Exception;

  protected Object get(String name) {
    return namespace.get(name);
  }

  protected void set(String name, Object value) {
    namespace.set(name, value);
  }

  protected boolean has(String name) {
    return namespace.contains(name);
  }

  protected void print(Object value) {
    output.append(String.valueOf(value));
  }

  protected void println(Object value) {
    output.append(value + "\n");
  }

  protected void println() {
    output.append("\n");
  }

  /**
   * Parse JSON text into a tree. The mapper itself stays with the host, so snippets cannot change
   * how it binds types.
   */
  protected JsonNode parseJson(String text) {
    try {
      return JacksonUtility.getJsonMapper().readTree(text);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Invalid JSON: " + e.getOriginalMessage());
    }
  }

  protected String toJson(Object value) {
    try {
      return JacksonUtility.getJsonMapper().writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Value cannot be written as JSON: " + e.getOriginalMessage());
    }
  }

  protected ObjectNode objectNode() {
    return JacksonUtility.getJsonMapper().createObjectNode();
  }

  protected ArrayNode arrayNode() {
    return JacksonUtility.getJsonMapper().createArrayNode();
  }

  /** Captured print output, capped at a fixed number of characters. */
  static final class OutputBuffer {
    private final StringBuilder buffer = new StringBuilder();
    private final int limit;
    private boolean truncated;

    OutputBuffer(int limit) {
      this.limit = limit;
    }

    synchronized void append(String text) {
      if (truncated) return;
      int room = limit - buffer.length();
      if (text.length() <= room) {
        buffer.append(text);
      } else {
        buffer.append(text, 0, Math.max(room, 0));
        buffer.append("\n... [output truncated]");
        truncated = true;
      }
    }

    synchronized String text() {
      return buffer.toString();
    }
  }
}
