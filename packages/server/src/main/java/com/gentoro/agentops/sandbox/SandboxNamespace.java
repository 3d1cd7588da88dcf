package com.gentoro.agentops.sandbox;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Variables visible to a snippet. The snippet reaches them only through {@link SandboxSnippet#get}
 * and {@link SandboxSnippet#set}; nothing else of the host is shared.
 */
public final class SandboxNamespace {
  /** Variable read back as the snippet's answer. */
  public static final String RESULT = "result";

  private final Map<String, Object> values = new LinkedHashMap<>();

  public SandboxNamespace() {}

  public SandboxNamespace(Map<String, ?> initial) {
    if (initial != null) values.putAll(initial);
  }

  public synchronized Object get(String name) {
    return values.get(name);
  }

  public synchronized void set(String name, Object value) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("variable name must not be blank");
    }
    values.put(name, value);
  }

  public synchronized boolean contains(String name) {
    return values.containsKey(name);
  }

  public synchronized Map<String, Object> snapshot() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }
}
