package com.gentoro.agentops.tool;

import com.gentoro.agentops.exception.ToolRegistrationException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Name-keyed set of {@link ToolDescriptor}s. Registration order is preserved. Registration happens
 * during application wiring; lookups afterwards are safe from any thread.
 */
public class ToolRegistry {
  private static final org.slf4j.Logger log =
      com.gentoro.agentops.logging.LoggingService.getLogger(ToolRegistry.class);

  private final Map<String, ToolDescriptor> tools =
      Collections.synchronizedMap(new LinkedHashMap<>());

  public ToolRegistry register(ToolDescriptor descriptor) {
    synchronized (tools) {
      if (tools.containsKey(descriptor.name())) {
        throw new ToolRegistrationException(
            "Tool '" + descriptor.name() + "' is already registered");
      }
      tools.put(descriptor.name(), descriptor);
    }
    log.debug("Registered tool {}", descriptor);
    return this;
  }

  public ToolRegistry registerAll(Collection<ToolDescriptor> descriptors) {
    descriptors.forEach(this::register);
    return this;
  }

  public Optional<ToolDescriptor> find(String name) {
    return name == null ? Optional.empty() : Optional.ofNullable(tools.get(name));
  }

  public boolean contains(String name) {
    return name != null && tools.containsKey(name);
  }

  public List<ToolDescriptor> all() {
    synchronized (tools) {
      return List.copyOf(tools.values());
    }
  }

  /**
   * Descriptors for the given names, in the order requested.
   *
   * @throws ToolRegistrationException when any name is not registered
   */
  public List<ToolDescriptor> subset(Collection<String> names) {
    List<ToolDescriptor> out = new ArrayList<>();
    List<String> unknown = new ArrayList<>();
    for (String n : names) {
      ToolDescriptor d = tools.get(n);
      if (d == null) unknown.add(n);
      else out.add(d);
    }
    if (!unknown.isEmpty()) {
      throw new ToolRegistrationException("Unknown tool(s): " + String.join(", ", unknown));
    }
    return out;
  }
}
