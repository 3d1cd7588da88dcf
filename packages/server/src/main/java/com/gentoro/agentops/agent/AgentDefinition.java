package com.gentoro.agentops.agent;

import com.gentoro.agentops.exception.ConfigException;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.HierarchicalConfiguration;

/**
 * Agent as declared in {@code application.yaml}:
 *
 * <pre>
 * agents:
 *   - name: sql_specialist
 *     directive: agents/sql-specialist
 *     tools: [get_database_schema, execute_sql_query]
 * </pre>
 *
 * {@code directive} is the id of a prompt template whose rendered text becomes the agent's
 * directive.
 */
public record AgentDefinition(String name, String directive, List<String> tools) {
  public AgentDefinition {
    tools = tools == null ? List.of() : List.copyOf(tools);
  }

  public static List<AgentDefinition> fromConfiguration(Configuration configuration) {
    if (!(configuration instanceof HierarchicalConfiguration<?> hierarchical)) {
      throw new ConfigException(
          "Agent definitions require a hierarchical configuration, got "
              + configuration.getClass().getSimpleName());
    }
    List<AgentDefinition> out = new ArrayList<>();
    for (HierarchicalConfiguration<?> node : hierarchical.configurationsAt("agents")) {
      String name = node.getString("name", null);
      if (name == null || name.isBlank()) {
        throw new ConfigException("Every entry under 'agents' needs a name");
      }
      String directive = node.getString("directive", null);
      if (directive == null || directive.isBlank()) {
        throw new ConfigException("Agent '" + name + "' has no directive");
      }
      out.add(new AgentDefinition(name, directive, node.getList(String.class, "tools", List.of())));
    }
    return out;
  }
}
