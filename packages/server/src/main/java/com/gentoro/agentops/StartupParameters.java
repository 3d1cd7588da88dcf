package com.gentoro.agentops;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Command line parameters, given as {@code --name value} pairs.
 *
 * <ul>
 *   <li>{@code --mode}: {@code interactive} (default), {@code query}, {@code server}, {@code api}
 *       or {@code help};
 *   <li>{@code --config-file}: configuration location, default {@code
 *       classpath:application.yaml};
 *   <li>{@code --query}: the question to answer, required in {@code query} mode.
 * </ul>
 */
public class StartupParameters {
  public static final Set<String> MODES = Set.of("interactive", "query", "server", "api", "help");

  final Map<String, Object> parameters = new HashMap<>();

  {
    parameters.put("config-file", ConfigurationProvider.DEFAULT_LOCATION);
    parameters.put("mode", "interactive");
  }

  public StartupParameters(String[] arguments) {
    this.parameters.putAll(parseArguments(arguments));
    this.validate();
  }

  private Map<String, Object> parseArguments(String[] arguments) {
    Map<String, Object> result = new HashMap<>();
    for (int p = 0; p < arguments.length; p++) {
      if (!arguments[p].startsWith("--")) {
        continue;
      }
      String paramName = arguments[p].substring(2);
      String paramValue = null;
      // A flag directly followed by another flag has no value.
      if (p < arguments.length - 1 && !arguments[p + 1].startsWith("--")) {
        paramValue = arguments[p + 1];
        p++;
      }
      if ("help".equals(paramName) && paramValue == null) {
        result.put("mode", "help");
        continue;
      }
      result.put(paramName, paramValue);
    }
    return result;
  }

  private void validate() {
    Object mode = parameters.get("mode");
    if (mode == null || !MODES.contains(mode.toString())) {
      throw new IllegalArgumentException("Invalid mode: " + mode);
    }
    Object configFile = parameters.get("config-file");
    if (configFile == null || configFile.toString().isBlank()) {
      throw new IllegalArgumentException("Missing config file location");
    }
    if ("query".equals(mode)) {
      Object query = parameters.get("query");
      if (query == null || query.toString().isBlank()) {
        throw new IllegalArgumentException("Mode 'query' requires --query \"<question>\"");
      }
    }
  }

  public String mode() {
    return getParameter("mode", String.class);
  }

  public String configFile() {
    return getOptionalParameter("config-file", String.class)
        .orElse(ConfigurationProvider.DEFAULT_LOCATION);
  }

  public Optional<String> query() {
    return getOptionalParameter("query", String.class);
  }

  public <T> T getParameter(String name, Class<T> type) {
    return type.cast(parameters.get(name));
  }

  public <T> Optional<T> getOptionalParameter(String name, Class<T> type) {
    return Optional.ofNullable(type.cast(parameters.get(name)));
  }

  public boolean isParameterPresent(String name) {
    return parameters.containsKey(name);
  }

  public static String usage() {
    return """
        Usage: agentops [--mode interactive|query|server|api|help] [--config-file <location>]
                        [--query "<question>"]

          interactive  read questions from the console (default)
          query        answer a single --query and print the conversation as JSON
          server       host the tool endpoint (/mcp) and /health until stopped
          api          like server, plus /query, /chat and /schema answered by the agents
          help         print this message
        """;
  }
}
