package com.gentoro.agentops;

import com.gentoro.agentops.exception.ConfigException;
import com.gentoro.agentops.exception.SerializationException;
import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.builder.FileBasedConfigurationBuilder;
import org.apache.commons.configuration2.builder.fluent.Parameters;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.configuration2.interpol.Lookup;

/**
 * Loads the YAML application configuration.
 *
 * <p>Locations: {@code classpath:application.yaml}, {@code file:/etc/agentops.yaml} or a plain
 * filesystem path. Values may reference environment variables as {@code ${env:NAME}}; variables
 * missing from the process environment are looked up in a {@code .env.local} file.
 */
public final class ConfigurationProvider {
  private static final org.slf4j.Logger log =
      com.gentoro.agentops.logging.LoggingService.getLogger(ConfigurationProvider.class);

  public static final String DEFAULT_LOCATION = "classpath:application.yaml";

  private final Configuration configuration;

  public ConfigurationProvider(String location) {
    this.configuration = load(location);
  }

  public Configuration config() {
    return configuration;
  }

  /** Parse YAML text directly; used for inline configuration and in tests. */
  public static Configuration fromYaml(String yaml) {
    YAMLConfiguration config = new YAMLConfiguration();
    try {
      config.read(new StringReader(yaml));
    } catch (ConfigurationException e) {
      throw new ConfigException("Invalid YAML configuration", e);
    }
    return withEnvLookup(config);
  }

  private static Configuration load(String location) {
    String loc = location == null || location.isBlank() ? DEFAULT_LOCATION : location.trim();
    if (loc.startsWith("classpath:")) {
      return loadFromClasspath(loc.substring("classpath:".length()));
    }
    if (loc.regionMatches(true, 0, "file:", 0, 5)) {
      try {
        return loadFromFile(new File(URI.create(loc)));
      } catch (IllegalArgumentException e) {
        throw new ConfigException("Invalid configuration URI: " + loc, e);
      }
    }
    return loadFromFile(new File(loc));
  }

  private static Configuration loadFromClasspath(String resourceName) {
    String name = resourceName.startsWith("/") ? resourceName.substring(1) : resourceName;
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    try (InputStream input = cl.getResourceAsStream(name)) {
      if (input == null) {
        throw new ConfigException("Configuration resource not found on classpath: " + name);
      }
      log.info("Loading configuration from classpath resource: {}", name);
      return fromYaml(new String(input.readAllBytes(), StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new SerializationException("Failed to read YAML from classpath resource: " + name, e);
    }
  }

  private static Configuration loadFromFile(File file) {
    if (!file.isFile()) {
      throw new ConfigException("Configuration file not found: " + file.getAbsolutePath());
    }
    log.info("Loading configuration from file: {}", file.getAbsolutePath());
    try {
      FileBasedConfigurationBuilder<YAMLConfiguration> builder =
          new FileBasedConfigurationBuilder<>(YAMLConfiguration.class)
              .configure(new Parameters().fileBased().setFile(file));
      return withEnvLookup(builder.getConfiguration());
    } catch (ConfigurationException e) {
      throw new ConfigException("Failed to load YAML file: " + file, e);
    }
  }

  private static Configuration withEnvLookup(Configuration config) {
    config.getInterpolator().registerLookup("env", new EnvFileLookup());
    return config;
  }

  /** Environment lookup that falls back to {@code .env.local} in the working directory. */
  static final class EnvFileLookup implements Lookup {
    private static final List<Path> CANDIDATES =
        List.of(Paths.get(".env.local"), Paths.get("packages/server/.env.local"));

    private volatile Map<String, String> fallback;

    @Override
    public Object lookup(String key) {
      String value = System.getenv(key);
      if (value != null && !value.isEmpty()) {
        return value;
      }
      return fallback().get(key);
    }

    private Map<String, String> fallback() {
      Map<String, String> local = fallback;
      if (local == null) {
        synchronized (this) {
          if (fallback == null) {
            fallback = readEnvFile();
          }
          local = fallback;
        }
      }
      return local;
    }

    private static Map<String, String> readEnvFile() {
      for (Path candidate : CANDIDATES) {
        if (Files.isRegularFile(candidate)) {
          log.info("Reading environment fallback from {}", candidate.toAbsolutePath());
          return parse(candidate);
        }
      }
      log.debug("No .env.local found; ${env:...} resolves from the process environment only");
      return new HashMap<>();
    }

    static Map<String, String> parse(Path path) {
      try (BufferedReader br = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
        return br.lines()
            .map(String::trim)
            .filter(line -> !line.isEmpty() && !line.startsWith("#"))
            .filter(line -> line.indexOf('=') > 0)
            .collect(
                Collectors.toMap(
                    line -> line.substring(0, line.indexOf('=')).trim(),
                    line -> unquote(line.substring(line.indexOf('=') + 1).trim()),
                    (a, b) -> b));
      } catch (IOException e) {
        log.warn("Could not read {}: {}", path, e.getMessage());
        return Collections.emptyMap();
      }
    }

    private static String unquote(String value) {
      if (value.length() >= 2
          && ((value.startsWith("\"") && value.endsWith("\""))
              || (value.startsWith("'") && value.endsWith("'")))) {
        return value.substring(1, value.length() - 1);
      }
      return value;
    }
  }
}
