package com.gentoro.agentops.prompt;

import com.gentoro.agentops.exception.ConfigException;
import com.gentoro.agentops.prompt.impl.ClasspathPromptRepository;
import com.gentoro.agentops.prompt.impl.FileSystemPromptRepository;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;

public class PromptRepositoryFactory {

  /**
   * Create a PromptRepository from the {@code prompt} namespace of the application configuration.
   * {@code prompt.location} is either {@code classpath:prompts} or a directory ({@code
   * file:/abs/path} or a plain path).
   */
  public static PromptRepository create(Configuration configuration) {
    String location = configuration.getString("prompt.location", "classpath:prompts");
    if (location == null || location.isBlank()) {
      throw new ConfigException("Missing prompt.location configuration");
    }
    return create(location.trim());
  }

  public static PromptRepository create(String location) {
    if (location.startsWith("classpath:")) {
      String base = location.substring("classpath:".length());
      if (base.startsWith("/")) base = base.substring(1);
      if (base.isBlank()) {
        throw new ConfigException("Invalid prompt.location: classpath base path is empty");
      }
      return new ClasspathPromptRepository(base);
    }

    Path basePath;
    try {
      basePath = location.startsWith("file:") ? Path.of(URI.create(location)) : Path.of(location);
    } catch (IllegalArgumentException iae) {
      throw new ConfigException("Invalid prompt location URI/path: " + location, iae);
    }
    if (!Files.isDirectory(basePath)) {
      throw new ConfigException("Prompt storage directory does not exist: " + basePath);
    }
    return new FileSystemPromptRepository(basePath);
  }
}
