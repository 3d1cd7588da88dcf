package com.gentoro.agentops.prompt.impl;

import com.gentoro.agentops.exception.NotFoundException;
import com.gentoro.agentops.exception.PromptException;
import com.gentoro.agentops.prompt.PromptRepository;
import com.gentoro.agentops.prompt.PromptTemplate;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads prompt YAML templates from a directory. Files are read on every call so prompts can be
 * tuned without restarting.
 */
public class FileSystemPromptRepository implements PromptRepository {
  private final Path path;

  public FileSystemPromptRepository(Path path) {
    this.path = path;
  }

  @Override
  public PromptTemplate get(String name) {
    if (name == null || name.isBlank()) {
      throw new PromptException("Prompt name must not be blank");
    }
    String id = name.charAt(0) == '/' ? name.substring(1) : name;
    Path yamlPath = resolveExisting(id);
    if (yamlPath == null) {
      throw new NotFoundException("Prompt not found: " + path.resolve(id));
    }
    try {
      return YamlPromptParser.parse(id, Files.readString(yamlPath));
    } catch (IOException e) {
      throw new PromptException("Failed to read prompt file: " + yamlPath, e);
    }
  }

  private Path resolveExisting(String id) {
    Path yaml = path.resolve(id + ".yaml").normalize();
    if (!yaml.startsWith(path.normalize())) return null;
    if (Files.isRegularFile(yaml)) return yaml;
    Path yml = path.resolve(id + ".yml").normalize();
    if (Files.isRegularFile(yml)) return yml;
    return null;
  }
}
