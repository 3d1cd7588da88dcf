package com.gentoro.agentops.prompt.impl;

import com.gentoro.agentops.exception.ExceptionUtil;
import com.gentoro.agentops.exception.NotFoundException;
import com.gentoro.agentops.exception.PromptException;
import com.gentoro.agentops.prompt.PromptRepository;
import com.gentoro.agentops.prompt.PromptTemplate;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads prompt YAML templates from the classpath starting at a base directory. Example basePath:
 * "prompts" (will resolve resources like "prompts/agent-turn.yaml"). Parsed templates are cached.
 */
public class ClasspathPromptRepository implements PromptRepository {
  private final String basePath;
  private final ClassLoader classLoader;
  private final Map<String, PromptTemplate> cache = new ConcurrentHashMap<>();

  public ClasspathPromptRepository(String basePath) {
    this(basePath, Thread.currentThread().getContextClassLoader());
  }

  public ClasspathPromptRepository(String basePath, ClassLoader classLoader) {
    this.basePath = normalize(Objects.requireNonNull(basePath, "basePath"));
    this.classLoader =
        Objects.requireNonNullElseGet(
            classLoader, () -> ClasspathPromptRepository.class.getClassLoader());
  }

  @Override
  public PromptTemplate get(String name) {
    if (name == null || name.isBlank()) {
      throw new PromptException("Prompt name must not be blank");
    }
    String id = name.charAt(0) == '/' ? name.substring(1) : name;
    return cache.computeIfAbsent(id, this::load);
  }

  private PromptTemplate load(String id) {
    String resource = resolveExisting(id);
    if (resource == null) {
      throw new NotFoundException("Prompt not found on classpath: " + basePath + "/" + id);
    }
    try (InputStream is = classLoader.getResourceAsStream(resource)) {
      if (is == null) {
        throw new NotFoundException("Prompt resource not found: " + resource);
      }
      return YamlPromptParser.parse(id, new String(is.readAllBytes(), StandardCharsets.UTF_8));
    } catch (Exception e) {
      throw ExceptionUtil.rethrowIfUnchecked(
          e, (ex) -> new PromptException("Failed to read prompt file: " + id, ex));
    }
  }

  private String resolveExisting(String id) {
    String yaml = basePath + "/" + id + ".yaml";
    if (classLoader.getResource(yaml) != null) return yaml;
    String yml = basePath + "/" + id + ".yml";
    if (classLoader.getResource(yml) != null) return yml;
    return null;
  }

  private static String normalize(String p) {
    String out = p.trim();
    if (out.startsWith("/")) out = out.substring(1);
    if (out.endsWith("/")) out = out.substring(0, out.length() - 1);
    return out;
  }
}
