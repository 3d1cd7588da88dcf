package com.gentoro.agentops.prompt.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.agentops.exception.PromptException;
import com.gentoro.agentops.exception.ValidationException;
import com.gentoro.agentops.model.LlmClient;
import com.gentoro.agentops.prompt.PromptTemplate;
import com.gentoro.agentops.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns prompt YAML into a {@link PebblePromptTemplate}.
 *
 * <pre>
 * sections:
 *   - role: system
 *     id: directive
 *     enabled: true
 *     content: |
 *       You are {{ agent_name }} ...
 * </pre>
 */
final class YamlPromptParser {
  private YamlPromptParser() {}

  static PromptTemplate parse(String id, String yamlContent) {
    JsonNode root;
    try {
      root = JacksonUtility.getYamlMapper().readTree(yamlContent);
    } catch (JsonProcessingException e) {
      throw new PromptException("Prompt YAML is not valid: " + id, e);
    }
    JsonNode arr = root == null ? null : root.get("sections");
    if (arr == null || !arr.isArray()) {
      throw new ValidationException("Prompt YAML must contain a 'sections' array: " + id);
    }

    List<PromptTemplate.PromptSection> sections = new ArrayList<>();
    for (JsonNode n : arr) {
      String roleStr = n.path("role").asText(null);
      if (roleStr == null) {
        throw new ValidationException("Missing role for a section in prompt: " + id);
      }
      LlmClient.Role role =
          switch (roleStr.toLowerCase()) {
            case "user" -> LlmClient.Role.USER;
            case "assistant" -> LlmClient.Role.ASSISTANT;
            case "system" -> LlmClient.Role.SYSTEM;
            default -> throw new ValidationException(
                "Unknown role '" + roleStr + "' in prompt: " + id);
          };

      String sectionId = n.path("id").asText(null);
      if (sectionId == null || sectionId.isBlank()) {
        throw new ValidationException("Missing section id in prompt: " + id);
      }
      boolean enabled = n.path("enabled").asBoolean(true);
      String content = n.path("content").asText("");
      if (content.isBlank()) {
        throw new ValidationException(
            "Empty content for section '" + sectionId + "' in prompt: " + id);
      }
      sections.add(new PromptTemplate.PromptSection(role, sectionId, enabled, content));
    }
    return new PebblePromptTemplate(id, sections);
  }
}
