package com.gentoro.agentops.model;

import java.util.List;

/**
 * Primary abstraction for interacting with Large Language Model (LLM) providers.
 *
 * <p>Agents and the speaker decision function only ever see this interface. Concrete providers are
 * selected through {@link LlmClientFactory}, which discovers {@link LlmClientProvider}s with
 * {@link java.util.ServiceLoader}.
 */
public interface LlmClient {

  /**
   * Run one completion over the given messages.
   *
   * @param listener optional observer of provider events; may be null
   * @return the model's reply text
   * @throws com.gentoro.agentops.exception.LlmException when the provider call fails
   */
  String chat(List<Message> messages, InferenceEventListener listener);

  default String chat(List<Message> messages) {
    return chat(messages, null);
  }

  enum Role {
    SYSTEM,
    ASSISTANT,
    USER
  }

  record Message(Role role, String content) {
    public static Message system(String content) {
      return new Message(Role.SYSTEM, content);
    }

    public static Message user(String content) {
      return new Message(Role.USER, content);
    }

    public static Message assistant(String content) {
      return new Message(Role.ASSISTANT, content);
    }

    static List<Message> allExcept(List<Message> messages, Role role) {
      return messages.stream().filter(m -> !m.role().equals(role)).toList();
    }

    static boolean contains(List<Message> messages, Role role) {
      return messages.stream().anyMatch(m -> m.role().equals(role));
    }
  }

  enum EventType {
    ON_COMPLETION,
    ON_END
  }

  interface InferenceEventListener {
    void on(EventType type, Object data);
  }
}
