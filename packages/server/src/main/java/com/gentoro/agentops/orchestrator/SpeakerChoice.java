package com.gentoro.agentops.orchestrator;

/**
 * Answer of a {@link SpeakerDecisionFunction}: a named agent, a named agent that must speak again
 * ({@code forced}), or nobody.
 */
public record SpeakerChoice(String name, boolean forced) {
  private static final SpeakerChoice NONE = new SpeakerChoice(null, false);

  public static SpeakerChoice of(String name) {
    return new SpeakerChoice(name, false);
  }

  public static SpeakerChoice forced(String name) {
    return new SpeakerChoice(name, true);
  }

  public static SpeakerChoice none() {
    return NONE;
  }

  public boolean isNone() {
    return name == null;
  }
}
