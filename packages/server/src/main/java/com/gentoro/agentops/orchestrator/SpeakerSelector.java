package com.gentoro.agentops.orchestrator;

import com.gentoro.agentops.agent.AgentDescriptor;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Chooses the next agent to speak.
 *
 * <p>The {@link SpeakerDecisionFunction} proposes a speaker; this class then applies the rules
 * that hold whatever the proposal was:
 *
 * <ul>
 *   <li>an agent that already produced {@code maxConsecutiveTurns} turns in a row is ineligible;
 *   <li>the previous speaker is not picked again while another agent is eligible, unless the
 *       choice is forced; the next eligible agent in registration order is used instead;
 *   <li>an unknown or ineligible name, or a failing decision function, falls back to round-robin
 *       in registration order starting after the last agent that spoke.
 * </ul>
 *
 * Selection depends only on its arguments, so one instance can serve concurrent conversations.
 */
public class SpeakerSelector {
  private static final org.slf4j.Logger log =
      com.gentoro.agentops.logging.LoggingService.getLogger(SpeakerSelector.class);

  private final SpeakerDecisionFunction decisionFunction;
  private final int maxConsecutiveTurns;

  public SpeakerSelector(SpeakerDecisionFunction decisionFunction, int maxConsecutiveTurns) {
    this.decisionFunction = Objects.requireNonNull(decisionFunction, "decisionFunction");
    if (maxConsecutiveTurns < 1) {
      throw new IllegalArgumentException("maxConsecutiveTurns must be at least 1");
    }
    this.maxConsecutiveTurns = maxConsecutiveTurns;
  }

  /**
   * @return the chosen descriptor, or empty when no agent is eligible or the decision function
   *     answered "none"
   */
  public Optional<AgentDescriptor> select(
      List<Message> history, List<AgentDescriptor> descriptors) {
    if (descriptors.isEmpty()) {
      return Optional.empty();
    }
    String last = lastAgentSpeaker(history);
    int streak = last == null ? 0 : consecutiveTurns(history, last);
    List<AgentDescriptor> eligible = new ArrayList<>();
    for (AgentDescriptor d : descriptors) {
      if (!d.name().equals(last) || streak < maxConsecutiveTurns) {
        eligible.add(d);
      }
    }
    if (eligible.isEmpty()) {
      log.debug("No eligible speaker: '{}' reached {} consecutive turns", last, streak);
      return Optional.empty();
    }

    SpeakerChoice choice;
    try {
      choice = decisionFunction.chooseNext(history, descriptors);
    } catch (RuntimeException e) {
      log.warn("Speaker decision failed, using round-robin: {}", e.getMessage(), e);
      choice = null;
    }
    if (choice != null && choice.isNone()) {
      return Optional.empty();
    }

    AgentDescriptor chosen = choice == null ? null : find(eligible, choice.name());
    if (chosen == null) {
      if (choice != null) {
        log.debug("Unknown or ineligible speaker '{}', using round-robin", choice.name());
      }
      return Optional.of(nextAfter(descriptors, eligible, last));
    }
    if (chosen.name().equals(last) && !choice.forced() && eligible.size() > 1) {
      AgentDescriptor replacement = nextAfter(descriptors, eligible, last);
      log.debug("'{}' spoke last; selecting '{}' instead", last, replacement.name());
      return Optional.of(replacement);
    }
    return Optional.of(chosen);
  }

  /** Name of the most recent agent turn, or null when no agent has spoken. */
  static String lastAgentSpeaker(List<Message> history) {
    for (int i = history.size() - 1; i >= 0; i--) {
      Message m = history.get(i);
      if (m.kind() == Message.Kind.AGENT) {
        return m.speaker();
      }
    }
    return null;
  }

  /** Trailing agent turns by {@code speaker}; tool and system messages do not break a streak. */
  static int consecutiveTurns(List<Message> history, String speaker) {
    int count = 0;
    for (int i = history.size() - 1; i >= 0; i--) {
      Message m = history.get(i);
      if (m.kind() == Message.Kind.USER) {
        break;
      }
      if (m.kind() != Message.Kind.AGENT) {
        continue;
      }
      if (!m.speaker().equals(speaker)) {
        break;
      }
      count++;
    }
    return count;
  }

  private static AgentDescriptor find(List<AgentDescriptor> candidates, String name) {
    if (name == null) return null;
    for (AgentDescriptor d : candidates) {
      if (d.name().equals(name)) return d;
    }
    return null;
  }

  /**
   * First eligible agent after {@code last} in registration order, wrapping around. Returns the
   * first eligible agent when nobody has spoken yet.
   */
  private static AgentDescriptor nextAfter(
      List<AgentDescriptor> all, List<AgentDescriptor> eligible, String last) {
    int start = 0;
    if (last != null) {
      for (int i = 0; i < all.size(); i++) {
        if (all.get(i).name().equals(last)) {
          start = i + 1;
          break;
        }
      }
    }
    for (int k = 0; k < all.size(); k++) {
      AgentDescriptor candidate = all.get((start + k) % all.size());
      if (eligible.contains(candidate)) {
        return candidate;
      }
    }
    return eligible.get(0);
  }
}
