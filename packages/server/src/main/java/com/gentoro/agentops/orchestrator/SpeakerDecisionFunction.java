package com.gentoro.agentops.orchestrator;

import com.gentoro.agentops.agent.AgentDescriptor;
import java.util.List;

/** Proposes the next speaker. {@link SpeakerSelector} enforces the turn rules on top of it. */
@FunctionalInterface
public interface SpeakerDecisionFunction {
  SpeakerChoice chooseNext(List<Message> history, List<AgentDescriptor> descriptors);
}
