package com.gentoro.agentops.sandbox;

import java.util.List;
import java.util.Map;

/**
 * What a sandbox process reports back once the snippet returns or fails.
 *
 * @param outcome {@link Outcome#OK}, {@link Outcome#DENIED} when the snippet tried to link a
 *     refused class, or {@link Outcome#FAILED}
 * @param output the answer text, or the failure description
 * @param denied refused class names, in request order
 * @param namespace variables after the run, as JSON-compatible values
 */
record SandboxReply(
    Outcome outcome, String output, List<String> denied, Map<String, Object> namespace) {

  enum Outcome {
    OK,
    DENIED,
    FAILED
  }
}
