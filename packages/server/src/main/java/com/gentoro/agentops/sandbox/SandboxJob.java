package com.gentoro.agentops.sandbox;

import java.util.Map;
import java.util.Set;

/**
 * What the host sends to a sandbox process: the compiled snippet, the policy to link it under and
 * the seed variables.
 */
record SandboxJob(
    String className,
    Map<String, byte[]> classes,
    Set<String> allowedTypes,
    Set<String> allowedPackages,
    Map<String, Object> namespace,
    int maxOutputChars) {

  SandboxPolicy policy() {
    return new SandboxPolicy(allowedTypes, allowedPackages);
  }
}
