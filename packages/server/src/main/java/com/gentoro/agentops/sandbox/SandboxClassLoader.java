package com.gentoro.agentops.sandbox;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Defines the classes of one compiled snippet and refuses to link anything the {@link
 * SandboxPolicy} does not allow.
 *
 * <p>The JVM resolves every class a snippet refers to through the snippet's defining loader, so
 * this is the single place that sees fully qualified names, {@code .class} literals and reflective
 * calls as well as imported types. Refused names are recorded so the executor can tell a policy
 * violation from an ordinary linkage error.
 */
class SandboxClassLoader extends ClassLoader {
  private static final org.slf4j.Logger log =
      com.gentoro.agentops.logging.LoggingService.getLogger(SandboxClassLoader.class);

  private final Map<String, byte[]> snippetClasses;
  private final SandboxPolicy policy;
  private final Set<String> denied = Collections.synchronizedSet(new LinkedHashSet<>());

  SandboxClassLoader(Map<String, byte[]> snippetClasses, SandboxPolicy policy, ClassLoader parent) {
    super("sandbox", parent);
    this.snippetClasses = Map.copyOf(snippetClasses);
    this.policy = policy;
  }

  @Override
  protected Class<?> loadClass(String name, boolean resolve) throws ClassNotFoundException {
    synchronized (getClassLoadingLock(name)) {
      Class<?> c = findLoadedClass(name);
      if (c == null) {
        byte[] bytes = snippetClasses.get(name);
        if (bytes != null) {
          c = defineClass(name, bytes, 0, bytes.length);
        } else if (policy.isLinkable(name)) {
          c = getParent().loadClass(name);
        } else {
          denied.add(name);
          log.debug("Sandboxed code attempted to link {}", name);
          throw new ClassNotFoundException(name + " is not accessible from sandboxed code");
        }
      }
      if (resolve) {
        resolveClass(c);
      }
      return c;
    }
  }

  @Override
  protected Class<?> findClass(String name) throws ClassNotFoundException {
    return loadClass(name, false);
  }

  /** Names refused so far, in the order they were requested. */
  Set<String> deniedClasses() {
    synchronized (denied) {
      return Set.copyOf(denied);
    }
  }
}
