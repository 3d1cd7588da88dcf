package com.gentoro.agentops.sandbox.utils;

import java.util.LinkedHashMap;
import java.util.Map;
import javax.tools.FileObject;
import javax.tools.ForwardingJavaFileManager;
import javax.tools.JavaFileObject;
import javax.tools.StandardJavaFileManager;

/**
 * Keeps javac output in memory. One instance serves a single compilation so the classes of one
 * snippet never leak into the next.
 */
public class MemoryFileManager extends ForwardingJavaFileManager<StandardJavaFileManager> {
  private final Map<String, InMemoryClassFile> compiledClasses = new LinkedHashMap<>();

  public MemoryFileManager(StandardJavaFileManager standardManager) {
    super(standardManager);
  }

  @Override
  public JavaFileObject getJavaFileForOutput(
      Location location, String className, JavaFileObject.Kind kind, FileObject sibling) {
    InMemoryClassFile file = new InMemoryClassFile(className, kind);
    compiledClasses.put(className, file);
    return file;
  }

  /** Binary class name to bytecode, for everything emitted so far (nested classes included). */
  public Map<String, byte[]> getAllClassBytes() {
    Map<String, byte[]> result = new LinkedHashMap<>();
    for (InMemoryClassFile file : compiledClasses.values()) {
      result.put(file.className(), file.getBytes());
    }
    return result;
  }

  /** Releases the collected output; the wrapped standard manager stays open for reuse. */
  @Override
  public void close() {
    compiledClasses.clear();
  }
}
