package com.gentoro.agentops.sandbox.utils;

import java.net.URI;
import javax.tools.SimpleJavaFileObject;

/** Snippet source held in memory under a synthetic {@code string:///} URI. */
public class InMemoryJavaFileObject extends SimpleJavaFileObject {
  private final String sourceCode;

  public InMemoryJavaFileObject(String className, String sourceCode) {
    super(
        URI.create("string:///" + className.replace('.', '/') + Kind.SOURCE.extension),
        Kind.SOURCE);
    this.sourceCode = sourceCode;
  }

  public String getSourceCode() {
    return sourceCode;
  }

  @Override
  public CharSequence getCharContent(boolean ignoreEncodingErrors) {
    return sourceCode;
  }
}
