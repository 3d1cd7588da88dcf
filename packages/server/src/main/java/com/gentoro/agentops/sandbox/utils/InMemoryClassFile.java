package com.gentoro.agentops.sandbox.utils;

import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.net.URI;
import javax.tools.SimpleJavaFileObject;

/** Bytecode sink for one class emitted by javac. */
class InMemoryClassFile extends SimpleJavaFileObject {
  private final String className;
  private final ByteArrayOutputStream outputStream = new ByteArrayOutputStream();

  InMemoryClassFile(String className, Kind kind) {
    super(URI.create("mem:///" + className.replace('.', '/') + kind.extension), kind);
    this.className = className;
  }

  String className() {
    return className;
  }

  @Override
  public OutputStream openOutputStream() {
    return outputStream;
  }

  byte[] getBytes() {
    return outputStream.toByteArray();
  }
}
