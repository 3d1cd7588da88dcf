package com.gentoro.agentops.sandbox;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.agentops.exception.ExceptionUtil;
import com.gentoro.agentops.utility.JacksonUtility;
import java.io.PrintStream;
import java.lang.reflect.InvocationTargetException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point of the sandbox process. Reads one {@link SandboxJob} from stdin, prints {@value
 * #READY} once the job is decoded, runs the snippet and prints a single {@value #RESULT_PREFIX}
 * line with the {@link SandboxReply}. Any other stdout line is noise the host ignores.
 */
public final class SandboxWorker {
  static final String READY = "@@sandbox-ready";
  static final String RESULT_PREFIX = "@@sandbox-result ";

  private SandboxWorker() {}

  public static void main(String[] args) throws Exception {
    PrintStream out = System.out;
    ObjectMapper mapper = JacksonUtility.getJsonMapper();
    SandboxJob job = mapper.readValue(System.in.readAllBytes(), SandboxJob.class);
    out.println(READY);
    out.flush();

    SandboxReply reply = execute(job);
    out.println(RESULT_PREFIX + mapper.writeValueAsString(reply));
    out.flush();
    System.exit(0);
  }

  static SandboxReply execute(SandboxJob job) {
    SandboxNamespace namespace = new SandboxNamespace(job.namespace());
    SandboxClassLoader loader =
        new SandboxClassLoader(job.classes(), job.policy(), SandboxWorker.class.getClassLoader());
    SandboxSnippet.OutputBuffer output = new SandboxSnippet.OutputBuffer(job.maxOutputChars());

    Throwable failure = null;
    try {
      SandboxSnippet snippet =
          (SandboxSnippet) loader.loadClass(job.className()).getDeclaredConstructor().newInstance();
      snippet.attach(namespace, output);
      snippet.run();
    } catch (Throwable t) {
      failure = t;
    }

    // a snippet may catch the linkage error itself; a denied link still voids the run
    List<String> denied = List.copyOf(loader.deniedClasses());
    if (!denied.isEmpty()) {
      return new SandboxReply(SandboxReply.Outcome.DENIED, "", denied, Map.of());
    }
    if (failure != null) {
      return new SandboxReply(
          SandboxReply.Outcome.FAILED, ExceptionUtil.describe(unwrap(failure)), List.of(), Map.of());
    }

    Object result = namespace.get(SandboxNamespace.RESULT);
    String answer;
    if (result != null) {
      answer = String.valueOf(result);
    } else {
      String printed = output.text().strip();
      answer = printed.isEmpty() ? SandboxExecutor.NO_OUTPUT : printed;
    }
    return new SandboxReply(
        SandboxReply.Outcome.OK, answer, List.of(), exportable(namespace.snapshot()));
  }

  /** Namespace values as JSON trees; values Jackson cannot write travel as their string form. */
  static Map<String, Object> exportable(Map<String, Object> values) {
    ObjectMapper mapper = JacksonUtility.getJsonMapper();
    Map<String, Object> out = new LinkedHashMap<>();
    values.forEach(
        (name, value) -> {
          try {
            out.put(name, mapper.valueToTree(value));
          } catch (IllegalArgumentException e) {
            out.put(name, String.valueOf(value));
          }
        });
    return out;
  }

  private static Throwable unwrap(Throwable t) {
    Throwable current = t;
    while (current instanceof InvocationTargetException && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }
}
