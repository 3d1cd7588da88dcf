package com.gentoro.agentops.sandbox;

import com.gentoro.agentops.exception.ExceptionUtil;
import com.gentoro.agentops.exception.SandboxValidationException;
import com.gentoro.agentops.tool.ErrorKind;
import com.gentoro.agentops.tool.ExecutionResult;
import com.gentoro.agentops.tool.ToolDescriptor;
import com.gentoro.agentops.tool.ToolHandler;
import com.gentoro.agentops.tool.ToolProperty;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The {@code code_interpreter} tool: runs a Java snippet under a restricted capability set.
 *
 * <p>A snippet is optional import declarations followed by statements. The statements become the
 * body of {@link SandboxSnippet#run()}. The pipeline is: add commonly forgotten imports, reject
 * imports outside the {@link SandboxPolicy}, compile in memory, then hand the bytecode to a child
 * JVM ({@link SandboxLauncher}) that links it through a {@link SandboxClassLoader} enforcing the
 * policy again. The child has a capped heap and is killed when the time limit passes.
 *
 * <p>The answer is the namespace variable {@code result} when the snippet sets it, otherwise the
 * captured print output, otherwise {@value #NO_OUTPUT}. Every failure, {@link Error}s included,
 * comes back as an error result.
 */
public class SandboxExecutor implements ToolHandler {
  private static final org.slf4j.Logger log =
      com.gentoro.agentops.logging.LoggingService.getLogger(SandboxExecutor.class);

  public static final String TOOL_NAME = "code_interpreter";
  public static final String CODE_ARGUMENT = "code";
  public static final String NO_OUTPUT = "Code executed successfully (no output)";

  private final SandboxPolicy policy;
  private final SnippetCompiler compiler;
  private final ImportValidator validator;
  private final SandboxLauncher launcher;
  private final Duration timeout;
  private final int maxOutputChars;
  private final AtomicLong snippetIds = new AtomicLong();

  public SandboxExecutor(Duration timeout, int maxOutputChars) {
    this(SandboxPolicy.defaults(), new SnippetCompiler(), new SandboxLauncher(), timeout, maxOutputChars);
  }

  public SandboxExecutor(
      SandboxPolicy policy,
      SnippetCompiler compiler,
      SandboxLauncher launcher,
      Duration timeout,
      int maxOutputChars) {
    this.policy = policy;
    this.compiler = compiler;
    this.validator = new ImportValidator(compiler, policy);
    this.launcher = launcher;
    this.timeout = timeout;
    this.maxOutputChars = maxOutputChars;
  }

  public ToolDescriptor descriptor() {
    return ToolDescriptor.builder()
        .name(TOOL_NAME)
        .description(
            "Run a Java snippet for calculations and data transformation. Write optional import"
                + " lines followed by plain statements (no class or method declaration). Use"
                + " set(\"result\", value) to return a value, get(name) to read variables,"
                + " println(x) to print, and parseJson(text)/toJson(value) for JSON. Only java.lang"
                + " basics, java.util collections, java.util.stream/function/regex, java.math,"
                + " java.time, java.text and Jackson tree types are available; no files,"
                + " network, threads, System or reflection.")
        .schema(ToolProperty.object(ToolProperty.string(CODE_ARGUMENT, "Java snippet", true)))
        .handler(this)
        .build();
  }

  @Override
  public ExecutionResult handle(Map<String, Object> arguments) {
    Object code = arguments == null ? null : arguments.get(CODE_ARGUMENT);
    if (code == null || code.toString().isBlank()) {
      return ExecutionResult.error(ErrorKind.VALIDATION, "Missing '" + CODE_ARGUMENT + "' parameter");
    }
    return run(code.toString());
  }

  public ExecutionResult run(String code) {
    return run(code, new SandboxNamespace());
  }

  public ExecutionResult run(String code, SandboxNamespace namespace) {
    long start = System.currentTimeMillis();
    String className = "Snippet_" + snippetIds.incrementAndGet();
    try {
      ExecutionResult result = execute(className, code == null ? "" : code, namespace);
      log.debug(
          "Sandbox run {} finished in {}ms with status {}",
          className,
          System.currentTimeMillis() - start,
          result.status());
      return result;
    } catch (SandboxValidationException e) {
      log.info("Sandbox rejected {}: {}", className, e.getMessage());
      return ExecutionResult.error(ErrorKind.VALIDATION, e.getMessage());
    } catch (Throwable t) {
      log.error("Sandbox run {} failed unexpectedly", className, t);
      return ExecutionResult.error(ErrorKind.EXECUTION, ExceptionUtil.describe(t));
    }
  }

  private ExecutionResult execute(String className, String code, SandboxNamespace namespace) {
    String source = toSource(className, code);
    validator.validate(className, source);

    SnippetCompiler.CompilationResult compiled = compiler.compile(className, source);
    if (!compiled.success()) {
      return ExecutionResult.error(ErrorKind.VALIDATION, compiled.errors());
    }

    SandboxJob job =
        new SandboxJob(
            className,
            compiled.classes(),
            policy.types(),
            policy.packages(),
            SandboxWorker.exportable(namespace.snapshot()),
            maxOutputChars);
    SandboxReply reply;
    try {
      reply = launcher.run(job, timeout);
    } catch (TimeoutException e) {
      log.warn("Sandbox run {} exceeded {}ms and was killed", className, timeout.toMillis());
      return ExecutionResult.error(
          ErrorKind.TIMEOUT, "Execution exceeded the time limit of %d ms".formatted(timeout.toMillis()));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return ExecutionResult.error(ErrorKind.EXECUTION, "Execution interrupted");
    }

    return switch (reply.outcome()) {
      case DENIED -> accessDenied(reply.denied());
      case FAILED -> ExecutionResult.error(ErrorKind.EXECUTION, reply.output());
      case OK -> {
        if (reply.namespace() != null) {
          reply.namespace().forEach(namespace::set);
        }
        yield ExecutionResult.ok(reply.output());
      }
    };
  }

  private static ExecutionResult accessDenied(List<String> denied) {
    return ExecutionResult.error(
        ErrorKind.VALIDATION,
        "Access to %s is not allowed in sandboxed code".formatted(String.join(", ", denied)));
  }

  /** Wrap snippet text into a compilable class extending {@link SandboxSnippet}. */
  static String toSource(String className, String code) {
    List<String> header = new ArrayList<>();
    List<String> body = new ArrayList<>();
    boolean inHeader = true;
    for (String line : code.split("\\R", -1)) {
      String trimmed = line.strip();
      if (inHeader) {
        if (trimmed.startsWith("package ")) continue;
        if (trimmed.isEmpty() || trimmed.startsWith("import ") || trimmed.startsWith("//")) {
          header.add(line);
          continue;
        }
        inHeader = false;
      }
      body.add(line);
    }
    String imports = String.join("\n", header);
    String statements = String.join("\n", body);

    StringBuilder src = new StringBuilder();
    src.append(imports).append('\n');
    for (String missing : ImportFixer.missingImports(imports, statements)) {
      src.append(missing).append('\n');
    }
    src.append("\npublic class ")
        .append(className)
        .append(" extends ")
        .append(SandboxSnippet.class.getName())
        .append(" {\n  @Override\n  protected void run() throws Exception {\n")
        .append(statements)
        .append("\n  }\n}\n");
    return src.toString();
  }
}
