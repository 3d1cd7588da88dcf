package com.gentoro.agentops.sandbox;

import com.gentoro.agentops.exception.CompilationException;
import com.gentoro.agentops.exception.StateException;
import com.gentoro.agentops.sandbox.utils.InMemoryJavaFileObject;
import com.gentoro.agentops.sandbox.utils.MemoryFileManager;
import com.gentoro.agentops.utility.StringUtility;
import com.sun.source.tree.CompilationUnitTree;
import com.sun.source.tree.ImportTree;
import com.sun.source.tree.MemberSelectTree;
import com.sun.source.tree.Tree;
import com.sun.source.util.JavacTask;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import javax.tools.Diagnostic;
import javax.tools.DiagnosticCollector;
import javax.tools.JavaCompiler;
import javax.tools.JavaFileObject;
import javax.tools.StandardJavaFileManager;
import javax.tools.ToolProvider;

/**
 * In-memory javac front end: parses snippet sources for their imports and compiles them to
 * bytecode without touching the file system.
 *
 * <p>The standard file manager is shared and not thread-safe, so javac invocations are serialized.
 * Running the compiled code is not.
 */
public class SnippetCompiler {
  private static final org.slf4j.Logger log =
      com.gentoro.agentops.logging.LoggingService.getLogger(SnippetCompiler.class);

  private static final List<String> OPTIONS = List.of("-proc:none", "-g:none", "-Xlint:none");

  private final JavaCompiler compiler;
  private final StandardJavaFileManager standardFileManager;

  public SnippetCompiler() {
    this.compiler = ToolProvider.getSystemJavaCompiler();
    if (this.compiler == null) {
      throw new StateException("No Java compiler available; the sandbox requires a full JDK.");
    }
    this.standardFileManager = compiler.getStandardFileManager(null, Locale.ROOT, StandardCharsets.UTF_8);
  }

  /** One import declaration as written, e.g. {@code java.util.*} or static {@code java.lang.Math.max}. */
  public record ImportDeclaration(boolean isStatic, String name) {
    public boolean isOnDemand() {
      return name.endsWith(".*");
    }

    /** Name without a trailing {@code .*}. */
    public String target() {
      return isOnDemand() ? name.substring(0, name.length() - 2) : name;
    }

    @Override
    public String toString() {
      return (isStatic ? "static " : "") + name;
    }
  }

  public record CompilationResult(
      boolean success, String className, Map<String, byte[]> classes, String errors) {}

  /** Parse {@code source} and list its imports. Syntax errors are left for {@link #compile}. */
  public List<ImportDeclaration> parseImports(String className, String source) {
    synchronized (standardFileManager) {
      try {
        DiagnosticCollector<JavaFileObject> diagnostics = new DiagnosticCollector<>();
        JavacTask task =
            (JavacTask)
                compiler.getTask(
                    null,
                    standardFileManager,
                    diagnostics,
                    OPTIONS,
                    null,
                    List.of(new InMemoryJavaFileObject(className, source)));
        List<ImportDeclaration> imports = new ArrayList<>();
        for (CompilationUnitTree unit : task.parse()) {
          for (ImportTree imp : unit.getImports()) {
            imports.add(new ImportDeclaration(imp.isStatic(), qualifiedName(imp.getQualifiedIdentifier())));
          }
        }
        return imports;
      } catch (IOException e) {
        throw new CompilationException("Failed to parse snippet", e);
      }
    }
  }

  public CompilationResult compile(String className, String source) {
    log.trace(
        "Will attempt to compile snippet:\n\tClassname: {}.\n{}",
        className,
        StringUtility.formatWithIndent(source, 4));
    synchronized (standardFileManager) {
      MemoryFileManager memoryFileManager = new MemoryFileManager(standardFileManager);
      try {
        DiagnosticCollector<JavaFileObject> diagnostics = new DiagnosticCollector<>();
        long start = System.currentTimeMillis();
        JavaCompiler.CompilationTask task =
            compiler.getTask(
                null,
                memoryFileManager,
                diagnostics,
                OPTIONS,
                null,
                List.of(new InMemoryJavaFileObject(className, source)));
        boolean success = task.call();
        log.trace(
            "Compilation task completed {} in ({}ms).",
            success ? "successfully" : "unsuccessfully",
            System.currentTimeMillis() - start);

        if (!success) {
          StringBuilder errors = new StringBuilder("Compilation failed:\n");
          for (Diagnostic<? extends JavaFileObject> d : diagnostics.getDiagnostics()) {
            if (d.getKind() != Diagnostic.Kind.ERROR) continue;
            errors
                .append("  line ")
                .append(d.getLineNumber())
                .append(": ")
                .append(d.getMessage(Locale.ROOT))
                .append('\n');
          }
          return new CompilationResult(false, className, Map.of(), errors.toString().trim());
        }
        return new CompilationResult(true, className, memoryFileManager.getAllClassBytes(), null);
      } catch (RuntimeException e) {
        throw new CompilationException("Failed to compile snippet", e);
      } finally {
        memoryFileManager.close();
      }
    }
  }

  private static String qualifiedName(Tree tree) {
    if (tree instanceof MemberSelectTree select) {
      return qualifiedName(select.getExpression()) + "." + select.getIdentifier();
    }
    return tree.toString();
  }
}
