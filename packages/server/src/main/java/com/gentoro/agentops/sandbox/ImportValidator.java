package com.gentoro.agentops.sandbox;

import com.gentoro.agentops.exception.SandboxValidationException;
import java.util.ArrayList;
import java.util.List;

/** Rejects snippet sources whose import declarations reach outside the {@link SandboxPolicy}. */
public class ImportValidator {
  private final SnippetCompiler compiler;
  private final SandboxPolicy policy;

  public ImportValidator(SnippetCompiler compiler, SandboxPolicy policy) {
    this.compiler = compiler;
    this.policy = policy;
  }

  /**
   * @throws SandboxValidationException listing every rejected import
   */
  public void validate(String className, String source) {
    List<String> rejected = new ArrayList<>();
    for (SnippetCompiler.ImportDeclaration imp : compiler.parseImports(className, source)) {
      if (!isAllowed(imp)) {
        rejected.add(imp.toString());
      }
    }
    if (!rejected.isEmpty()) {
      throw new SandboxValidationException(
          "Import(s) not allowed in sandboxed code: " + String.join(", ", rejected), rejected);
    }
  }

  private boolean isAllowed(SnippetCompiler.ImportDeclaration imp) {
    String target = imp.target();
    if (imp.isStatic()) {
      // static imports name a member (or * of members) of a type
      String owner = imp.isOnDemand() ? target : target.substring(0, Math.max(target.lastIndexOf('.'), 0));
      return policy.isTypeAllowed(owner);
    }
    return imp.isOnDemand() ? policy.isOnDemandImportAllowed(target) : policy.isTypeAllowed(target);
  }
}
