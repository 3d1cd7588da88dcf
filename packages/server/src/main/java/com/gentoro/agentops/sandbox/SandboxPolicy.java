package com.gentoro.agentops.sandbox;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Types that sandboxed snippets may use.
 *
 * <p>The same policy is checked twice: against the snippet's import declarations before
 * compiling, and against every class the compiled snippet links to at run time (see {@link
 * SandboxClassLoader}). The second check is what stops fully qualified names and reflection, which
 * never show up as imports.
 *
 * <p>Names may be given in binary ({@code java.util.Map$Entry}) or canonical ({@code
 * java.util.Map.Entry}) form. A nested type is allowed when its top-level type is.
 */
public final class SandboxPolicy {

  private static final List<String> DEFAULT_TYPES =
      List.of(
          // java.lang, without Class, System, Runtime, Thread, ClassLoader, Process*, reflection
          "java.lang.Object",
          "java.lang.String",
          "java.lang.StringBuilder",
          "java.lang.CharSequence",
          "java.lang.Character",
          "java.lang.Boolean",
          "java.lang.Number",
          "java.lang.Byte",
          "java.lang.Short",
          "java.lang.Integer",
          "java.lang.Long",
          "java.lang.Float",
          "java.lang.Double",
          "java.lang.Math",
          "java.lang.StrictMath",
          "java.lang.Comparable",
          "java.lang.Iterable",
          "java.lang.Enum",
          "java.lang.Void",
          "java.lang.Throwable",
          "java.lang.Exception",
          "java.lang.RuntimeException",
          "java.lang.ArithmeticException",
          "java.lang.ClassCastException",
          "java.lang.IllegalArgumentException",
          "java.lang.IllegalStateException",
          "java.lang.IndexOutOfBoundsException",
          "java.lang.ArrayIndexOutOfBoundsException",
          "java.lang.StringIndexOutOfBoundsException",
          "java.lang.NullPointerException",
          "java.lang.NumberFormatException",
          "java.lang.UnsupportedOperationException",
          "java.lang.Override",
          "java.lang.FunctionalInterface",
          "java.lang.SuppressWarnings",
          "java.lang.SafeVarargs",
          "java.lang.Deprecated",
          // java.util, without Scanner, Timer, ServiceLoader, Properties, concurrency
          "java.util.Collection",
          "java.util.Collections",
          "java.util.List",
          "java.util.ArrayList",
          "java.util.LinkedList",
          "java.util.Map",
          "java.util.HashMap",
          "java.util.LinkedHashMap",
          "java.util.TreeMap",
          "java.util.SortedMap",
          "java.util.NavigableMap",
          "java.util.AbstractMap",
          "java.util.Set",
          "java.util.HashSet",
          "java.util.LinkedHashSet",
          "java.util.TreeSet",
          "java.util.SortedSet",
          "java.util.NavigableSet",
          "java.util.Queue",
          "java.util.Deque",
          "java.util.ArrayDeque",
          "java.util.PriorityQueue",
          "java.util.Iterator",
          "java.util.ListIterator",
          "java.util.Arrays",
          "java.util.Objects",
          "java.util.Optional",
          "java.util.OptionalInt",
          "java.util.OptionalLong",
          "java.util.OptionalDouble",
          "java.util.Comparator",
          "java.util.StringJoiner",
          "java.util.Random",
          "java.util.UUID",
          "java.util.BitSet",
          "java.util.IntSummaryStatistics",
          "java.util.LongSummaryStatistics",
          "java.util.DoubleSummaryStatistics",
          "java.util.NoSuchElementException",
          "java.util.ConcurrentModificationException",
          // Jackson tree model; parsing and writing go through SandboxSnippet helpers
          "com.fasterxml.jackson.databind.JsonNode",
          // snippet API
          SandboxSnippet.class.getName(),
          SandboxNamespace.class.getName());

  private static final List<String> DEFAULT_PACKAGES =
      List.of(
          "java.math",
          "java.time",
          "java.text",
          "java.util.function",
          "java.util.stream",
          "java.util.regex",
          "com.fasterxml.jackson.databind.node");

  /** Sub-packages of allowed packages that hold JVM-wide registries. */
  private static final List<String> EXCLUDED_PACKAGES = List.of("java.time.zone");

  /**
   * Classes javac emits references to on its own (string concatenation, lambdas, enum switches).
   * They are linkable but cannot be imported.
   */
  private static final List<String> LINK_ONLY_TYPES =
      List.of(
          "java.lang.invoke.StringConcatFactory",
          "java.lang.invoke.LambdaMetafactory",
          "java.lang.invoke.MethodHandles$Lookup",
          "java.lang.invoke.MethodHandle",
          "java.lang.invoke.MethodType",
          "java.lang.invoke.CallSite",
          "java.lang.NoSuchFieldError");

  private final Set<String> types;
  private final Set<String> packages;
  private final Set<String> linkOnlyTypes;

  public SandboxPolicy(Set<String> types, Set<String> packages) {
    this.types = Set.copyOf(types);
    this.packages = Set.copyOf(packages);
    this.linkOnlyTypes = Set.copyOf(LINK_ONLY_TYPES);
  }

  public static SandboxPolicy defaults() {
    return new SandboxPolicy(new LinkedHashSet<>(DEFAULT_TYPES), new LinkedHashSet<>(DEFAULT_PACKAGES));
  }

  Set<String> types() {
    return types;
  }

  Set<String> packages() {
    return packages;
  }

  /** Whether {@code name} may appear in a single-type import or as a static import's owner. */
  public boolean isTypeAllowed(String name) {
    if (name == null || name.isBlank()) return false;
    String canonical = name.replace('$', '.');
    if (types.contains(canonical)) return true;
    String topLevel = topLevelType(canonical);
    if (topLevel != null && types.contains(topLevel)) return true;
    return isPackageAllowed(packageOf(canonical));
  }

  /**
   * Whether an on-demand import ({@code import p.*;}) is acceptable: the package is allowed as a
   * whole, or contains allowed types. In the latter case the remaining types stay unreachable at
   * link time.
   */
  public boolean isOnDemandImportAllowed(String packageOrType) {
    if (isPackageAllowed(packageOrType) || isTypeAllowed(packageOrType)) return true;
    String prefix = packageOrType + ".";
    return types.stream()
        .anyMatch(t -> t.startsWith(prefix) && t.indexOf('.', prefix.length()) < 0);
  }

  /** Whether compiled snippet code may link to the class with binary name {@code binaryName}. */
  public boolean isLinkable(String binaryName) {
    return linkOnlyTypes.contains(binaryName) || isTypeAllowed(binaryName);
  }

  private boolean isPackageAllowed(String pkg) {
    if (pkg == null || pkg.isEmpty()) return false;
    for (String excluded : EXCLUDED_PACKAGES) {
      if (pkg.equals(excluded) || pkg.startsWith(excluded + ".")) return false;
    }
    for (String allowed : packages) {
      if (pkg.equals(allowed) || pkg.startsWith(allowed + ".")) return true;
    }
    return false;
  }

  /** Package part: the segments before the first one that starts with an upper-case letter. */
  static String packageOf(String canonical) {
    String[] parts = canonical.split("\\.");
    StringBuilder pkg = new StringBuilder();
    for (String part : parts) {
      if (!part.isEmpty() && Character.isUpperCase(part.charAt(0))) break;
      if (pkg.length() > 0) pkg.append('.');
      pkg.append(part);
    }
    return pkg.length() == canonical.length() ? canonical : pkg.toString();
  }

  private static String topLevelType(String canonical) {
    String pkg = packageOf(canonical);
    if (pkg.equals(canonical)) return null;
    String rest = canonical.substring(pkg.isEmpty() ? 0 : pkg.length() + 1);
    int dot = rest.indexOf('.');
    String top = dot < 0 ? rest : rest.substring(0, dot);
    return pkg.isEmpty() ? top : pkg + "." + top;
  }
}
