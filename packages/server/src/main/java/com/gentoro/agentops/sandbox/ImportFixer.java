package com.gentoro.agentops.sandbox;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Adds imports for commonly used sandbox types that snippet authors (language models mostly)
 * forget to declare. Only types the default {@link SandboxPolicy} allows are ever added.
 */
public class ImportFixer {

  private static final Map<String, String> COMMON_IMPORTS =
      Map.ofEntries(
          // Collections
          Map.entry("List", "java.util.List"),
          Map.entry("ArrayList", "java.util.ArrayList"),
          Map.entry("Map", "java.util.Map"),
          Map.entry("HashMap", "java.util.HashMap"),
          Map.entry("LinkedHashMap", "java.util.LinkedHashMap"),
          Map.entry("TreeMap", "java.util.TreeMap"),
          Map.entry("Set", "java.util.Set"),
          Map.entry("HashSet", "java.util.HashSet"),
          Map.entry("TreeSet", "java.util.TreeSet"),
          Map.entry("Arrays", "java.util.Arrays"),
          Map.entry("Collections", "java.util.Collections"),
          Map.entry("Comparator", "java.util.Comparator"),
          Map.entry("Objects", "java.util.Objects"),
          Map.entry("Optional", "java.util.Optional"),
          Map.entry("Collectors", "java.util.stream.Collectors"),
          Map.entry("Stream", "java.util.stream.Stream"),
          Map.entry("IntStream", "java.util.stream.IntStream"),

          // Numbers and dates
          Map.entry("BigDecimal", "java.math.BigDecimal"),
          Map.entry("BigInteger", "java.math.BigInteger"),
          Map.entry("RoundingMode", "java.math.RoundingMode"),
          Map.entry("LocalDate", "java.time.LocalDate"),
          Map.entry("LocalDateTime", "java.time.LocalDateTime"),
          Map.entry("Duration", "java.time.Duration"),
          Map.entry("DateTimeFormatter", "java.time.format.DateTimeFormatter"),
          Map.entry("ChronoUnit", "java.time.temporal.ChronoUnit"),
          Map.entry("Pattern", "java.util.regex.Pattern"),
          Map.entry("Matcher", "java.util.regex.Matcher"),

          // Jackson
          Map.entry("JsonNode", "com.fasterxml.jackson.databind.JsonNode"),
          Map.entry("ArrayNode", "com.fasterxml.jackson.databind.node.ArrayNode"),
          Map.entry("ObjectNode", "com.fasterxml.jackson.databind.node.ObjectNode"));

  private static final Pattern IMPORT = Pattern.compile("import\\s+(static\\s+)?([\\w.]+)(\\.\\*)?\\s*;");
  private static final Pattern TYPE_TOKEN = Pattern.compile("\\b([A-Z][A-Za-z0-9_]*)\\b");

  private ImportFixer() {}

  /**
   * Import declarations missing from {@code imports} for types referenced in {@code body}.
   *
   * @param imports the snippet's own import block (may be empty)
   * @param body the snippet's statements
   * @return {@code import ...;} lines to add, sorted
   */
  public static List<String> missingImports(String imports, String body) {
    Set<String> importedSimpleNames = new HashSet<>();
    Set<String> wildcardPackages = new HashSet<>();
    Matcher importMatcher = IMPORT.matcher(imports == null ? "" : imports);
    while (importMatcher.find()) {
      String name = importMatcher.group(2);
      if (importMatcher.group(3) != null) {
        wildcardPackages.add(name);
      } else {
        importedSimpleNames.add(name.substring(name.lastIndexOf('.') + 1));
      }
    }

    Set<String> usedTypes = new HashSet<>();
    Matcher typeMatcher = TYPE_TOKEN.matcher(body == null ? "" : body);
    while (typeMatcher.find()) {
      usedTypes.add(typeMatcher.group(1));
    }

    List<String> missing = new ArrayList<>();
    for (String type : usedTypes) {
      String fqn = COMMON_IMPORTS.get(type);
      if (fqn == null || importedSimpleNames.contains(type)) continue;
      if (wildcardPackages.contains(fqn.substring(0, fqn.lastIndexOf('.')))) continue;
      missing.add("import " + fqn + ";");
    }
    missing.sort(null);
    return missing;
  }
}
