package com.gentoro.agentops.utility;

import java.util.Arrays;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

public class StringUtility {

  public static String formatWithIndent(String input, int indent) {
    return formatWithIndent(input, indent, 1000);
  }

  public static String formatWithIndent(String input, int indent, int limit) {
    if (input == null) return "";
    if (indent < 0) indent = 0;

    String spaces = " ".repeat(indent);
    String formatted = input.replaceAll("\\r\\n?", "\n").trim();

    String[] lines = formatted.split("\n");
    if (limit > -1 && lines.length > limit) {
      return Arrays.stream(lines).map(line -> spaces + line).limit(limit)
              .collect(Collectors.joining("\n"))
          + " ...";
    } else {
      return Arrays.stream(lines).map(line -> spaces + line).collect(Collectors.joining("\n"));
    }
  }

  /**
   * Extract the body of the first fenced block of the given type (e.g. {@code ```json ... ```}).
   * Returns null when there is no such block.
   */
  public static String extractSnippet(String text, String type) {
    if (text == null || text.isEmpty()) {
      return null;
    }

    String regex = "(?s)```%s\\s*(.+?)\\s*```".formatted(Pattern.quote(type));
    Matcher matcher = Pattern.compile(regex).matcher(text);

    if (matcher.find()) {
      return matcher.group(1).trim();
    }

    return null;
  }

  /** Cut {@code input} to at most {@code max} characters, appending "..." when something was cut. */
  public static String truncate(String input, int max) {
    if (input == null) return "";
    if (max <= 0 || input.length() <= max) return input;
    return input.substring(0, max) + "...";
  }
}
