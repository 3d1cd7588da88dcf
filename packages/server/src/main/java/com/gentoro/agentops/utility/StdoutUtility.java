package com.gentoro.agentops.utility;

import com.gentoro.agentops.AgentOps;
import com.gentoro.agentops.exception.ExceptionUtil;

public class StdoutUtility {
  private static final String green = "\u001B[32m";
  private static final String red = "\u001B[31m";
  private static final String cyan = "\u001B[36m";
  private static final String reset = "\u001B[0m";

  public static void printRollingLine(AgentOps agentOps, String message) {
    if (isInteractive(agentOps)) {
      System.out.printf("\r%s", String.join("\\n", message.split("\n")));
    }
  }

  public static void printSpeakerLine(AgentOps agentOps, String speaker, String message) {
    if (isInteractive(agentOps)) {
      System.out.printf("\r%s[%s]%s%n", cyan, speaker, reset);
      System.out.println(StringUtility.formatWithIndent(message, 2));
    }
  }

  public static void printSuccessLine(AgentOps agentOps, String message) {
    if (isInteractive(agentOps)) {
      System.out.print("\r✅ ");
      for (String line : message.split("\n")) {
        System.out.printf("%s%s%s%n", green, line, reset);
      }
    }
  }

  public static void printNewLine(AgentOps agentOps, String message) {
    if (isInteractive(agentOps)) {
      System.out.printf("\r%s\n", message);
    }
  }

  public static void printError(AgentOps agentOps, String message, Throwable cause) {
    if (isInteractive(agentOps)) {
      System.out.printf("\r❌ %s%s%s%n", red, message, reset);
      if (cause != null) {
        for (String line : ExceptionUtil.formatCompactStackTrace(cause).split("\n")) {
          System.out.printf("  %s%s%s%n", red, line, reset);
        }
      }
    }
  }

  private static boolean isInteractive(AgentOps agentOps) {
    return agentOps != null && agentOps.isInteractiveModeEnabled();
  }
}
