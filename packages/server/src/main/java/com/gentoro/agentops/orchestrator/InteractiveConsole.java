package com.gentoro.agentops.orchestrator;

import com.gentoro.agentops.AgentOps;
import com.gentoro.agentops.utility.StdoutUtility;
import java.io.InputStream;
import java.util.Scanner;

/** Read-eval loop over stdin: every line is a query, {@code exit} quits. */
public class InteractiveConsole {
  private static final org.slf4j.Logger log =
      com.gentoro.agentops.logging.LoggingService.getLogger(InteractiveConsole.class);

  private final AgentOps agentOps;
  private final Orchestrator orchestrator;
  private final InputStream input;

  public InteractiveConsole(AgentOps agentOps, Orchestrator orchestrator) {
    this(agentOps, orchestrator, System.in);
  }

  public InteractiveConsole(AgentOps agentOps, Orchestrator orchestrator, InputStream input) {
    this.agentOps = agentOps;
    this.orchestrator = orchestrator;
    this.input = input;
  }

  /** Blocks until {@code exit} or end of input. */
  public void run() {
    Scanner scanner = new Scanner(input);
    System.out.println("Ask a question (or 'exit' to quit):");
    while (true) {
      System.out.print("> ");
      if (!scanner.hasNextLine()) {
        break;
      }
      String line = scanner.nextLine().trim();
      if (line.equalsIgnoreCase("exit")) {
        System.out.println("Goodbye!");
        break;
      }
      if (line.isEmpty()) {
        continue;
      }
      try {
        print(orchestrator.execute(line));
      } catch (Exception e) {
        log.error("Error handling query", e);
        StdoutUtility.printError(agentOps, "Could not handle the query", e);
      }
    }
  }

  void print(OrchestrationResult result) {
    for (OrchestrationResult.Entry entry : result.conversation()) {
      if (Message.USER.equals(entry.speaker())) {
        continue;
      }
      StdoutUtility.printSpeakerLine(agentOps, entry.speaker(), entry.content());
    }
    if (result.succeeded() && !result.finalAnswer().isEmpty()) {
      StdoutUtility.printSuccessLine(agentOps, result.finalAnswer());
    } else if (!result.succeeded()) {
      StdoutUtility.printError(
          agentOps, "Conversation ended early: " + result.terminationReason(), null);
    }
    StdoutUtility.printNewLine(
        agentOps, "Participants: " + String.join(", ", result.participants()));
  }
}
