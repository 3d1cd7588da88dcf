package com.gentoro.agentops;

public class AgentOpsApp {

  private static final org.slf4j.Logger log =
      com.gentoro.agentops.logging.LoggingService.getLogger(AgentOpsApp.class);

  public static void main(String[] args) {
    AgentOps app;
    try {
      app = new AgentOps(args);
    } catch (IllegalArgumentException e) {
      System.err.println(e.getMessage());
      System.err.println(StartupParameters.usage());
      System.exit(2);
      return;
    }
    try {
      app.initialize();
      String mode = app.startupParameters().mode();
      if ("server".equals(mode) || "api".equals(mode)) {
        app.waitShutdownSignal();
      }
    } catch (Exception e) {
      log.error("Application failed to start", e);
      app.shutdown();
      System.exit(1);
    }
  }
}
