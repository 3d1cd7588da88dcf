package com.gentoro.agentops;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class StartupParametersTest {

  @Test
  void defaults() {
    StartupParameters params = new StartupParameters(new String[0]);
    assertEquals("interactive", params.mode());
    assertEquals("classpath:application.yaml", params.configFile());
    assertTrue(params.query().isEmpty());
    assertFalse(params.isParameterPresent("query"));
  }

  @Test
  void queryMode() {
    StartupParameters params =
        new StartupParameters(
            new String[] {
              "--mode", "query", "--query", "How many customers?", "--config-file", "/tmp/a.yaml"
            });
    assertEquals("query", params.mode());
    assertEquals("How many customers?", params.query().orElseThrow());
    assertEquals("/tmp/a.yaml", params.configFile());
  }

  @Test
  void queryModeRequiresQuery() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new StartupParameters(new String[] {"--mode", "query"}));
    assertThrows(
        IllegalArgumentException.class,
        () -> new StartupParameters(new String[] {"--mode", "query", "--query", " "}));
  }

  @Test
  void invalidMode() {
    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () -> new StartupParameters(new String[] {"--mode", "batch"}));
    assertTrue(e.getMessage().contains("batch"));
  }

  @Test
  void bareHelpFlag() {
    assertEquals("help", new StartupParameters(new String[] {"--help"}).mode());
    assertEquals("help", new StartupParameters(new String[] {"--help", "--query", "x"}).mode());
  }

  @Test
  void flagWithoutValue() {
    StartupParameters params = new StartupParameters(new String[] {"--verbose", "--mode", "server"});
    assertTrue(params.isParameterPresent("verbose"));
    assertTrue(params.getOptionalParameter("verbose", String.class).isEmpty());
    assertEquals("server", params.mode());
  }

  @Test
  void apiModeNeedsNoQuery() {
    StartupParameters params = new StartupParameters(new String[] {"--mode", "api"});
    assertEquals("api", params.mode());
    assertTrue(params.query().isEmpty());
  }

  @Test
  void usageListsModes() {
    String usage = StartupParameters.usage();
    for (String mode : StartupParameters.MODES) {
      assertTrue(usage.contains(mode), mode);
    }
  }
}
