package com.gentoro.agentops.sandbox;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class SandboxPolicyTest {

  private final SandboxPolicy policy = SandboxPolicy.defaults();

  @Test
  void allowsListedTypesAndPackages() {
    assertTrue(policy.isTypeAllowed("java.util.List"));
    assertTrue(policy.isTypeAllowed("java.util.Map.Entry"));
    assertTrue(policy.isTypeAllowed("java.util.Map$Entry"));
    assertTrue(policy.isTypeAllowed("java.time.format.DateTimeFormatter"));
    assertTrue(policy.isTypeAllowed("java.math.BigDecimal"));
  }

  @Test
  void refusesHostCapabilities() {
    assertFalse(policy.isTypeAllowed("java.lang.System"));
    assertFalse(policy.isTypeAllowed("java.lang.Class"));
    assertFalse(policy.isTypeAllowed("java.lang.Thread"));
    assertFalse(policy.isTypeAllowed("java.io.File"));
    assertFalse(policy.isTypeAllowed("java.lang.reflect.Method"));
    assertFalse(policy.isTypeAllowed("java.util.concurrent.Executors"));
    assertFalse(policy.isTypeAllowed(""));
  }

  @Test
  void refusesTypesWithJvmWideSetters() {
    assertFalse(policy.isTypeAllowed("java.util.Locale"));
    assertFalse(policy.isTypeAllowed("java.util.TimeZone"));
    assertFalse(policy.isTypeAllowed("java.time.zone.ZoneRulesProvider"));
    assertFalse(policy.isTypeAllowed("com.fasterxml.jackson.databind.ObjectMapper"));
    assertFalse(policy.isTypeAllowed("com.fasterxml.jackson.core.JsonProcessingException"));
    assertTrue(policy.isTypeAllowed("java.time.ZoneId"));
    assertTrue(policy.isTypeAllowed("com.fasterxml.jackson.databind.JsonNode"));
  }

  @Test
  void onDemandImports() {
    assertTrue(policy.isOnDemandImportAllowed("java.util.stream"));
    assertTrue(policy.isOnDemandImportAllowed("java.util"));
    assertFalse(policy.isOnDemandImportAllowed("java.io"));
    assertFalse(policy.isOnDemandImportAllowed("java.util.concurrent"));
  }

  @Test
  void linkOnlyTypesCannotBeImported() {
    assertTrue(policy.isLinkable("java.lang.invoke.StringConcatFactory"));
    assertFalse(policy.isTypeAllowed("java.lang.invoke.StringConcatFactory"));
  }

  @Test
  void packageOfStopsAtFirstTypeSegment() {
    assertEquals("java.util", SandboxPolicy.packageOf("java.util.Map.Entry"));
    assertEquals("java.util.stream", SandboxPolicy.packageOf("java.util.stream"));
  }
}
