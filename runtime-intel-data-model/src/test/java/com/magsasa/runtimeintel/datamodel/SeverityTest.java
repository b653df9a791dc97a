package com.magsasa.runtimeintel.datamodel;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import org.junit.jupiter.api.Test;

class SeverityTest {

  @Test
  void testParseAliasesAndUnknownValues() {
    assertEquals(Severity.CRITICAL, Severity.parse("critical"));
    assertEquals(Severity.CRITICAL, Severity.parse("HIGH"));
    assertEquals(Severity.CRITICAL, Severity.parse(" error "));
    assertEquals(Severity.INFO, Severity.parse("info"));
    assertEquals(Severity.WARNING, Severity.parse("warning"));
    assertEquals(Severity.WARNING, Severity.parse("sev-9000"));
    assertEquals(Severity.WARNING, Severity.parse(null));
  }

  @Test
  void testParseStrictRejectsUnknownValues() {
    assertEquals(Severity.WARNING, Severity.parseStrict("warning"));
    assertThrows(ConfigurationException.class, () -> Severity.parseStrict("sev-9000"));
  }

  @Test
  void testOrdering() {
    assertTrue(Severity.CRITICAL.isAtLeast(Severity.WARNING));
    assertTrue(Severity.WARNING.isAtLeast(Severity.WARNING));
    assertFalse(Severity.INFO.isAtLeast(Severity.WARNING));
    assertEquals("critical", Severity.CRITICAL.label());
  }

  @Test
  void testEpochSecondsKeepMillisecondPrecision() {
    assertEquals(
        Instant.ofEpochMilli(1_700_000_000_123L), MetricSample.fromEpochSeconds(1_700_000_000.123));
  }
}
