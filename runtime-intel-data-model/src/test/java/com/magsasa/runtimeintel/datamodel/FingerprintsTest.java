package com.magsasa.runtimeintel.datamodel;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FingerprintsTest {

  @Test
  void testLabelOrderDoesNotChangeFingerprint() {
    Map<String, String> first = new LinkedHashMap<>();
    first.put("service", "payments");
    first.put("instance", "pod-1");
    Map<String, String> second = new LinkedHashMap<>();
    second.put("instance", "pod-1");
    second.put("service", "payments");

    assertEquals(
        Fingerprints.of("HighLatency", first), Fingerprints.of("HighLatency", second));
    assertEquals(32, Fingerprints.of("HighLatency", first).length());
  }

  @Test
  void testSeverityLabelIsIgnored() {
    assertEquals(
        Fingerprints.of("HighLatency", Map.of("service", "payments", "severity", "warning")),
        Fingerprints.of("HighLatency", Map.of("service", "payments", "severity", "critical")));
  }

  @Test
  void testIdentityAndLabelValuesDistinguishFingerprints() {
    String base = Fingerprints.of("HighLatency", Map.of("service", "payments"));
    assertNotEquals(base, Fingerprints.of("HighErrorRate", Map.of("service", "payments")));
    assertNotEquals(base, Fingerprints.of("HighLatency", Map.of("service", "checkout")));
    assertNotEquals(base, Fingerprints.of("HighLatency", Map.of()));
  }

  @Test
  void testSeriesKeyIgnoresLabelOrder() {
    Map<String, String> labels = new LinkedHashMap<>();
    labels.put("b", "2");
    labels.put("a", "1");
    SeriesKey key = SeriesKey.of("latency", labels);

    assertEquals(SeriesKey.of("latency", Map.of("a", "1", "b", "2")), key);
    assertEquals("a", key.getLabels().firstKey());
    assertEquals(key.shard(8), SeriesKey.of("latency", Map.of("a", "1", "b", "2")).shard(8));
  }
}
