package com.magsasa.runtimeintel.annotation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.magsasa.runtimeintel.datamodel.AlertEvent;
import com.magsasa.runtimeintel.datamodel.ConfigurationException;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class DashboardMappingsTest {

  private static final Config ANNOTATION_CONFIG =
      ConfigFactory.parseString(
          "mappings = ["
              + "{ pattern = \"^api\\\\.latency\", dashboard-uid = perf, panel-id = 4 },"
              + "{ pattern = \"Latency\", dashboard-uid = overview, dashboard-id = 2,"
              + " panel-id = 1 }"
              + "]");

  @Test
  void testFirstMatchingMappingWins() {
    DashboardMappings mappings =
        DashboardMappings.fromConfig(ANNOTATION_CONFIG, "http://grafana:3000/");

    assertEquals(2, mappings.size());
    assertEquals("perf", mappings.find(event("api.latency.p99")).get().getDashboardUid());
    PanelMapping overview = mappings.find(event("HighLatency")).get();
    assertEquals("overview", overview.getDashboardUid());
    assertEquals(2L, overview.getDashboardId());
    assertTrue(mappings.find(event("cpu.usage")).isEmpty());
  }

  @Test
  void testDashboardLinkCoversIncident() {
    DashboardMappings mappings =
        DashboardMappings.fromConfig(ANNOTATION_CONFIG, "http://grafana:3000/");
    Instant start = Instant.parse("2024-03-01T12:00:00Z");

    assertEquals(
        "http://grafana:3000/d/perf?viewPanel=4&from="
            + start.minusSeconds(1800).toEpochMilli()
            + "&to="
            + start.plusSeconds(1800).toEpochMilli(),
        mappings
            .dashboardLink(AlertEvent.builder().name("api.latency").startedAt(start).build())
            .get());
    assertEquals(
        "http://grafana:3000/d/perf?viewPanel=4",
        mappings.dashboardLink(event("api.latency")).get());
  }

  @Test
  void testInvalidPatternIsRejected() {
    Config invalid =
        ConfigFactory.parseString(
            "mappings = [{ pattern = \"(\", dashboard-uid = x, panel-id = 1 }]");

    assertThrows(
        ConfigurationException.class, () -> DashboardMappings.fromConfig(invalid, "http://g"));
    assertEquals(0, DashboardMappings.fromConfig(ConfigFactory.empty(), "http://g").size());
  }

  private static AlertEvent event(String name) {
    return AlertEvent.builder().name(name).build();
  }
}
