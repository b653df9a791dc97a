package com.magsasa.runtimeintel.annotation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.magsasa.runtimeintel.annotation.grafana.GrafanaAnnotationClient;
import com.magsasa.runtimeintel.datamodel.AlertEvent;
import com.magsasa.runtimeintel.datamodel.AlertEvent.AlertStatus;
import com.magsasa.runtimeintel.datamodel.Notification;
import com.magsasa.runtimeintel.datamodel.Notification.Transition;
import com.magsasa.runtimeintel.datamodel.Severity;
import com.magsasa.runtimeintel.notification.transport.webhook.ObjectMapperProvider;
import com.magsasa.runtimeintel.notification.transport.webhook.http.HttpWithJsonSender;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DashboardAnnotatorTest {
  private static final Instant OPENED_AT = Instant.parse("2024-03-01T12:00:00Z");

  private MockWebServer grafana;
  private SimpleMeterRegistry meterRegistry;
  private DashboardAnnotator annotator;

  @BeforeEach
  void setUp() throws IOException {
    grafana = new MockWebServer();
    grafana.start();
    meterRegistry = new SimpleMeterRegistry();
    DashboardMappings mappings =
        new DashboardMappings(
            List.of(new PanelMapping(Pattern.compile("^api\\.latency$"), "api", 7L, 3)),
            "http://grafana");
    GrafanaAnnotationClient client =
        new GrafanaAnnotationClient(
            HttpWithJsonSender.getInstance(), grafana.url("/").toString(), "secret-key");
    annotator =
        new DashboardAnnotator(
            mappings, client, meterRegistry, Clock.fixed(OPENED_AT, ZoneOffset.UTC));
  }

  @AfterEach
  void tearDown() throws IOException {
    grafana.shutdown();
  }

  @Test
  void testOpenThenResolveProducesTenMinuteRegion() throws Exception {
    grafana.enqueue(created(41));
    grafana.enqueue(new MockResponse().setResponseCode(200));

    Optional<Annotation> opened = annotator.annotate(notification(Transition.OPEN, null));
    assertTrue(opened.isPresent());
    assertEquals(41L, opened.get().getRemoteId());
    assertTrue(opened.get().isOpen());

    Optional<Annotation> closed =
        annotator.annotate(notification(Transition.RESOLVED, OPENED_AT.plusSeconds(600)));
    assertTrue(closed.isPresent());
    assertEquals(OPENED_AT, closed.get().getStartTime());
    assertEquals(OPENED_AT.plusSeconds(600), closed.get().getEndTime());
    assertEquals(Duration.ofMinutes(10), closed.get().getDuration());
    assertTrue(closed.get().isRegion());
    assertEquals(0, annotator.getOpenAnnotationCount());

    RecordedRequest create = grafana.takeRequest(1, TimeUnit.SECONDS);
    assertEquals("POST", create.getMethod());
    assertEquals("/api/annotations", create.getPath());
    assertEquals("Bearer secret-key", create.getHeader("Authorization"));
    JsonNode createBody = body(create);
    assertEquals("api", createBody.get("dashboardUID").asText());
    assertEquals(3, createBody.get("panelId").asLong());
    assertEquals(OPENED_AT.toEpochMilli(), createBody.get("time").asLong());
    assertFalse(createBody.has("timeEnd"));
    assertEquals(
        List.of("anomaly", "severity-critical", "metric-api.latency", "runtime-intelligence"),
        ObjectMapperProvider.get().convertValue(createBody.get("tags"), List.class));

    RecordedRequest update = grafana.takeRequest(1, TimeUnit.SECONDS);
    assertEquals("PATCH", update.getMethod());
    assertEquals("/api/annotations/41", update.getPath());
    assertEquals(OPENED_AT.plusSeconds(600).toEpochMilli(), body(update).get("timeEnd").asLong());
  }

  @Test
  void testRepeatedOpenCreatesNothing() throws Exception {
    grafana.enqueue(created(5));

    annotator.annotate(notification(Transition.OPEN, null));
    assertTrue(annotator.annotate(notification(Transition.OPEN, null)).isEmpty());

    assertEquals(1, grafana.getRequestCount());
    assertEquals(1, annotator.getOpenAnnotationCount());
  }

  @Test
  void testResolutionWithoutOpenAnnotationCreatesPoint() throws Exception {
    grafana.enqueue(created(8));
    grafana.enqueue(created(9));
    Instant resolvedAt = OPENED_AT.plusSeconds(300);

    Optional<Annotation> first = annotator.annotate(notification(Transition.RESOLVED, resolvedAt));
    Optional<Annotation> replay =
        annotator.annotate(notification(Transition.RESOLVED, resolvedAt));

    assertTrue(first.isPresent());
    assertEquals(resolvedAt, first.get().getStartTime());
    assertEquals(resolvedAt, first.get().getEndTime());
    assertFalse(first.get().isRegion());
    assertEquals(9L, replay.get().getRemoteId());
    assertEquals(0, annotator.getOpenAnnotationCount());
    assertEquals("POST", grafana.takeRequest().getMethod());
    assertEquals("POST", grafana.takeRequest().getMethod());
  }

  @Test
  void testFailedWriteIsCountedAndNotThrown() {
    grafana.enqueue(new MockResponse().setResponseCode(500).setBody("boom"));
    grafana.enqueue(created(12));

    assertTrue(annotator.annotate(notification(Transition.OPEN, null)).isEmpty());
    assertEquals(1, annotator.getFailureCount());
    assertEquals(
        1.0,
        meterRegistry
            .get(DashboardAnnotator.WRITE_COUNTER)
            .tags("action", "create", "result", "failed")
            .counter()
            .count());

    // the resolution still lands as a point annotation
    Optional<Annotation> point =
        annotator.annotate(notification(Transition.RESOLVED, OPENED_AT.plusSeconds(60)));
    assertTrue(point.isPresent());
    assertNull(annotator.findOpen("fp-1").orElse(null));
  }

  @Test
  void testUnmappedEventsAndDigestsAreIgnored() {
    Notification unmapped =
        notification(Transition.OPEN, null).toBuilder()
            .alert(alert(null).toBuilder().name("db.connections").build())
            .build();

    assertTrue(annotator.annotate(unmapped).isEmpty());
    assertTrue(annotator.annotate(notification(Transition.DIGEST, null)).isEmpty());
    assertEquals(0, grafana.getRequestCount());
  }

  @Test
  void testEvictOpenAnnotations() {
    grafana.enqueue(created(3));
    annotator.annotate(notification(Transition.OPEN, null));

    assertEquals(0, annotator.evictOpenAnnotations(OPENED_AT));
    assertEquals(1, annotator.evictOpenAnnotations(OPENED_AT.plusSeconds(1)));
    assertEquals(0, annotator.getOpenAnnotationCount());
  }

  @Test
  void testAlertText() {
    AlertEvent webhookAlert =
        alert(null).toBuilder()
            .source("webhook")
            .name("HighLatency")
            .summary("p99 above 2s")
            .description("checkout is slow")
            .baselineValue(null)
            .build();

    assertEquals(
        "p99 above 2s\nService: payments\nSeverity: critical\ncheckout is slow\nCurrent: 2.400",
        DashboardAnnotator.text(webhookAlert));
    assertEquals(
        List.of(
            "alert",
            "severity-critical",
            "alert-HighLatency",
            "service-payments",
            "runtime-intelligence"),
        DashboardAnnotator.tags(webhookAlert));
  }

  private static MockResponse created(long id) {
    return new MockResponse()
        .setResponseCode(200)
        .setBody("{\"message\":\"Annotation added\",\"id\":" + id + "}");
  }

  private static JsonNode body(RecordedRequest request) throws IOException {
    return ObjectMapperProvider.get().readTree(request.getBody().readUtf8());
  }

  private static Notification notification(Transition transition, Instant resolvedAt) {
    return Notification.builder()
        .alert(alert(resolvedAt))
        .transition(transition)
        .occurrenceCount(1)
        .routeName("default")
        .channels(List.of())
        .links(Map.of())
        .createdAt(OPENED_AT)
        .build();
  }

  private static AlertEvent alert(Instant resolvedAt) {
    return AlertEvent.builder()
        .fingerprint("fp-1")
        .eventId("evt-1")
        .name("api.latency")
        .status(resolvedAt == null ? AlertStatus.FIRING : AlertStatus.RESOLVED)
        .severity(Severity.CRITICAL)
        .service("payments")
        .team("core")
        .summary("api.latency anomaly")
        .source(AlertEvent.DETECTOR_SOURCE_PREFIX + "latency-ewma")
        .labels(Map.of())
        .observedValue(2.4)
        .baselineValue(0.8)
        .startedAt(OPENED_AT)
        .resolvedAt(resolvedAt)
        .build();
  }
}
