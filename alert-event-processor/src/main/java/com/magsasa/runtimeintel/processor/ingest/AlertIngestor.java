package com.magsasa.runtimeintel.processor.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import com.magsasa.runtimeintel.datamodel.AlertEvent;
import com.magsasa.runtimeintel.datamodel.AlertEvent.AlertStatus;
import com.magsasa.runtimeintel.datamodel.AnomalyEvent;
import com.magsasa.runtimeintel.datamodel.Fingerprints;
import com.magsasa.runtimeintel.datamodel.Severity;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Normalizes Alertmanager style webhook payloads and detector anomalies into {@link AlertEvent}s.
 * Both a single alert and the {@code {"alerts": [...]}} envelope are accepted.
 */
public class AlertIngestor {

  private static final Logger LOGGER = LoggerFactory.getLogger(AlertIngestor.class);

  static final String ALERTS = "alerts";
  static final String ALERT_NAME = "alertname";
  static final String STATUS = "status";
  static final String LABELS = "labels";
  static final String ANNOTATIONS = "annotations";
  static final String STARTS_AT = "startsAt";
  static final String ENDS_AT = "endsAt";
  static final String SEVERITY_LABEL = "severity";
  static final String SERVICE_LABEL = "service";
  static final String TEAM_LABEL = "team";
  static final String SUMMARY_ANNOTATION = "summary";
  static final String DESCRIPTION_ANNOTATION = "description";
  static final String CURRENT_VALUE_ANNOTATION = "current_value";
  static final String BASELINE_VALUE_ANNOTATION = "baseline_value";
  static final String UNKNOWN = "unknown";
  static final String WEBHOOK_SOURCE = "webhook";
  // Alertmanager sends the zero time for alerts that have not ended
  private static final int NO_END_YEAR = 1;

  private final Clock clock;

  public AlertIngestor(Clock clock) {
    this.clock = clock;
  }

  /**
   * Normalizes every alert of the payload. Malformed alerts inside an envelope are logged and
   * skipped; the payload is rejected as a whole only when nothing in it could be used.
   *
   * @return the accepted events and the rejection reasons of skipped alerts
   */
  public IngestResult ingest(JsonNode payload) {
    if (payload == null || !payload.isObject()) {
      throw new AlertIngestionException("alert payload must be a JSON object");
    }
    List<JsonNode> alerts = new ArrayList<>();
    if (payload.has(ALERTS)) {
      JsonNode alertsNode = payload.get(ALERTS);
      if (!alertsNode.isArray()) {
        throw new AlertIngestionException("alerts must be an array");
      }
      alertsNode.forEach(alerts::add);
    } else {
      alerts.add(payload);
    }

    List<AlertEvent> events = new ArrayList<>();
    List<String> rejections = new ArrayList<>();
    for (JsonNode alert : alerts) {
      try {
        events.add(normalize(alert));
      } catch (AlertIngestionException e) {
        LOGGER.warn("Rejected alert {}: {}", alert, e.getMessage());
        rejections.add(e.getMessage());
      }
    }
    if (events.isEmpty() && !rejections.isEmpty()) {
      throw new AlertIngestionException(rejections.get(0));
    }
    return new IngestResult(events, rejections);
  }

  public AlertEvent normalize(JsonNode alert) {
    if (alert == null || !alert.isObject()) {
      throw new AlertIngestionException("alert must be a JSON object");
    }
    Map<String, String> labels = readStringMap(alert.get(LABELS), LABELS);
    Map<String, String> annotations = readStringMap(alert.get(ANNOTATIONS), ANNOTATIONS);

    String alertName =
        alert.hasNonNull(ALERT_NAME) ? alert.get(ALERT_NAME).asText() : labels.get(ALERT_NAME);
    if (alertName == null || alertName.isBlank()) {
      throw new AlertIngestionException("missing alertname");
    }
    AlertStatus status = parseStatus(alert.get(STATUS));
    Instant now = clock.instant();
    Instant startedAt = parseTime(alert.get(STARTS_AT), STARTS_AT);
    Instant endsAt = parseTime(alert.get(ENDS_AT), ENDS_AT);
    Instant resolvedAt = null;
    if (status == AlertStatus.RESOLVED) {
      resolvedAt = endsAt != null ? endsAt : now;
    }

    return AlertEvent.builder()
        .fingerprint(Fingerprints.of(alertName, labels))
        .eventId(UUID.randomUUID().toString())
        .name(alertName)
        .status(status)
        .severity(Severity.parse(labels.get(SEVERITY_LABEL)))
        .service(labels.getOrDefault(SERVICE_LABEL, UNKNOWN))
        .team(labels.getOrDefault(TEAM_LABEL, UNKNOWN))
        .summary(
            annotations.getOrDefault(
                SUMMARY_ANNOTATION, annotations.getOrDefault(DESCRIPTION_ANNOTATION, alertName)))
        .description(annotations.get(DESCRIPTION_ANNOTATION))
        .source(WEBHOOK_SOURCE)
        .labels(Collections.unmodifiableMap(labels))
        .annotations(Collections.unmodifiableMap(annotations))
        .observedValue(parseOptionalDouble(annotations.get(CURRENT_VALUE_ANNOTATION)))
        .baselineValue(parseOptionalDouble(annotations.get(BASELINE_VALUE_ANNOTATION)))
        .startedAt(startedAt != null ? startedAt : now)
        .resolvedAt(resolvedAt)
        .build();
  }

  /** Converts a detector anomaly into a firing alert keyed by its series identity. */
  public AlertEvent fromAnomaly(AnomalyEvent anomaly) {
    Map<String, String> labels = anomaly.getLabels() == null ? Map.of() : anomaly.getLabels();
    String summary =
        String.format(
            Locale.ROOT,
            "%s: %s observed %.2f against baseline %.2f (score %.2f)",
            anomaly.getDetectorName(),
            anomaly.getMetricId(),
            anomaly.getObservedValue(),
            anomaly.getBaselineValue(),
            anomaly.getDeviationScore());
    return AlertEvent.builder()
        .fingerprint(Fingerprints.of(anomaly.getMetricId(), labels))
        .eventId(anomaly.getEventId())
        .name(anomaly.getMetricId())
        .status(AlertStatus.FIRING)
        .severity(anomaly.getSeverity())
        .service(labels.getOrDefault(SERVICE_LABEL, UNKNOWN))
        .team(labels.getOrDefault(TEAM_LABEL, UNKNOWN))
        .summary(summary)
        .source(AlertEvent.DETECTOR_SOURCE_PREFIX + anomaly.getDetectorName())
        .labels(labels)
        .annotations(Map.of())
        .observedValue(anomaly.getObservedValue())
        .baselineValue(anomaly.getBaselineValue())
        .startedAt(anomaly.getDetectedAt())
        .build();
  }

  private static AlertStatus parseStatus(JsonNode statusNode) {
    if (statusNode == null || statusNode.isNull()) {
      return AlertStatus.FIRING;
    }
    switch (statusNode.asText().toLowerCase(Locale.ROOT)) {
      case "firing":
        return AlertStatus.FIRING;
      case "resolved":
        return AlertStatus.RESOLVED;
      default:
        throw new AlertIngestionException("unknown status " + statusNode.asText());
    }
  }

  private static Instant parseTime(JsonNode timeNode, String field) {
    if (timeNode == null || timeNode.isNull() || timeNode.asText().isEmpty()) {
      return null;
    }
    Instant parsed;
    try {
      parsed = Instant.parse(timeNode.asText());
    } catch (DateTimeParseException e) {
      throw new AlertIngestionException("unparseable " + field + " " + timeNode.asText());
    }
    return parsed.atZone(ZoneOffset.UTC).getYear() <= NO_END_YEAR ? null : parsed;
  }

  private static Map<String, String> readStringMap(JsonNode node, String field) {
    Map<String, String> values = new LinkedHashMap<>();
    if (node == null || node.isNull()) {
      return values;
    }
    if (!node.isObject()) {
      throw new AlertIngestionException(field + " must be an object");
    }
    Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> entry = fields.next();
      values.put(entry.getKey(), entry.getValue().asText());
    }
    return values;
  }

  private static Double parseOptionalDouble(String value) {
    if (value == null) {
      return null;
    }
    try {
      return Double.valueOf(value.trim());
    } catch (NumberFormatException e) {
      LOGGER.debug("Ignoring non numeric annotation value {}", value);
      return null;
    }
  }

  public static class IngestResult {
    private final List<AlertEvent> events;
    private final List<String> rejections;

    IngestResult(List<AlertEvent> events, List<String> rejections) {
      this.events = events;
      this.rejections = rejections;
    }

    public List<AlertEvent> getEvents() {
      return events;
    }

    public List<String> getRejections() {
      return rejections;
    }
  }
}
