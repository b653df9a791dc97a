package com.magsasa.runtimeintel.datamodel;

import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Common shape of detector anomalies and externally raised alerts once they enter the
 * suppression, routing and delivery stages.
 */
@Value
@Builder(toBuilder = true)
public class AlertEvent {
  public static final String DETECTOR_SOURCE_PREFIX = "detector:";

  String fingerprint;
  String eventId;
  String name;
  AlertStatus status;
  Severity severity;
  String service;
  String team;
  String summary;
  String description;
  String source;
  Map<String, String> labels;
  Map<String, String> annotations;
  Double observedValue;
  Double baselineValue;
  Instant startedAt;
  Instant resolvedAt;

  public boolean isResolved() {
    return status == AlertStatus.RESOLVED;
  }

  public boolean isFromDetector() {
    return source != null && source.startsWith(DETECTOR_SOURCE_PREFIX);
  }

  public enum AlertStatus {
    FIRING,
    RESOLVED
  }
}
