package com.magsasa.runtimeintel.datamodel;

import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/** Emitted by a detector when a sample deviates from its series baseline. */
@Value
@Builder
public class AnomalyEvent {
  String eventId;
  String metricId;
  Map<String, String> labels;
  DetectorKind detectorKind;
  String detectorName;
  double observedValue;
  double baselineValue;
  double deviationScore;
  Severity severity;
  Instant detectedAt;
  Instant windowStart;
  Instant windowEnd;
}
