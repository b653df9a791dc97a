package com.magsasa.runtimeintel.annotation;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Dashboard annotation written for an incident. An annotation with an {@code endTime} later than
 * its {@code startTime} is drawn as a region, otherwise as a point.
 */
@Value
@Builder(toBuilder = true)
public class Annotation {
  String eventId;
  String fingerprint;
  String dashboardUid;
  Long dashboardId;
  Long panelId;
  Instant startTime;
  Instant endTime;
  String text;
  List<String> tags;
  Long remoteId;

  public boolean isOpen() {
    return endTime == null;
  }

  public boolean isRegion() {
    return endTime != null && endTime.isAfter(startTime);
  }

  public Duration getDuration() {
    return endTime == null ? Duration.ZERO : Duration.between(startTime, endTime);
  }
}
