package com.magsasa.runtimeintel.notification.service.notification;

import com.magsasa.runtimeintel.datamodel.AlertEvent;
import com.magsasa.runtimeintel.datamodel.Notification;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/** Plain JSON body for {@code WEBHOOK_FORMAT_JSON} channels. */
@Builder
@Getter
public class AlertWebhookEvent {
  String title;
  String fingerprint;
  String name;
  String status;
  String transition;
  String severity;
  String service;
  String team;
  String summary;
  String description;
  String source;
  Double observedValue;
  Double baselineValue;
  long occurrenceCount;
  String routeName;
  boolean unrouted;
  Instant startedAt;
  Instant resolvedAt;
  Map<String, String> labels;
  Map<String, String> links;

  public static AlertWebhookEvent from(Notification notification) {
    AlertEvent alert = notification.getAlert();
    return AlertWebhookEvent.builder()
        .title(NotificationTemplate.title(notification))
        .fingerprint(alert.getFingerprint())
        .name(alert.getName())
        .status(alert.getStatus().name().toLowerCase(Locale.ROOT))
        .transition(notification.getTransition().name())
        .severity(alert.getSeverity().label())
        .service(alert.getService())
        .team(alert.getTeam())
        .summary(alert.getSummary())
        .description(alert.getDescription())
        .source(alert.getSource())
        .observedValue(alert.getObservedValue())
        .baselineValue(alert.getBaselineValue())
        .occurrenceCount(notification.getOccurrenceCount())
        .routeName(notification.getRouteName())
        .unrouted(notification.isUnrouted())
        .startedAt(alert.getStartedAt())
        .resolvedAt(alert.getResolvedAt())
        .labels(alert.getLabels())
        .links(notification.getLinks())
        .build();
  }
}
