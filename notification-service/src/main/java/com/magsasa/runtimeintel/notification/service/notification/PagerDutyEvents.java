package com.magsasa.runtimeintel.notification.service.notification;

import com.magsasa.runtimeintel.datamodel.AlertEvent;
import com.magsasa.runtimeintel.datamodel.Notification;
import com.magsasa.runtimeintel.datamodel.Notification.Transition;
import com.magsasa.runtimeintel.notification.transport.pagerduty.PagerDutyEvent;
import com.magsasa.runtimeintel.notification.transport.pagerduty.PagerDutyEvent.Link;
import com.magsasa.runtimeintel.notification.transport.pagerduty.PagerDutyEvent.Payload;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Maps notifications onto PagerDuty Events v2; the fingerprint is the dedup key. */
public final class PagerDutyEvents {
  private static final int MAX_SUMMARY_LENGTH = 1024;

  private PagerDutyEvents() {}

  public static PagerDutyEvent from(Notification notification, String routingKey) {
    AlertEvent alert = notification.getAlert();
    String summary = NotificationTemplate.title(notification) + ": " + alert.getSummary();
    if (summary.length() > MAX_SUMMARY_LENGTH) {
      summary = summary.substring(0, MAX_SUMMARY_LENGTH);
    }

    Map<String, Object> customDetails = new LinkedHashMap<>();
    putIfPresent(customDetails, "description", alert.getDescription());
    putIfPresent(customDetails, "current_value", alert.getObservedValue());
    putIfPresent(customDetails, "baseline_value", alert.getBaselineValue());
    customDetails.put("occurrence_count", notification.getOccurrenceCount());
    customDetails.put("transition", notification.getTransition().name());
    putIfPresent(customDetails, "alert_labels", alert.getLabels());
    putIfPresent(customDetails, "alert_annotations", alert.getAnnotations());

    List<Link> links = new ArrayList<>();
    String runbook = NotificationTemplate.link(notification, Notification.LINK_RUNBOOK);
    if (runbook != null) {
      links.add(new Link(runbook, "Runbook"));
    }
    String dashboard = NotificationTemplate.link(notification, Notification.LINK_DASHBOARD);
    if (dashboard != null) {
      links.add(new Link(dashboard, "Dashboard"));
    }

    return PagerDutyEvent.builder()
        .routingKey(routingKey)
        .eventAction(
            notification.getTransition() == Transition.RESOLVED
                ? PagerDutyEvent.ACTION_RESOLVE
                : PagerDutyEvent.ACTION_TRIGGER)
        .dedupKey(alert.getFingerprint())
        .payload(
            Payload.builder()
                .summary(summary)
                .source(alert.getService())
                .severity(alert.getSeverity().label())
                .timestamp(alert.getStartedAt() == null ? null : alert.getStartedAt().toString())
                .component(alert.getName())
                .group(alert.getTeam())
                .customDetails(customDetails)
                .build())
        .links(links.isEmpty() ? null : links)
        .build();
  }

  private static void putIfPresent(Map<String, Object> details, String key, Object value) {
    if (value != null) {
      details.put(key, value);
    }
  }
}
