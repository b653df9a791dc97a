package com.magsasa.runtimeintel.notification.service.notification;

import com.google.common.base.Strings;
import com.magsasa.runtimeintel.datamodel.AlertEvent;
import com.magsasa.runtimeintel.datamodel.Notification;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** Wording shared by every channel format, so Slack, JSON and PagerDuty read the same. */
public final class NotificationTemplate {
  private static final DateTimeFormatter TIMESTAMP_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);
  static final String RESOLVED_PREFIX = "RESOLVED";
  static final String DIGEST_PREFIX = "DIGEST";

  private NotificationTemplate() {}

  public static String title(Notification notification) {
    AlertEvent alert = notification.getAlert();
    String prefix;
    switch (notification.getTransition()) {
      case RESOLVED:
        prefix = RESOLVED_PREFIX;
        break;
      case DIGEST:
        prefix = DIGEST_PREFIX;
        break;
      default:
        prefix = alert.getSeverity().name();
    }
    return String.format("[%s] %s", prefix, alert.getName());
  }

  /** "Current: x | Baseline: y", or null when the alert carries neither value. */
  public static String valueLine(AlertEvent alert) {
    List<String> parts = new ArrayList<>();
    if (alert.getObservedValue() != null) {
      parts.add(String.format(Locale.ROOT, "Current: %.2f", alert.getObservedValue()));
    }
    if (alert.getBaselineValue() != null) {
      parts.add(String.format(Locale.ROOT, "Baseline: %.2f", alert.getBaselineValue()));
    }
    return parts.isEmpty() ? null : String.join(" | ", parts);
  }

  public static String occurrenceLine(Notification notification) {
    long count = notification.getOccurrenceCount();
    switch (notification.getTransition()) {
      case DIGEST:
        return String.format("Fired %d times while notifications were suppressed", count);
      case RESOLVED:
        return count > 1 ? String.format("Resolved after %d occurrences", count) : null;
      default:
        return count > 1 ? String.format("Seen %d times", count) : null;
    }
  }

  public static String link(Notification notification, String name) {
    if (notification.getLinks() == null) {
      return null;
    }
    return Strings.emptyToNull(notification.getLinks().get(name));
  }

  public static String formatTime(Instant instant) {
    return instant == null ? "unknown time" : TIMESTAMP_FORMAT.format(instant);
  }
}
