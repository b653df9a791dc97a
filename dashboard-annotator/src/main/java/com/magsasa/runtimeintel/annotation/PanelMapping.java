package com.magsasa.runtimeintel.annotation;

import com.magsasa.runtimeintel.datamodel.AlertEvent;
import java.time.Duration;
import java.time.Instant;
import java.util.regex.Pattern;
import lombok.Value;

/** Static link between alert or metric names and the dashboard panel that charts them. */
@Value
public class PanelMapping {
  private static final Duration LINK_PADDING = Duration.ofMinutes(30);

  Pattern pattern;
  String dashboardUid;
  Long dashboardId;
  long panelId;

  public boolean matches(AlertEvent event) {
    return event.getName() != null && pattern.matcher(event.getName()).find();
  }

  /** Panel view covering the incident with some padding on both sides. */
  public String deepLink(String dashboardBaseUrl, AlertEvent event) {
    StringBuilder link =
        new StringBuilder(dashboardBaseUrl)
            .append("/d/")
            .append(dashboardUid)
            .append("?viewPanel=")
            .append(panelId);
    Instant start = event.getStartedAt();
    if (start != null) {
      Instant end = event.getResolvedAt() == null ? start : event.getResolvedAt();
      link.append("&from=")
          .append(start.minus(LINK_PADDING).toEpochMilli())
          .append("&to=")
          .append(end.plus(LINK_PADDING).toEpochMilli());
    }
    return link.toString();
  }
}
