package com.magsasa.runtimeintel.notification.transport.pagerduty;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * PagerDuty Events API v2 request. Incidents are keyed by {@code dedup_key}, so a {@code
 * resolve} with the same key closes what the {@code trigger} opened.
 */
@Getter
@Builder
public class PagerDutyEvent {
  public static final String EVENTS_V2_URL = "https://events.pagerduty.com/v2/enqueue";
  public static final String ACTION_TRIGGER = "trigger";
  public static final String ACTION_RESOLVE = "resolve";

  @JsonProperty("routing_key")
  private final String routingKey;

  @JsonProperty("event_action")
  private final String eventAction;

  @JsonProperty("dedup_key")
  private final String dedupKey;

  private final Payload payload;
  private final List<Link> links;

  @Getter
  @Builder
  public static class Payload {
    private final String summary;
    private final String source;
    private final String severity;
    private final String timestamp;
    private final String component;
    private final String group;

    @JsonProperty("custom_details")
    private final Map<String, Object> customDetails;
  }

  @Getter
  public static class Link {
    private final String href;
    private final String text;

    public Link(String href, String text) {
      this.href = href;
      this.text = text;
    }
  }
}
