package com.magsasa.runtimeintel.notification.transport.webhook.slack;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Getter;

/** Link button; Slack opens {@code url} and still posts the action to the app, if any. */
@Getter
@Builder
public class Button implements Element {
  public static final String TYPE = "button";
  public static final String PRIMARY_STYLE = "primary";
  public static final String DANGER_STYLE = "danger";

  private final String type = TYPE;
  private final Text text;

  @JsonProperty("action_id")
  private final String actionId;

  private final String value;
  private final String url;
  private final String style;

  public static Button link(String actionId, String label, String url) {
    return Button.builder().actionId(actionId).text(Text.plain(label)).url(url).build();
  }
}
