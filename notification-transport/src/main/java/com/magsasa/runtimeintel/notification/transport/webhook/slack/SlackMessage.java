package com.magsasa.runtimeintel.notification.transport.webhook.slack;

import java.util.List;
import lombok.Getter;

/** Body accepted by Slack incoming webhooks. {@code text} is the notification fallback. */
@Getter
public class SlackMessage {
  private final String text;
  private final List<Attachment> attachments;

  public SlackMessage(String text, List<Attachment> attachments) {
    this.text = text;
    this.attachments = attachments;
  }
}
