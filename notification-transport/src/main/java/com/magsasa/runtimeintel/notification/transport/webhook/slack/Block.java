package com.magsasa.runtimeintel.notification.transport.webhook.slack;

/** Top level layout block of a Slack message. */
public interface Block {
  String getType();
}
