package com.magsasa.runtimeintel.notification.transport.webhook.slack;

/** Interactive or context element nested inside a {@link Block}. */
public interface Element {
  String getType();
}
