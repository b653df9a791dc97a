package com.magsasa.runtimeintel.notification.transport.webhook.slack;

import java.util.Locale;

public enum BlockType {
  SECTION,
  ACTIONS,
  HEADER,
  CONTEXT,
  DIVIDER;

  public String jsonName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
