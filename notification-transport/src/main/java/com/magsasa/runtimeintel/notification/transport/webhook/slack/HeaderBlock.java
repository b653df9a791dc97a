package com.magsasa.runtimeintel.notification.transport.webhook.slack;

import lombok.Getter;

@Getter
public class HeaderBlock implements Block {
  private final String type = BlockType.HEADER.jsonName();
  private final Text text;

  public HeaderBlock(String text) {
    this.text = Text.plain(text);
  }
}
