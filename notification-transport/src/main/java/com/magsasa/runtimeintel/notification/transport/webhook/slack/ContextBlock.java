package com.magsasa.runtimeintel.notification.transport.webhook.slack;

import java.util.List;
import lombok.Getter;

@Getter
public class ContextBlock implements Block {
  private final String type = BlockType.CONTEXT.jsonName();
  private final List<Element> elements;

  public ContextBlock(List<Element> elements) {
    this.elements = elements;
  }
}
