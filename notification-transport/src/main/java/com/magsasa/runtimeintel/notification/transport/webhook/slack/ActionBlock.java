package com.magsasa.runtimeintel.notification.transport.webhook.slack;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class ActionBlock implements Block {
  private final String type = BlockType.ACTIONS.jsonName();
  private final List<Element> elements;

  @JsonProperty("block_id")
  private final String blockId;
}
