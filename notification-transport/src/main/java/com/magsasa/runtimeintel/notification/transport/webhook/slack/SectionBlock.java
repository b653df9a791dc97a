package com.magsasa.runtimeintel.notification.transport.webhook.slack;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class SectionBlock implements Block {
  private final String type = BlockType.SECTION.jsonName();
  private final Text text;

  @JsonProperty("block_id")
  private final String blockId;

  private final List<Text> fields;
  private final Element accessory;
}
