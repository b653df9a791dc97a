package com.magsasa.runtimeintel.notification.transport.webhook.slack;

import java.util.List;
import lombok.Getter;

/** Colored attachment holding the message blocks. */
@Getter
public class Attachment {
  public static final String RED = "#d41729";
  public static final String AMBER = "#f2c744";
  public static final String BLUE = "#439fe0";
  public static final String GREEN = "#2eb886";

  private final String color;
  private final List<Block> blocks;

  public Attachment(String color, List<Block> blocks) {
    this.color = color;
    this.blocks = blocks;
  }
}
