package com.magsasa.runtimeintel.notification.transport.webhook.slack;

import lombok.Getter;

@Getter
public class Text implements Element {
  public static final String MARKDOWN_TYPE = "mrkdwn";
  public static final String PLAINTEXT_TYPE = "plain_text";

  private final String type;
  private final String text;

  public Text(String type, String text) {
    this.type = type;
    this.text = text;
  }

  public static Text markdown(String text) {
    return new Text(MARKDOWN_TYPE, text);
  }

  public static Text plain(String text) {
    return new Text(PLAINTEXT_TYPE, text);
  }
}
