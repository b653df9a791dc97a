package com.magsasa.runtimeintel.notification.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.magsasa.runtimeintel.datamodel.ConfigurationException;
import com.magsasa.runtimeintel.notification.service.NotificationChannel.PagerDutyNotificationChannelConfig;
import com.magsasa.runtimeintel.notification.service.NotificationChannel.WebFormatNotificationChannelConfig;
import com.magsasa.runtimeintel.notification.transport.pagerduty.PagerDutyEvent;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class NotificationChannelsReaderTest {

  private static final String PAGERDUTY_SECRET_PROPERTY =
      "notification.secret.pagerduty-payments";

  @TempDir Path tempDir;

  @AfterEach
  void tearDown() {
    System.clearProperty(PAGERDUTY_SECRET_PROPERTY);
  }

  @Test
  void testReadsWebhookAndPagerDutyChannels() throws IOException {
    System.setProperty(PAGERDUTY_SECRET_PROPERTY, "pd-routing-key");
    Config sourceConfig =
        writeChannels(
            "[{\"channelId\":\"slack-ops\",\"channelName\":\"Ops Slack\",\"channelConfig\":["
                + "{\"channelConfigType\":\"WEBHOOK\",\"url\":\"http://slack/hook\","
                + "\"webhookFormat\":\"WEBHOOK_FORMAT_SLACK\"},"
                + "{\"channelConfigType\":\"WEBHOOK\",\"url\":\"http://audit/hook\"}]},"
                + "{\"channelId\":\"pagerduty-payments\",\"channelConfig\":["
                + "{\"channelConfigType\":\"PAGERDUTY\","
                + "\"routingKeySecret\":\"pagerduty-payments\"}]}]");

    Map<String, NotificationChannel> channels =
        new NotificationChannelsReader(sourceConfig).readAllNotificationChannels();

    assertEquals(List.of("slack-ops", "pagerduty-payments"), List.copyOf(channels.keySet()));
    NotificationChannel slack = channels.get("slack-ops");
    assertEquals("Ops Slack", slack.getChannelName());
    assertEquals(2, slack.getNotificationChannelConfig().size());
    WebFormatNotificationChannelConfig slackConfig =
        (WebFormatNotificationChannelConfig) slack.getNotificationChannelConfig().get(0);
    assertEquals(NotificationChannelsReader.WEBHOOK_FORMAT_SLACK, slackConfig.getWebhookFormat());
    WebFormatNotificationChannelConfig auditConfig =
        (WebFormatNotificationChannelConfig) slack.getNotificationChannelConfig().get(1);
    assertEquals(NotificationChannelsReader.WEBHOOK_FORMAT_JSON, auditConfig.getWebhookFormat());

    NotificationChannel pagerDuty = channels.get("pagerduty-payments");
    assertEquals("pagerduty-payments", pagerDuty.getChannelName());
    PagerDutyNotificationChannelConfig pagerDutyConfig =
        (PagerDutyNotificationChannelConfig) pagerDuty.getNotificationChannelConfig().get(0);
    assertEquals("pd-routing-key", pagerDutyConfig.getRoutingKey());
    assertEquals(PagerDutyEvent.EVENTS_V2_URL, pagerDutyConfig.getUrl());
  }

  @Test
  void testInvalidChannelsAreRejected() throws IOException {
    assertThrows(
        ConfigurationException.class,
        () ->
            new NotificationChannelsReader(
                    writeChannels(
                        "[{\"channelId\":\"x\",\"channelConfig\":"
                            + "[{\"channelConfigType\":\"EMAIL\"}]}]"))
                .readAllNotificationChannels());
    assertThrows(
        ConfigurationException.class,
        () ->
            new NotificationChannelsReader(
                    writeChannels(
                        "[{\"channelId\":\"x\",\"channelConfig\":[{\"channelConfigType\":"
                            + "\"PAGERDUTY\",\"routingKeySecret\":\"absent-secret\"}]}]"))
                .readAllNotificationChannels());
    assertThrows(
        ConfigurationException.class,
        () ->
            new NotificationChannelsReader(
                    writeChannels(
                        "[{\"channelId\":\"x\",\"channelConfig\":[{\"channelConfigType\":"
                            + "\"WEBHOOK\",\"url\":\"http://a\"}]},"
                            + "{\"channelId\":\"x\",\"channelConfig\":[{\"channelConfigType\":"
                            + "\"WEBHOOK\",\"url\":\"http://b\"}]}]"))
                .readAllNotificationChannels());
    assertThrows(
        ConfigurationException.class,
        () ->
            new NotificationChannelsReader(writeChannels("{\"channelId\":\"x\"}"))
                .readAllNotificationChannels());
  }

  private Config writeChannels(String json) throws IOException {
    Path file = Files.writeString(tempDir.resolve("channels-" + json.hashCode() + ".json"), json);
    return ConfigFactory.parseMap(Map.of("type", "fs", "fs.path", file.toString()));
  }
}
