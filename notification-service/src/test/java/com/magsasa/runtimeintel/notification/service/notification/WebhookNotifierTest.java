package com.magsasa.runtimeintel.notification.service.notification;

import static com.magsasa.runtimeintel.notification.service.NotificationTestFixtures.notification;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import com.fasterxml.jackson.databind.JsonNode;
import com.magsasa.runtimeintel.datamodel.Notification.Transition;
import com.magsasa.runtimeintel.notification.service.NotificationChannel.PagerDutyNotificationChannelConfig;
import com.magsasa.runtimeintel.notification.service.NotificationChannel.WebFormatNotificationChannelConfig;
import com.magsasa.runtimeintel.notification.service.NotificationChannelsReader;
import com.magsasa.runtimeintel.notification.transport.webhook.ObjectMapperProvider;
import com.magsasa.runtimeintel.notification.transport.webhook.WebhookSender;
import com.magsasa.runtimeintel.notification.transport.webhook.http.HttpWithJsonSender;
import com.magsasa.runtimeintel.notification.transport.webhook.slack.Attachment;
import java.io.IOException;
import java.util.List;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class WebhookNotifierTest {

  private MockWebServer mockWebServer;
  private final WebhookNotifier notifier =
      new WebhookNotifier(new WebhookSender(HttpWithJsonSender.getInstance()));

  @BeforeEach
  void setUp() throws IOException {
    mockWebServer = new MockWebServer();
    mockWebServer.start();
    mockWebServer.enqueue(new MockResponse().setResponseCode(200));
  }

  @AfterEach
  void tearDown() throws IOException {
    mockWebServer.shutdown();
  }

  @Test
  void testSlackFormat() throws Exception {
    notifier.notify(
        notification(Transition.OPEN, List.of("slack")),
        webhook(NotificationChannelsReader.WEBHOOK_FORMAT_SLACK));

    JsonNode body = recordedBody();
    assertEquals("[CRITICAL] HighLatency", body.get("text").asText());
    JsonNode attachment = body.get("attachments").get(0);
    assertEquals(Attachment.RED, attachment.get("color").asText());
    JsonNode blocks = attachment.get("blocks");
    assertEquals("header", blocks.get(0).get("type").asText());
    assertEquals("*Service:*\npayments", blocks.get(1).get("fields").get(0).get("text").asText());
    assertEquals(
        "*Environment:*\nprod", blocks.get(1).get("fields").get(3).get("text").asText());
    assertEquals("Current: 2.40 | Baseline: 0.80", blocks.get(3).get("text").get("text").asText());
    JsonNode buttons = blocks.get(4).get("elements");
    assertEquals("https://runbooks/high-latency", buttons.get(0).get("url").asText());
    assertEquals("http://grafana/d/payments?viewPanel=2", buttons.get(1).get("url").asText());
    JsonNode footer = blocks.get(5).get("elements");
    assertEquals("Triggered at 2024-03-01 12:00:00 UTC", footer.get(0).get("text").asText());
    assertEquals("Seen 3 times", footer.get(1).get("text").asText());
  }

  @Test
  void testJsonFormat() throws Exception {
    notifier.notify(
        notification(Transition.RESOLVED, List.of("json")),
        webhook(NotificationChannelsReader.WEBHOOK_FORMAT_JSON));

    JsonNode body = recordedBody();
    assertEquals("[RESOLVED] HighLatency", body.get("title").asText());
    assertEquals("resolved", body.get("status").asText());
    assertEquals("critical", body.get("severity").asText());
    assertEquals(3, body.get("occurrenceCount").asInt());
    assertEquals("2024-03-01T12:10:00Z", body.get("resolvedAt").asText());
    assertEquals(
        "http://grafana/d/payments?viewPanel=2", body.get("links").get("dashboard").asText());
    assertFalse(body.get("unrouted").asBoolean());
  }

  @Test
  void testPagerDutyResolveUsesFingerprintAsDedupKey() throws Exception {
    notifier.notify(
        notification(Transition.RESOLVED, List.of("pd")),
        PagerDutyNotificationChannelConfig.builder()
            .channelConfigType(NotificationChannelsReader.CHANNEL_CONFIG_TYPE_PAGERDUTY)
            .url(mockWebServer.url("/v2/enqueue").toString())
            .routingKey("routing-key")
            .build());

    JsonNode body = recordedBody();
    assertEquals("routing-key", body.get("routing_key").asText());
    assertEquals("resolve", body.get("event_action").asText());
    assertEquals("3f2a9c", body.get("dedup_key").asText());
    assertEquals("critical", body.get("payload").get("severity").asText());
    assertEquals("payments", body.get("payload").get("source").asText());
    assertEquals(3, body.get("payload").get("custom_details").get("occurrence_count").asInt());
    assertEquals("Runbook", body.get("links").get(0).get("text").asText());
  }

  @Test
  void testDigestWording() {
    assertEquals(
        "[DIGEST] HighLatency",
        NotificationTemplate.title(notification(Transition.DIGEST, List.of())));
    assertEquals(
        "Fired 3 times while notifications were suppressed",
        NotificationTemplate.occurrenceLine(notification(Transition.DIGEST, List.of())));
  }

  private WebFormatNotificationChannelConfig webhook(String format) {
    return WebFormatNotificationChannelConfig.builder()
        .channelConfigType(NotificationChannelsReader.CHANNEL_CONFIG_TYPE_WEBHOOK)
        .webhookFormat(format)
        .url(mockWebServer.url("/hook").toString())
        .build();
  }

  private JsonNode recordedBody() throws Exception {
    return ObjectMapperProvider.get().readTree(mockWebServer.takeRequest().getBody().readUtf8());
  }
}
