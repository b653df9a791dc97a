package com.magsasa.runtimeintel.notification.transport.webhook;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.magsasa.runtimeintel.notification.transport.NotificationDeliveryException;
import com.magsasa.runtimeintel.notification.transport.webhook.http.HttpWithJsonSender;
import java.io.IOException;
import java.util.Map;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class WebhookSenderTest {

  private MockWebServer mockWebServer;
  private final WebhookSender webhookSender = new WebhookSender(HttpWithJsonSender.getInstance());

  @BeforeEach
  void setUp() throws IOException {
    mockWebServer = new MockWebServer();
    mockWebServer.start();
  }

  @AfterEach
  void tearDown() throws IOException {
    mockWebServer.shutdown();
  }

  @Test
  void testPostsSerializedPayloadWithHeaders() throws InterruptedException {
    mockWebServer.enqueue(new MockResponse().setResponseCode(202));

    webhookSender.send(
        mockWebServer.url("/hooks/ops").toString(),
        new Payload("disk full", null),
        Map.of("X-Routing-Key", "ops"));

    RecordedRequest request = mockWebServer.takeRequest();
    assertEquals("POST", request.getMethod());
    assertEquals("/hooks/ops", request.getPath());
    assertEquals("ops", request.getHeader("X-Routing-Key"));
    assertTrue(request.getHeader("Content-Type").startsWith("application/json"));
    assertEquals("{\"summary\":\"disk full\"}", request.getBody().readUtf8());
  }

  @Test
  void testServerErrorsAreRetryable() {
    mockWebServer.enqueue(new MockResponse().setResponseCode(503));

    NotificationDeliveryException exception =
        assertThrows(
            NotificationDeliveryException.class,
            () -> webhookSender.send(mockWebServer.url("/").toString(), new Payload("x", "y")));

    assertEquals(503, exception.getStatusCode());
    assertTrue(exception.isRetryable());
  }

  @Test
  void testClientErrorsAreNotRetryable() {
    mockWebServer.enqueue(new MockResponse().setResponseCode(400));

    NotificationDeliveryException exception =
        assertThrows(
            NotificationDeliveryException.class,
            () -> webhookSender.send(mockWebServer.url("/").toString(), new Payload("x", "y")));

    assertEquals(400, exception.getStatusCode());
    assertFalse(exception.isRetryable());
  }

  @Test
  void testThrottlingIsRetryable() {
    assertTrue(WebhookSender.isRetryable(429));
    assertFalse(WebhookSender.isRetryable(404));
  }

  @Test
  void testUnreachableEndpointIsRetryable() throws IOException {
    String url = mockWebServer.url("/").toString();
    mockWebServer.shutdown();

    NotificationDeliveryException exception =
        assertThrows(
            NotificationDeliveryException.class,
            () -> webhookSender.send(url, new Payload("x", "y")));

    assertEquals(NotificationDeliveryException.NO_STATUS, exception.getStatusCode());
    assertTrue(exception.isRetryable());
  }

  static class Payload {
    private final String summary;
    private final String detail;

    Payload(String summary, String detail) {
      this.summary = summary;
      this.detail = detail;
    }

    public String getSummary() {
      return summary;
    }

    public String getDetail() {
      return detail;
    }
  }
}
