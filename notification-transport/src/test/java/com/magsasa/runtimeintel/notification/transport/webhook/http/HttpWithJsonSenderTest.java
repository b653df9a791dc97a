package com.magsasa.runtimeintel.notification.transport.webhook.http;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.magsasa.runtimeintel.notification.transport.webhook.http.HttpWithJsonSender.JsonResponse;
import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HttpWithJsonSenderTest {

  private MockWebServer mockWebServer;

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
  void testPostReturnsStatusAndBody() throws IOException, InterruptedException {
    mockWebServer.enqueue(new MockResponse().setResponseCode(200).setBody("{\"id\":7}"));
    HttpWithJsonSender sender = new HttpWithJsonSender(new OkHttpClient());

    JsonResponse response =
        sender.post(
            mockWebServer.url("/api/annotations").toString(),
            "{\"text\":\"spike\"}",
            Map.of("Authorization", "Bearer token"));

    assertTrue(response.isSuccessful());
    assertEquals("{\"id\":7}", response.getBody());
    RecordedRequest request = mockWebServer.takeRequest();
    assertEquals("Bearer token", request.getHeader("Authorization"));
    assertEquals("{\"text\":\"spike\"}", request.getBody().readUtf8());
  }

  @Test
  void testPatchUsesPatchMethod() throws IOException, InterruptedException {
    mockWebServer.enqueue(new MockResponse().setResponseCode(404).setBody("missing"));
    HttpWithJsonSender sender =
        HttpWithJsonSender.withTimeouts(Duration.ofSeconds(1), Duration.ofSeconds(1));

    JsonResponse response =
        sender.patch(mockWebServer.url("/api/annotations/7").toString(), "{}", Map.of());

    assertFalse(response.isSuccessful());
    assertEquals(404, response.getCode());
    assertEquals("PATCH", mockWebServer.takeRequest().getMethod());
  }
}
