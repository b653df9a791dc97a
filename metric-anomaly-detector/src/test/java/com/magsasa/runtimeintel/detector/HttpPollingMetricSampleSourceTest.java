package com.magsasa.runtimeintel.detector;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HttpPollingMetricSampleSourceTest {

  private MockWebServer mockWebServer;
  private HttpPollingMetricSampleSource source;

  @BeforeEach
  void setUp() throws IOException {
    mockWebServer = new MockWebServer();
    mockWebServer.start();
    source =
        new HttpPollingMetricSampleSource(
            new OkHttpClient(), mockWebServer.url("/api/v1/samples").toString());
  }

  @AfterEach
  void tearDown() throws IOException {
    mockWebServer.shutdown();
  }

  @Test
  void testPollParsesSamples() throws IOException {
    mockWebServer.enqueue(
        new MockResponse()
            .setResponseCode(200)
            .addHeader("Content-Type", "application/json")
            .setBody(
                "[{\"metric\":\"api.latency\",\"labels\":{\"service\":\"payments\"},"
                    + "\"timestamp\":1700000000.5,\"value\":101.0}]"));

    MetricSampleParser.ParsedSamples parsed = source.poll();

    assertEquals(1, parsed.getSamples().size());
    assertEquals("api.latency", parsed.getSamples().get(0).getMetricId());
    assertEquals(1, mockWebServer.getRequestCount());
  }

  @Test
  void testPollFailsOnErrorResponse() {
    mockWebServer.enqueue(new MockResponse().setResponseCode(503));

    assertThrows(IOException.class, () -> source.poll());
  }
}
