package com.magsasa.runtimeintel.detector;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.typesafe.config.Config;
import java.io.IOException;
import java.time.Duration;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Queries an HTTP endpoint returning a JSON array of samples. */
public class HttpPollingMetricSampleSource implements MetricSampleSource {

  private static final Logger LOGGER = LoggerFactory.getLogger(HttpPollingMetricSampleSource.class);
  private static final String URL_CONFIG = "url";
  private static final String TIMEOUT_CONFIG = "timeout";
  private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  private final OkHttpClient client;
  private final String url;
  private final MetricSampleParser parser = new MetricSampleParser();

  public HttpPollingMetricSampleSource(Config sourceConfig) {
    this(
        new OkHttpClient.Builder()
            .callTimeout(
                sourceConfig.hasPath(TIMEOUT_CONFIG)
                    ? sourceConfig.getDuration(TIMEOUT_CONFIG)
                    : DEFAULT_TIMEOUT)
            .build(),
        sourceConfig.getString(URL_CONFIG));
  }

  @VisibleForTesting
  HttpPollingMetricSampleSource(OkHttpClient client, String url) {
    this.client = client;
    this.url = url;
  }

  @Override
  public MetricSampleParser.ParsedSamples poll() throws IOException {
    Request request = new Request.Builder().url(url).get().build();
    try (Response response = client.newCall(request).execute()) {
      ResponseBody body = response.body();
      if (!response.isSuccessful() || body == null) {
        throw new IOException(
            String.format("Metric query to %s failed with code %d", url, response.code()));
      }
      JsonNode document = OBJECT_MAPPER.readTree(body.string());
      MetricSampleParser.ParsedSamples parsed = parser.parse(document);
      LOGGER.debug(
          "Polled {} samples from {}, rejected {}",
          parsed.getSamples().size(),
          url,
          parsed.getRejections().size());
      return parsed;
    }
  }
}
