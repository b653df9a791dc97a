package com.magsasa.runtimeintel.annotation.grafana;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.magsasa.runtimeintel.annotation.Annotation;
import com.magsasa.runtimeintel.annotation.AnnotationConfig;
import com.magsasa.runtimeintel.annotation.AnnotationWriteException;
import com.magsasa.runtimeintel.datamodel.ConfigurationException;
import com.magsasa.runtimeintel.notification.transport.NotificationSecretFinder;
import com.magsasa.runtimeintel.notification.transport.webhook.ObjectMapperProvider;
import com.magsasa.runtimeintel.notification.transport.webhook.http.HttpWithJsonSender;
import com.magsasa.runtimeintel.notification.transport.webhook.http.HttpWithJsonSender.JsonResponse;
import java.io.IOException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Writes annotations through the Grafana HTTP API using a bearer token. */
public class GrafanaAnnotationClient {
  private static final Logger LOGGER = LoggerFactory.getLogger(GrafanaAnnotationClient.class);
  static final String ANNOTATIONS_PATH = "/api/annotations";
  private static final String AUTHORIZATION_HEADER = "Authorization";
  private static final String ID_FIELD = "id";

  private final HttpWithJsonSender sender;
  private final String annotationsUrl;
  private final Map<String, String> headers;

  public GrafanaAnnotationClient(HttpWithJsonSender sender, String grafanaUrl, String apiKey) {
    this.sender = sender;
    String baseUrl =
        grafanaUrl.endsWith("/") ? grafanaUrl.substring(0, grafanaUrl.length() - 1) : grafanaUrl;
    this.annotationsUrl = baseUrl + ANNOTATIONS_PATH;
    this.headers = apiKey == null ? Map.of() : Map.of(AUTHORIZATION_HEADER, "Bearer " + apiKey);
  }

  public static GrafanaAnnotationClient fromConfig(AnnotationConfig config) {
    String apiKey = null;
    if (config.getApiKeySecret() != null) {
      apiKey =
          NotificationSecretFinder.findSecret(config.getApiKeySecret())
              .orElseThrow(
                  () ->
                      new ConfigurationException(
                          String.format(
                              "Missing annotation api key secret:%s",
                              config.getApiKeySecret())));
    }
    return new GrafanaAnnotationClient(
        HttpWithJsonSender.withTimeouts(config.getTimeout(), config.getTimeout()),
        config.getUrl(),
        apiKey);
  }

  /** Creates the annotation and returns the id the server assigned to it. */
  public long create(Annotation annotation) {
    JsonResponse response =
        execute("create", annotationsUrl, GrafanaAnnotationRequest.create(annotation), false);
    try {
      JsonNode body = ObjectMapperProvider.get().readTree(response.getBody());
      if (body == null || !body.hasNonNull(ID_FIELD)) {
        throw new AnnotationWriteException(
            String.format("Annotation create response carries no id: %s", response.getBody()));
      }
      long id = body.get(ID_FIELD).asLong();
      LOGGER.debug("Created annotation id={} fingerprint={}", id, annotation.getFingerprint());
      return id;
    } catch (JsonProcessingException e) {
      throw new AnnotationWriteException("Unreadable annotation create response", e);
    }
  }

  /** Sets the end time of a previously created annotation, turning it into a region. */
  public void close(long remoteId, Annotation annotation) {
    execute(
        "update",
        annotationsUrl + "/" + remoteId,
        GrafanaAnnotationRequest.close(annotation),
        true);
    LOGGER.debug("Closed annotation id={} fingerprint={}", remoteId, annotation.getFingerprint());
  }

  private JsonResponse execute(
      String action, String url, GrafanaAnnotationRequest request, boolean patch) {
    JsonResponse response;
    try {
      String body = ObjectMapperProvider.get().writeValueAsString(request);
      response = patch ? sender.patch(url, body, headers) : sender.post(url, body, headers);
    } catch (IOException e) {
      throw new AnnotationWriteException(
          String.format("Annotation %s request to %s failed", action, url), e);
    }
    if (!response.isSuccessful()) {
      throw new AnnotationWriteException(
          String.format(
              "Annotation %s rejected by %s: %d %s",
              action, url, response.getCode(), response.getBody()));
    }
    return response;
  }
}
