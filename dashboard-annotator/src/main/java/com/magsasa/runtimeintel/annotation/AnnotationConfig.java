package com.magsasa.runtimeintel.annotation;

import com.typesafe.config.Config;
import java.time.Duration;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AnnotationConfig {
  private static final String ENABLED_CONFIG = "enabled";
  private static final String URL_CONFIG = "url";
  private static final String API_KEY_SECRET_CONFIG = "api-key-secret";
  private static final String TIMEOUT_CONFIG = "timeout";

  private static final String DEFAULT_URL = "http://localhost:3000";
  private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

  boolean enabled;
  @Builder.Default String url = DEFAULT_URL;
  String apiKeySecret;
  @Builder.Default Duration timeout = DEFAULT_TIMEOUT;

  public static AnnotationConfig fromConfig(Config annotationConfig) {
    return AnnotationConfig.builder()
        .enabled(
            annotationConfig.hasPath(ENABLED_CONFIG)
                && annotationConfig.getBoolean(ENABLED_CONFIG))
        .url(
            annotationConfig.hasPath(URL_CONFIG)
                ? annotationConfig.getString(URL_CONFIG)
                : DEFAULT_URL)
        .apiKeySecret(
            annotationConfig.hasPath(API_KEY_SECRET_CONFIG)
                ? annotationConfig.getString(API_KEY_SECRET_CONFIG)
                : null)
        .timeout(
            annotationConfig.hasPath(TIMEOUT_CONFIG)
                ? annotationConfig.getDuration(TIMEOUT_CONFIG)
                : DEFAULT_TIMEOUT)
        .build();
  }
}
