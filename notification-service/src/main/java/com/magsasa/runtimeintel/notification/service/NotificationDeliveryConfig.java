package com.magsasa.runtimeintel.notification.service;

import com.typesafe.config.Config;
import java.time.Duration;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class NotificationDeliveryConfig {
  private static final String RETRY_MAX_ATTEMPTS = "retry.max-attempts";
  private static final String RETRY_INITIAL_INTERVAL = "retry.initial-interval";
  private static final String RETRY_MULTIPLIER = "retry.multiplier";
  private static final String EXECUTOR_THREADS = "executor-threads";

  private static final int DEFAULT_MAX_ATTEMPTS = 3;
  private static final Duration DEFAULT_INITIAL_INTERVAL = Duration.ofMillis(500);
  private static final double DEFAULT_MULTIPLIER = 2.0;
  private static final int DEFAULT_EXECUTOR_THREADS = 4;

  @Builder.Default int maxAttempts = DEFAULT_MAX_ATTEMPTS;
  @Builder.Default Duration initialInterval = DEFAULT_INITIAL_INTERVAL;
  @Builder.Default double multiplier = DEFAULT_MULTIPLIER;
  @Builder.Default int executorThreads = DEFAULT_EXECUTOR_THREADS;

  public static NotificationDeliveryConfig fromConfig(Config notificationConfig) {
    return NotificationDeliveryConfig.builder()
        .maxAttempts(
            notificationConfig.hasPath(RETRY_MAX_ATTEMPTS)
                ? notificationConfig.getInt(RETRY_MAX_ATTEMPTS)
                : DEFAULT_MAX_ATTEMPTS)
        .initialInterval(
            notificationConfig.hasPath(RETRY_INITIAL_INTERVAL)
                ? notificationConfig.getDuration(RETRY_INITIAL_INTERVAL)
                : DEFAULT_INITIAL_INTERVAL)
        .multiplier(
            notificationConfig.hasPath(RETRY_MULTIPLIER)
                ? notificationConfig.getDouble(RETRY_MULTIPLIER)
                : DEFAULT_MULTIPLIER)
        .executorThreads(
            notificationConfig.hasPath(EXECUTOR_THREADS)
                ? notificationConfig.getInt(EXECUTOR_THREADS)
                : DEFAULT_EXECUTOR_THREADS)
        .build();
  }
}
