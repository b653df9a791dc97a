package com.magsasa.runtimeintel.engine;

import com.magsasa.runtimeintel.processor.suppression.SuppressionConfig;
import com.typesafe.config.Config;
import java.time.Duration;
import lombok.Builder;
import lombok.Value;

/** Settings read once at startup; unlike {@code RuntimeConfig} they are not reloaded. */
@Value
@Builder
public class PipelineConfig {
  private static final String DETECTION_WORKERS_CONFIG = "detection.workers";
  private static final String SERIES_IDLE_TTL_CONFIG = "detection.series-idle-ttl";
  private static final String SUPPRESSION_CONFIG = "suppression";
  private static final String ANNOTATION_THREADS_CONFIG = "annotation.executor-threads";
  private static final String OPEN_ANNOTATION_TTL_CONFIG = "annotation.open-annotation-ttl";
  private static final String SHUTDOWN_TIMEOUT_CONFIG = "shutdown.timeout";

  private static final int DEFAULT_DETECTION_WORKERS = 4;
  private static final Duration DEFAULT_SERIES_IDLE_TTL = Duration.ofMinutes(30);
  private static final int DEFAULT_ANNOTATION_THREADS = 2;
  private static final Duration DEFAULT_OPEN_ANNOTATION_TTL = Duration.ofHours(24);
  private static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);

  @Builder.Default int detectionWorkers = DEFAULT_DETECTION_WORKERS;
  @Builder.Default Duration seriesIdleTtl = DEFAULT_SERIES_IDLE_TTL;
  @Builder.Default SuppressionConfig suppressionConfig = SuppressionConfig.defaults();
  @Builder.Default int annotationThreads = DEFAULT_ANNOTATION_THREADS;
  @Builder.Default Duration openAnnotationTtl = DEFAULT_OPEN_ANNOTATION_TTL;
  @Builder.Default Duration shutdownTimeout = DEFAULT_SHUTDOWN_TIMEOUT;

  public static PipelineConfig fromConfig(Config appConfig) {
    return PipelineConfig.builder()
        .detectionWorkers(
            appConfig.hasPath(DETECTION_WORKERS_CONFIG)
                ? appConfig.getInt(DETECTION_WORKERS_CONFIG)
                : DEFAULT_DETECTION_WORKERS)
        .seriesIdleTtl(
            appConfig.hasPath(SERIES_IDLE_TTL_CONFIG)
                ? appConfig.getDuration(SERIES_IDLE_TTL_CONFIG)
                : DEFAULT_SERIES_IDLE_TTL)
        .suppressionConfig(
            appConfig.hasPath(SUPPRESSION_CONFIG)
                ? SuppressionConfig.fromConfig(appConfig.getConfig(SUPPRESSION_CONFIG))
                : SuppressionConfig.defaults())
        .annotationThreads(
            appConfig.hasPath(ANNOTATION_THREADS_CONFIG)
                ? appConfig.getInt(ANNOTATION_THREADS_CONFIG)
                : DEFAULT_ANNOTATION_THREADS)
        .openAnnotationTtl(
            appConfig.hasPath(OPEN_ANNOTATION_TTL_CONFIG)
                ? appConfig.getDuration(OPEN_ANNOTATION_TTL_CONFIG)
                : DEFAULT_OPEN_ANNOTATION_TTL)
        .shutdownTimeout(
            appConfig.hasPath(SHUTDOWN_TIMEOUT_CONFIG)
                ? appConfig.getDuration(SHUTDOWN_TIMEOUT_CONFIG)
                : DEFAULT_SHUTDOWN_TIMEOUT)
        .build();
  }
}
