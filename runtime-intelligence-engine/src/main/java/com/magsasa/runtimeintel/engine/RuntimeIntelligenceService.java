package com.magsasa.runtimeintel.engine;

import com.magsasa.runtimeintel.annotation.AnnotationConfig;
import com.magsasa.runtimeintel.annotation.DashboardAnnotator;
import com.magsasa.runtimeintel.annotation.DashboardMappings;
import com.magsasa.runtimeintel.annotation.grafana.GrafanaAnnotationClient;
import com.magsasa.runtimeintel.detector.HttpPollingMetricSampleSource;
import com.magsasa.runtimeintel.detector.MetricSampleSource;
import com.magsasa.runtimeintel.engine.config.RuntimeConfig;
import com.magsasa.runtimeintel.engine.config.RuntimeConfigLoader;
import com.magsasa.runtimeintel.engine.http.HttpServer;
import com.magsasa.runtimeintel.engine.job.JobManager;
import com.magsasa.runtimeintel.engine.job.PipelineJobManager;
import com.magsasa.runtimeintel.notification.service.NotificationDeliveryConfig;
import com.magsasa.runtimeintel.notification.service.NotificationEventProcessor;
import com.magsasa.runtimeintel.notification.service.notification.WebhookNotifier;
import com.magsasa.runtimeintel.notification.transport.NotificationSenderConfig;
import com.magsasa.runtimeintel.notification.transport.webhook.WebhookSender;
import com.magsasa.runtimeintel.notification.transport.webhook.http.HttpWithJsonSender;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.quartz.impl.StdSchedulerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Wires the pipeline, its HTTP endpoints and scheduled jobs, and owns their lifecycle. */
public class RuntimeIntelligenceService {
  private static final Logger LOGGER = LoggerFactory.getLogger(RuntimeIntelligenceService.class);

  private static final String SERVICE_NAME_CONFIG = "service.name";
  private static final String HTTP_HOST_CONFIG = "http.host";
  private static final String HTTP_PORT_CONFIG = "http.port";
  private static final String ANNOTATION_CONFIG = "annotation";
  private static final String METRIC_SOURCE_CONFIG = "metric.source";
  private static final String METRIC_SOURCE_URL_CONFIG = "url";
  private static final String NOTIFICATION_CONFIG = "notification";
  private static final String DEFAULT_SERVICE_NAME = "runtime-intelligence";
  private static final String DEFAULT_HTTP_HOST = "0.0.0.0";
  private static final int DEFAULT_HTTP_PORT = 5001;

  private final Config appConfig;
  private final MeterRegistry meterRegistry;
  private final Clock clock;
  private RuntimeIntelligencePipeline pipeline;
  private HttpServer httpServer;
  private Scheduler scheduler;
  private JobManager jobManager;

  public RuntimeIntelligenceService(Config appConfig, MeterRegistry meterRegistry, Clock clock) {
    this.appConfig = appConfig;
    this.meterRegistry = meterRegistry;
    this.clock = clock;
  }

  /** Reads configuration and builds every component; configuration errors fail here. */
  public void init() {
    RuntimeConfigLoader configLoader = new RuntimeConfigLoader(appConfig, clock);
    RuntimeConfig runtimeConfig = configLoader.load();

    NotificationSenderConfig senderConfig = NotificationSenderConfig.from(appConfig);
    Config notificationConfig = section(NOTIFICATION_CONFIG);
    NotificationEventProcessor notificationProcessor =
        new NotificationEventProcessor(
            NotificationDeliveryConfig.fromConfig(notificationConfig),
            runtimeConfig.getChannels(),
            new WebhookNotifier(
                new WebhookSender(
                    HttpWithJsonSender.withTimeouts(
                        senderConfig.getConnectTimeout(), senderConfig.getReadTimeout()))),
            meterRegistry,
            clock);

    Config annotationSection = section(ANNOTATION_CONFIG);
    DashboardMappings mappings =
        DashboardMappings.fromConfig(annotationSection, senderConfig.getDashboardBaseUrl());
    AnnotationConfig annotationConfig = AnnotationConfig.fromConfig(annotationSection);
    DashboardAnnotator annotator =
        annotationConfig.isEnabled()
            ? new DashboardAnnotator(
                mappings,
                GrafanaAnnotationClient.fromConfig(annotationConfig),
                meterRegistry,
                clock)
            : null;

    pipeline =
        new RuntimeIntelligencePipeline(
            PipelineConfig.fromConfig(appConfig),
            runtimeConfig,
            notificationProcessor,
            mappings,
            annotator,
            DeadLetterLog.fromConfig(appConfig, clock),
            meterRegistry,
            clock);

    httpServer =
        new HttpServer(
            appConfig.hasPath(HTTP_HOST_CONFIG)
                ? appConfig.getString(HTTP_HOST_CONFIG)
                : DEFAULT_HTTP_HOST,
            appConfig.hasPath(HTTP_PORT_CONFIG)
                ? appConfig.getInt(HTTP_PORT_CONFIG)
                : DEFAULT_HTTP_PORT,
            pipeline);

    try {
      scheduler = new StdSchedulerFactory().getScheduler();
      jobManager = new PipelineJobManager(pipeline, configLoader, metricSource());
      jobManager.initJob(appConfig);
    } catch (SchedulerException e) {
      throw new RuntimeException(e);
    }
    LOGGER.info(
        "Initialized {} with annotations {}",
        serviceName(),
        annotator == null ? "disabled" : "enabled");
  }

  private Config section(String path) {
    return appConfig.hasPath(path) ? appConfig.getConfig(path) : ConfigFactory.empty();
  }

  private MetricSampleSource metricSource() {
    if (!appConfig.hasPath(METRIC_SOURCE_CONFIG)) {
      return null;
    }
    Config sourceConfig = appConfig.getConfig(METRIC_SOURCE_CONFIG);
    return sourceConfig.hasPath(METRIC_SOURCE_URL_CONFIG)
        ? new HttpPollingMetricSampleSource(sourceConfig)
        : null;
  }

  public void start() {
    try {
      httpServer.start();
      jobManager.startJob(scheduler);
      scheduler.start();
    } catch (Exception e) {
      throw new RuntimeException(e);
    }
    LOGGER.info("Started {}", serviceName());
  }

  /** Stops scheduling and intake first, then drains the pipeline. */
  public void stop() {
    try {
      jobManager.stopJob(scheduler);
      scheduler.shutdown(true);
      pipeline.shutdown();
      httpServer.stop();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RuntimeException(e);
    } catch (Exception e) {
      throw new RuntimeException(e);
    }
    LOGGER.info("Stopped {}", serviceName());
  }

  public RuntimeIntelligencePipeline getPipeline() {
    return pipeline;
  }

  public int getHttpPort() {
    return httpServer.getPort();
  }

  private String serviceName() {
    return appConfig.hasPath(SERVICE_NAME_CONFIG)
        ? appConfig.getString(SERVICE_NAME_CONFIG)
        : DEFAULT_SERVICE_NAME;
  }

  public static void main(String[] args) {
    RuntimeIntelligenceService service =
        new RuntimeIntelligenceService(
            ConfigFactory.load(), new SimpleMeterRegistry(), Clock.systemUTC());
    service.init();
    Runtime.getRuntime().addShutdownHook(new Thread(service::stop, "shutdown"));
    service.start();
  }
}
