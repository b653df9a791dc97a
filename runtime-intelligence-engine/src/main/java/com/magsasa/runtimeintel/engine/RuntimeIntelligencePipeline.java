package com.magsasa.runtimeintel.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.magsasa.runtimeintel.annotation.DashboardAnnotator;
import com.magsasa.runtimeintel.annotation.DashboardMappings;
import com.magsasa.runtimeintel.datamodel.AlertEvent;
import com.magsasa.runtimeintel.datamodel.AnomalyEvent;
import com.magsasa.runtimeintel.datamodel.MetricSample;
import com.magsasa.runtimeintel.datamodel.Notification;
import com.magsasa.runtimeintel.detector.DetectionEngine;
import com.magsasa.runtimeintel.detector.MetricSampleParser;
import com.magsasa.runtimeintel.detector.MetricSampleParser.ParsedSamples;
import com.magsasa.runtimeintel.detector.SampleIngestionException;
import com.magsasa.runtimeintel.engine.config.RuntimeConfig;
import com.magsasa.runtimeintel.notification.service.DeliveryResult;
import com.magsasa.runtimeintel.notification.service.NotificationEventProcessor;
import com.magsasa.runtimeintel.processor.ingest.AlertIngestionException;
import com.magsasa.runtimeintel.processor.ingest.AlertIngestor;
import com.magsasa.runtimeintel.processor.ingest.AlertIngestor.IngestResult;
import com.magsasa.runtimeintel.processor.routing.Router;
import com.magsasa.runtimeintel.processor.routing.RoutingDecision;
import com.magsasa.runtimeintel.processor.suppression.SuppressionDecision;
import com.magsasa.runtimeintel.processor.suppression.SuppressionEngine;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Connects detection, ingestion, suppression, routing, delivery and annotation. Suppression and
 * routing run synchronously on the calling thread; delivery and annotation then run in parallel.
 * Side effects of one fingerprint run one notification at a time, in the order suppression
 * forwarded them, so a RESOLVED never overtakes its OPEN at a channel or at the dashboard.
 */
public class RuntimeIntelligencePipeline {
  private static final Logger LOGGER = LoggerFactory.getLogger(RuntimeIntelligencePipeline.class);

  static final String RUNBOOK_ANNOTATION = "runbook_url";
  static final String DASHBOARD_ANNOTATION = "dashboard_url";
  static final String DELIVERY_FAILED_REASON = "delivery-failed";
  static final String SHUTDOWN_PENDING_REASON = "shutdown-pending";
  private static final String SUPPRESSION_RECORDS_GAUGE =
      "runtime.intelligence.suppression.records";
  private static final String ACTIVE_SERIES_GAUGE = "runtime.intelligence.detector.active.series";

  private final PipelineConfig pipelineConfig;
  private final AtomicReference<RuntimeConfig> runtimeConfig;
  private final DetectionEngine detectionEngine;
  private final SuppressionEngine suppressionEngine;
  private final AlertIngestor alertIngestor;
  private final MetricSampleParser sampleParser = new MetricSampleParser();
  private final NotificationEventProcessor notificationProcessor;
  private final DashboardMappings dashboardMappings;
  // null when annotations are disabled
  private final DashboardAnnotator annotator;
  private final ExecutorService annotationExecutor;
  private final DeadLetterLog deadLetterLog;
  private final PipelineStats stats;
  private final Clock clock;
  private final AtomicBoolean accepting = new AtomicBoolean(true);
  private final Map<CompletableFuture<Void>, Notification> inFlight = new ConcurrentHashMap<>();
  // tail of the side effect chain per fingerprint
  private final ConcurrentMap<String, CompletableFuture<Void>> lanes = new ConcurrentHashMap<>();

  public RuntimeIntelligencePipeline(
      PipelineConfig pipelineConfig,
      RuntimeConfig runtimeConfig,
      NotificationEventProcessor notificationProcessor,
      DashboardMappings dashboardMappings,
      DashboardAnnotator annotator,
      DeadLetterLog deadLetterLog,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.pipelineConfig = pipelineConfig;
    this.runtimeConfig = new AtomicReference<>(runtimeConfig);
    this.notificationProcessor = notificationProcessor;
    this.dashboardMappings = dashboardMappings;
    this.annotator = annotator;
    this.deadLetterLog = deadLetterLog;
    this.clock = clock;
    this.stats = new PipelineStats(meterRegistry);
    this.alertIngestor = new AlertIngestor(clock);
    this.suppressionEngine =
        new SuppressionEngine(pipelineConfig.getSuppressionConfig(), clock, meterRegistry);
    this.annotationExecutor =
        Executors.newFixedThreadPool(
            pipelineConfig.getAnnotationThreads(),
            new ThreadFactoryBuilder().setNameFormat("annotation-%d").setDaemon(true).build());
    this.detectionEngine =
        new DetectionEngine(
            pipelineConfig.getDetectionWorkers(),
            runtimeConfig.getDetectors(),
            this::onAnomaly,
            clock,
            meterRegistry);
    meterRegistry.gauge(SUPPRESSION_RECORDS_GAUGE, suppressionEngine, SuppressionEngine::size);
    meterRegistry.gauge(
        ACTIVE_SERIES_GAUGE, detectionEngine, DetectionEngine::getActiveSeriesCount);
  }

  /** Sink of the detection workers. */
  void onAnomaly(AnomalyEvent anomaly) {
    LOGGER.debug(
        "Anomaly metric={} detector={} score={}",
        anomaly.getMetricId(),
        anomaly.getDetectorName(),
        anomaly.getDeviationScore());
    handle(alertIngestor.fromAnomaly(anomaly));
  }

  /**
   * Normalizes an alert webhook payload and feeds every accepted alert through the pipeline.
   *
   * @throws AlertIngestionException when nothing in the payload could be accepted
   */
  public IngestResult ingestAlerts(JsonNode payload) {
    IngestResult result;
    try {
      result = alertIngestor.ingest(payload);
    } catch (AlertIngestionException e) {
      stats.ingestRejected(1);
      throw e;
    }
    stats.ingestRejected(result.getRejections().size());
    result.getEvents().forEach(this::handle);
    return result;
  }

  /**
   * Hands pushed samples to detection.
   *
   * @throws SampleIngestionException when the document holds no acceptable sample
   */
  public ParsedSamples ingestSamples(JsonNode document) {
    ParsedSamples parsed = sampleParser.parse(document);
    stats.ingestRejected(parsed.getRejections().size());
    if (parsed.getSamples().isEmpty() && !parsed.getRejections().isEmpty()) {
      throw new SampleIngestionException(String.join("; ", parsed.getRejections()));
    }
    submitSamples(parsed.getSamples());
    return parsed;
  }

  /** Submits samples pulled from the metric feed; rejected elements are only counted. */
  public int submitPolled(ParsedSamples parsed) {
    stats.ingestRejected(parsed.getRejections().size());
    return submitSamples(parsed.getSamples());
  }

  public int submitSamples(List<MetricSample> samples) {
    int submitted = 0;
    for (MetricSample sample : samples) {
      if (detectionEngine.submit(sample)) {
        submitted++;
      }
    }
    return submitted;
  }

  /** Runs one event through suppression and routing and starts its side effects. */
  public CompletableFuture<Void> handle(AlertEvent event) {
    stats.processed();
    AtomicReference<CompletableFuture<Void>> sideEffects = new AtomicReference<>();
    SuppressionDecision decision =
        suppressionEngine.offer(event, forwarded -> sideEffects.set(dispatch(forwarded)));
    switch (decision.getOutcome()) {
      case FORWARDED:
        return sideEffects.get();
      case DEDUPLICATED:
        stats.deduplicated();
        return CompletableFuture.completedFuture(null);
      case SUPPRESSED:
        stats.suppressed();
        return CompletableFuture.completedFuture(null);
      default:
        throw new IllegalStateException(
            String.format("Invalid suppression outcome:%s", decision.getOutcome()));
    }
  }

  private CompletableFuture<Void> dispatch(SuppressionDecision decision) {
    AlertEvent alert = decision.getEvent();
    RoutingDecision routing = Router.route(alert, runtimeConfig.get().getRoutingRules());
    stats.routed(routing.isUnrouted());
    Notification notification =
        Notification.builder()
            .alert(alert)
            .transition(decision.getTransition())
            .occurrenceCount(decision.getOccurrenceCount())
            .routeName(routing.getRouteName())
            .unrouted(routing.isUnrouted())
            .channels(routing.getChannels())
            .links(links(alert))
            .createdAt(clock.instant())
            .build();
    LOGGER.info(
        "Dispatching fingerprint={} name={} transition={} route={} channels={}",
        alert.getFingerprint(),
        alert.getName(),
        notification.getTransition(),
        notification.getRouteName(),
        notification.getChannels());

    return enqueue(notification);
  }

  /**
   * Starts the side effects of the notification once those of the previous notification for the
   * same fingerprint have completed. Called with the fingerprint's suppression lock held.
   */
  private CompletableFuture<Void> enqueue(Notification notification) {
    String fingerprint = notification.getAlert().getFingerprint();
    CompletableFuture<Void> done = new CompletableFuture<>();
    track(done, notification);
    CompletableFuture<Void> previous = lanes.put(fingerprint, done);
    if (previous == null) {
      start(notification, done);
    } else {
      previous.whenComplete((ignored, error) -> start(notification, done));
    }
    return done;
  }

  private void start(Notification notification, CompletableFuture<Void> done) {
    String fingerprint = notification.getAlert().getFingerprint();
    CompletableFuture<Void> sideEffects;
    try {
      sideEffects =
          CompletableFuture.allOf(
              notificationProcessor.process(notification).thenAccept(this::onDelivered),
              annotate(notification));
    } catch (RuntimeException e) {
      sideEffects = CompletableFuture.failedFuture(e);
    }
    sideEffects.whenComplete(
        (ignored, error) -> {
          if (error != null) {
            LOGGER.error("Side effects failed for fingerprint={}", fingerprint, error);
          }
          lanes.remove(fingerprint, done);
          done.complete(null);
        });
  }

  private CompletableFuture<Void> annotate(Notification notification) {
    if (annotator == null) {
      return CompletableFuture.completedFuture(null);
    }
    String fingerprint = notification.getAlert().getFingerprint();
    try {
      return CompletableFuture.runAsync(() -> annotator.annotate(notification), annotationExecutor)
          .exceptionally(
              e -> {
                LOGGER.error("Annotation task failed for fingerprint={}", fingerprint, e);
                return null;
              });
    } catch (RejectedExecutionException e) {
      LOGGER.warn("Annotation skipped for fingerprint={}, pipeline is stopping", fingerprint);
      return CompletableFuture.completedFuture(null);
    }
  }

  private void onDelivered(List<DeliveryResult> results) {
    for (DeliveryResult result : results) {
      if (result.isDelivered()) {
        stats.notified();
      } else {
        stats.deliveryFailed();
        if (deadLetterLog.append(DELIVERY_FAILED_REASON, result)) {
          stats.deadLettered();
        }
      }
    }
  }

  private void track(CompletableFuture<Void> future, Notification notification) {
    inFlight.put(future, notification);
    future.whenComplete((ignored, error) -> inFlight.remove(future));
  }

  @VisibleForTesting
  Map<String, String> links(AlertEvent alert) {
    Map<String, String> links = new LinkedHashMap<>();
    Map<String, String> annotations =
        alert.getAnnotations() == null ? Map.of() : alert.getAnnotations();
    Map<String, String> labels = alert.getLabels() == null ? Map.of() : alert.getLabels();
    String dashboard =
        Strings.isNullOrEmpty(annotations.get(DASHBOARD_ANNOTATION))
            ? dashboardMappings.dashboardLink(alert).orElse(null)
            : annotations.get(DASHBOARD_ANNOTATION);
    if (dashboard != null) {
      links.put(Notification.LINK_DASHBOARD, dashboard);
    }
    String runbook =
        Strings.isNullOrEmpty(annotations.get(RUNBOOK_ANNOTATION))
            ? labels.get(RUNBOOK_ANNOTATION)
            : annotations.get(RUNBOOK_ANNOTATION);
    if (!Strings.isNullOrEmpty(runbook)) {
      links.put(Notification.LINK_RUNBOOK, runbook);
    }
    return links;
  }

  /**
   * Periodic upkeep: digests and auto resolutions from the suppression table, idle series and
   * stale open annotations are evicted.
   */
  public void runMaintenance() {
    suppressionEngine.sweep(this::dispatch);
    detectionEngine
        .evictIdleSeries(pipelineConfig.getSeriesIdleTtl())
        .thenAccept(
            evicted -> {
              if (evicted > 0) {
                LOGGER.info("Evicted {} idle series", evicted);
              }
            });
    if (annotator != null) {
      annotator.evictOpenAnnotations(clock.instant().minus(pipelineConfig.getOpenAnnotationTtl()));
    }
  }

  /** Swaps in a new configuration snapshot. */
  public void reload(RuntimeConfig next) {
    RuntimeConfig previous = runtimeConfig.getAndSet(next);
    notificationProcessor.updateChannels(next.getChannels());
    detectionEngine.reload(next.getDetectors());
    LOGGER.info(
        "Applied configuration from {} loaded at {}, previous from {}",
        next.getSource(),
        next.getLoadedAt(),
        previous.getLoadedAt());
  }

  public RuntimeConfig getRuntimeConfig() {
    return runtimeConfig.get();
  }

  public int clearSuppression() {
    return suppressionEngine.clear();
  }

  public boolean isAccepting() {
    return accepting.get() && detectionEngine.isAccepting();
  }

  public Map<String, Object> health() {
    Map<String, Object> health = new LinkedHashMap<>();
    health.put("status", isAccepting() ? "healthy" : "stopping");
    health.put("detectors", detectionEngine.getSampleCounts());
    health.put("active_series", detectionEngine.getActiveSeriesCount());
    health.put("suppression_table_size", suppressionEngine.size());
    Map<String, Object> lastNotifications = new LinkedHashMap<>();
    notificationProcessor
        .getLastDeliveries()
        .forEach(
            (channel, result) -> {
              Map<String, Object> summary = new LinkedHashMap<>();
              summary.put("fingerprint", result.getFingerprint());
              summary.put("transition", result.getTransition());
              summary.put("delivered", result.isDelivered());
              summary.put("completed_at", result.getCompletedAt());
              lastNotifications.put(channel, summary);
            });
    health.put("last_notification", lastNotifications);
    health.put("open_annotations", annotator == null ? 0 : annotator.getOpenAnnotationCount());
    health.put("config_loaded_at", runtimeConfig.get().getLoadedAt());
    return health;
  }

  public Map<String, Long> stats() {
    return stats.snapshot(
        annotator == null ? 0 : annotator.getFailureCount(), detectionEngine.getOutOfOrderCount());
  }

  /**
   * Stops intake, drains detection, flushes pending digests and waits for side effects. Whatever
   * is still in flight at the deadline is written to the dead letter log.
   */
  public void shutdown() throws InterruptedException {
    if (!accepting.compareAndSet(true, false)) {
      return;
    }
    Duration timeout = pipelineConfig.getShutdownTimeout();
    long deadline = System.nanoTime() + timeout.toNanos();
    LOGGER.info("Stopping pipeline, waiting up to {}", timeout);
    detectionEngine.shutdown(timeout);
    suppressionEngine.flushDigests(this::dispatch);

    List<CompletableFuture<Void>> pending = new ArrayList<>(inFlight.keySet());
    try {
      CompletableFuture.allOf(pending.toArray(new CompletableFuture[0]))
          .get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
    } catch (TimeoutException e) {
      LOGGER.warn("{} notifications still in flight at shutdown", inFlight.size());
    } catch (ExecutionException e) {
      LOGGER.error("Side effect failed during shutdown", e);
    }
    for (CompletableFuture<Void> future : pending) {
      Notification notification = inFlight.get(future);
      if (!future.isDone() && notification != null) {
        if (deadLetterLog.append(SHUTDOWN_PENDING_REASON, notification)) {
          stats.deadLettered();
        }
      }
    }
    notificationProcessor.shutdown(Duration.ofNanos(Math.max(0, deadline - System.nanoTime())));
    annotationExecutor.shutdown();
    annotationExecutor.awaitTermination(
        Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
    LOGGER.info("Pipeline stopped");
  }

  @VisibleForTesting
  SuppressionEngine getSuppressionEngine() {
    return suppressionEngine;
  }
}
