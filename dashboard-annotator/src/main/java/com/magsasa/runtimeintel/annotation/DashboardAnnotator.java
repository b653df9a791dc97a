package com.magsasa.runtimeintel.annotation;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.Striped;
import com.magsasa.runtimeintel.annotation.grafana.GrafanaAnnotationClient;
import com.magsasa.runtimeintel.datamodel.AlertEvent;
import com.magsasa.runtimeintel.datamodel.Notification;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Marks incidents on the dashboards that chart them. OPEN creates an annotation and remembers
 * it by fingerprint, RESOLVED closes that annotation into a region, or writes a point when no
 * open annotation is known. Failures are logged and counted and never thrown.
 */
public class DashboardAnnotator {
  private static final Logger LOGGER = LoggerFactory.getLogger(DashboardAnnotator.class);

  static final String WRITE_COUNTER = "runtime.intelligence.annotation.writes";
  private static final String ACTION_TAG = "action";
  private static final String RESULT_TAG = "result";
  static final String TAG_ANOMALY = "anomaly";
  static final String TAG_ALERT = "alert";
  static final String TAG_RESOLVED = "resolved";
  static final String TAG_RUNTIME_INTELLIGENCE = "runtime-intelligence";

  private final GrafanaAnnotationClient client;
  private final MeterRegistry meterRegistry;
  private final Clock clock;
  private final Striped<Lock> locks = Striped.lock(64);
  private final ConcurrentMap<String, Annotation> openAnnotations = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final AtomicLong failures = new AtomicLong();
  private volatile DashboardMappings mappings;

  public DashboardAnnotator(
      DashboardMappings mappings,
      GrafanaAnnotationClient client,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.mappings = mappings;
    this.client = client;
    this.meterRegistry = meterRegistry;
    this.clock = clock;
  }

  public void updateMappings(DashboardMappings mappings) {
    this.mappings = mappings;
  }

  public DashboardMappings getMappings() {
    return mappings;
  }

  public Optional<Annotation> annotate(Notification notification) {
    AlertEvent alert = notification.getAlert();
    Optional<PanelMapping> mapping = mappings.find(alert);
    if (mapping.isEmpty()) {
      LOGGER.debug("No dashboard mapping for name={}", alert.getName());
      return Optional.empty();
    }
    Lock lock = locks.get(alert.getFingerprint());
    lock.lock();
    try {
      switch (notification.getTransition()) {
        case OPEN:
          return open(alert, mapping.get());
        case RESOLVED:
          return resolve(alert, mapping.get());
        case DIGEST:
          return Optional.empty();
        default:
          throw new IllegalArgumentException(
              String.format("Invalid transition type:%s", notification.getTransition()));
      }
    } finally {
      lock.unlock();
    }
  }

  private Optional<Annotation> open(AlertEvent alert, PanelMapping mapping) {
    if (openAnnotations.containsKey(alert.getFingerprint())) {
      LOGGER.debug("Annotation already open for fingerprint={}", alert.getFingerprint());
      return Optional.empty();
    }
    Annotation annotation = newAnnotation(alert, mapping, startTime(alert), null);
    try {
      Annotation created = annotation.toBuilder().remoteId(client.create(annotation)).build();
      openAnnotations.put(alert.getFingerprint(), created);
      record("create", true);
      return Optional.of(created);
    } catch (AnnotationWriteException e) {
      onFailure("create", alert, e);
      return Optional.empty();
    }
  }

  private Optional<Annotation> resolve(AlertEvent alert, PanelMapping mapping) {
    Instant endTime = alert.getResolvedAt() == null ? clock.instant() : alert.getResolvedAt();
    Annotation open = openAnnotations.get(alert.getFingerprint());
    if (open != null) {
      Annotation closed =
          open.toBuilder()
              .endTime(endTime.isBefore(open.getStartTime()) ? open.getStartTime() : endTime)
              .tags(withTag(open.getTags(), TAG_RESOLVED))
              .build();
      try {
        client.close(open.getRemoteId(), closed);
        openAnnotations.remove(alert.getFingerprint());
        record("close", true);
        return Optional.of(closed);
      } catch (AnnotationWriteException e) {
        onFailure("close", alert, e);
        return Optional.empty();
      }
    }

    Annotation point =
        newAnnotation(alert, mapping, endTime, endTime).toBuilder()
            .tags(withTag(tags(alert), TAG_RESOLVED))
            .build();
    try {
      Annotation created = point.toBuilder().remoteId(client.create(point)).build();
      record("point", true);
      return Optional.of(created);
    } catch (AnnotationWriteException e) {
      onFailure("point", alert, e);
      return Optional.empty();
    }
  }

  /** Forgets open annotations started before {@code cutoff}. Returns how many were dropped. */
  public int evictOpenAnnotations(Instant cutoff) {
    List<String> stale = new ArrayList<>();
    openAnnotations.forEach(
        (fingerprint, annotation) -> {
          if (annotation.getStartTime().isBefore(cutoff)) {
            stale.add(fingerprint);
          }
        });
    stale.forEach(openAnnotations::remove);
    if (!stale.isEmpty()) {
      LOGGER.info("Evicted {} open annotations started before {}", stale.size(), cutoff);
    }
    return stale.size();
  }

  public int getOpenAnnotationCount() {
    return openAnnotations.size();
  }

  @VisibleForTesting
  Optional<Annotation> findOpen(String fingerprint) {
    return Optional.ofNullable(openAnnotations.get(fingerprint));
  }

  public long getFailureCount() {
    return failures.get();
  }

  private Instant startTime(AlertEvent alert) {
    return alert.getStartedAt() == null ? clock.instant() : alert.getStartedAt();
  }

  private static Annotation newAnnotation(
      AlertEvent alert, PanelMapping mapping, Instant start, Instant end) {
    return Annotation.builder()
        .eventId(alert.getEventId())
        .fingerprint(alert.getFingerprint())
        .dashboardUid(mapping.getDashboardUid())
        .dashboardId(mapping.getDashboardId())
        .panelId(mapping.getPanelId())
        .startTime(start)
        .endTime(end)
        .text(text(alert))
        .tags(tags(alert))
        .build();
  }

  @VisibleForTesting
  static String text(AlertEvent alert) {
    StringBuilder text = new StringBuilder();
    String severity = alert.getSeverity().label();
    if (alert.isFromDetector()) {
      text.append("Anomaly detected\nMetric: ").append(alert.getName());
      text.append("\nSeverity: ").append(severity);
    } else {
      text.append(alert.getSummary());
      text.append("\nService: ").append(alert.getService());
      text.append("\nSeverity: ").append(severity);
      if (alert.getDescription() != null) {
        text.append('\n').append(alert.getDescription());
      }
    }
    if (alert.getObservedValue() != null) {
      text.append(String.format(Locale.ROOT, "\nCurrent: %.3f", alert.getObservedValue()));
    }
    if (alert.getBaselineValue() != null) {
      text.append(String.format(Locale.ROOT, "\nBaseline: %.3f", alert.getBaselineValue()));
    }
    return text.toString();
  }

  @VisibleForTesting
  static List<String> tags(AlertEvent alert) {
    List<String> tags = new ArrayList<>();
    String severityTag = "severity-" + alert.getSeverity().label();
    if (alert.isFromDetector()) {
      tags.add(TAG_ANOMALY);
      tags.add(severityTag);
      tags.add("metric-" + alert.getName());
    } else {
      tags.add(TAG_ALERT);
      tags.add(severityTag);
      tags.add("alert-" + alert.getName());
      tags.add("service-" + alert.getService());
    }
    tags.add(TAG_RUNTIME_INTELLIGENCE);
    return tags;
  }

  private static List<String> withTag(List<String> tags, String tag) {
    List<String> result = new ArrayList<>(tags);
    if (!result.contains(tag)) {
      result.add(tag);
    }
    return result;
  }

  private void onFailure(String action, AlertEvent alert, AnnotationWriteException e) {
    failures.incrementAndGet();
    record(action, false);
    LOGGER.warn(
        "Annotation {} failed for fingerprint={} name={}",
        action,
        alert.getFingerprint(),
        alert.getName(),
        e);
  }

  private void record(String action, boolean success) {
    String result = success ? "success" : "failed";
    counters
        .computeIfAbsent(
            action + "." + result,
            key -> meterRegistry.counter(WRITE_COUNTER, ACTION_TAG, action, RESULT_TAG, result))
        .increment();
  }
}
