package com.magsasa.runtimeintel.engine;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.LinkedHashMap;
import java.util.Map;

/** Pipeline level counters backing {@code /stats}. */
public class PipelineStats {
  static final String PIPELINE_COUNTER = "runtime.intelligence.pipeline.events";
  private static final String STAGE_TAG = "stage";

  private final Counter processed;
  private final Counter suppressed;
  private final Counter deduplicated;
  private final Counter routed;
  private final Counter unrouted;
  private final Counter notified;
  private final Counter deliveryFailed;
  private final Counter ingestRejected;
  private final Counter deadLettered;

  public PipelineStats(MeterRegistry meterRegistry) {
    this.processed = counter(meterRegistry, "processed");
    this.suppressed = counter(meterRegistry, "suppressed");
    this.deduplicated = counter(meterRegistry, "deduplicated");
    this.routed = counter(meterRegistry, "routed");
    this.unrouted = counter(meterRegistry, "unrouted");
    this.notified = counter(meterRegistry, "notified");
    this.deliveryFailed = counter(meterRegistry, "delivery_failed");
    this.ingestRejected = counter(meterRegistry, "ingest_rejected");
    this.deadLettered = counter(meterRegistry, "dead_lettered");
  }

  private static Counter counter(MeterRegistry meterRegistry, String stage) {
    return meterRegistry.counter(PIPELINE_COUNTER, STAGE_TAG, stage);
  }

  void processed() {
    processed.increment();
  }

  void suppressed() {
    suppressed.increment();
  }

  void deduplicated() {
    deduplicated.increment();
  }

  void routed(boolean isUnrouted) {
    (isUnrouted ? unrouted : routed).increment();
  }

  void notified() {
    notified.increment();
  }

  void deliveryFailed() {
    deliveryFailed.increment();
  }

  void ingestRejected(int count) {
    ingestRejected.increment(count);
  }

  void deadLettered() {
    deadLettered.increment();
  }

  /**
   * Current counter values. Annotation failures and out of order samples are owned by the
   * annotator and the detectors and are passed in.
   */
  public Map<String, Long> snapshot(long annotationFailed, long outOfOrder) {
    Map<String, Long> stats = new LinkedHashMap<>();
    stats.put("processed", (long) processed.count());
    stats.put("suppressed", (long) suppressed.count());
    stats.put("deduplicated", (long) deduplicated.count());
    stats.put("routed", (long) routed.count());
    stats.put("unrouted", (long) unrouted.count());
    stats.put("notified", (long) notified.count());
    stats.put("delivery_failed", (long) deliveryFailed.count());
    stats.put("annotation_failed", annotationFailed);
    stats.put("ingest_rejected", (long) ingestRejected.count());
    stats.put("out_of_order", outOfOrder);
    stats.put("dead_lettered", (long) deadLettered.count());
    return stats;
  }
}
