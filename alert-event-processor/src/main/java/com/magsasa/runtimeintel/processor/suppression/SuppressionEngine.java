package com.magsasa.runtimeintel.processor.suppression;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.Striped;
import com.magsasa.runtimeintel.datamodel.AlertEvent;
import com.magsasa.runtimeintel.datamodel.AlertEvent.AlertStatus;
import com.magsasa.runtimeintel.datamodel.Notification.Transition;
import com.magsasa.runtimeintel.processor.suppression.SuppressionDecision.Outcome;
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
import java.util.concurrent.locks.Lock;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collapses repeated firings of the same fingerprint into one notification per suppression
 * window. Every fingerprint is guarded by a lock stripe so unrelated incidents never contend.
 *
 * <p>Callers that need forwarded decisions in order pass a sink to {@link #offer(AlertEvent,
 * Consumer)}, {@link #sweep(Consumer)} or {@link #flushDigests(Consumer)}. The sink runs while the
 * fingerprint's stripe is held, so it sees the decisions of one fingerprint in the order they were
 * made. It must not block.
 */
public class SuppressionEngine {

  private static final Logger LOGGER = LoggerFactory.getLogger(SuppressionEngine.class);

  static final String DECISION_COUNTER = "runtime.intelligence.suppression.decisions";
  private static final String OUTCOME_TAG = "outcome";
  private static final int DEFAULT_LOCK_STRIPES = 64;

  private final ConcurrentMap<String, SuppressionRecord> records = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> decisionCounters = new ConcurrentHashMap<>();
  private final Striped<Lock> locks;
  private final Clock clock;
  private final MeterRegistry meterRegistry;
  private volatile SuppressionConfig config;

  public SuppressionEngine(SuppressionConfig config, Clock clock, MeterRegistry meterRegistry) {
    this(config, clock, meterRegistry, DEFAULT_LOCK_STRIPES);
  }

  @VisibleForTesting
  SuppressionEngine(
      SuppressionConfig config, Clock clock, MeterRegistry meterRegistry, int lockStripes) {
    this.config = config;
    this.clock = clock;
    this.meterRegistry = meterRegistry;
    this.locks = Striped.lock(lockStripes);
  }

  public void updateConfig(SuppressionConfig config) {
    this.config = config;
  }

  public SuppressionDecision offer(AlertEvent event) {
    return offer(event, decision -> {});
  }

  public SuppressionDecision offer(AlertEvent event, Consumer<SuppressionDecision> onForward) {
    Instant now = clock.instant();
    Lock lock = locks.get(event.getFingerprint());
    lock.lock();
    try {
      SuppressionDecision decision = event.isResolved() ? resolve(event, now) : fire(event, now);
      getDecisionCounter(decision.getOutcome()).increment();
      if (decision.isForwarded()) {
        onForward.accept(decision);
      }
      LOGGER.debug(
          "Suppression decision fingerprint={} outcome={} transition={} count={}",
          event.getFingerprint(),
          decision.getOutcome(),
          decision.getTransition(),
          decision.getOccurrenceCount());
      return decision;
    } finally {
      lock.unlock();
    }
  }

  private SuppressionDecision fire(AlertEvent event, Instant now) {
    SuppressionConfig current = config;
    SuppressionRecord record = records.get(event.getFingerprint());
    if (record == null || record.getState() == SuppressionState.RESOLVED) {
      record = new SuppressionRecord(event, now, now.plus(current.getSuppressionWindow()));
      records.put(event.getFingerprint(), record);
      return SuppressionDecision.forward(Transition.OPEN, 1, event);
    }

    Instant previousArrival = record.touch(event, now);
    if (!now.isBefore(record.getMutedUntil())) {
      record.open(event.getSeverity(), now.plus(current.getSuppressionWindow()));
      return SuppressionDecision.forward(Transition.OPEN, record.getOccurrenceCount(), event);
    }
    if (event.getSeverity() == record.getSeverity()
        && !now.isAfter(previousArrival.plus(current.getDedupWindow()))) {
      record.deduplicate();
      return SuppressionDecision.drop(Outcome.DEDUPLICATED, record.getOccurrenceCount(), event);
    }
    // an escalation inside the window only raises the severity the next digest reports
    record.suppress(event.getSeverity());
    return SuppressionDecision.drop(Outcome.SUPPRESSED, record.getOccurrenceCount(), event);
  }

  private SuppressionDecision resolve(AlertEvent event, Instant now) {
    SuppressionRecord record = records.get(event.getFingerprint());
    if (record == null) {
      record = new SuppressionRecord(event, now, now);
      records.put(event.getFingerprint(), record);
    }
    record.resolve(event, now);
    return SuppressionDecision.forward(Transition.RESOLVED, record.getOccurrenceCount(), event);
  }

  /**
   * Emits digests for windows that closed with suppressed arrivals, auto-resolves quiet detector
   * incidents and evicts records that are no longer needed.
   */
  public SweepResult sweep() {
    return sweep(decision -> {});
  }

  public SweepResult sweep(Consumer<SuppressionDecision> onForward) {
    Instant now = clock.instant();
    SuppressionConfig current = config;
    List<SuppressionDecision> notifications = new ArrayList<>();
    int evicted = 0;
    for (String fingerprint : records.keySet()) {
      Lock lock = locks.get(fingerprint);
      lock.lock();
      try {
        SuppressionRecord record = records.get(fingerprint);
        if (record == null) {
          continue;
        }
        if (record.getState() == SuppressionState.RESOLVED) {
          if (!now.isBefore(record.getMutedUntil().plus(current.getGracePeriod()))) {
            records.remove(fingerprint);
            evicted++;
          }
          continue;
        }
        boolean quiet =
            record.isFromDetector()
                && !now.isBefore(record.getLastSeen().plus(current.getAutoResolveAfter()));
        if (record.getSuppressedSinceDigest() > 0
            && (quiet || !now.isBefore(record.getMutedUntil()))) {
          emit(digest(record), notifications, onForward);
        }
        if (quiet) {
          emit(autoResolve(record, now), notifications, onForward);
          continue;
        }
        if (!now.isBefore(record.getLastSeen().plus(current.getIdleTtl()))) {
          records.remove(fingerprint);
          evicted++;
        }
      } finally {
        lock.unlock();
      }
    }
    if (!notifications.isEmpty() || evicted > 0) {
      LOGGER.info(
          "Suppression sweep emitted {} notifications and evicted {} records",
          notifications.size(),
          evicted);
    }
    return new SweepResult(notifications, evicted);
  }

  private static void emit(
      SuppressionDecision decision,
      List<SuppressionDecision> notifications,
      Consumer<SuppressionDecision> onForward) {
    notifications.add(decision);
    onForward.accept(decision);
  }

  private static SuppressionDecision digest(SuppressionRecord record) {
    SuppressionDecision decision =
        SuppressionDecision.forward(
            Transition.DIGEST, record.getOccurrenceCount(), record.digestEvent());
    record.digestSent();
    return decision;
  }

  private SuppressionDecision autoResolve(SuppressionRecord record, Instant now) {
    AlertEvent last = record.getLastEvent();
    AlertEvent resolved =
        last.toBuilder().status(AlertStatus.RESOLVED).resolvedAt(last.getStartedAt()).build();
    record.resolve(resolved, now);
    LOGGER.info(
        "Auto resolved fingerprint={} after {} without anomalies",
        record.getFingerprint(),
        config.getAutoResolveAfter());
    return SuppressionDecision.forward(
        Transition.RESOLVED, record.getOccurrenceCount(), resolved);
  }

  /** Emits a digest for every open incident with unreported arrivals, windows elapsed or not. */
  public List<SuppressionDecision> flushDigests() {
    return flushDigests(decision -> {});
  }

  public List<SuppressionDecision> flushDigests(Consumer<SuppressionDecision> onForward) {
    List<SuppressionDecision> digests = new ArrayList<>();
    for (String fingerprint : records.keySet()) {
      Lock lock = locks.get(fingerprint);
      lock.lock();
      try {
        SuppressionRecord record = records.get(fingerprint);
        if (record != null
            && record.getState() != SuppressionState.RESOLVED
            && record.getSuppressedSinceDigest() > 0) {
          emit(digest(record), digests, onForward);
        }
      } finally {
        lock.unlock();
      }
    }
    return digests;
  }

  /** Drops every record. Returns how many were held. */
  public int clear() {
    int size = records.size();
    records.clear();
    LOGGER.info("Cleared {} suppression records", size);
    return size;
  }

  public int size() {
    return records.size();
  }

  public Optional<SuppressionRecord> find(String fingerprint) {
    Lock lock = locks.get(fingerprint);
    lock.lock();
    try {
      return Optional.ofNullable(records.get(fingerprint)).map(SuppressionRecord::copy);
    } finally {
      lock.unlock();
    }
  }

  private Counter getDecisionCounter(Outcome outcome) {
    return decisionCounters.computeIfAbsent(
        outcome.name(),
        key -> meterRegistry.counter(DECISION_COUNTER, OUTCOME_TAG, key.toLowerCase(Locale.ROOT)));
  }

  public static class SweepResult {
    private final List<SuppressionDecision> notifications;
    private final int evicted;

    SweepResult(List<SuppressionDecision> notifications, int evicted) {
      this.notifications = notifications;
      this.evicted = evicted;
    }

    public List<SuppressionDecision> getNotifications() {
      return notifications;
    }

    public int getEvicted() {
      return evicted;
    }
  }
}
