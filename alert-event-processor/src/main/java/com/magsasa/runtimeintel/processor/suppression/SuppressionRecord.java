package com.magsasa.runtimeintel.processor.suppression;

import com.magsasa.runtimeintel.datamodel.AlertEvent;
import com.magsasa.runtimeintel.datamodel.Severity;
import java.time.Instant;
import lombok.Getter;

/**
 * Suppression bookkeeping for one fingerprint. Instances are only mutated while the stripe lock
 * of their fingerprint is held; callers outside the engine only ever see copies.
 */
@Getter
public class SuppressionRecord {
  private final String fingerprint;
  private final String source;
  private final Instant firstSeen;
  private SuppressionState state;
  private Instant lastSeen;
  private Instant mutedUntil;
  private long occurrenceCount;
  private long suppressedSinceDigest;
  private Severity severity;
  private AlertEvent lastEvent;

  SuppressionRecord(AlertEvent event, Instant now, Instant mutedUntil) {
    this.fingerprint = event.getFingerprint();
    this.source = event.getSource();
    this.firstSeen = now;
    this.state = event.isResolved() ? SuppressionState.RESOLVED : SuppressionState.OPEN;
    this.lastSeen = now;
    this.mutedUntil = mutedUntil;
    this.occurrenceCount = 1;
    this.severity = event.getSeverity();
    this.lastEvent = event;
  }

  private SuppressionRecord(SuppressionRecord other) {
    this.fingerprint = other.fingerprint;
    this.source = other.source;
    this.firstSeen = other.firstSeen;
    this.state = other.state;
    this.lastSeen = other.lastSeen;
    this.mutedUntil = other.mutedUntil;
    this.occurrenceCount = other.occurrenceCount;
    this.suppressedSinceDigest = other.suppressedSinceDigest;
    this.severity = other.severity;
    this.lastEvent = other.lastEvent;
  }

  SuppressionRecord copy() {
    return new SuppressionRecord(this);
  }

  boolean isFromDetector() {
    return source != null && source.startsWith(AlertEvent.DETECTOR_SOURCE_PREFIX);
  }

  /** Records another firing arrival and returns the previous arrival time. */
  Instant touch(AlertEvent event, Instant now) {
    Instant previous = lastSeen;
    occurrenceCount++;
    lastSeen = now;
    lastEvent = event;
    return previous;
  }

  void open(Severity severity, Instant mutedUntil) {
    this.state = SuppressionState.OPEN;
    this.severity = severity;
    this.mutedUntil = mutedUntil;
    this.suppressedSinceDigest = 0;
  }

  /** Counts a muted arrival; a higher severity raises the incident without reopening it. */
  void suppress(Severity arrived) {
    state = SuppressionState.SUPPRESSED;
    suppressedSinceDigest++;
    if (arrived.isAtLeast(severity)) {
      severity = arrived;
    }
  }

  void deduplicate() {
    suppressedSinceDigest++;
  }

  void resolve(AlertEvent event, Instant now) {
    state = SuppressionState.RESOLVED;
    lastSeen = now;
    mutedUntil = now;
    suppressedSinceDigest = 0;
    lastEvent = event;
  }

  /** The latest arrival, carrying the highest severity seen in the current window. */
  AlertEvent digestEvent() {
    return lastEvent.getSeverity() == severity
        ? lastEvent
        : lastEvent.toBuilder().severity(severity).build();
  }

  void digestSent() {
    suppressedSinceDigest = 0;
  }
}
