package com.magsasa.runtimeintel.detector.evaluator;

import com.magsasa.runtimeintel.datamodel.AnomalyEvent;
import com.magsasa.runtimeintel.datamodel.MetricSample;
import com.magsasa.runtimeintel.datamodel.SeriesKey;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.LongAdder;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps one lazily created state per series and rejects samples that do not move the series
 * forward in time. Subclasses only implement the scoring for a single accepted value.
 */
public abstract class AbstractSeriesDetector<S extends AbstractSeriesDetector.SeriesState>
    implements AnomalyDetector {

  private static final Logger LOGGER = LoggerFactory.getLogger(AbstractSeriesDetector.class);

  protected final DetectorSpec spec;
  private final Pattern metricPattern;
  private final Clock clock;
  private final Map<SeriesKey, S> series = new HashMap<>();
  private final LongAdder sampleCount = new LongAdder();
  private final LongAdder outOfOrderCount = new LongAdder();
  private final LongAdder anomalyCount = new LongAdder();
  private volatile int seriesCount;

  protected AbstractSeriesDetector(DetectorSpec spec, Clock clock) {
    this.spec = spec;
    this.metricPattern = Pattern.compile(spec.getMetric());
    this.clock = clock;
  }

  protected abstract S newState();

  /** Scores {@code value} against the state before absorbing it, then absorbs it. */
  protected abstract EvaluationResult evaluate(S state, double value, Instant timestamp);

  @Override
  public DetectorSpec getSpec() {
    return spec;
  }

  @Override
  public boolean accepts(String metricId) {
    return metricPattern.matcher(metricId).matches();
  }

  @Override
  public Optional<AnomalyEvent> evaluate(MetricSample sample) {
    if (!Double.isFinite(sample.getValue())) {
      return Optional.empty();
    }
    SeriesKey key = sample.getSeriesKey();
    S state = series.get(key);
    if (state == null) {
      state = newState();
      series.put(key, state);
      seriesCount = series.size();
    }
    Instant timestamp = sample.getTimestamp();
    if (state.lastTimestamp != null && !timestamp.isAfter(state.lastTimestamp)) {
      outOfOrderCount.increment();
      LOGGER.debug(
          "Detector {} dropped out of order sample for {} at {}, last accepted {}",
          spec.getName(),
          key,
          timestamp,
          state.lastTimestamp);
      return Optional.empty();
    }
    sampleCount.increment();
    if (state.firstTimestamp == null) {
      state.firstTimestamp = timestamp;
    }
    state.lastTimestamp = timestamp;
    state.lastArrival = clock.instant();

    EvaluationResult result = evaluate(state, sample.getValue(), timestamp);
    if (!result.isViolation()) {
      return Optional.empty();
    }
    anomalyCount.increment();
    AnomalyEvent event =
        AnomalyEvent.builder()
            .eventId(UUID.randomUUID().toString())
            .metricId(sample.getMetricId())
            .labels(key.getLabels())
            .detectorKind(spec.getKind())
            .detectorName(spec.getName())
            .observedValue(sample.getValue())
            .baselineValue(result.getBaseline())
            .deviationScore(result.getDeviationScore())
            .severity(
                EvaluatorUtil.severityOf(
                    result.getDeviationScore(), spec.getThreshold(), spec.getCriticalFactor()))
            .detectedAt(timestamp)
            .windowStart(
                result.getWindowStart() == null ? state.firstTimestamp : result.getWindowStart())
            .windowEnd(timestamp)
            .build();
    LOGGER.debug("Detector {} flagged {}", spec.getName(), event);
    return Optional.of(event);
  }

  /** Drops series without samples for longer than {@code idleTtl}. Returns the evicted count. */
  public int evictIdle(Instant now, Duration idleTtl) {
    int evicted = 0;
    Iterator<S> iterator = series.values().iterator();
    while (iterator.hasNext()) {
      S state = iterator.next();
      if (state.lastArrival != null && state.lastArrival.plus(idleTtl).isBefore(now)) {
        iterator.remove();
        evicted++;
      }
    }
    seriesCount = series.size();
    return evicted;
  }

  public long getSampleCount() {
    return sampleCount.sum();
  }

  public long getOutOfOrderCount() {
    return outOfOrderCount.sum();
  }

  public long getAnomalyCount() {
    return anomalyCount.sum();
  }

  public int getSeriesCount() {
    return seriesCount;
  }

  /** Bookkeeping shared by every series state. */
  public static class SeriesState {
    Instant firstTimestamp;
    Instant lastTimestamp;
    Instant lastArrival;
  }
}
