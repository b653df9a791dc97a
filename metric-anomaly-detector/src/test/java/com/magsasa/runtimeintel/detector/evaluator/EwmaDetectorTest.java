package com.magsasa.runtimeintel.detector.evaluator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.magsasa.runtimeintel.datamodel.AnomalyEvent;
import com.magsasa.runtimeintel.datamodel.DetectorKind;
import com.magsasa.runtimeintel.datamodel.MetricSample;
import com.magsasa.runtimeintel.datamodel.Severity;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class EwmaDetectorTest {

  static final Instant START = Instant.parse("2024-01-01T00:00:00Z");
  private static final Clock CLOCK = Clock.fixed(START, ZoneOffset.UTC);

  @Test
  void testSingleSpikeAfterStableSeriesEmitsExactlyOneEvent() {
    EwmaDetector detector = new EwmaDetector(DetectorSpec.ewma("latency-ewma", 0.3, 3, 10), CLOCK);
    List<AnomalyEvent> events = new ArrayList<>();
    int t = 0;
    for (int i = 0; i < 50; i++) {
      detector.evaluate(sample("api.latency", t++, i % 2 == 0 ? 101 : 99)).ifPresent(events::add);
    }
    assertTrue(events.isEmpty());

    detector.evaluate(sample("api.latency", t++, 150)).ifPresent(events::add);
    for (int i = 0; i < 50; i++) {
      double value = i % 2 == 0 ? 100.5 : 99.5;
      detector.evaluate(sample("api.latency", t++, value)).ifPresent(events::add);
    }

    assertEquals(1, events.size());
    AnomalyEvent event = events.get(0);
    assertEquals(150, event.getObservedValue());
    assertEquals(100, event.getBaselineValue(), 1.0);
    assertTrue(event.getDeviationScore() > 3);
    assertEquals(Severity.CRITICAL, event.getSeverity());
    assertEquals(DetectorKind.EWMA, event.getDetectorKind());
    assertEquals("latency-ewma", event.getDetectorName());
    assertEquals(START, event.getWindowStart());
    assertEquals(START.plusSeconds(50), event.getWindowEnd());
    assertEquals(101, detector.getSampleCount());
  }

  @Test
  void testConstantSeriesNeverSignals() {
    EwmaDetector detector = new EwmaDetector(DetectorSpec.ewma("constant", 0.3, 3, 10), CLOCK);
    for (int i = 0; i < 500; i++) {
      assertTrue(detector.evaluate(sample("queue.depth", i, 42.7)).isEmpty());
    }
  }

  @Test
  void testNoSignalBeforeWarmUp() {
    EwmaDetector detector = new EwmaDetector(DetectorSpec.ewma("warm", 0.3, 3, 10), CLOCK);
    for (int i = 0; i < 5; i++) {
      detector.evaluate(sample("cpu", i, i % 2 == 0 ? 10.5 : 9.5));
    }
    assertTrue(detector.evaluate(sample("cpu", 5, 1000)).isEmpty());
  }

  @Test
  void testOutOfOrderSamplesAreDroppedAndCounted() {
    EwmaDetector detector = new EwmaDetector(DetectorSpec.ewma("order", 0.3, 3, 10), CLOCK);
    detector.evaluate(sample("cpu", 10, 1));
    Optional<AnomalyEvent> replayed = detector.evaluate(sample("cpu", 10, 500));
    Optional<AnomalyEvent> older = detector.evaluate(sample("cpu", 3, 500));

    assertTrue(replayed.isEmpty());
    assertTrue(older.isEmpty());
    assertEquals(2, detector.getOutOfOrderCount());
    assertEquals(1, detector.getSampleCount());
  }

  @Test
  void testSeriesAreIndependentAndEvictedWhenIdle() {
    EwmaDetector detector = new EwmaDetector(DetectorSpec.ewma("series", 0.3, 3, 10), CLOCK);
    detector.evaluate(sample("cpu", Map.of("host", "a"), 1, 1));
    detector.evaluate(sample("cpu", Map.of("host", "b"), 1, 1));
    assertEquals(2, detector.getSeriesCount());

    assertEquals(0, detector.evictIdle(START.plus(Duration.ofMinutes(10)), Duration.ofMinutes(30)));
    assertEquals(2, detector.evictIdle(START.plus(Duration.ofMinutes(31)), Duration.ofMinutes(30)));
    assertEquals(0, detector.getSeriesCount());
  }

  static MetricSample sample(String metric, long second, double value) {
    return sample(metric, Map.of("service", "payments"), second, value);
  }

  static MetricSample sample(String metric, Map<String, String> labels, long second, double value) {
    return MetricSample.builder()
        .metricId(metric)
        .labels(labels)
        .timestamp(START.plusSeconds(second))
        .value(value)
        .build();
  }
}
