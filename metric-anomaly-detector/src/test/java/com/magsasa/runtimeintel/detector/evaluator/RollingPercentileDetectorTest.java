package com.magsasa.runtimeintel.detector.evaluator;

import static com.magsasa.runtimeintel.detector.evaluator.EwmaDetectorTest.START;
import static com.magsasa.runtimeintel.detector.evaluator.EwmaDetectorTest.sample;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.magsasa.runtimeintel.datamodel.AnomalyEvent;
import com.magsasa.runtimeintel.datamodel.Severity;
import java.time.Clock;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class RollingPercentileDetectorTest {

  private static final Clock CLOCK = Clock.fixed(START, ZoneOffset.UTC);

  private RollingPercentileDetector warmedUp() {
    RollingPercentileDetector detector =
        new RollingPercentileDetector(
            DetectorSpec.rollingPercentile("p99", 200, 99, 1.0, 20), CLOCK);
    for (int i = 0; i < 50; i++) {
      assertTrue(detector.evaluate(sample("latency", i, 10 + (i % 10))).isEmpty());
    }
    return detector;
  }

  @Test
  void testValueMustExceedPercentileByMargin() {
    assertTrue(warmedUp().evaluate(sample("latency", 50, 38)).isEmpty());

    Optional<AnomalyEvent> event = warmedUp().evaluate(sample("latency", 50, 39));
    assertTrue(event.isPresent());
    assertEquals(19, event.get().getBaselineValue(), 1e-9);
    assertEquals(20d / 19d, event.get().getDeviationScore(), 1e-9);
    assertEquals(Severity.WARNING, event.get().getSeverity());
  }

  @Test
  void testLargeExcessIsCritical() {
    Optional<AnomalyEvent> event = warmedUp().evaluate(sample("latency", 50, 100));

    assertTrue(event.isPresent());
    assertEquals(Severity.CRITICAL, event.get().getSeverity());
  }

  @Test
  void testConstantWindowNeverSignals() {
    RollingPercentileDetector detector =
        new RollingPercentileDetector(
            DetectorSpec.rollingPercentile("p99", 50, 99, 1.0, 20), CLOCK);
    for (int i = 0; i < 300; i++) {
      assertTrue(detector.evaluate(sample("latency", i, 7.25)).isEmpty());
    }
  }

  @Test
  void testEvictionKeepsSortedWindowConsistent() {
    RollingPercentileDetector detector =
        new RollingPercentileDetector(DetectorSpec.rollingPercentile("p50", 10, 50, 1.0, 5), CLOCK);
    int t = 0;
    for (int i = 0; i < 10; i++) {
      detector.evaluate(sample("latency", t++, 1000 + i));
    }
    // replace the whole window with a lower level
    for (int i = 0; i < 10; i++) {
      detector.evaluate(sample("latency", t++, 10 + (i % 2)));
    }

    assertTrue(detector.evaluate(sample("latency", t++, 21)).isEmpty());
    assertTrue(detector.evaluate(sample("latency", t, 100)).isPresent());
  }

  @Test
  void testPercentileInterpolation() {
    double[] sorted = {1, 2, 3, 4};
    assertEquals(2.5, EvaluatorUtil.percentile(sorted, 4, 50), 1e-9);
    assertEquals(4, EvaluatorUtil.percentile(sorted, 4, 100), 1e-9);
    assertEquals(3.97, EvaluatorUtil.percentile(sorted, 4, 99), 1e-9);
  }
}
