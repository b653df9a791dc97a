package com.magsasa.runtimeintel.detector.evaluator;

import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;

/**
 * Flags values above the window percentile by more than a relative margin, so with a margin of
 * 1.0 a value has to exceed twice the percentile. The window is kept both in arrival order, for
 * eviction, and sorted, for rank queries.
 */
public class RollingPercentileDetector
    extends AbstractSeriesDetector<RollingPercentileDetector.RankedWindow> {

  public RollingPercentileDetector(DetectorSpec spec, Clock clock) {
    super(spec, clock);
  }

  @Override
  protected RankedWindow newState() {
    return new RankedWindow(spec.getWindowSize());
  }

  @Override
  protected EvaluationResult evaluate(RankedWindow state, double value, Instant timestamp) {
    EvaluationResult result = EvaluationResult.NO_SIGNAL;
    if (state.size >= spec.getWarmUpCount() && state.hasSpread()) {
      double p = EvaluatorUtil.percentile(state.sorted, state.size, spec.getPercentile());
      if (!EvaluatorUtil.isZeroSpread(Math.abs(p), 0d)) {
        double excess = (value - p) / Math.abs(p);
        if (excess > spec.getMargin()) {
          result =
              EvaluationResult.builder()
                  .isViolation(true)
                  .baseline(p)
                  .deviationScore(excess)
                  .windowStart(state.oldestTimestamp())
                  .build();
        }
      }
    }
    state.add(value, timestamp);
    return result;
  }

  static class RankedWindow extends AbstractSeriesDetector.SeriesState {
    private final double[] arrivals;
    private final Instant[] timestamps;
    private final double[] sorted;
    private int size;
    private int next;

    RankedWindow(int capacity) {
      this.arrivals = new double[capacity];
      this.timestamps = new Instant[capacity];
      this.sorted = new double[capacity];
    }

    boolean hasSpread() {
      return sorted[0] != sorted[size - 1];
    }

    Instant oldestTimestamp() {
      return size == arrivals.length ? timestamps[next] : timestamps[0];
    }

    void add(double value, Instant timestamp) {
      if (size == arrivals.length) {
        int index = Arrays.binarySearch(sorted, 0, size, arrivals[next]);
        System.arraycopy(sorted, index + 1, sorted, index, size - index - 1);
        size--;
      }
      int insertAt = Arrays.binarySearch(sorted, 0, size, value);
      if (insertAt < 0) {
        insertAt = -insertAt - 1;
      }
      System.arraycopy(sorted, insertAt, sorted, insertAt + 1, size - insertAt);
      sorted[insertAt] = value;
      size++;

      arrivals[next] = value;
      timestamps[next] = timestamp;
      next = (next + 1) % arrivals.length;
    }
  }
}
