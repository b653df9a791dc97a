package com.magsasa.runtimeintel.detector.evaluator;

import java.time.Clock;
import java.time.Instant;

/**
 * Sliding window z-score. Mean and sample standard deviation come from running sums over the
 * window excluding the newest value. Sums are kept relative to the first value of the series and
 * recomputed exactly once per window length to bound accumulated rounding error.
 */
public class ZScoreDetector extends AbstractSeriesDetector<ZScoreDetector.WindowState> {

  public ZScoreDetector(DetectorSpec spec, Clock clock) {
    super(spec, clock);
  }

  @Override
  protected WindowState newState() {
    return new WindowState(spec.getWindowSize());
  }

  @Override
  protected EvaluationResult evaluate(WindowState state, double value, Instant timestamp) {
    if (state.size == 0) {
      state.shift = value;
    }
    EvaluationResult result = EvaluationResult.NO_SIGNAL;
    if (state.size >= spec.getWarmUpCount()) {
      double shiftedMean = state.sum / state.size;
      double variance =
          Math.max(0d, (state.sumOfSquares - state.size * shiftedMean * shiftedMean))
              / (state.size - 1);
      double mean = shiftedMean + state.shift;
      double stdDev = Math.sqrt(variance);
      if (!EvaluatorUtil.isZeroSpread(stdDev, mean)) {
        double z = (value - mean) / stdDev;
        if (Math.abs(z) > spec.getThreshold()) {
          result =
              EvaluationResult.builder()
                  .isViolation(true)
                  .baseline(mean)
                  .deviationScore(z)
                  .windowStart(state.oldestTimestamp())
                  .build();
        }
      }
    }
    state.add(value, timestamp);
    return result;
  }

  static class WindowState extends AbstractSeriesDetector.SeriesState {
    private final double[] values;
    private final Instant[] timestamps;
    private int size;
    private int next;
    private int insertsSinceRecompute;
    private double shift;
    private double sum;
    private double sumOfSquares;

    WindowState(int capacity) {
      this.values = new double[capacity];
      this.timestamps = new Instant[capacity];
    }

    Instant oldestTimestamp() {
      return size == values.length ? timestamps[next] : timestamps[0];
    }

    void add(double value, Instant timestamp) {
      double shifted = value - shift;
      if (size == values.length) {
        double evicted = values[next] - shift;
        sum -= evicted;
        sumOfSquares -= evicted * evicted;
      } else {
        size++;
      }
      values[next] = value;
      timestamps[next] = timestamp;
      next = (next + 1) % values.length;
      sum += shifted;
      sumOfSquares += shifted * shifted;

      if (++insertsSinceRecompute >= values.length) {
        recompute();
      }
    }

    private void recompute() {
      double exactSum = 0;
      double exactSumOfSquares = 0;
      for (int i = 0; i < size; i++) {
        double shifted = values[i] - shift;
        exactSum += shifted;
        exactSumOfSquares += shifted * shifted;
      }
      sum = exactSum;
      sumOfSquares = exactSumOfSquares;
      insertsSinceRecompute = 0;
    }
  }
}
