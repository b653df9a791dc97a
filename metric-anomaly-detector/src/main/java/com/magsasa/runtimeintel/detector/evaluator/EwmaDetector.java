package com.magsasa.runtimeintel.detector.evaluator;

import java.time.Clock;
import java.time.Instant;

/**
 * Exponentially weighted moving average with a smoothed variance. A value is compared against
 * the forecast held before it arrives and is absorbed afterwards whether or not it was flagged.
 */
public class EwmaDetector extends AbstractSeriesDetector<EwmaDetector.EwmaState> {

  public EwmaDetector(DetectorSpec spec, Clock clock) {
    super(spec, clock);
  }

  @Override
  protected EwmaState newState() {
    return new EwmaState();
  }

  @Override
  protected EvaluationResult evaluate(EwmaState state, double value, Instant timestamp) {
    if (state.count == 0) {
      state.mean = value;
      state.variance = 0;
      state.count = 1;
      return EvaluationResult.NO_SIGNAL;
    }

    double forecast = state.mean;
    double sigma = Math.sqrt(state.variance);
    double deviation = value - forecast;
    EvaluationResult result = EvaluationResult.NO_SIGNAL;
    if (state.count >= spec.getWarmUpCount() && !EvaluatorUtil.isZeroSpread(sigma, forecast)) {
      double score = Math.abs(deviation) / sigma;
      if (score > spec.getThreshold()) {
        result =
            EvaluationResult.builder()
                .isViolation(true)
                .baseline(forecast)
                .deviationScore(score)
                .build();
      }
    }

    double alpha = spec.getAlpha();
    state.mean = alpha * value + (1 - alpha) * forecast;
    state.variance = alpha * deviation * deviation + (1 - alpha) * state.variance;
    state.count++;
    return result;
  }

  static class EwmaState extends AbstractSeriesDetector.SeriesState {
    long count;
    double mean;
    double variance;
  }
}
