package com.magsasa.runtimeintel.detector.evaluator;

import com.magsasa.runtimeintel.datamodel.Severity;

public class EvaluatorUtil {
  static final double RELATIVE_EPSILON = 1e-9;

  /** A spread this small relative to the baseline is floating point noise, not variance. */
  static boolean isZeroSpread(double spread, double baseline) {
    return !(spread > RELATIVE_EPSILON * Math.max(1d, Math.abs(baseline)));
  }

  static Severity severityOf(double deviationScore, double threshold, double criticalFactor) {
    return Math.abs(deviationScore) >= threshold * criticalFactor
        ? Severity.CRITICAL
        : Severity.WARNING;
  }

  /** Linear interpolation between closest ranks over the first {@code size} sorted values. */
  static double percentile(double[] sorted, int size, double percentile) {
    if (size == 1) {
      return sorted[0];
    }
    double rank = percentile / 100d * (size - 1);
    int lower = (int) Math.floor(rank);
    int upper = (int) Math.ceil(rank);
    return sorted[lower] + (sorted[upper] - sorted[lower]) * (rank - lower);
  }
}
