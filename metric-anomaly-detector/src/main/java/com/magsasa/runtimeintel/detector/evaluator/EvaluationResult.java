package com.magsasa.runtimeintel.detector.evaluator;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

@Builder
@Getter
public class EvaluationResult {
  static final EvaluationResult NO_SIGNAL = EvaluationResult.builder().isViolation(false).build();

  private final boolean isViolation;
  private final double baseline;
  private final double deviationScore;
  private final Instant windowStart;
}
