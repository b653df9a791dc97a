package com.magsasa.runtimeintel.detector.evaluator;

import com.magsasa.runtimeintel.datamodel.ConfigurationException;
import java.time.Clock;

public class DetectorFactory {

  private final Clock clock;

  public DetectorFactory(Clock clock) {
    this.clock = clock;
  }

  public AbstractSeriesDetector<?> create(DetectorSpec spec) {
    switch (spec.getKind()) {
      case EWMA:
        return new EwmaDetector(spec, clock);
      case ZSCORE:
        return new ZScoreDetector(spec, clock);
      case ROLLING_PERCENTILE:
        return new RollingPercentileDetector(spec, clock);
      default:
        throw new ConfigurationException(
            String.format("Invalid detector algorithm:%s", spec.getKind()));
    }
  }
}
