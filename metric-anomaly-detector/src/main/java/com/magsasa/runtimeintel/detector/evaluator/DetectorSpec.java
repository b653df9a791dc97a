package com.magsasa.runtimeintel.detector.evaluator;

import com.magsasa.runtimeintel.datamodel.ConfigurationException;
import com.magsasa.runtimeintel.datamodel.DetectorKind;
import com.typesafe.config.Config;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import lombok.Builder;
import lombok.Value;

/** Immutable configuration of one named detector. Equal specs describe the same detector. */
@Value
@Builder(toBuilder = true)
public class DetectorSpec {
  private static final String NAME = "name";
  private static final String ALGORITHM = "algorithm";
  private static final String METRIC = "metric";
  private static final String THRESHOLD = "threshold";
  private static final String WINDOW_SIZE = "window-size";
  private static final String WARM_UP_COUNT = "warm-up-count";
  private static final String ALPHA = "alpha";
  private static final String PERCENTILE = "percentile";
  private static final String MARGIN = "margin";
  private static final String CRITICAL_FACTOR = "critical-factor";

  private static final String DEFAULT_METRIC = ".*";
  private static final double DEFAULT_EWMA_ALPHA = 0.3;
  private static final double DEFAULT_EWMA_THRESHOLD = 3.0;
  private static final int DEFAULT_EWMA_WARM_UP = 10;
  private static final double DEFAULT_ZSCORE_THRESHOLD = 3.0;
  private static final int DEFAULT_ZSCORE_WINDOW = 60;
  private static final int DEFAULT_ZSCORE_WARM_UP = 10;
  private static final int DEFAULT_PERCENTILE_WINDOW = 200;
  private static final int DEFAULT_PERCENTILE_WARM_UP = 20;
  private static final double DEFAULT_PERCENTILE = 99.0;
  private static final double DEFAULT_PERCENTILE_MARGIN = 1.0;
  private static final double DEFAULT_CRITICAL_FACTOR = 1.5;

  String name;
  DetectorKind kind;
  String metric;
  double threshold;
  int windowSize;
  int warmUpCount;
  double alpha;
  double percentile;
  double margin;
  double criticalFactor;

  public static DetectorSpec ewma(String name, double alpha, double k, int warmUpCount) {
    return DetectorSpec.builder()
        .name(name)
        .kind(DetectorKind.EWMA)
        .metric(DEFAULT_METRIC)
        .alpha(alpha)
        .threshold(k)
        .warmUpCount(warmUpCount)
        .criticalFactor(DEFAULT_CRITICAL_FACTOR)
        .build()
        .validate();
  }

  public static DetectorSpec zScore(String name, int windowSize, double threshold, int warmUp) {
    return DetectorSpec.builder()
        .name(name)
        .kind(DetectorKind.ZSCORE)
        .metric(DEFAULT_METRIC)
        .windowSize(windowSize)
        .threshold(threshold)
        .warmUpCount(warmUp)
        .criticalFactor(DEFAULT_CRITICAL_FACTOR)
        .build()
        .validate();
  }

  public static DetectorSpec rollingPercentile(
      String name, int windowSize, double percentile, double margin, int warmUp) {
    return DetectorSpec.builder()
        .name(name)
        .kind(DetectorKind.ROLLING_PERCENTILE)
        .metric(DEFAULT_METRIC)
        .windowSize(windowSize)
        .percentile(percentile)
        .margin(margin)
        .threshold(margin)
        .warmUpCount(warmUp)
        .criticalFactor(DEFAULT_CRITICAL_FACTOR)
        .build()
        .validate();
  }

  /** Reads a detector entry of the rules document, applying per algorithm defaults. */
  public static DetectorSpec fromConfig(Config config) {
    if (!config.hasPath(NAME) || !config.hasPath(ALGORITHM)) {
      throw new ConfigurationException("Detector requires both name and algorithm: " + config);
    }
    String name = config.getString(NAME);
    DetectorKind kind = DetectorKind.fromConfigName(config.getString(ALGORITHM));
    DetectorSpecBuilder builder =
        DetectorSpec.builder()
            .name(name)
            .kind(kind)
            .metric(config.hasPath(METRIC) ? config.getString(METRIC) : DEFAULT_METRIC)
            .criticalFactor(getDouble(config, CRITICAL_FACTOR, DEFAULT_CRITICAL_FACTOR));
    switch (kind) {
      case EWMA:
        builder
            .alpha(getDouble(config, ALPHA, DEFAULT_EWMA_ALPHA))
            .threshold(getDouble(config, THRESHOLD, DEFAULT_EWMA_THRESHOLD))
            .warmUpCount(getInt(config, WARM_UP_COUNT, DEFAULT_EWMA_WARM_UP));
        break;
      case ZSCORE:
        builder
            .windowSize(getInt(config, WINDOW_SIZE, DEFAULT_ZSCORE_WINDOW))
            .threshold(getDouble(config, THRESHOLD, DEFAULT_ZSCORE_THRESHOLD))
            .warmUpCount(getInt(config, WARM_UP_COUNT, DEFAULT_ZSCORE_WARM_UP));
        break;
      case ROLLING_PERCENTILE:
        double margin = getDouble(config, MARGIN, DEFAULT_PERCENTILE_MARGIN);
        builder
            .windowSize(getInt(config, WINDOW_SIZE, DEFAULT_PERCENTILE_WINDOW))
            .percentile(getDouble(config, PERCENTILE, DEFAULT_PERCENTILE))
            .margin(margin)
            .threshold(margin)
            .warmUpCount(getInt(config, WARM_UP_COUNT, DEFAULT_PERCENTILE_WARM_UP));
        break;
      default:
        throw new ConfigurationException("Unsupported detector algorithm: " + kind);
    }
    return builder.build().validate();
  }

  DetectorSpec validate() {
    check(name != null && !name.isBlank(), "name is required");
    check(threshold > 0, "threshold must be positive");
    check(criticalFactor >= 1, "critical-factor must be at least 1");
    try {
      Pattern.compile(metric);
    } catch (PatternSyntaxException e) {
      throw new ConfigurationException(
          String.format("Detector %s has an invalid metric pattern: %s", name, metric), e);
    }
    switch (kind) {
      case EWMA:
        check(alpha > 0 && alpha <= 1, "alpha must be in (0, 1]");
        check(warmUpCount >= 1, "warm-up-count must be at least 1");
        break;
      case ZSCORE:
        check(windowSize >= 2, "window-size must be at least 2");
        check(
            warmUpCount >= 2 && warmUpCount <= windowSize, "warm-up-count must be in [2, window]");
        break;
      case ROLLING_PERCENTILE:
        check(windowSize >= 2, "window-size must be at least 2");
        check(percentile > 0 && percentile <= 100, "percentile must be in (0, 100]");
        check(
            warmUpCount >= 1 && warmUpCount <= windowSize, "warm-up-count must be in [1, window]");
        break;
      default:
        break;
    }
    return this;
  }

  private void check(boolean condition, String message) {
    if (!condition) {
      throw new ConfigurationException(String.format("Detector %s: %s", name, message));
    }
  }

  private static double getDouble(Config config, String path, double defaultValue) {
    return config.hasPath(path) ? config.getDouble(path) : defaultValue;
  }

  private static int getInt(Config config, String path, int defaultValue) {
    return config.hasPath(path) ? config.getInt(path) : defaultValue;
  }
}
