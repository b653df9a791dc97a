package com.magsasa.runtimeintel.datamodel;

import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.Value;

/** One observation of a metric series. */
@Value
@Builder
public class MetricSample {
  String metricId;
  Map<String, String> labels;
  Instant timestamp;
  double value;

  // built on first use, then shared by shard selection and every detector
  @Getter(lazy = true)
  @EqualsAndHashCode.Exclude
  @ToString.Exclude
  SeriesKey seriesKey = SeriesKey.of(metricId, labels);

  /** Converts epoch seconds with a millisecond fraction, as sent by metric feeds. */
  public static Instant fromEpochSeconds(double epochSeconds) {
    return Instant.ofEpochMilli(Math.round(epochSeconds * 1000d));
  }
}
