package com.magsasa.runtimeintel.datamodel;

import com.google.common.base.Preconditions;
import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/** Identity of a single time series: metric id plus its label set in key order. */
@Getter
@EqualsAndHashCode
public final class SeriesKey {
  private final String metricId;
  private final SortedMap<String, String> labels;

  private SeriesKey(String metricId, SortedMap<String, String> labels) {
    this.metricId = metricId;
    this.labels = Collections.unmodifiableSortedMap(labels);
  }

  public static SeriesKey of(String metricId, Map<String, String> labels) {
    Preconditions.checkArgument(metricId != null && !metricId.isEmpty(), "metric id is required");
    return new SeriesKey(metricId, labels == null ? new TreeMap<>() : new TreeMap<>(labels));
  }

  /** Index of the worker owning this series among {@code shardCount} workers. */
  public int shard(int shardCount) {
    return Math.floorMod(hashCode(), shardCount);
  }

  @Override
  public String toString() {
    return metricId + labels;
  }
}
