package com.magsasa.runtimeintel.processor.suppression;

import com.google.common.base.Preconditions;
import com.typesafe.config.Config;
import java.time.Duration;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SuppressionConfig {
  private static final String DEDUP_WINDOW_CONFIG = "dedup-window";
  private static final String SUPPRESSION_WINDOW_CONFIG = "window";
  private static final String GRACE_PERIOD_CONFIG = "grace-period";
  private static final String IDLE_TTL_CONFIG = "idle-ttl";
  private static final String AUTO_RESOLVE_AFTER_CONFIG = "auto-resolve-after";

  private static final Duration DEFAULT_DEDUP_WINDOW = Duration.ofMinutes(5);
  private static final Duration DEFAULT_SUPPRESSION_WINDOW = Duration.ofMinutes(15);
  private static final Duration DEFAULT_GRACE_PERIOD = Duration.ofMinutes(5);
  private static final Duration DEFAULT_IDLE_TTL = Duration.ofHours(24);
  private static final Duration DEFAULT_AUTO_RESOLVE_AFTER = Duration.ofMinutes(15);

  @Builder.Default Duration dedupWindow = DEFAULT_DEDUP_WINDOW;
  @Builder.Default Duration suppressionWindow = DEFAULT_SUPPRESSION_WINDOW;
  @Builder.Default Duration gracePeriod = DEFAULT_GRACE_PERIOD;
  @Builder.Default Duration idleTtl = DEFAULT_IDLE_TTL;
  @Builder.Default Duration autoResolveAfter = DEFAULT_AUTO_RESOLVE_AFTER;

  public static SuppressionConfig defaults() {
    return SuppressionConfig.builder().build();
  }

  public static SuppressionConfig fromConfig(Config config) {
    SuppressionConfig suppressionConfig =
        SuppressionConfig.builder()
            .dedupWindow(durationOrDefault(config, DEDUP_WINDOW_CONFIG, DEFAULT_DEDUP_WINDOW))
            .suppressionWindow(
                durationOrDefault(config, SUPPRESSION_WINDOW_CONFIG, DEFAULT_SUPPRESSION_WINDOW))
            .gracePeriod(durationOrDefault(config, GRACE_PERIOD_CONFIG, DEFAULT_GRACE_PERIOD))
            .idleTtl(durationOrDefault(config, IDLE_TTL_CONFIG, DEFAULT_IDLE_TTL))
            .autoResolveAfter(
                durationOrDefault(config, AUTO_RESOLVE_AFTER_CONFIG, DEFAULT_AUTO_RESOLVE_AFTER))
            .build();
    Preconditions.checkArgument(
        !suppressionConfig.getSuppressionWindow().isNegative()
            && !suppressionConfig.getDedupWindow().isNegative(),
        "suppression windows must not be negative");
    return suppressionConfig;
  }

  private static Duration durationOrDefault(Config config, String path, Duration defaultValue) {
    return config.hasPath(path) ? config.getDuration(path) : defaultValue;
  }
}
