package com.magsasa.runtimeintel.engine.config;

import com.magsasa.runtimeintel.detector.evaluator.DetectorSpec;
import com.magsasa.runtimeintel.notification.service.NotificationChannel;
import com.magsasa.runtimeintel.processor.routing.RoutingRules;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Everything that can change on a reload: detectors, routes and channels. A snapshot is never
 * modified; a reload builds a new one and swaps it in as a whole.
 */
@Value
@Builder
public class RuntimeConfig {
  List<DetectorSpec> detectors;
  RoutingRules routingRules;
  Map<String, NotificationChannel> channels;
  String source;
  Instant loadedAt;
}
