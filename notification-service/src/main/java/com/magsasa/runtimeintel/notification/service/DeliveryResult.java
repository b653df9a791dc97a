package com.magsasa.runtimeintel.notification.service;

import com.magsasa.runtimeintel.datamodel.Notification.Transition;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/** Outcome of delivering one notification to one channel, after all retries. */
@Value
@Builder
public class DeliveryResult {
  String channelId;
  String fingerprint;
  Transition transition;
  boolean delivered;
  int attempts;
  String error;
  Instant completedAt;
}
