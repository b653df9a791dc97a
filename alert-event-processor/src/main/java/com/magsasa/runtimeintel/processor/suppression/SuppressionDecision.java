package com.magsasa.runtimeintel.processor.suppression;

import com.magsasa.runtimeintel.datamodel.AlertEvent;
import com.magsasa.runtimeintel.datamodel.Notification.Transition;
import lombok.Value;

/** Outcome of offering one event, or of one sweep action, to the {@link SuppressionEngine}. */
@Value
public class SuppressionDecision {
  Outcome outcome;
  Transition transition;
  long occurrenceCount;
  AlertEvent event;

  public boolean isForwarded() {
    return outcome == Outcome.FORWARDED;
  }

  static SuppressionDecision forward(Transition transition, long count, AlertEvent event) {
    return new SuppressionDecision(Outcome.FORWARDED, transition, count, event);
  }

  static SuppressionDecision drop(Outcome outcome, long count, AlertEvent event) {
    return new SuppressionDecision(outcome, null, count, event);
  }

  public enum Outcome {
    FORWARDED,
    DEDUPLICATED,
    SUPPRESSED
  }
}
