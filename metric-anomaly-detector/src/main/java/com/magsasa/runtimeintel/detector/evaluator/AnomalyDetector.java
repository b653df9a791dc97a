package com.magsasa.runtimeintel.detector.evaluator;

import com.magsasa.runtimeintel.datamodel.AnomalyEvent;
import com.magsasa.runtimeintel.datamodel.MetricSample;
import java.util.Optional;

/**
 * Stateful streaming detector. Implementations are not thread safe: every series must be
 * evaluated by a single owner thread.
 */
public interface AnomalyDetector {

  DetectorSpec getSpec();

  /** Whether this detector evaluates samples of the given metric. */
  boolean accepts(String metricId);

  Optional<AnomalyEvent> evaluate(MetricSample sample);
}
