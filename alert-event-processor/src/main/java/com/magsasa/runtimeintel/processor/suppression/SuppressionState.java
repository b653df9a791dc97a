package com.magsasa.runtimeintel.processor.suppression;

public enum SuppressionState {
  OPEN,
  SUPPRESSED,
  RESOLVED
}
