package com.magsasa.runtimeintel.datamodel;

import java.util.Locale;

public enum DetectorKind {
  EWMA,
  ZSCORE,
  ROLLING_PERCENTILE;

  public static DetectorKind fromConfigName(String name) {
    switch (name.trim().toLowerCase(Locale.ROOT).replace('_', '-')) {
      case "ewma":
        return EWMA;
      case "zscore":
      case "z-score":
        return ZSCORE;
      case "percentile":
      case "rolling-percentile":
        return ROLLING_PERCENTILE;
      default:
        throw new ConfigurationException(String.format("Invalid detector algorithm:%s", name));
    }
  }
}
