package com.magsasa.runtimeintel.datamodel;

import java.util.Locale;
import java.util.Map;

/** Ordered alert severity. Declaration order is rank order. */
public enum Severity {
  INFO,
  WARNING,
  CRITICAL;

  private static final Map<String, Severity> ALIASES =
      Map.of(
          "info", INFO,
          "low", INFO,
          "none", INFO,
          "warning", WARNING,
          "warn", WARNING,
          "critical", CRITICAL,
          "high", CRITICAL,
          "error", CRITICAL,
          "page", CRITICAL);

  /** Parses a severity label. Unknown or missing labels are treated as {@link #WARNING}. */
  public static Severity parse(String value) {
    if (value == null) {
      return WARNING;
    }
    return ALIASES.getOrDefault(value.trim().toLowerCase(Locale.ROOT), WARNING);
  }

  /** Strict variant of {@link #parse(String)} used for configuration values. */
  public static Severity parseStrict(String value) {
    Severity severity =
        value == null ? null : ALIASES.get(value.trim().toLowerCase(Locale.ROOT));
    if (severity == null) {
      throw new ConfigurationException(String.format("Unknown severity:%s", value));
    }
    return severity;
  }

  public boolean isAtLeast(Severity other) {
    return compareTo(other) >= 0;
  }

  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
