package com.magsasa.runtimeintel.datamodel;

import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.TreeMap;

public class Fingerprints {
  static final String SEVERITY_LABEL = "severity";
  private static final int FINGERPRINT_LENGTH = 32;

  private Fingerprints() {}

  /**
   * Stable fingerprint of an alert identity and its labels. Label order does not matter and the
   * severity label is excluded, so an escalation keeps the fingerprint of the incident.
   */
  public static String of(String identity, Map<String, String> labels) {
    Hasher hasher = Hashing.sha256().newHasher();
    hasher.putString(identity, StandardCharsets.UTF_8).putChar('\n');
    if (labels != null) {
      for (Map.Entry<String, String> label : new TreeMap<>(labels).entrySet()) {
        if (SEVERITY_LABEL.equals(label.getKey())) {
          continue;
        }
        hasher
            .putString(label.getKey(), StandardCharsets.UTF_8)
            .putChar('=')
            .putString(String.valueOf(label.getValue()), StandardCharsets.UTF_8)
            .putChar('\n');
      }
    }
    return hasher.hash().toString().substring(0, FINGERPRINT_LENGTH);
  }
}
