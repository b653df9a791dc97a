package com.magsasa.runtimeintel.datamodel;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/** An alert that passed suppression and routing, ready for delivery and annotation. */
@Value
@Builder(toBuilder = true)
public class Notification {
  public static final String LINK_DASHBOARD = "dashboard";
  public static final String LINK_RUNBOOK = "runbook";

  AlertEvent alert;
  Transition transition;
  long occurrenceCount;
  String routeName;
  boolean unrouted;
  List<String> channels;
  Map<String, String> links;
  Instant createdAt;

  public enum Transition {
    OPEN,
    RESOLVED,
    DIGEST
  }
}
