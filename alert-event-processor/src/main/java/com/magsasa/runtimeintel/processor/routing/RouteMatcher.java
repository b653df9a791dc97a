package com.magsasa.runtimeintel.processor.routing;

import com.magsasa.runtimeintel.datamodel.AlertEvent;
import com.magsasa.runtimeintel.datamodel.Severity;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import com.typesafe.config.ConfigValueType;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import lombok.Builder;
import lombok.Value;

/**
 * Conjunction of route clauses. An absent clause matches every event; an empty set is treated
 * the same as an absent clause.
 */
@Value
@Builder
public class RouteMatcher {
  private static final String SEVERITY_CONFIG = "severity";
  private static final String SERVICE_CONFIG = "service";
  private static final String TEAM_CONFIG = "team";
  private static final String LABELS_CONFIG = "labels";
  private static final String AT_LEAST_SUFFIX = "+";

  public static final RouteMatcher MATCH_ALL = RouteMatcher.builder().build();

  Set<Severity> severities;
  Set<String> services;
  Set<String> teams;
  Map<String, String> labels;

  public boolean matches(AlertEvent event) {
    if (severities != null && !severities.isEmpty() && !severities.contains(event.getSeverity())) {
      return false;
    }
    if (services != null && !services.isEmpty() && !services.contains(event.getService())) {
      return false;
    }
    if (teams != null && !teams.isEmpty() && !teams.contains(event.getTeam())) {
      return false;
    }
    if (labels != null) {
      Map<String, String> eventLabels = event.getLabels() == null ? Map.of() : event.getLabels();
      for (Map.Entry<String, String> label : labels.entrySet()) {
        if (!label.getValue().equals(eventLabels.get(label.getKey()))) {
          return false;
        }
      }
    }
    return true;
  }

  public static RouteMatcher fromConfig(Config matchConfig) {
    RouteMatcher.RouteMatcherBuilder builder = RouteMatcher.builder();
    if (matchConfig.hasPath(SEVERITY_CONFIG)) {
      Set<Severity> severities = EnumSet.noneOf(Severity.class);
      for (String clause : readStrings(matchConfig, SEVERITY_CONFIG)) {
        severities.addAll(parseSeverityClause(clause));
      }
      builder.severities(severities);
    }
    if (matchConfig.hasPath(SERVICE_CONFIG)) {
      builder.services(Set.copyOf(readStrings(matchConfig, SERVICE_CONFIG)));
    }
    if (matchConfig.hasPath(TEAM_CONFIG)) {
      builder.teams(Set.copyOf(readStrings(matchConfig, TEAM_CONFIG)));
    }
    if (matchConfig.hasPath(LABELS_CONFIG)) {
      Map<String, String> labels = new TreeMap<>();
      for (Map.Entry<String, ConfigValue> entry :
          matchConfig.getConfig(LABELS_CONFIG).entrySet()) {
        labels.put(unquote(entry.getKey()), String.valueOf(entry.getValue().unwrapped()));
      }
      builder.labels(labels);
    }
    return builder.build();
  }

  /** {@code warning+} expands to every severity at or above warning. */
  static Set<Severity> parseSeverityClause(String clause) {
    if (clause.endsWith(AT_LEAST_SUFFIX)) {
      Severity minimum =
          Severity.parseStrict(clause.substring(0, clause.length() - AT_LEAST_SUFFIX.length()));
      Set<Severity> severities = EnumSet.noneOf(Severity.class);
      for (Severity severity : Severity.values()) {
        if (severity.isAtLeast(minimum)) {
          severities.add(severity);
        }
      }
      return severities;
    }
    return EnumSet.of(Severity.parseStrict(clause));
  }

  private static List<String> readStrings(Config config, String path) {
    if (config.getValue(path).valueType() == ConfigValueType.LIST) {
      return config.getStringList(path);
    }
    return List.of(config.getString(path));
  }

  private static String unquote(String key) {
    return key.length() > 1 && key.startsWith("\"") && key.endsWith("\"")
        ? key.substring(1, key.length() - 1)
        : key;
  }
}
