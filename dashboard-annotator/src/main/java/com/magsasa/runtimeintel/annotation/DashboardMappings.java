package com.magsasa.runtimeintel.annotation;

import com.magsasa.runtimeintel.datamodel.AlertEvent;
import com.magsasa.runtimeintel.datamodel.ConfigurationException;
import com.typesafe.config.Config;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Ordered metric-pattern to panel mappings. The first mapping whose pattern is found in the
 * event name wins.
 */
public class DashboardMappings {
  private static final String MAPPINGS_CONFIG = "mappings";
  private static final String PATTERN_CONFIG = "pattern";
  private static final String DASHBOARD_UID_CONFIG = "dashboard-uid";
  private static final String DASHBOARD_ID_CONFIG = "dashboard-id";
  private static final String PANEL_ID_CONFIG = "panel-id";

  private final List<PanelMapping> mappings;
  private final String dashboardBaseUrl;

  public DashboardMappings(List<PanelMapping> mappings, String dashboardBaseUrl) {
    this.mappings = List.copyOf(mappings);
    this.dashboardBaseUrl =
        dashboardBaseUrl.endsWith("/")
            ? dashboardBaseUrl.substring(0, dashboardBaseUrl.length() - 1)
            : dashboardBaseUrl;
  }

  public static DashboardMappings empty(String dashboardBaseUrl) {
    return new DashboardMappings(List.of(), dashboardBaseUrl);
  }

  public static DashboardMappings fromConfig(Config annotationConfig, String dashboardBaseUrl) {
    if (!annotationConfig.hasPath(MAPPINGS_CONFIG)) {
      return empty(dashboardBaseUrl);
    }
    List<PanelMapping> mappings = new ArrayList<>();
    for (Config mappingConfig : annotationConfig.getConfigList(MAPPINGS_CONFIG)) {
      String regex = mappingConfig.getString(PATTERN_CONFIG);
      Pattern pattern;
      try {
        pattern = Pattern.compile(regex);
      } catch (PatternSyntaxException e) {
        throw new ConfigurationException(
            String.format("Invalid dashboard mapping pattern:%s", regex), e);
      }
      mappings.add(
          new PanelMapping(
              pattern,
              mappingConfig.getString(DASHBOARD_UID_CONFIG),
              mappingConfig.hasPath(DASHBOARD_ID_CONFIG)
                  ? mappingConfig.getLong(DASHBOARD_ID_CONFIG)
                  : null,
              mappingConfig.getLong(PANEL_ID_CONFIG)));
    }
    return new DashboardMappings(mappings, dashboardBaseUrl);
  }

  public Optional<PanelMapping> find(AlertEvent event) {
    return mappings.stream().filter(mapping -> mapping.matches(event)).findFirst();
  }

  public Optional<String> dashboardLink(AlertEvent event) {
    return find(event).map(mapping -> mapping.deepLink(dashboardBaseUrl, event));
  }

  public int size() {
    return mappings.size();
  }
}
