package com.magsasa.runtimeintel.processor.routing;

import com.magsasa.runtimeintel.datamodel.ConfigurationException;
import com.typesafe.config.Config;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable rule set. Routes are kept in evaluation order: descending priority, then the
 * configured tie-break.
 */
public class RoutingRules {
  private static final String ROUTES_CONFIG = "routes";
  private static final String ROUTING_CONFIG = "routing";
  private static final String DEFAULT_CHANNEL_CONFIG = "default-channel";
  private static final String TIE_BREAK_CONFIG = "tie-break";
  private static final String ROUTE_NAME_CONFIG = "name";
  private static final String ROUTE_PRIORITY_CONFIG = "priority";
  private static final String ROUTE_MATCH_CONFIG = "match";
  private static final String ROUTE_CHANNELS_CONFIG = "channels";
  private static final String DEFAULT_TIE_BREAK = "declaration";
  private static final int DEFAULT_PRIORITY = 0;

  private final List<Route> routes;
  private final String defaultChannel;
  private final TieBreak tieBreak;

  public RoutingRules(List<Route> routes, String defaultChannel, TieBreak tieBreak) {
    if (defaultChannel == null || defaultChannel.isBlank()) {
      throw new ConfigurationException("routing default channel is required");
    }
    Set<String> names = new HashSet<>();
    for (Route route : routes) {
      if (!names.add(route.getName())) {
        throw new ConfigurationException(
            String.format("Duplicate route name:%s", route.getName()));
      }
      if (route.getChannels() == null || route.getChannels().isEmpty()) {
        throw new ConfigurationException(
            String.format("Route %s has no channels", route.getName()));
      }
    }
    List<Route> ordered = new ArrayList<>(routes);
    ordered.sort(
        Comparator.comparingInt(Route::getPriority).reversed().thenComparing(tieBreak.getOrder()));
    this.routes = List.copyOf(ordered);
    this.defaultChannel = defaultChannel;
    this.tieBreak = tieBreak;
  }

  /** Reads {@code routes} and {@code routing} from a rules document. */
  public static RoutingRules fromConfig(Config rulesConfig) {
    Config routingConfig = rulesConfig.getConfig(ROUTING_CONFIG);
    String tieBreak =
        routingConfig.hasPath(TIE_BREAK_CONFIG)
            ? routingConfig.getString(TIE_BREAK_CONFIG)
            : DEFAULT_TIE_BREAK;
    List<Route> routes = new ArrayList<>();
    if (rulesConfig.hasPath(ROUTES_CONFIG)) {
      List<? extends Config> routeConfigs = rulesConfig.getConfigList(ROUTES_CONFIG);
      for (int i = 0; i < routeConfigs.size(); i++) {
        routes.add(readRoute(routeConfigs.get(i), i));
      }
    }
    return new RoutingRules(
        routes,
        routingConfig.getString(DEFAULT_CHANNEL_CONFIG),
        TieBreak.fromConfigName(tieBreak));
  }

  private static Route readRoute(Config routeConfig, int index) {
    if (!routeConfig.hasPath(ROUTE_NAME_CONFIG)) {
      throw new ConfigurationException(String.format("Route at index %d has no name", index));
    }
    return Route.builder()
        .name(routeConfig.getString(ROUTE_NAME_CONFIG))
        .priority(
            routeConfig.hasPath(ROUTE_PRIORITY_CONFIG)
                ? routeConfig.getInt(ROUTE_PRIORITY_CONFIG)
                : DEFAULT_PRIORITY)
        .matcher(
            routeConfig.hasPath(ROUTE_MATCH_CONFIG)
                ? RouteMatcher.fromConfig(routeConfig.getConfig(ROUTE_MATCH_CONFIG))
                : RouteMatcher.MATCH_ALL)
        .channels(
            routeConfig.hasPath(ROUTE_CHANNELS_CONFIG)
                ? routeConfig.getStringList(ROUTE_CHANNELS_CONFIG)
                : List.of())
        .declarationIndex(index)
        .build();
  }

  public List<Route> getRoutes() {
    return routes;
  }

  public String getDefaultChannel() {
    return defaultChannel;
  }

  public TieBreak getTieBreak() {
    return tieBreak;
  }

  /** Every channel a decision can name, the default channel included. */
  public Set<String> getReferencedChannels() {
    Set<String> channels = new LinkedHashSet<>();
    routes.forEach(route -> channels.addAll(route.getChannels()));
    channels.add(defaultChannel);
    return channels;
  }
}
