package com.magsasa.runtimeintel.processor.routing;

import com.magsasa.runtimeintel.datamodel.AlertEvent;
import java.util.List;

/**
 * Picks the channels for an event. The first route, in rule order, whose matcher accepts the
 * event wins; events no route accepts go to the default channel and are marked unrouted.
 */
public final class Router {

  private Router() {}

  public static RoutingDecision route(AlertEvent event, RoutingRules rules) {
    for (Route route : rules.getRoutes()) {
      if (route.getMatcher().matches(event)) {
        return new RoutingDecision(route.getName(), route.getChannels(), false);
      }
    }
    return new RoutingDecision(null, List.of(rules.getDefaultChannel()), true);
  }
}
