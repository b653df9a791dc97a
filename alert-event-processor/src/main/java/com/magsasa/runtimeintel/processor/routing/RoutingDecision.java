package com.magsasa.runtimeintel.processor.routing;

import java.util.List;
import lombok.Value;

@Value
public class RoutingDecision {
  String routeName;
  List<String> channels;
  boolean unrouted;
}
