package com.magsasa.runtimeintel.processor.routing;

import java.util.List;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class Route {
  String name;
  int priority;
  RouteMatcher matcher;
  List<String> channels;
  int declarationIndex;
}
