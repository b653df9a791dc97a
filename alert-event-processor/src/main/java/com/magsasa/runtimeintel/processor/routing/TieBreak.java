package com.magsasa.runtimeintel.processor.routing;

import com.magsasa.runtimeintel.datamodel.ConfigurationException;
import java.util.Comparator;
import java.util.Locale;

/** Ordering applied between routes of equal priority. */
public enum TieBreak {
  DECLARATION(Comparator.comparingInt(Route::getDeclarationIndex)),
  LEXICAL(Comparator.comparing(Route::getName));

  private final Comparator<Route> order;

  TieBreak(Comparator<Route> order) {
    this.order = order;
  }

  Comparator<Route> getOrder() {
    return order;
  }

  public static TieBreak fromConfigName(String name) {
    switch (name.toLowerCase(Locale.ROOT)) {
      case "declaration":
        return DECLARATION;
      case "lexical":
        return LEXICAL;
      default:
        throw new ConfigurationException(String.format("Invalid routing tie-break:%s", name));
    }
  }
}
