package com.magsasa.runtimeintel.datamodel.rule.source;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.util.List;
import java.util.function.Predicate;

/** A source of JSON rule documents, such as notification channel definitions. */
public interface RuleSource {
  List<JsonNode> getAllRules(Predicate<JsonNode> predicate) throws IOException;
}
