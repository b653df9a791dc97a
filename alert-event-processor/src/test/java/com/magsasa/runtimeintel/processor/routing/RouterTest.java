package com.magsasa.runtimeintel.processor.routing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.magsasa.runtimeintel.datamodel.AlertEvent;
import com.magsasa.runtimeintel.datamodel.AlertEvent.AlertStatus;
import com.magsasa.runtimeintel.datamodel.ConfigurationException;
import com.magsasa.runtimeintel.datamodel.Severity;
import com.typesafe.config.ConfigFactory;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RouterTest {

  private static final String RULES =
      "routing { default-channel = ops-default }\n"
          + "routes = [\n"
          + "  { name = catch-all, priority = 0, match { severity = \"warning+\" },"
          + " channels = [slack-ops] }\n"
          + "  { name = payments-critical, priority = 100,"
          + " match { severity = critical, service = payments },"
          + " channels = [pagerduty-payments, slack-payments] }\n"
          + "  { name = prod-db, priority = 50, match { team = [dba, storage],"
          + " labels { env = prod } }, channels = [slack-dba] }\n"
          + "]";

  private final RoutingRules rules = RoutingRules.fromConfig(ConfigFactory.parseString(RULES));

  @Test
  void testHigherPriorityRuleWinsOverCatchAll() {
    RoutingDecision decision = Router.route(event(Severity.CRITICAL, "payments", "core"), rules);

    assertEquals("payments-critical", decision.getRouteName());
    assertEquals(List.of("pagerduty-payments", "slack-payments"), decision.getChannels());
    assertFalse(decision.isUnrouted());
  }

  @Test
  void testWarningPlusMatchesWarningAndAbove() {
    assertEquals(
        "catch-all", Router.route(event(Severity.WARNING, "search", "core"), rules).getRouteName());
    assertEquals(
        "catch-all",
        Router.route(event(Severity.CRITICAL, "search", "core"), rules).getRouteName());
  }

  @Test
  void testUnmatchedEventGoesToDefaultChannel() {
    RoutingDecision decision = Router.route(event(Severity.INFO, "search", "core"), rules);

    assertTrue(decision.isUnrouted());
    assertNull(decision.getRouteName());
    assertEquals(List.of("ops-default"), decision.getChannels());
  }

  @Test
  void testAllClausesMustMatch() {
    AlertEvent prodDb =
        event(Severity.INFO, "orders", "dba").toBuilder().labels(Map.of("env", "prod")).build();
    AlertEvent stagingDb =
        event(Severity.INFO, "orders", "dba").toBuilder().labels(Map.of("env", "staging")).build();

    assertEquals("prod-db", Router.route(prodDb, rules).getRouteName());
    assertTrue(Router.route(stagingDb, rules).isUnrouted());
  }

  @Test
  void testRoutingIsDeterministic() {
    AlertEvent event = event(Severity.CRITICAL, "payments", "core");
    RoutingDecision first = Router.route(event, rules);
    for (int i = 0; i < 100; i++) {
      assertEquals(first, Router.route(event, rules));
    }
  }

  @Test
  void testEqualPriorityTieBreak() {
    String equalPriority =
        "routes = [\n"
            + "  { name = zeta, priority = 10, channels = [z] }\n"
            + "  { name = alpha, priority = 10, channels = [a] }\n"
            + "]\n";
    AlertEvent event = event(Severity.WARNING, "search", "core");

    RoutingRules declaration =
        RoutingRules.fromConfig(
            ConfigFactory.parseString(equalPriority + "routing { default-channel = d }"));
    RoutingRules lexical =
        RoutingRules.fromConfig(
            ConfigFactory.parseString(
                equalPriority + "routing { default-channel = d, tie-break = lexical }"));

    assertEquals(TieBreak.DECLARATION, declaration.getTieBreak());
    assertEquals("zeta", Router.route(event, declaration).getRouteName());
    assertEquals("alpha", Router.route(event, lexical).getRouteName());
  }

  @Test
  void testInvalidRulesAreRejected() {
    assertThrows(
        ConfigurationException.class,
        () ->
            RoutingRules.fromConfig(
                ConfigFactory.parseString(
                    "routing { default-channel = d, tie-break = random }")));
    assertThrows(
        ConfigurationException.class,
        () ->
            RoutingRules.fromConfig(
                ConfigFactory.parseString(
                    "routing { default-channel = d }\n"
                        + "routes = [{ name = r, match { severity = urgent }, channels = [c] }]")));
    assertThrows(
        ConfigurationException.class,
        () ->
            RoutingRules.fromConfig(
                ConfigFactory.parseString(
                    "routing { default-channel = d }\n"
                        + "routes = [{ name = r, channels = [c] },"
                        + " { name = r, channels = [c] }]")));
    assertThrows(
        ConfigurationException.class,
        () ->
            RoutingRules.fromConfig(
                ConfigFactory.parseString(
                    "routing { default-channel = d }\nroutes = [{ name = r }]")));
  }

  @Test
  void testReferencedChannelsIncludeDefault() {
    assertEquals(
        List.of("pagerduty-payments", "slack-payments", "slack-dba", "slack-ops", "ops-default"),
        List.copyOf(rules.getReferencedChannels()));
  }

  private static AlertEvent event(Severity severity, String service, String team) {
    return AlertEvent.builder()
        .fingerprint("fp")
        .name("HighLatency")
        .status(AlertStatus.FIRING)
        .severity(severity)
        .service(service)
        .team(team)
        .labels(Map.of())
        .build();
  }
}
