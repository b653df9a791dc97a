package com.magsasa.runtimeintel.engine.config;

import com.google.common.annotations.VisibleForTesting;
import com.magsasa.runtimeintel.datamodel.ConfigurationException;
import com.magsasa.runtimeintel.detector.evaluator.DetectorSpec;
import com.magsasa.runtimeintel.notification.service.NotificationChannel;
import com.magsasa.runtimeintel.notification.service.NotificationChannelsReader;
import com.magsasa.runtimeintel.processor.routing.RoutingRules;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import java.io.File;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds {@link RuntimeConfig} snapshots from the rules document and the notification channel
 * source. Any inconsistency fails the whole load with a {@link ConfigurationException}.
 */
public class RuntimeConfigLoader {
  private static final Logger LOGGER = LoggerFactory.getLogger(RuntimeConfigLoader.class);

  static final String RULES_PATH_CONFIG = "rules.path";
  static final String RULES_RESOURCE_CONFIG = "rules.resource";
  private static final String DEFAULT_RULES_RESOURCE = "rules.conf";
  private static final String DETECTORS_CONFIG = "detectors";

  private final Supplier<Config> rulesSupplier;
  private final String rulesSource;
  private final NotificationChannelsReader channelsReader;
  private final Clock clock;

  public RuntimeConfigLoader(Config appConfig, Clock clock) {
    this(
        rulesSupplier(appConfig),
        describeRules(appConfig),
        new NotificationChannelsReader(
            appConfig.getConfig(NotificationChannelsReader.NOTIFICATION_CHANNELS_SOURCE)),
        clock);
  }

  @VisibleForTesting
  RuntimeConfigLoader(
      Supplier<Config> rulesSupplier,
      String rulesSource,
      NotificationChannelsReader channelsReader,
      Clock clock) {
    this.rulesSupplier = rulesSupplier;
    this.rulesSource = rulesSource;
    this.channelsReader = channelsReader;
    this.clock = clock;
  }

  public RuntimeConfig load() {
    Config rulesConfig;
    try {
      rulesConfig = rulesSupplier.get().resolve();
    } catch (ConfigException e) {
      throw new ConfigurationException("Unable to read rules from " + rulesSource, e);
    }

    List<DetectorSpec> detectors;
    RoutingRules routingRules;
    try {
      detectors = readDetectors(rulesConfig);
      routingRules = RoutingRules.fromConfig(rulesConfig);
    } catch (ConfigException e) {
      throw new ConfigurationException("Invalid rules in " + rulesSource, e);
    }
    Map<String, NotificationChannel> channels = channelsReader.readAllNotificationChannels();

    for (String channel : routingRules.getReferencedChannels()) {
      if (!channels.containsKey(channel)) {
        throw new ConfigurationException(
            String.format("Route references unknown notification channel:%s", channel));
      }
    }

    LOGGER.info(
        "Loaded {} detectors, {} routes and {} channels from {}",
        detectors.size(),
        routingRules.getRoutes().size(),
        channels.size(),
        rulesSource);
    return RuntimeConfig.builder()
        .detectors(detectors)
        .routingRules(routingRules)
        .channels(channels)
        .source(rulesSource)
        .loadedAt(clock.instant())
        .build();
  }

  private static List<DetectorSpec> readDetectors(Config rulesConfig) {
    List<DetectorSpec> detectors = new ArrayList<>();
    if (!rulesConfig.hasPath(DETECTORS_CONFIG)) {
      return detectors;
    }
    Set<String> names = new HashSet<>();
    for (Config detectorConfig : rulesConfig.getConfigList(DETECTORS_CONFIG)) {
      DetectorSpec spec = DetectorSpec.fromConfig(detectorConfig);
      if (!names.add(spec.getName())) {
        throw new ConfigurationException(
            String.format("Duplicate detector name:%s", spec.getName()));
      }
      detectors.add(spec);
    }
    return detectors;
  }

  private static Supplier<Config> rulesSupplier(Config appConfig) {
    if (appConfig.hasPath(RULES_PATH_CONFIG)) {
      File rulesFile = new File(appConfig.getString(RULES_PATH_CONFIG));
      return () -> {
        if (!rulesFile.isFile()) {
          throw new ConfigurationException("Rules file not found: " + rulesFile.getPath());
        }
        return ConfigFactory.parseFile(rulesFile);
      };
    }
    String resource =
        appConfig.hasPath(RULES_RESOURCE_CONFIG)
            ? appConfig.getString(RULES_RESOURCE_CONFIG)
            : DEFAULT_RULES_RESOURCE;
    return () -> ConfigFactory.parseResources(resource);
  }

  private static String describeRules(Config appConfig) {
    if (appConfig.hasPath(RULES_PATH_CONFIG)) {
      return appConfig.getString(RULES_PATH_CONFIG);
    }
    return "classpath:"
        + (appConfig.hasPath(RULES_RESOURCE_CONFIG)
            ? appConfig.getString(RULES_RESOURCE_CONFIG)
            : DEFAULT_RULES_RESOURCE);
  }
}
