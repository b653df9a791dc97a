package com.magsasa.runtimeintel.notification.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.magsasa.runtimeintel.datamodel.ConfigurationException;
import com.magsasa.runtimeintel.datamodel.rule.source.RuleSource;
import com.magsasa.runtimeintel.datamodel.rule.source.RuleSourceProvider;
import com.magsasa.runtimeintel.notification.service.NotificationChannel.NotificationChannelConfig;
import com.magsasa.runtimeintel.notification.service.NotificationChannel.PagerDutyNotificationChannelConfig;
import com.magsasa.runtimeintel.notification.service.NotificationChannel.WebFormatNotificationChannelConfig;
import com.magsasa.runtimeintel.notification.transport.NotificationSecretFinder;
import com.magsasa.runtimeintel.notification.transport.pagerduty.PagerDutyEvent;
import com.typesafe.config.Config;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Loads the channel catalog from the configured rule source, keyed by channel id. */
public class NotificationChannelsReader {

  private static final Logger LOGGER = LoggerFactory.getLogger(NotificationChannelsReader.class);
  public static final String NOTIFICATION_CHANNELS_SOURCE = "notificationChannelsSource";
  private static final String CHANNEL_ID = "channelId";
  private static final String CHANNEL_NAME = "channelName";
  private static final String CHANNEL_CONFIG = "channelConfig";
  private static final String CHANNEL_CONFIG_TYPE = "channelConfigType";
  private static final String WEBFORMAT_CHANNEL_CONFIG_URL = "url";
  private static final String WEBFORMAT_CHANNEL_CONFIG_WEBHOOK_FORMAT = "webhookFormat";
  private static final String PAGERDUTY_ROUTING_KEY = "routingKey";
  private static final String PAGERDUTY_ROUTING_KEY_SECRET = "routingKeySecret";
  public static final String CHANNEL_CONFIG_TYPE_WEBHOOK = "WEBHOOK";
  public static final String CHANNEL_CONFIG_TYPE_PAGERDUTY = "PAGERDUTY";
  public static final String WEBHOOK_FORMAT_SLACK = "WEBHOOK_FORMAT_SLACK";
  public static final String WEBHOOK_FORMAT_JSON = "WEBHOOK_FORMAT_JSON";

  private final RuleSource ruleSource;

  public NotificationChannelsReader(Config ruleSourceConfig) {
    this(RuleSourceProvider.getProvider(ruleSourceConfig));
  }

  NotificationChannelsReader(RuleSource ruleSource) {
    this.ruleSource = ruleSource;
  }

  public Map<String, NotificationChannel> readAllNotificationChannels() {
    List<JsonNode> documents;
    try {
      documents = ruleSource.getAllRules(jsonNode -> true);
    } catch (IOException e) {
      throw new ConfigurationException("Unable to read notification channels", e);
    }
    Map<String, NotificationChannel> channels = new LinkedHashMap<>();
    for (JsonNode node : documents) {
      NotificationChannel channel = toChannel(node);
      if (channels.putIfAbsent(channel.getChannelId(), channel) != null) {
        throw new ConfigurationException(
            String.format("Duplicate notification channel:%s", channel.getChannelId()));
      }
    }
    LOGGER.info("Loaded {} notification channels", channels.size());
    return channels;
  }

  private NotificationChannel toChannel(JsonNode node) {
    String channelId = requiredText(node, CHANNEL_ID, "channel");
    return NotificationChannel.builder()
        .channelId(channelId)
        .channelName(node.hasNonNull(CHANNEL_NAME) ? node.get(CHANNEL_NAME).asText() : channelId)
        .notificationChannelConfig(getChannelConfigs(channelId, node.get(CHANNEL_CONFIG)))
        .build();
  }

  private List<NotificationChannelConfig> getChannelConfigs(String channelId, JsonNode configs) {
    if (configs == null || !configs.isArray() || configs.isEmpty()) {
      throw new ConfigurationException(
          String.format("Notification channel %s has no channelConfig", channelId));
    }
    List<NotificationChannelConfig> channelConfigs = new ArrayList<>();
    for (JsonNode channelConfigNode : configs) {
      String type = requiredText(channelConfigNode, CHANNEL_CONFIG_TYPE, channelId);
      switch (type) {
        case CHANNEL_CONFIG_TYPE_WEBHOOK:
          channelConfigs.add(webhookConfig(channelId, channelConfigNode));
          break;
        case CHANNEL_CONFIG_TYPE_PAGERDUTY:
          channelConfigs.add(pagerDutyConfig(channelId, channelConfigNode));
          break;
        default:
          throw new ConfigurationException(
              String.format("Invalid channel config type:%s for channel %s", type, channelId));
      }
    }
    return channelConfigs;
  }

  private static WebFormatNotificationChannelConfig webhookConfig(
      String channelId, JsonNode node) {
    String format =
        node.hasNonNull(WEBFORMAT_CHANNEL_CONFIG_WEBHOOK_FORMAT)
            ? node.get(WEBFORMAT_CHANNEL_CONFIG_WEBHOOK_FORMAT).asText()
            : WEBHOOK_FORMAT_JSON;
    if (!WEBHOOK_FORMAT_SLACK.equals(format) && !WEBHOOK_FORMAT_JSON.equals(format)) {
      throw new ConfigurationException(
          String.format("Invalid webhook format:%s for channel %s", format, channelId));
    }
    return WebFormatNotificationChannelConfig.builder()
        .channelConfigType(CHANNEL_CONFIG_TYPE_WEBHOOK)
        .url(requiredText(node, WEBFORMAT_CHANNEL_CONFIG_URL, channelId))
        .webhookFormat(format)
        .build();
  }

  private static PagerDutyNotificationChannelConfig pagerDutyConfig(
      String channelId, JsonNode node) {
    String routingKey;
    if (node.hasNonNull(PAGERDUTY_ROUTING_KEY)) {
      routingKey = node.get(PAGERDUTY_ROUTING_KEY).asText();
    } else {
      String secretName = requiredText(node, PAGERDUTY_ROUTING_KEY_SECRET, channelId);
      routingKey =
          NotificationSecretFinder.findSecret(secretName)
              .orElseThrow(
                  () ->
                      new ConfigurationException(
                          String.format(
                              "Missing secret %s for channel %s", secretName, channelId)));
    }
    return PagerDutyNotificationChannelConfig.builder()
        .channelConfigType(CHANNEL_CONFIG_TYPE_PAGERDUTY)
        .url(
            node.hasNonNull(WEBFORMAT_CHANNEL_CONFIG_URL)
                ? node.get(WEBFORMAT_CHANNEL_CONFIG_URL).asText()
                : PagerDutyEvent.EVENTS_V2_URL)
        .routingKey(routingKey)
        .build();
  }

  private static String requiredText(JsonNode node, String field, String context) {
    if (node == null || !node.hasNonNull(field) || node.get(field).asText().isBlank()) {
      throw new ConfigurationException(String.format("Missing %s in %s", field, context));
    }
    return node.get(field).asText();
  }
}
