package com.magsasa.runtimeintel.notification.service.notification;

import com.magsasa.runtimeintel.datamodel.Notification;
import com.magsasa.runtimeintel.notification.service.NotificationChannel.NotificationChannelConfig;
import com.magsasa.runtimeintel.notification.service.NotificationChannel.PagerDutyNotificationChannelConfig;
import com.magsasa.runtimeintel.notification.service.NotificationChannel.WebFormatNotificationChannelConfig;
import com.magsasa.runtimeintel.notification.service.NotificationChannelsReader;
import com.magsasa.runtimeintel.notification.transport.webhook.WebhookSender;

/** Renders a notification in the format a channel config asks for and sends it once. */
public class WebhookNotifier {

  private final WebhookSender webhookSender;

  public WebhookNotifier(WebhookSender webhookSender) {
    this.webhookSender = webhookSender;
  }

  public void notify(Notification notification, NotificationChannelConfig channelConfig) {
    switch (channelConfig.getChannelConfigType()) {
      case NotificationChannelsReader.CHANNEL_CONFIG_TYPE_WEBHOOK:
        WebFormatNotificationChannelConfig webFormatConfig =
            (WebFormatNotificationChannelConfig) channelConfig;
        if (NotificationChannelsReader.WEBHOOK_FORMAT_SLACK.equals(
            webFormatConfig.getWebhookFormat())) {
          webhookSender.send(webFormatConfig.getUrl(), AlertSlackEvent.getMessage(notification));
        } else {
          webhookSender.send(webFormatConfig.getUrl(), AlertWebhookEvent.from(notification));
        }
        break;
      case NotificationChannelsReader.CHANNEL_CONFIG_TYPE_PAGERDUTY:
        PagerDutyNotificationChannelConfig pagerDutyConfig =
            (PagerDutyNotificationChannelConfig) channelConfig;
        webhookSender.send(
            pagerDutyConfig.getUrl(),
            PagerDutyEvents.from(notification, pagerDutyConfig.getRoutingKey()));
        break;
      default:
        throw new IllegalArgumentException(
            String.format(
                "Invalid channel config type:%s", channelConfig.getChannelConfigType()));
    }
  }
}
