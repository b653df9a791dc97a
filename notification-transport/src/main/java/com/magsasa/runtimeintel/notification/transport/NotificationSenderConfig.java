package com.magsasa.runtimeintel.notification.transport;

import com.typesafe.config.Config;
import java.time.Duration;

public class NotificationSenderConfig {
  private static final String NOTIFICATION_CONFIG = "notification";
  private static final String DASHBOARD_BASE_URL = "dashboard.base-url";
  private static final String CONNECT_TIMEOUT = "http.connect-timeout";
  private static final String READ_TIMEOUT = "http.read-timeout";
  private static final String DEFAULT_DASHBOARD_BASE_URL = "http://localhost:3000";
  private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);
  private static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(10);

  private final Config rawConfig;
  private final String dashboardBaseUrl;
  private final Duration connectTimeout;
  private final Duration readTimeout;

  public static NotificationSenderConfig from(Config config) {
    return new NotificationSenderConfig(config.getConfig(NOTIFICATION_CONFIG));
  }

  private NotificationSenderConfig(Config notificationConfig) {
    this.rawConfig = notificationConfig;
    this.dashboardBaseUrl =
        stripTrailingSlash(
            notificationConfig.hasPath(DASHBOARD_BASE_URL)
                ? notificationConfig.getString(DASHBOARD_BASE_URL)
                : DEFAULT_DASHBOARD_BASE_URL);
    this.connectTimeout =
        notificationConfig.hasPath(CONNECT_TIMEOUT)
            ? notificationConfig.getDuration(CONNECT_TIMEOUT)
            : DEFAULT_CONNECT_TIMEOUT;
    this.readTimeout =
        notificationConfig.hasPath(READ_TIMEOUT)
            ? notificationConfig.getDuration(READ_TIMEOUT)
            : DEFAULT_READ_TIMEOUT;
  }

  private static String stripTrailingSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }

  public String getDashboardBaseUrl() {
    return dashboardBaseUrl;
  }

  public Duration getConnectTimeout() {
    return connectTimeout;
  }

  public Duration getReadTimeout() {
    return readTimeout;
  }

  public Config getRawConfig() {
    return rawConfig;
  }
}
