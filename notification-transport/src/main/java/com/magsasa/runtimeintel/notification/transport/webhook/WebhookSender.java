package com.magsasa.runtimeintel.notification.transport.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.google.common.base.Preconditions;
import com.magsasa.runtimeintel.notification.transport.NotificationDeliveryException;
import com.magsasa.runtimeintel.notification.transport.webhook.http.HttpWithJsonSender;
import com.magsasa.runtimeintel.notification.transport.webhook.http.HttpWithJsonSender.JsonResponse;
import java.io.IOException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serializes a payload and posts it to a webhook. Anything short of a 2xx answer is raised as a
 * {@link NotificationDeliveryException} so callers can decide whether to try again.
 */
public class WebhookSender {
  private static final Logger LOGGER = LoggerFactory.getLogger(WebhookSender.class);
  private static final int TOO_MANY_REQUESTS = 429;
  private static final int SERVER_ERROR = 500;
  private final HttpWithJsonSender sender;

  public WebhookSender(HttpWithJsonSender sender) {
    this.sender = sender;
  }

  public void send(String url, Object payload) {
    send(url, payload, Map.of());
  }

  public void send(String url, Object payload, Map<String, String> headers) {
    Preconditions.checkArgument(url != null, "webhook url is required");
    String jsonString;
    try {
      jsonString = ObjectMapperProvider.get().writeValueAsString(payload);
    } catch (JsonProcessingException e) {
      throw new NotificationDeliveryException(
          String.format("Unable to serialize %s", payload.getClass().getSimpleName()), e, false);
    }

    JsonResponse response;
    try {
      response = sender.post(url, jsonString, headers);
    } catch (IOException e) {
      throw new NotificationDeliveryException(
          String.format("Unable to reach %s: %s", url, e.getMessage()), e, true);
    }

    if (!response.isSuccessful()) {
      LOGGER.warn(
          "Error response from webhook. Response Code: {}, Response Message: {}, url: {}",
          response.getCode(),
          response.getMessage(),
          url);
      throw new NotificationDeliveryException(
          String.format(
              "Webhook %s answered %d %s", url, response.getCode(), response.getMessage()),
          response.getCode(),
          isRetryable(response.getCode()));
    }
    LOGGER.debug("Delivered to {} with code {}", url, response.getCode());
  }

  static boolean isRetryable(int statusCode) {
    return statusCode == TOO_MANY_REQUESTS || statusCode >= SERVER_ERROR;
  }
}
