package com.magsasa.runtimeintel.notification.transport;

/**
 * A payload could not be delivered. {@link #isRetryable()} tells whether another attempt may
 * succeed, which holds for network failures, throttling and server side errors.
 */
public class NotificationDeliveryException extends RuntimeException {
  public static final int NO_STATUS = -1;

  private final int statusCode;
  private final boolean retryable;

  public NotificationDeliveryException(String message, int statusCode, boolean retryable) {
    super(message);
    this.statusCode = statusCode;
    this.retryable = retryable;
  }

  public NotificationDeliveryException(String message, Throwable cause, boolean retryable) {
    super(message, cause);
    this.statusCode = NO_STATUS;
    this.retryable = retryable;
  }

  public int getStatusCode() {
    return statusCode;
  }

  public boolean isRetryable() {
    return retryable;
  }
}
