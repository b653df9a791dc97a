package com.magsasa.runtimeintel.notification.service;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.magsasa.runtimeintel.datamodel.Notification;
import com.magsasa.runtimeintel.notification.service.NotificationChannel.NotificationChannelConfig;
import com.magsasa.runtimeintel.notification.service.notification.WebhookNotifier;
import com.magsasa.runtimeintel.notification.transport.NotificationDeliveryException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Delivers notifications to their channels. Each channel is attempted on the delivery executor
 * with its own retry budget, so a slow or failing channel never holds up the others.
 */
public class NotificationEventProcessor {

  private static final Logger LOGGER = LoggerFactory.getLogger(NotificationEventProcessor.class);

  static final String DELIVERY_COUNTER = "runtime.intelligence.notification.deliveries";
  static final String ATTEMPT_COUNTER = "runtime.intelligence.notification.attempts";
  static final String DELIVERY_TIMER = "runtime.intelligence.notification.delivery.latency";
  private static final String CHANNEL_TAG = "channel";
  private static final String RESULT_TAG = "result";
  private static final String DELIVERED = "delivered";
  private static final String FAILED = "failed";

  private final WebhookNotifier webhookNotifier;
  private final RetryRegistry retryRegistry;
  private final ExecutorService deliveryExecutor;
  private final MeterRegistry meterRegistry;
  private final Clock clock;
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Timer> deliveryTimers = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, DeliveryResult> lastDeliveries = new ConcurrentHashMap<>();
  private volatile Map<String, NotificationChannel> channels;

  public NotificationEventProcessor(
      NotificationDeliveryConfig deliveryConfig,
      Map<String, NotificationChannel> channels,
      WebhookNotifier webhookNotifier,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.channels = Map.copyOf(channels);
    this.webhookNotifier = webhookNotifier;
    this.meterRegistry = meterRegistry;
    this.clock = clock;
    this.retryRegistry = RetryRegistry.of(retryConfig(deliveryConfig));
    this.deliveryExecutor =
        Executors.newFixedThreadPool(
            deliveryConfig.getExecutorThreads(),
            new ThreadFactoryBuilder()
                .setNameFormat("notification-delivery-%d")
                .setDaemon(true)
                .build());
  }

  @VisibleForTesting
  static RetryConfig retryConfig(NotificationDeliveryConfig deliveryConfig) {
    return RetryConfig.custom()
        .maxAttempts(deliveryConfig.getMaxAttempts())
        .intervalFunction(
            IntervalFunction.ofExponentialBackoff(
                deliveryConfig.getInitialInterval(), deliveryConfig.getMultiplier()))
        .retryOnException(
            throwable ->
                throwable instanceof NotificationDeliveryException
                    && ((NotificationDeliveryException) throwable).isRetryable())
        .build();
  }

  public void updateChannels(Map<String, NotificationChannel> channels) {
    this.channels = Map.copyOf(channels);
    LOGGER.info("Notification channels updated: {}", channels.keySet());
  }

  public boolean hasChannel(String channelId) {
    return channels.containsKey(channelId);
  }

  /**
   * Fans the notification out to every channel it names. The returned future completes once all
   * channels have a {@link DeliveryResult}; it never completes exceptionally.
   */
  public CompletableFuture<List<DeliveryResult>> process(Notification notification) {
    LOGGER.debug(
        "Processing notification fingerprint={} transition={} channels={}",
        notification.getAlert().getFingerprint(),
        notification.getTransition(),
        notification.getChannels());
    List<CompletableFuture<DeliveryResult>> deliveries = new ArrayList<>();
    for (String channelId : notification.getChannels()) {
      try {
        deliveries.add(
            CompletableFuture.supplyAsync(
                () -> deliver(channelId, notification), deliveryExecutor));
      } catch (RejectedExecutionException e) {
        deliveries.add(
            CompletableFuture.completedFuture(
                record(failed(channelId, notification, 0, e.getMessage()))));
      }
    }
    return CompletableFuture.allOf(deliveries.toArray(new CompletableFuture[0]))
        .thenApply(
            ignored ->
                deliveries.stream().map(CompletableFuture::join).collect(Collectors.toList()));
  }

  private DeliveryResult deliver(String channelId, Notification notification) {
    NotificationChannel channel = channels.get(channelId);
    if (channel == null) {
      return record(
          failed(channelId, notification, 0, "unknown notification channel " + channelId));
    }
    Retry retry = retryRegistry.retry(channelId);
    AtomicInteger attempts = new AtomicInteger();
    List<String> errors = new ArrayList<>();
    Instant startTime = Instant.now();
    try {
      // every config of the channel gets its own attempt budget
      for (NotificationChannelConfig channelConfig : channel.getNotificationChannelConfig()) {
        try {
          Retry.decorateRunnable(
                  retry,
                  () -> {
                    attempts.incrementAndGet();
                    getCounter(ATTEMPT_COUNTER, channelId, null).increment();
                    webhookNotifier.notify(notification, channelConfig);
                  })
              .run();
        } catch (RuntimeException e) {
          LOGGER.warn(
              "Channel config {} of channel={} failed for fingerprint={}: {}",
              channelConfig.getChannelConfigType(),
              channelId,
              notification.getAlert().getFingerprint(),
              e.getMessage());
          errors.add(e.getMessage());
        }
      }
    } finally {
      deliveryTimers
          .computeIfAbsent(
              channelId, k -> meterRegistry.timer(DELIVERY_TIMER, CHANNEL_TAG, channelId))
          .record(Duration.between(startTime, Instant.now()).toMillis(), TimeUnit.MILLISECONDS);
    }
    if (!errors.isEmpty()) {
      return record(failed(channelId, notification, attempts.get(), String.join("; ", errors)));
    }
    LOGGER.info(
        "Delivered notification fingerprint={} transition={} channel={} attempts={}",
        notification.getAlert().getFingerprint(),
        notification.getTransition(),
        channelId,
        attempts.get());
    return record(
        DeliveryResult.builder()
            .channelId(channelId)
            .fingerprint(notification.getAlert().getFingerprint())
            .transition(notification.getTransition())
            .delivered(true)
            .attempts(attempts.get())
            .completedAt(clock.instant())
            .build());
  }

  private DeliveryResult failed(
      String channelId, Notification notification, int attempts, String error) {
    LOGGER.error(
        "Giving up on notification fingerprint={} channel={} after {} attempts: {}",
        notification.getAlert().getFingerprint(),
        channelId,
        attempts,
        error);
    return DeliveryResult.builder()
        .channelId(channelId)
        .fingerprint(notification.getAlert().getFingerprint())
        .transition(notification.getTransition())
        .delivered(false)
        .attempts(attempts)
        .error(error)
        .completedAt(clock.instant())
        .build();
  }

  private DeliveryResult record(DeliveryResult result) {
    lastDeliveries.put(result.getChannelId(), result);
    getCounter(DELIVERY_COUNTER, result.getChannelId(), result.isDelivered() ? DELIVERED : FAILED)
        .increment();
    return result;
  }

  /** Last delivery outcome per channel id. */
  public Map<String, DeliveryResult> getLastDeliveries() {
    return Map.copyOf(lastDeliveries);
  }

  public boolean shutdown(Duration timeout) throws InterruptedException {
    deliveryExecutor.shutdown();
    boolean terminated =
        deliveryExecutor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
    if (!terminated) {
      LOGGER.warn("Notification deliveries still running after {}", timeout);
    }
    return terminated;
  }

  private Counter getCounter(String name, String channelId, String result) {
    String key = name + "/" + channelId + "/" + result;
    return counters.computeIfAbsent(
        key,
        ignored ->
            result == null
                ? meterRegistry.counter(name, CHANNEL_TAG, channelId)
                : meterRegistry.counter(name, CHANNEL_TAG, channelId, RESULT_TAG, result));
  }
}
