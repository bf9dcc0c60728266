package com.platformcore.webhook.services;

import java.io.IOException;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import com.amazonaws.services.lambda.runtime.LambdaLogger;
import com.amazonaws.services.lambda.runtime.LambdaRuntime;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.platformcore.webhook.config.WebhookSettings;
import com.platformcore.webhook.exceptions.CircuitBreakerOpenException;
import com.platformcore.webhook.exceptions.DeliveryException;
import com.platformcore.webhook.exceptions.RetryException;
import com.platformcore.webhook.exceptions.ValidationException;
import com.platformcore.webhook.models.DeliveryRecord;
import com.platformcore.webhook.models.DeliveryStatus;
import com.platformcore.webhook.models.EventEnvelope;
import com.platformcore.webhook.models.WebhookEvent;
import com.platformcore.webhook.models.WebhookSubscription;
import com.platformcore.webhook.models.WebhookTestResult;
import com.platformcore.webhook.utils.JsonUtils;
import com.platformcore.webhook.utils.RetryOptions;
import com.platformcore.webhook.utils.RetryResult;
import com.platformcore.webhook.utils.RetryStrategy;
import com.platformcore.webhook.utils.RetryUtils;
import com.platformcore.webhook.utils.WebhookSignatureUtils;

/**
 * Delivers domain events to the subscriptions that match them.
 *
 * <p>Matched subscriptions are served one after another on the calling thread. Each network
 * call runs as {@code retry(breaker.execute(post))}: the retry loop is outermost, so the
 * endpoint's breaker is consulted again on every attempt, and an open breaker ends the loop
 * without using up the remaining attempts.
 *
 * <p>Delivery failures never escape {@link #deliver}; they end up in the returned
 * {@link DeliveryRecord}. A subscription without a secret is a configuration error and is
 * raised as {@link ValidationException}, which also stops the rest of the dispatch.
 */
public class WebhookDispatcher {

  public static final String TEST_EVENT_TYPE = "webhook.test";

  private static final LambdaLogger logger = LambdaRuntime.getLogger();

  private final WebhookSettings settings;
  private final EventMatcher eventMatcher;
  private final WebhookSubscriptionService subscriptionService;
  private final WebhookDeliveryHistoryService historyService;
  private final WebhookHttpService httpService;
  private final CircuitBreakerRegistry circuitBreakers;
  private final Clock clock;
  private final ObjectMapper objectMapper = JsonUtils.newObjectMapper();
  private final AtomicBoolean enabled = new AtomicBoolean(false);

  public WebhookDispatcher(WebhookSettings settings, EventMatcher eventMatcher,
      WebhookSubscriptionService subscriptionService,
      WebhookDeliveryHistoryService historyService, WebhookHttpService httpService,
      CircuitBreakerRegistry circuitBreakers, Clock clock) {
    this.settings = settings;
    this.eventMatcher = eventMatcher;
    this.subscriptionService = subscriptionService;
    this.historyService = historyService;
    this.httpService = httpService;
    this.circuitBreakers = circuitBreakers;
    this.clock = clock;
  }

  public void initialize() {
    enabled.set(true);
    logger.log("Webhook dispatcher initialized for " + settings.getServiceName());
  }

  public void enable() {
    enabled.set(true);
  }

  public void disable() {
    enabled.set(false);
  }

  public boolean isEnabled() {
    return enabled.get();
  }

  /**
   * @return one record per matched subscription, all sharing the same event id; empty when the
   *         dispatcher is disabled or nothing matches
   */
  public List<DeliveryRecord> dispatch(WebhookEvent event) {
    if (!enabled.get()) {
      return List.of();
    }

    List<WebhookSubscription> webhooks =
        eventMatcher.findMatching(event.getTenantId(), event.getEventType());
    if (webhooks.isEmpty()) {
      return List.of();
    }

    String eventId = UUID.randomUUID().toString();
    logger.log("Dispatching " + event.getEventType() + " (eventId=" + eventId + ", correlationId="
        + event.getCorrelationId() + ") to " + webhooks.size() + " webhook(s) for tenant "
        + event.getTenantId());

    List<DeliveryRecord> deliveries = new ArrayList<>(webhooks.size());
    for (WebhookSubscription webhook : webhooks) {
      deliveries.add(deliver(webhook, eventId, event));
    }
    return deliveries;
  }

  /**
   * Sends one event to one subscription and records the outcome on it.
   */
  public DeliveryRecord deliver(WebhookSubscription webhook, String eventId, WebhookEvent event) {
    Instant createdAt = clock.instant();
    DeliveryRecord.Builder delivery = DeliveryRecord.builder(UUID.randomUUID().toString(), eventId,
        event.getEventType(), createdAt);

    EventEnvelope envelope = new EventEnvelope(eventId, event.getEventType(),
        createdAt.toString(), event.getTenantId(), event.getUserId(), event.getData(),
        settings.getApiVersion());
    String payload = serialize(envelope);
    long timestamp = clock.millis();

    if (webhook.getSecret() == null || webhook.getSecret().isEmpty()) {
      logger.log("Webhook secret is missing or invalid: service=" + settings.getServiceName()
          + ", webhookId=" + webhook.getId() + ", tenantId=" + webhook.getTenantId());
      throw new ValidationException("secret", "Webhook secret is required for delivery");
    }
    String signature = WebhookSignatureUtils.generateSignature(payload, webhook.getSecret(),
        timestamp);

    int maxAttempts = webhook.getMaxRetries() != null ? webhook.getMaxRetries()
        : settings.getDefaultMaxRetries();
    Duration timeout = Duration.ofMillis(webhook.getTimeout() != null ? webhook.getTimeout()
        : settings.getDefaultTimeoutMs());
    CircuitBreaker breaker = circuitBreakers.forUrl(webhook.getUrl());

    RetryOptions options = new RetryOptions()
        .maxRetries(Math.max(0, maxAttempts - 1))
        .strategy(RetryStrategy.EXPONENTIAL)
        .baseDelayMs(settings.getRetryBaseDelayMs())
        .maxDelayMs(settings.getRetryMaxDelayMs())
        .jitter(settings.isRetryJitter())
        .name("Webhook-" + settings.getServiceName() + "-" + webhook.getId())
        .isRetryable(error -> !(error instanceof CircuitBreakerOpenException)
            && !Thread.currentThread().isInterrupted())
        .onRetry((attempt, error, delayMs) -> {
          delivery.status(DeliveryStatus.RETRYING)
              .nextRetryAt(clock.instant().plusMillis(delayMs));
          logger.log("Webhook delivery failed, will retry: webhookId=" + webhook.getId()
              + ", eventType=" + event.getEventType() + ", attempt=" + attempt + "/" + maxAttempts
              + ", error=" + error.getMessage());
        });

    try {
      RetryResult<HttpResponse<String>> result = RetryUtils.retry(
          () -> breaker.execute(() -> post(webhook, payload, signature, timestamp, eventId,
              timeout, delivery)),
          options);

      delivery.attempts(result.getAttempts())
          .status(DeliveryStatus.SUCCESS)
          .deliveredAt(clock.instant())
          .nextRetryAt(null);

      logger.log("Webhook delivered: service=" + settings.getServiceName() + ", webhookId="
          + webhook.getId() + ", eventType=" + event.getEventType() + ", statusCode="
          + result.getResult().statusCode() + ", attempts=" + result.getAttempts());
    } catch (RetryException e) {
      String error = e.getCause() instanceof InterruptedException
          ? "Webhook delivery interrupted while waiting to retry"
          : e.getCause().getMessage();
      delivery.attempts(e.getAttempts())
          .status(DeliveryStatus.FAILED)
          .error(error)
          .nextRetryAt(null);

      if (e.getCause() instanceof CircuitBreakerOpenException) {
        logger.log("Webhook delivery blocked by circuit breaker: webhookId=" + webhook.getId()
            + ", eventType=" + event.getEventType() + ", url=" + webhook.getUrl());
      } else {
        logger.log("Webhook delivery failed after all retries: webhookId=" + webhook.getId()
            + ", eventType=" + event.getEventType() + ", attempts=" + e.getAttempts()
            + ", error=" + error);
      }
    }

    DeliveryRecord record = delivery.build();
    recordOutcome(webhook, record);
    return record;
  }

  /**
   * The store client refuses to run on an interrupted thread, so the flag is held back while
   * the outcome is written and restored afterwards.
   */
  private void recordOutcome(WebhookSubscription webhook, DeliveryRecord record) {
    boolean interrupted = Thread.interrupted();
    try {
      historyService.recordOutcome(webhook, record);
    } finally {
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /**
   * Sends a synthetic {@code webhook.test} event through the normal delivery path.
   */
  public WebhookTestResult test(String id, String tenantId) {
    return subscriptionService.get(id, tenantId)
        .map(webhook -> {
          Map<String, Object> data = new LinkedHashMap<>();
          data.put("message", "This is a test webhook delivery");
          data.put("service", settings.getServiceName());
          data.put("webhookId", id);
          data.put("timestamp", clock.instant().toString());
          WebhookEvent event = new WebhookEvent(TEST_EVENT_TYPE, tenantId, null, data);
          return WebhookTestResult.from(deliver(webhook, UUID.randomUUID().toString(), event));
        })
        .orElseGet(WebhookTestResult::notFound);
  }

  private HttpResponse<String> post(WebhookSubscription webhook, String payload,
      String signature, long timestamp, String eventId, Duration timeout,
      DeliveryRecord.Builder delivery) {
    delivery.statusCode(null).responseBody(null);
    long start = System.nanoTime();
    HttpResponse<String> response;
    try {
      response = httpService.sendWebhook(webhook.getUrl(), payload, signature, timestamp, eventId,
          webhook.getHeaders(), timeout);
    } catch (IOException e) {
      delivery.duration(elapsedMillis(start));
      throw new DeliveryException("Webhook request failed: " + describe(e), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new DeliveryException("Webhook request interrupted", e);
    }

    delivery.duration(elapsedMillis(start)).statusCode(response.statusCode())
        .responseBody(truncate(response.body()));

    if (response.statusCode() < 200 || response.statusCode() >= 300) {
      throw new DeliveryException(response.statusCode(), "HTTP " + response.statusCode());
    }
    return response;
  }

  private String serialize(EventEnvelope envelope) {
    try {
      return objectMapper.writeValueAsString(envelope);
    } catch (JsonProcessingException e) {
      throw new ValidationException("data", "Event data cannot be serialized: " + e.getMessage());
    }
  }

  private String truncate(String body) {
    if (body == null) {
      return null;
    }
    int max = settings.getMaxResponseBodyLength();
    return body.length() <= max ? body : body.substring(0, max);
  }

  private static long elapsedMillis(long startNanos) {
    return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
  }

  private static String describe(IOException e) {
    return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
  }
}
