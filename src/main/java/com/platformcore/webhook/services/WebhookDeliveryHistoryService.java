package com.platformcore.webhook.services;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.OptionalInt;
import java.util.stream.Collectors;
import com.amazonaws.services.lambda.runtime.LambdaLogger;
import com.amazonaws.services.lambda.runtime.LambdaRuntime;
import com.platformcore.webhook.config.WebhookSettings;
import com.platformcore.webhook.models.DeliveryHistoryQuery;
import com.platformcore.webhook.models.DeliveryRecord;
import com.platformcore.webhook.models.DeliveryStatus;
import com.platformcore.webhook.models.WebhookStats;
import com.platformcore.webhook.models.WebhookSubscription;

/**
 * Records delivery outcomes on their subscription and answers history and statistics queries
 * from the embedded delivery lists.
 */
public class WebhookDeliveryHistoryService {

  private static final LambdaLogger logger = LambdaRuntime.getLogger();
  private static final Duration STATS_WINDOW = Duration.ofHours(24);

  private final WebhookStore store;
  private final WebhookSettings settings;
  private final Clock clock;

  public WebhookDeliveryHistoryService(WebhookStore store, WebhookSettings settings, Clock clock) {
    this.store = store;
    this.settings = settings;
    this.clock = clock;
  }

  /**
   * Applies a finalized delivery to its subscription: health counters first, then the bounded
   * append. A failure that brings the counter to {@code maxConsecutiveFailures} disables the
   * subscription.
   */
  public void recordOutcome(WebhookSubscription webhook, DeliveryRecord delivery) {
    Instant now = clock.instant();
    if (delivery.getStatus() == DeliveryStatus.SUCCESS) {
      store.markDelivered(webhook.getTenantId(), webhook.getId(), now);
    } else {
      OptionalInt failures = store.markFailed(webhook.getTenantId(), webhook.getId(), now);
      if (failures.isPresent() && failures.getAsInt() >= settings.getMaxConsecutiveFailures()) {
        String reason = "Auto-disabled after " + settings.getMaxConsecutiveFailures()
            + " consecutive failures";
        store.disable(webhook.getTenantId(), webhook.getId(), reason);
        logger.log("Webhook auto-disabled due to failures: service=" + settings.getServiceName()
            + ", webhookId=" + webhook.getId() + ", consecutiveFailures=" + failures.getAsInt());
      }
    }

    boolean stored = store.appendDelivery(webhook.getTenantId(), webhook.getId(), delivery,
        settings.getMaxRecentDeliveries());
    if (!stored) {
      logger.log("Delivery " + delivery.getId() + " not stored, webhook " + webhook.getId()
          + " no longer exists");
    }
  }

  public List<DeliveryRecord> history(String webhookId, String tenantId,
      DeliveryHistoryQuery query) {
    return store.find(tenantId, webhookId)
        .map(webhook -> webhook.getDeliveries().stream()
            .filter(d -> query.getStatus() == null || d.getStatus() == query.getStatus())
            .sorted(Comparator.comparing(DeliveryRecord::getCreatedAt).reversed())
            .limit(Math.max(0, query.getLimit()))
            .collect(Collectors.toList()))
        .orElseGet(List::of);
  }

  public WebhookStats stats(String tenantId) {
    List<WebhookSubscription> webhooks = store.findByTenant(tenantId);
    Instant since = clock.instant().minus(STATS_WINDOW);

    int active = 0;
    int recent = 0;
    int succeeded = 0;
    for (WebhookSubscription webhook : webhooks) {
      if (webhook.isActiveSubscription()) {
        active++;
      }
      for (DeliveryRecord delivery : webhook.getDeliveries()) {
        if (!delivery.getCreatedAt().isBefore(since)) {
          recent++;
          if (delivery.getStatus() == DeliveryStatus.SUCCESS) {
            succeeded++;
          }
        }
      }
    }

    int successRate = recent > 0 ? (int) Math.round(succeeded * 100.0 / recent) : 100;
    return new WebhookStats(webhooks.size(), active, webhooks.size() - active, recent,
        successRate);
  }

  /**
   * Removes successful deliveries older than {@code olderThanDays}. Failed and retrying
   * deliveries are kept for audit regardless of age; the list capacity still bounds them.
   *
   * @return number of delivery records removed
   */
  public int cleanup(int olderThanDays) {
    Instant cutoff = clock.instant().minus(Duration.ofDays(olderThanDays));
    int cleaned = 0;

    for (WebhookSubscription webhook : store.findAll()) {
      boolean hasExpired = webhook.getDeliveries().stream()
          .anyMatch(d -> d.getStatus() == DeliveryStatus.SUCCESS
              && d.getCreatedAt().isBefore(cutoff));
      if (!hasExpired) {
        continue;
      }
      cleaned += store.pruneDeliveries(webhook.getTenantId(), webhook.getId(),
          d -> !d.getCreatedAt().isBefore(cutoff) || d.getStatus() != DeliveryStatus.SUCCESS,
          settings.getMaxRecentDeliveries());
    }

    if (cleaned > 0) {
      logger.log("Cleaned up " + cleaned + " old webhook deliveries: service="
          + settings.getServiceName() + ", olderThanDays=" + olderThanDays);
    }
    return cleaned;
  }
}
