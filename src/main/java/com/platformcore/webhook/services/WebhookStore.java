package com.platformcore.webhook.services;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.Predicate;
import com.platformcore.webhook.models.DeliveryRecord;
import com.platformcore.webhook.models.WebhookSubscription;

/**
 * Persistence for the subscriptions of one owning service. Every method addresses a
 * subscription by {@code (tenantId, id)}; a store instance never sees another service's data.
 *
 * <p>Health counters and the embedded delivery list are changed only through the dedicated
 * methods below, which implementations must apply atomically so concurrent deliveries from
 * several processes do not lose updates.
 */
public interface WebhookStore {

  void insert(WebhookSubscription subscription);

  /**
   * @return the subscription with {@code deliveries} and {@code deliveryCount} never null
   */
  Optional<WebhookSubscription> find(String tenantId, String id);

  List<WebhookSubscription> findByTenant(String tenantId);

  /** All subscriptions of this service, across tenants. */
  List<WebhookSubscription> findAll();

  /**
   * Writes the configuration fields and {@code isActive}. With {@code resetHealth} the failure
   * counter is set to zero and the disabled reason removed in the same write.
   *
   * @return the stored subscription after the write, empty if it does not exist
   */
  Optional<WebhookSubscription> saveConfiguration(WebhookSubscription subscription,
      boolean resetHealth);

  boolean delete(String tenantId, String id);

  /** Resets the failure counter and records a successful delivery. */
  boolean markDelivered(String tenantId, String id, Instant deliveredAt);

  /**
   * Atomically increments the failure counter.
   *
   * @return the counter after the increment, empty if the subscription is gone
   */
  OptionalInt markFailed(String tenantId, String id, Instant attemptedAt);

  boolean disable(String tenantId, String id, String reason);

  /**
   * Appends to the bounded delivery list, evicting the oldest entries beyond {@code capacity},
   * and increments the delivery counter.
   */
  boolean appendDelivery(String tenantId, String id, DeliveryRecord record, int capacity);

  /**
   * Replaces the delivery list with the entries matching {@code retain}.
   *
   * @return number of entries removed
   */
  int pruneDeliveries(String tenantId, String id, Predicate<DeliveryRecord> retain, int capacity);
}
