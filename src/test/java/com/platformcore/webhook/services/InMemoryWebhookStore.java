package com.platformcore.webhook.services;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import com.platformcore.webhook.models.DeliveryRecord;
import com.platformcore.webhook.models.DeliveryStatus;
import com.platformcore.webhook.models.WebhookSubscription;

/**
 * {@link WebhookStore} kept in a map. Every read returns a copy so tests observe only what was
 * written through the store methods.
 */
class InMemoryWebhookStore implements WebhookStore {

  private final Map<String, WebhookSubscription> items = new LinkedHashMap<>();

  private static String key(String tenantId, String id) {
    return tenantId + "/" + id;
  }

  @Override
  public synchronized void insert(WebhookSubscription subscription) {
    items.put(key(subscription.getTenantId(), subscription.getId()),
        new WebhookSubscription(subscription));
  }

  @Override
  public synchronized Optional<WebhookSubscription> find(String tenantId, String id) {
    WebhookSubscription stored = items.get(key(tenantId, id));
    return stored == null ? Optional.empty() : Optional.of(new WebhookSubscription(stored));
  }

  @Override
  public synchronized List<WebhookSubscription> findByTenant(String tenantId) {
    return items.values().stream().filter(s -> tenantId.equals(s.getTenantId()))
        .map(WebhookSubscription::new).collect(Collectors.toList());
  }

  @Override
  public synchronized List<WebhookSubscription> findAll() {
    return items.values().stream().map(WebhookSubscription::new).collect(Collectors.toList());
  }

  @Override
  public synchronized Optional<WebhookSubscription> saveConfiguration(
      WebhookSubscription subscription, boolean resetHealth) {
    WebhookSubscription stored = items.get(key(subscription.getTenantId(), subscription.getId()));
    if (stored == null) {
      return Optional.empty();
    }
    WebhookSubscription updated = new WebhookSubscription(subscription);
    updated.setConsecutiveFailures(resetHealth ? 0 : stored.getConsecutiveFailures());
    updated.setDisabledReason(resetHealth ? null : stored.getDisabledReason());
    updated.setLastDeliveryAt(stored.getLastDeliveryAt());
    updated.setLastDeliveryStatus(stored.getLastDeliveryStatus());
    updated.setDeliveries(new ArrayList<>(stored.getDeliveries()));
    updated.setDeliveryCount(stored.getDeliveryCount());
    items.put(key(subscription.getTenantId(), subscription.getId()), updated);
    return Optional.of(new WebhookSubscription(updated));
  }

  @Override
  public synchronized boolean delete(String tenantId, String id) {
    return items.remove(key(tenantId, id)) != null;
  }

  @Override
  public synchronized boolean markDelivered(String tenantId, String id, Instant deliveredAt) {
    WebhookSubscription stored = items.get(key(tenantId, id));
    if (stored == null) {
      return false;
    }
    stored.setConsecutiveFailures(0);
    stored.setLastDeliveryStatus(DeliveryStatus.SUCCESS);
    stored.setLastDeliveryAt(deliveredAt);
    return true;
  }

  @Override
  public synchronized OptionalInt markFailed(String tenantId, String id, Instant attemptedAt) {
    WebhookSubscription stored = items.get(key(tenantId, id));
    if (stored == null) {
      return OptionalInt.empty();
    }
    stored.setConsecutiveFailures(stored.getConsecutiveFailures() + 1);
    stored.setLastDeliveryStatus(DeliveryStatus.FAILED);
    stored.setLastDeliveryAt(attemptedAt);
    return OptionalInt.of(stored.getConsecutiveFailures());
  }

  @Override
  public synchronized boolean disable(String tenantId, String id, String reason) {
    WebhookSubscription stored = items.get(key(tenantId, id));
    if (stored == null) {
      return false;
    }
    stored.setIsActive(false);
    stored.setDisabledReason(reason);
    return true;
  }

  @Override
  public synchronized boolean appendDelivery(String tenantId, String id, DeliveryRecord record,
      int capacity) {
    WebhookSubscription stored = items.get(key(tenantId, id));
    if (stored == null) {
      return false;
    }
    List<DeliveryRecord> deliveries = stored.getDeliveries();
    deliveries.add(record);
    while (deliveries.size() > capacity) {
      deliveries.remove(0);
    }
    stored.setDeliveryCount(stored.getDeliveryCount() + 1);
    return true;
  }

  @Override
  public synchronized int pruneDeliveries(String tenantId, String id,
      Predicate<DeliveryRecord> retain, int capacity) {
    WebhookSubscription stored = items.get(key(tenantId, id));
    if (stored == null) {
      return 0;
    }
    List<DeliveryRecord> kept = stored.getDeliveries().stream().filter(retain)
        .collect(Collectors.toCollection(ArrayList::new));
    int removed = stored.getDeliveries().size() - kept.size();
    while (kept.size() > capacity) {
      kept.remove(0);
    }
    stored.setDeliveries(kept);
    return removed;
  }

  /** Writes a record straight into the embedded list, bypassing the counter. */
  synchronized void seedDelivery(String tenantId, String id, DeliveryRecord record) {
    items.get(key(tenantId, id)).getDeliveries().add(record);
  }

  /** Replaces a stored subscription as-is, for simulating legacy or corrupt items. */
  synchronized void put(WebhookSubscription subscription) {
    items.put(key(subscription.getTenantId(), subscription.getId()),
        new WebhookSubscription(subscription));
  }
}
