package com.platformcore.webhook.services;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import com.platformcore.webhook.config.WebhookSettings;
import com.platformcore.webhook.models.DeliveryHistoryQuery;
import com.platformcore.webhook.models.DeliveryRecord;
import com.platformcore.webhook.models.RegisterWebhookRequest;
import com.platformcore.webhook.models.UpdateWebhookRequest;
import com.platformcore.webhook.models.WebhookEvent;
import com.platformcore.webhook.models.WebhookStats;
import com.platformcore.webhook.models.WebhookSubscription;
import com.platformcore.webhook.models.WebhookTestResult;

/**
 * Management surface of the webhook engine for one owning service. The gateway layer calls
 * this; the pieces behind it can also be used on their own.
 */
public class WebhookManager {

  private final WebhookSettings settings;
  private final WebhookSubscriptionService subscriptions;
  private final WebhookDeliveryHistoryService history;
  private final WebhookDispatcher dispatcher;
  private final CircuitBreakerRegistry circuitBreakers;

  public WebhookManager(WebhookSettings settings, WebhookStore store, WebhookHttpService httpService,
      Clock clock) {
    this.settings = settings;
    this.subscriptions = new WebhookSubscriptionService(store, settings, clock);
    this.history = new WebhookDeliveryHistoryService(store, settings, clock);
    this.circuitBreakers = new CircuitBreakerRegistry(settings, clock);
    this.dispatcher = new WebhookDispatcher(settings,
        new EventMatcher(store, settings.getMaxConsecutiveFailures()), subscriptions, history,
        httpService, circuitBreakers, clock);
  }

  public static WebhookManager create(WebhookSettings settings) {
    return new WebhookManager(settings,
        new WebhookDynamoDbService(settings.getTableName(), settings.getServiceName()),
        new WebhookHttpService(settings.getUserAgent()), Clock.systemUTC());
  }

  public void initialize() {
    dispatcher.initialize();
  }

  public void enable() {
    dispatcher.enable();
  }

  public void disable() {
    dispatcher.disable();
  }

  public boolean isEnabled() {
    return dispatcher.isEnabled();
  }

  public WebhookSubscription register(RegisterWebhookRequest request) {
    return subscriptions.register(request);
  }

  public Optional<WebhookSubscription> update(String id, String tenantId,
      UpdateWebhookRequest updates) {
    return subscriptions.update(id, tenantId, updates);
  }

  public boolean delete(String id, String tenantId) {
    return subscriptions.delete(id, tenantId);
  }

  public Optional<WebhookSubscription> get(String id, String tenantId) {
    return subscriptions.get(id, tenantId);
  }

  public List<WebhookSubscription> list(String tenantId, boolean includeInactive) {
    return subscriptions.list(tenantId, includeInactive);
  }

  public List<DeliveryRecord> dispatch(WebhookEvent event) {
    return dispatcher.dispatch(event);
  }

  public WebhookTestResult test(String id, String tenantId) {
    return dispatcher.test(id, tenantId);
  }

  public List<DeliveryRecord> history(String webhookId, String tenantId,
      DeliveryHistoryQuery query) {
    return history.history(webhookId, tenantId, query);
  }

  public WebhookStats stats(String tenantId) {
    return history.stats(tenantId);
  }

  public int cleanup() {
    return history.cleanup(settings.getRetentionDays());
  }

  public int cleanup(int olderThanDays) {
    return history.cleanup(olderThanDays);
  }

  public CircuitBreakerRegistry getCircuitBreakers() {
    return circuitBreakers;
  }

  public WebhookSettings getSettings() {
    return settings;
  }
}
