package com.platformcore.webhook.services;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import com.amazonaws.services.lambda.runtime.LambdaLogger;
import com.amazonaws.services.lambda.runtime.LambdaRuntime;
import com.platformcore.webhook.config.WebhookSettings;
import com.platformcore.webhook.exceptions.ValidationException;
import com.platformcore.webhook.models.RegisterWebhookRequest;
import com.platformcore.webhook.models.UpdateWebhookRequest;
import com.platformcore.webhook.models.WebhookSubscription;

/**
 * Tenant-scoped CRUD over the subscriptions of one owning service. Invalid input raises
 * {@link ValidationException}; unknown subscriptions come back as empty results.
 */
public class WebhookSubscriptionService {

  private static final LambdaLogger logger = LambdaRuntime.getLogger();

  private final WebhookStore store;
  private final WebhookSettings settings;
  private final Clock clock;

  public WebhookSubscriptionService(WebhookStore store, WebhookSettings settings, Clock clock) {
    this.store = store;
    this.settings = settings;
    this.clock = clock;
  }

  public WebhookSubscription register(RegisterWebhookRequest request) {
    requireText("tenantId", request.getTenantId());
    if (request.getTenantId().indexOf(WebhookDynamoDbService.KEY_SEPARATOR) >= 0) {
      throw new ValidationException("tenantId",
          "tenantId must not contain '" + WebhookDynamoDbService.KEY_SEPARATOR + "'");
    }
    requireText("name", request.getName());
    validateUrl(request.getUrl());
    validateSecret(request.getSecret());
    Set<String> events = validateEvents(request.getEvents());
    validateLimits(request.getTimeout(), request.getMaxRetries());

    Instant now = clock.instant();
    WebhookSubscription webhook = new WebhookSubscription();
    webhook.setId(UUID.randomUUID().toString());
    webhook.setTenantId(request.getTenantId());
    webhook.setName(request.getName());
    webhook.setUrl(request.getUrl());
    webhook.setSecret(request.getSecret());
    webhook.setEvents(events);
    webhook.setIsActive(true);
    webhook.setHeaders(request.getHeaders() == null ? null : new LinkedHashMap<>(request.getHeaders()));
    webhook.setTimeout(request.getTimeout() != null ? request.getTimeout()
        : settings.getDefaultTimeoutMs());
    webhook.setMaxRetries(request.getMaxRetries() != null ? request.getMaxRetries()
        : settings.getDefaultMaxRetries());
    webhook.setDescription(request.getDescription());
    webhook.setCreatedAt(now);
    webhook.setUpdatedAt(now);
    webhook.setConsecutiveFailures(0);
    webhook.setDeliveryCount(0);

    store.insert(webhook);

    logger.log("Webhook registered: service=" + settings.getServiceName() + ", webhookId="
        + webhook.getId() + ", tenantId=" + webhook.getTenantId() + ", url=" + webhook.getUrl()
        + ", events=" + webhook.getEvents());
    return webhook;
  }

  /**
   * Applies the non-null fields of {@code updates}. Setting {@code isActive=true} also resets
   * the failure counter and clears the disabled reason.
   */
  public Optional<WebhookSubscription> update(String id, String tenantId,
      UpdateWebhookRequest updates) {
    Optional<WebhookSubscription> existing = store.find(tenantId, id);
    if (existing.isEmpty()) {
      logger.log("Webhook not found: id=" + id + ", tenantId=" + tenantId + ", service="
          + settings.getServiceName());
      return Optional.empty();
    }

    WebhookSubscription webhook = existing.get();
    if (updates.getName() != null) {
      requireText("name", updates.getName());
      webhook.setName(updates.getName());
    }
    if (updates.getUrl() != null) {
      validateUrl(updates.getUrl());
      webhook.setUrl(updates.getUrl());
    }
    if (updates.getSecret() != null) {
      validateSecret(updates.getSecret());
      webhook.setSecret(updates.getSecret());
    }
    if (updates.getEvents() != null) {
      webhook.setEvents(validateEvents(updates.getEvents()));
    }
    if (updates.getHeaders() != null) {
      webhook.setHeaders(new LinkedHashMap<>(updates.getHeaders()));
    }
    validateLimits(updates.getTimeout(), updates.getMaxRetries());
    if (updates.getTimeout() != null) {
      webhook.setTimeout(updates.getTimeout());
    }
    if (updates.getMaxRetries() != null) {
      webhook.setMaxRetries(updates.getMaxRetries());
    }
    if (updates.getDescription() != null) {
      webhook.setDescription(updates.getDescription());
    }
    boolean reactivate = Boolean.TRUE.equals(updates.getIsActive());
    if (updates.getIsActive() != null) {
      webhook.setIsActive(updates.getIsActive());
    }
    webhook.setUpdatedAt(clock.instant());

    Optional<WebhookSubscription> saved = store.saveConfiguration(webhook, reactivate);
    if (reactivate && saved.isPresent()) {
      logger.log("Webhook reactivated: webhookId=" + id + ", tenantId=" + tenantId);
    }
    return saved;
  }

  public boolean delete(String id, String tenantId) {
    boolean deleted = store.delete(tenantId, id);
    if (deleted) {
      logger.log("Webhook deleted: webhookId=" + id + ", tenantId=" + tenantId + ", service="
          + settings.getServiceName());
    }
    return deleted;
  }

  public Optional<WebhookSubscription> get(String id, String tenantId) {
    Optional<WebhookSubscription> webhook = store.find(tenantId, id);
    if (webhook.isEmpty()) {
      logger.log("Webhook not found: id=" + id + ", tenantId=" + tenantId + ", service="
          + settings.getServiceName());
    }
    return webhook;
  }

  public List<WebhookSubscription> list(String tenantId) {
    return list(tenantId, false);
  }

  public List<WebhookSubscription> list(String tenantId, boolean includeInactive) {
    List<WebhookSubscription> webhooks = store.findByTenant(tenantId);
    if (includeInactive) {
      return webhooks;
    }
    return webhooks.stream().filter(WebhookSubscription::isActiveSubscription)
        .collect(Collectors.toList());
  }

  private static void requireText(String field, String value) {
    if (value == null || value.isBlank()) {
      throw new ValidationException(field, field + " is required");
    }
  }

  private static void validateSecret(String secret) {
    if (secret == null || secret.isEmpty()) {
      throw new ValidationException("secret", "Webhook secret is required");
    }
  }

  private static void validateUrl(String url) {
    requireText("url", url);
    try {
      URI uri = new URI(url);
      String scheme = uri.getScheme();
      if (!uri.isAbsolute() || uri.getHost() == null
          || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
        throw new ValidationException("url", "url must be an absolute http(s) URL: " + url);
      }
    } catch (URISyntaxException e) {
      throw new ValidationException("url", "url is malformed: " + e.getMessage());
    }
  }

  private static Set<String> validateEvents(Set<String> events) {
    if (events == null || events.isEmpty()) {
      throw new ValidationException("events", "At least one event pattern is required");
    }
    Set<String> patterns = new LinkedHashSet<>();
    for (String event : events) {
      if (event == null || event.isBlank()) {
        throw new ValidationException("events", "Event patterns must not be blank");
      }
      patterns.add(event.trim());
    }
    return patterns;
  }

  private static void validateLimits(Integer timeout, Integer maxRetries) {
    if (timeout != null && timeout <= 0) {
      throw new ValidationException("timeout", "timeout must be positive");
    }
    if (maxRetries != null && maxRetries < 1) {
      throw new ValidationException("maxRetries", "maxRetries must be at least 1");
    }
  }
}
