package com.platformcore.webhook.models;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A tenant-owned registration of a target URL and the event patterns it receives, together with
 * its delivery health and the most recent delivery records.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class WebhookSubscription {
  private String id;
  private String tenantId;
  private String name;
  private String url;
  private String secret;
  private Set<String> events = new LinkedHashSet<>();
  private Boolean isActive;
  private Map<String, String> headers;
  private Integer timeout;
  private Integer maxRetries;
  private String description;
  private Instant createdAt;
  private Instant updatedAt;
  private Instant lastDeliveryAt;
  private DeliveryStatus lastDeliveryStatus;
  private int consecutiveFailures;
  private String disabledReason;
  private List<DeliveryRecord> deliveries = new ArrayList<>();
  private long deliveryCount;

  public WebhookSubscription() {}

  public WebhookSubscription(WebhookSubscription other) {
    this.id = other.id;
    this.tenantId = other.tenantId;
    this.name = other.name;
    this.url = other.url;
    this.secret = other.secret;
    this.events = other.events == null ? new LinkedHashSet<>() : new LinkedHashSet<>(other.events);
    this.isActive = other.isActive;
    this.headers = other.headers == null ? null : new LinkedHashMap<>(other.headers);
    this.timeout = other.timeout;
    this.maxRetries = other.maxRetries;
    this.description = other.description;
    this.createdAt = other.createdAt;
    this.updatedAt = other.updatedAt;
    this.lastDeliveryAt = other.lastDeliveryAt;
    this.lastDeliveryStatus = other.lastDeliveryStatus;
    this.consecutiveFailures = other.consecutiveFailures;
    this.disabledReason = other.disabledReason;
    this.deliveries = other.deliveries == null ? new ArrayList<>() : new ArrayList<>(other.deliveries);
    this.deliveryCount = other.deliveryCount;
  }

  @JsonIgnore
  public boolean isActiveSubscription() {
    return Boolean.TRUE.equals(isActive);
  }

  // Getters and setters
  public String getId() { return id; }
  public void setId(String id) { this.id = id; }

  public String getTenantId() { return tenantId; }
  public void setTenantId(String tenantId) { this.tenantId = tenantId; }

  public String getName() { return name; }
  public void setName(String name) { this.name = name; }

  public String getUrl() { return url; }
  public void setUrl(String url) { this.url = url; }

  public String getSecret() { return secret; }
  public void setSecret(String secret) { this.secret = secret; }

  public Set<String> getEvents() { return events; }
  public void setEvents(Set<String> events) { this.events = events; }

  public Boolean getIsActive() { return isActive; }
  public void setIsActive(Boolean isActive) { this.isActive = isActive; }

  public Map<String, String> getHeaders() { return headers; }
  public void setHeaders(Map<String, String> headers) { this.headers = headers; }

  public Integer getTimeout() { return timeout; }
  public void setTimeout(Integer timeout) { this.timeout = timeout; }

  public Integer getMaxRetries() { return maxRetries; }
  public void setMaxRetries(Integer maxRetries) { this.maxRetries = maxRetries; }

  public String getDescription() { return description; }
  public void setDescription(String description) { this.description = description; }

  public Instant getCreatedAt() { return createdAt; }
  public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

  public Instant getUpdatedAt() { return updatedAt; }
  public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }

  public Instant getLastDeliveryAt() { return lastDeliveryAt; }
  public void setLastDeliveryAt(Instant lastDeliveryAt) { this.lastDeliveryAt = lastDeliveryAt; }

  public DeliveryStatus getLastDeliveryStatus() { return lastDeliveryStatus; }
  public void setLastDeliveryStatus(DeliveryStatus lastDeliveryStatus) {
    this.lastDeliveryStatus = lastDeliveryStatus;
  }

  public int getConsecutiveFailures() { return consecutiveFailures; }
  public void setConsecutiveFailures(int consecutiveFailures) {
    this.consecutiveFailures = consecutiveFailures;
  }

  public String getDisabledReason() { return disabledReason; }
  public void setDisabledReason(String disabledReason) { this.disabledReason = disabledReason; }

  public List<DeliveryRecord> getDeliveries() { return deliveries; }
  public void setDeliveries(List<DeliveryRecord> deliveries) { this.deliveries = deliveries; }

  public long getDeliveryCount() { return deliveryCount; }
  public void setDeliveryCount(long deliveryCount) { this.deliveryCount = deliveryCount; }

  // the secret is left out on purpose, this ends up in logs
  @Override
  public String toString() {
    return "WebhookSubscription [id=" + id + ", tenantId=" + tenantId + ", name=" + name + ", url="
        + url + ", events=" + events + ", isActive=" + isActive + ", consecutiveFailures="
        + consecutiveFailures + ", disabledReason=" + disabledReason + ", deliveryCount="
        + deliveryCount + "]";
  }
}
