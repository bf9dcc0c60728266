package com.platformcore.webhook.models;

import java.util.Map;
import java.util.Set;

/**
 * Partial update of a subscription. Null fields are left unchanged.
 */
public class UpdateWebhookRequest {
  private String name;
  private String url;
  private String secret;
  private Set<String> events;
  private Map<String, String> headers;
  private Integer timeout;
  private Integer maxRetries;
  private String description;
  private Boolean isActive;

  public String getName() { return name; }
  public void setName(String name) { this.name = name; }

  public String getUrl() { return url; }
  public void setUrl(String url) { this.url = url; }

  public String getSecret() { return secret; }
  public void setSecret(String secret) { this.secret = secret; }

  public Set<String> getEvents() { return events; }
  public void setEvents(Set<String> events) { this.events = events; }

  public Map<String, String> getHeaders() { return headers; }
  public void setHeaders(Map<String, String> headers) { this.headers = headers; }

  public Integer getTimeout() { return timeout; }
  public void setTimeout(Integer timeout) { this.timeout = timeout; }

  public Integer getMaxRetries() { return maxRetries; }
  public void setMaxRetries(Integer maxRetries) { this.maxRetries = maxRetries; }

  public String getDescription() { return description; }
  public void setDescription(String description) { this.description = description; }

  public Boolean getIsActive() { return isActive; }
  public void setIsActive(Boolean isActive) { this.isActive = isActive; }
}
