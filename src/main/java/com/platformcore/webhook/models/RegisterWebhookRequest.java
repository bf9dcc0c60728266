package com.platformcore.webhook.models;

import java.util.Map;
import java.util.Set;

public class RegisterWebhookRequest {
  private String tenantId;
  private String name;
  private String url;
  private String secret;
  private Set<String> events;
  private Map<String, String> headers;
  private Integer timeout;
  private Integer maxRetries;
  private String description;

  public RegisterWebhookRequest() {}

  public RegisterWebhookRequest(String tenantId, String name, String url, String secret,
      Set<String> events) {
    this.tenantId = tenantId;
    this.name = name;
    this.url = url;
    this.secret = secret;
    this.events = events;
  }

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

  public Map<String, String> getHeaders() { return headers; }
  public void setHeaders(Map<String, String> headers) { this.headers = headers; }

  public Integer getTimeout() { return timeout; }
  public void setTimeout(Integer timeout) { this.timeout = timeout; }

  public Integer getMaxRetries() { return maxRetries; }
  public void setMaxRetries(Integer maxRetries) { this.maxRetries = maxRetries; }

  public String getDescription() { return description; }
  public void setDescription(String description) { this.description = description; }
}
