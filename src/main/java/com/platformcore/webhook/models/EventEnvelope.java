package com.platformcore.webhook.models;

import java.util.Map;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Body of the outbound POST. {@code id} is the event id shared by every subscription notified
 * for the same event, so receivers can deduplicate on it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"id", "type", "timestamp", "tenantId", "userId", "data", "apiVersion"})
public class EventEnvelope {
  private String id;
  private String type;
  private String timestamp;
  private String tenantId;
  private String userId;
  private Map<String, Object> data;
  private String apiVersion;

  public EventEnvelope() {}

  public EventEnvelope(String id, String type, String timestamp, String tenantId, String userId,
      Map<String, Object> data, String apiVersion) {
    this.id = id;
    this.type = type;
    this.timestamp = timestamp;
    this.tenantId = tenantId;
    this.userId = userId;
    this.data = data;
    this.apiVersion = apiVersion;
  }

  public String getId() {
    return id;
  }

  public void setId(String id) {
    this.id = id;
  }

  public String getType() {
    return type;
  }

  public void setType(String type) {
    this.type = type;
  }

  public String getTimestamp() {
    return timestamp;
  }

  public void setTimestamp(String timestamp) {
    this.timestamp = timestamp;
  }

  public String getTenantId() {
    return tenantId;
  }

  public void setTenantId(String tenantId) {
    this.tenantId = tenantId;
  }

  public String getUserId() {
    return userId;
  }

  public void setUserId(String userId) {
    this.userId = userId;
  }

  public Map<String, Object> getData() {
    return data;
  }

  public void setData(Map<String, Object> data) {
    this.data = data;
  }

  public String getApiVersion() {
    return apiVersion;
  }

  public void setApiVersion(String apiVersion) {
    this.apiVersion = apiVersion;
  }

  @Override
  public String toString() {
    return "EventEnvelope [id=" + id + ", type=" + type + ", timestamp=" + timestamp + ", tenantId="
        + tenantId + ", userId=" + userId + ", apiVersion=" + apiVersion + "]";
  }
}
