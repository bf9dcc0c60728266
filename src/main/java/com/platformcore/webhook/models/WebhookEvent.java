package com.platformcore.webhook.models;

import java.util.Map;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A domain event handed to the dispatcher, either directly by a service or through the SQS
 * publisher queue.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class WebhookEvent {
	private String eventType;
	private String tenantId;
	private String userId;
	private Map<String, Object> data;
	private String correlationId;

	public WebhookEvent() {}

	public WebhookEvent(String eventType, String tenantId, String userId, Map<String, Object> data) {
		this.eventType = eventType;
		this.tenantId = tenantId;
		this.userId = userId;
		this.data = data;
	}

	public String getEventType() {
		return eventType;
	}

	public void setEventType(String eventType) {
		this.eventType = eventType;
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

	public String getCorrelationId() {
		return correlationId;
	}

	public void setCorrelationId(String correlationId) {
		this.correlationId = correlationId;
	}

	@Override
	public String toString() {
		return "WebhookEvent [eventType=" + eventType + ", tenantId=" + tenantId + ", userId=" + userId
				+ ", correlationId=" + correlationId + "]";
	}
}
