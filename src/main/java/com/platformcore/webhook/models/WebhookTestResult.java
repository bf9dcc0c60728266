package com.platformcore.webhook.models;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class WebhookTestResult {
  private final boolean success;
  private final Integer statusCode;
  private final Long responseTime;
  private final String error;

  public WebhookTestResult(boolean success, Integer statusCode, Long responseTime, String error) {
    this.success = success;
    this.statusCode = statusCode;
    this.responseTime = responseTime;
    this.error = error;
  }

  public static WebhookTestResult notFound() {
    return new WebhookTestResult(false, null, null, "Webhook not found");
  }

  public static WebhookTestResult from(DeliveryRecord delivery) {
    return new WebhookTestResult(delivery.getStatus() == DeliveryStatus.SUCCESS,
        delivery.getStatusCode(), delivery.getDuration(), delivery.getError());
  }

  public boolean isSuccess() { return success; }

  public Integer getStatusCode() { return statusCode; }

  public Long getResponseTime() { return responseTime; }

  public String getError() { return error; }
}
