package com.platformcore.webhook.config;

import java.util.Map;

/**
 * Engine-wide settings for one owning service. Defaults apply unless overridden by the
 * environment of the Lambda function.
 */
public class WebhookSettings {

  public static final String DEFAULT_API_VERSION = "2024-01-01";
  public static final String DEFAULT_USER_AGENT = "Webhooks/1.0";

  private String serviceName = "core";
  private String tableName = "webhooks";
  private String apiVersion = DEFAULT_API_VERSION;
  private int defaultTimeoutMs = 30000;
  private int defaultMaxRetries = 5;
  private int maxConsecutiveFailures = 10;
  private int maxResponseBodyLength = 1000;
  private String userAgent = DEFAULT_USER_AGENT;
  private int maxRecentDeliveries = 100;
  private long retryBaseDelayMs = 1000L;
  private long retryMaxDelayMs = 60000L;
  private boolean retryJitter = true;
  private int breakerFailureThreshold = 5;
  private long breakerResetTimeoutMs = 60000L;
  private long breakerMonitoringWindowMs = 120000L;
  private int retentionDays = 30;

  public WebhookSettings() {}

  public WebhookSettings(String serviceName) {
    this.serviceName = serviceName;
  }

  public static WebhookSettings fromEnvironment() {
    return fromEnvironment(System.getenv());
  }

  public static WebhookSettings fromEnvironment(Map<String, String> env) {
    WebhookSettings settings = new WebhookSettings();
    settings.setServiceName(env.getOrDefault("WEBHOOK_SERVICE_NAME", settings.getServiceName()));
    settings.setTableName(env.getOrDefault("DYNAMODB_TABLE_NAME", settings.getTableName()));
    settings.setApiVersion(env.getOrDefault("WEBHOOK_API_VERSION", settings.getApiVersion()));
    settings.setUserAgent(env.getOrDefault("WEBHOOK_USER_AGENT", settings.getUserAgent()));
    settings.setDefaultTimeoutMs(
        intValue(env, "WEBHOOK_DEFAULT_TIMEOUT_MS", settings.getDefaultTimeoutMs()));
    settings.setDefaultMaxRetries(
        intValue(env, "WEBHOOK_DEFAULT_MAX_RETRIES", settings.getDefaultMaxRetries()));
    settings.setMaxConsecutiveFailures(
        intValue(env, "WEBHOOK_MAX_CONSECUTIVE_FAILURES", settings.getMaxConsecutiveFailures()));
    settings.setRetryBaseDelayMs(
        longValue(env, "WEBHOOK_RETRY_BASE_DELAY_MS", settings.getRetryBaseDelayMs()));
    settings.setRetryMaxDelayMs(
        longValue(env, "WEBHOOK_RETRY_MAX_DELAY_MS", settings.getRetryMaxDelayMs()));
    settings.setRetentionDays(intValue(env, "WEBHOOK_RETENTION_DAYS", settings.getRetentionDays()));
    return settings;
  }

  private static int intValue(Map<String, String> env, String name, int fallback) {
    String value = env.get(name);
    if (value == null || value.isBlank()) {
      return fallback;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid integer for " + name + ": " + value, e);
    }
  }

  private static long longValue(Map<String, String> env, String name, long fallback) {
    String value = env.get(name);
    if (value == null || value.isBlank()) {
      return fallback;
    }
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid number for " + name + ": " + value, e);
    }
  }

  public String getServiceName() { return serviceName; }
  public void setServiceName(String serviceName) { this.serviceName = serviceName; }

  public String getTableName() { return tableName; }
  public void setTableName(String tableName) { this.tableName = tableName; }

  public String getApiVersion() { return apiVersion; }
  public void setApiVersion(String apiVersion) { this.apiVersion = apiVersion; }

  public int getDefaultTimeoutMs() { return defaultTimeoutMs; }
  public void setDefaultTimeoutMs(int defaultTimeoutMs) { this.defaultTimeoutMs = defaultTimeoutMs; }

  public int getDefaultMaxRetries() { return defaultMaxRetries; }
  public void setDefaultMaxRetries(int defaultMaxRetries) { this.defaultMaxRetries = defaultMaxRetries; }

  public int getMaxConsecutiveFailures() { return maxConsecutiveFailures; }
  public void setMaxConsecutiveFailures(int maxConsecutiveFailures) {
    this.maxConsecutiveFailures = maxConsecutiveFailures;
  }

  public int getMaxResponseBodyLength() { return maxResponseBodyLength; }
  public void setMaxResponseBodyLength(int maxResponseBodyLength) {
    this.maxResponseBodyLength = maxResponseBodyLength;
  }

  public String getUserAgent() { return userAgent; }
  public void setUserAgent(String userAgent) { this.userAgent = userAgent; }

  public int getMaxRecentDeliveries() { return maxRecentDeliveries; }
  public void setMaxRecentDeliveries(int maxRecentDeliveries) {
    this.maxRecentDeliveries = maxRecentDeliveries;
  }

  public long getRetryBaseDelayMs() { return retryBaseDelayMs; }
  public void setRetryBaseDelayMs(long retryBaseDelayMs) { this.retryBaseDelayMs = retryBaseDelayMs; }

  public long getRetryMaxDelayMs() { return retryMaxDelayMs; }
  public void setRetryMaxDelayMs(long retryMaxDelayMs) { this.retryMaxDelayMs = retryMaxDelayMs; }

  public boolean isRetryJitter() { return retryJitter; }
  public void setRetryJitter(boolean retryJitter) { this.retryJitter = retryJitter; }

  public int getBreakerFailureThreshold() { return breakerFailureThreshold; }
  public void setBreakerFailureThreshold(int breakerFailureThreshold) {
    this.breakerFailureThreshold = breakerFailureThreshold;
  }

  public long getBreakerResetTimeoutMs() { return breakerResetTimeoutMs; }
  public void setBreakerResetTimeoutMs(long breakerResetTimeoutMs) {
    this.breakerResetTimeoutMs = breakerResetTimeoutMs;
  }

  public long getBreakerMonitoringWindowMs() { return breakerMonitoringWindowMs; }
  public void setBreakerMonitoringWindowMs(long breakerMonitoringWindowMs) {
    this.breakerMonitoringWindowMs = breakerMonitoringWindowMs;
  }

  public int getRetentionDays() { return retentionDays; }
  public void setRetentionDays(int retentionDays) { this.retentionDays = retentionDays; }
}
