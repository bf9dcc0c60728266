package com.platformcore.webhook.models;

public class DeliveryHistoryQuery {
  public static final int DEFAULT_LIMIT = 100;

  private int limit = DEFAULT_LIMIT;
  private DeliveryStatus status;

  public DeliveryHistoryQuery() {}

  public DeliveryHistoryQuery(int limit, DeliveryStatus status) {
    this.limit = limit;
    this.status = status;
  }

  public static DeliveryHistoryQuery all() {
    return new DeliveryHistoryQuery();
  }

  public int getLimit() { return limit; }
  public void setLimit(int limit) { this.limit = limit; }

  public DeliveryStatus getStatus() { return status; }
  public void setStatus(DeliveryStatus status) { this.status = status; }
}
