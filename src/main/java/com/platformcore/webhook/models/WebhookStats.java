package com.platformcore.webhook.models;

public class WebhookStats {
  private final int total;
  private final int active;
  private final int disabled;
  private final int deliveriesLast24h;
  private final int successRate;

  public WebhookStats(int total, int active, int disabled, int deliveriesLast24h,
      int successRate) {
    this.total = total;
    this.active = active;
    this.disabled = disabled;
    this.deliveriesLast24h = deliveriesLast24h;
    this.successRate = successRate;
  }

  public int getTotal() { return total; }

  public int getActive() { return active; }

  public int getDisabled() { return disabled; }

  public int getDeliveriesLast24h() { return deliveriesLast24h; }

  /** Percentage of successful deliveries in the last 24 hours, 100 when there were none. */
  public int getSuccessRate() { return successRate; }

  @Override
  public String toString() {
    return "WebhookStats [total=" + total + ", active=" + active + ", disabled=" + disabled
        + ", deliveriesLast24h=" + deliveriesLast24h + ", successRate=" + successRate + "]";
  }
}
