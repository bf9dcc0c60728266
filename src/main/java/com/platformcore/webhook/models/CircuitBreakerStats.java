package com.platformcore.webhook.models;

public class CircuitBreakerStats {
  private final CircuitBreakerState state;
  private final int failures;
  private final int recentFailures;
  private final Long lastFailureTime;
  private final Long timeUntilRetry;

  public CircuitBreakerStats(CircuitBreakerState state, int failures, int recentFailures,
      Long lastFailureTime, Long timeUntilRetry) {
    this.state = state;
    this.failures = failures;
    this.recentFailures = recentFailures;
    this.lastFailureTime = lastFailureTime;
    this.timeUntilRetry = timeUntilRetry;
  }

  public CircuitBreakerState getState() { return state; }

  public int getFailures() { return failures; }

  public int getRecentFailures() { return recentFailures; }

  /** Epoch millis of the last failure, null if none was recorded. */
  public Long getLastFailureTime() { return lastFailureTime; }

  /** Millis until the breaker admits a trial call, null unless open. */
  public Long getTimeUntilRetry() { return timeUntilRetry; }
}
