package com.platformcore.webhook.exceptions;

import com.platformcore.webhook.models.CircuitBreakerState;

/**
 * Thrown instead of calling an endpoint whose circuit breaker is open.
 */
public class CircuitBreakerOpenException extends RuntimeException {

  private final CircuitBreakerState state;
  private final long remainingMillis;

  public CircuitBreakerOpenException(String name, CircuitBreakerState state, long remainingMillis) {
    super("Circuit breaker " + name + " is OPEN. Service unavailable. Retry after "
        + (long) Math.ceil(remainingMillis / 1000.0) + "s");
    this.state = state;
    this.remainingMillis = remainingMillis;
  }

  public CircuitBreakerState getState() {
    return state;
  }

  public long getRemainingMillis() {
    return remainingMillis;
  }
}
