package com.platformcore.webhook.exceptions;

/**
 * The retry loop gave up. The cause is the failure of the last attempt.
 */
public class RetryException extends RuntimeException {

  private final int attempts;
  private final boolean exhausted;

  public RetryException(String name, int attempts, boolean exhausted, Throwable cause) {
    super(name + " failed after " + attempts + " attempt(s): " + cause.getMessage(), cause);
    this.attempts = attempts;
    this.exhausted = exhausted;
  }

  public int getAttempts() {
    return attempts;
  }

  /**
   * @return true when every allowed attempt was used, false when a non-retryable error stopped
   *         the loop early
   */
  public boolean isExhausted() {
    return exhausted;
  }
}
