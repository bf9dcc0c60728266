package com.platformcore.webhook.exceptions;

/**
 * A single delivery attempt failed, either with a non-2xx response or in transport.
 */
public class DeliveryException extends RuntimeException {

  private final Integer statusCode;

  public DeliveryException(int statusCode, String message) {
    super(message);
    this.statusCode = statusCode;
  }

  public DeliveryException(String message, Throwable cause) {
    super(message, cause);
    this.statusCode = null;
  }

  public Integer getStatusCode() {
    return statusCode;
  }
}
