package com.platformcore.webhook.exceptions;

/**
 * Raised for malformed registration input and for subscriptions that cannot be signed.
 */
public class ValidationException extends RuntimeException {

  private final String field;

  public ValidationException(String field, String message) {
    super(message);
    this.field = field;
  }

  public String getField() {
    return field;
  }
}
