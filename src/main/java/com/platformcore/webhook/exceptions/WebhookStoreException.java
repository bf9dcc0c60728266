package com.platformcore.webhook.exceptions;

public class WebhookStoreException extends RuntimeException {

  public WebhookStoreException(String message) {
    super(message);
  }

  public WebhookStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
