package com.platformcore.webhook.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum DeliveryStatus {
  PENDING("pending"),
  SUCCESS("success"),
  FAILED("failed"),
  RETRYING("retrying");

  private final String value;

  DeliveryStatus(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  public boolean isTerminal() {
    return this == SUCCESS || this == FAILED;
  }

  @JsonCreator
  public static DeliveryStatus fromValue(String value) {
    for (DeliveryStatus status : values()) {
      if (status.value.equalsIgnoreCase(value)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown delivery status: " + value);
  }
}
