package com.platformcore.webhook.models;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CircuitBreakerState {
  CLOSED("closed"),
  OPEN("open"),
  HALF_OPEN("half-open");

  private final String value;

  CircuitBreakerState(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }
}
