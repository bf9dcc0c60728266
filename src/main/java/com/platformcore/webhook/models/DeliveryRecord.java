package com.platformcore.webhook.models;

import java.time.Instant;
import java.util.Objects;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of one delivery of one event to one subscription. Instances are immutable; a delivery
 * in progress is tracked by a {@link Builder} and published through {@link Builder#build()} once
 * its status is final.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class DeliveryRecord {
  private final String id;
  private final String eventId;
  private final String eventType;
  private final DeliveryStatus status;
  private final int attempts;
  private final Integer statusCode;
  private final String responseBody;
  private final String error;
  private final Long duration;
  private final Instant createdAt;
  private final Instant deliveredAt;
  private final Instant nextRetryAt;

  @JsonCreator
  public DeliveryRecord(@JsonProperty("id") String id,
      @JsonProperty("eventId") String eventId,
      @JsonProperty("eventType") String eventType,
      @JsonProperty("status") DeliveryStatus status,
      @JsonProperty("attempts") int attempts,
      @JsonProperty("statusCode") Integer statusCode,
      @JsonProperty("responseBody") String responseBody,
      @JsonProperty("error") String error,
      @JsonProperty("duration") Long duration,
      @JsonProperty("createdAt") Instant createdAt,
      @JsonProperty("deliveredAt") Instant deliveredAt,
      @JsonProperty("nextRetryAt") Instant nextRetryAt) {
    this.id = id;
    this.eventId = eventId;
    this.eventType = eventType;
    this.status = status;
    this.attempts = attempts;
    this.statusCode = statusCode;
    this.responseBody = responseBody;
    this.error = error;
    this.duration = duration;
    this.createdAt = createdAt;
    this.deliveredAt = deliveredAt;
    this.nextRetryAt = nextRetryAt;
  }

  public static Builder builder(String id, String eventId, String eventType, Instant createdAt) {
    return new Builder(id, eventId, eventType, createdAt);
  }

  public String getId() { return id; }

  public String getEventId() { return eventId; }

  public String getEventType() { return eventType; }

  public DeliveryStatus getStatus() { return status; }

  public int getAttempts() { return attempts; }

  public Integer getStatusCode() { return statusCode; }

  public String getResponseBody() { return responseBody; }

  public String getError() { return error; }

  public Long getDuration() { return duration; }

  public Instant getCreatedAt() { return createdAt; }

  public Instant getDeliveredAt() { return deliveredAt; }

  public Instant getNextRetryAt() { return nextRetryAt; }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof DeliveryRecord)) {
      return false;
    }
    DeliveryRecord that = (DeliveryRecord) o;
    return attempts == that.attempts && Objects.equals(id, that.id)
        && Objects.equals(eventId, that.eventId) && Objects.equals(eventType, that.eventType)
        && status == that.status && Objects.equals(statusCode, that.statusCode)
        && Objects.equals(responseBody, that.responseBody) && Objects.equals(error, that.error)
        && Objects.equals(duration, that.duration) && Objects.equals(createdAt, that.createdAt)
        && Objects.equals(deliveredAt, that.deliveredAt)
        && Objects.equals(nextRetryAt, that.nextRetryAt);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, eventId, status, createdAt);
  }

  @Override
  public String toString() {
    return "DeliveryRecord [id=" + id + ", eventId=" + eventId + ", eventType=" + eventType
        + ", status=" + status + ", attempts=" + attempts + ", statusCode=" + statusCode
        + ", error=" + error + ", duration=" + duration + ", createdAt=" + createdAt + "]";
  }

  /**
   * Mutable view of a delivery while its attempts are running.
   */
  public static final class Builder {
    private final String id;
    private final String eventId;
    private final String eventType;
    private final Instant createdAt;
    private DeliveryStatus status = DeliveryStatus.PENDING;
    private int attempts;
    private Integer statusCode;
    private String responseBody;
    private String error;
    private Long duration;
    private Instant deliveredAt;
    private Instant nextRetryAt;

    private Builder(String id, String eventId, String eventType, Instant createdAt) {
      this.id = id;
      this.eventId = eventId;
      this.eventType = eventType;
      this.createdAt = createdAt;
    }

    public Builder status(DeliveryStatus status) {
      this.status = status;
      return this;
    }

    public Builder attempts(int attempts) {
      this.attempts = attempts;
      return this;
    }

    public Builder statusCode(Integer statusCode) {
      this.statusCode = statusCode;
      return this;
    }

    public Builder responseBody(String responseBody) {
      this.responseBody = responseBody;
      return this;
    }

    public Builder error(String error) {
      this.error = error;
      return this;
    }

    public Builder duration(Long duration) {
      this.duration = duration;
      return this;
    }

    public Builder deliveredAt(Instant deliveredAt) {
      this.deliveredAt = deliveredAt;
      return this;
    }

    public Builder nextRetryAt(Instant nextRetryAt) {
      this.nextRetryAt = nextRetryAt;
      return this;
    }

    public DeliveryRecord build() {
      if (!status.isTerminal()) {
        throw new IllegalStateException("Delivery " + id + " is still " + status.getValue());
      }
      return new DeliveryRecord(id, eventId, eventType, status, attempts, statusCode, responseBody,
          error, duration, createdAt, deliveredAt, nextRetryAt);
    }
  }
}
