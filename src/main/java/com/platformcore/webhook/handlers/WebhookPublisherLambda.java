package com.platformcore.webhook.handlers;

import java.util.ArrayList;
import java.util.List;
import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.LambdaLogger;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import com.amazonaws.services.lambda.runtime.events.SQSBatchResponse;
import com.amazonaws.services.lambda.runtime.events.SQSEvent;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.platformcore.webhook.config.WebhookSettings;
import com.platformcore.webhook.models.DeliveryRecord;
import com.platformcore.webhook.models.DeliveryStatus;
import com.platformcore.webhook.models.WebhookEvent;
import com.platformcore.webhook.services.WebhookManager;
import com.platformcore.webhook.utils.JsonUtils;

/**
 * Consumes domain events from SQS and dispatches them to matching webhooks. Delivery failures
 * are already recorded on the subscriptions, so only messages that could not be dispatched at
 * all are reported back as batch item failures.
 */
public class WebhookPublisherLambda implements RequestHandler<SQSEvent, SQSBatchResponse> {

  private final ObjectMapper readObjectMapper;
  private final WebhookManager webhookManager;

  public WebhookPublisherLambda() {
    this(WebhookManager.create(WebhookSettings.fromEnvironment()));
  }

  public WebhookPublisherLambda(WebhookManager webhookManager) {
    this.webhookManager = webhookManager;
    this.webhookManager.initialize();
    this.readObjectMapper = JsonUtils.newObjectMapper();
  }

  @Override
  public SQSBatchResponse handleRequest(SQSEvent event, Context context) {
    List<SQSBatchResponse.BatchItemFailure> failures = new ArrayList<>();
    for (SQSEvent.SQSMessage message : event.getRecords()) {
      try {
        processWebhookMessage(message, context.getLogger());
      } catch (Exception e) {
        context.getLogger().log("Error processing message " + message.getMessageId() + ": "
            + e.getMessage());
        failures.add(new SQSBatchResponse.BatchItemFailure(message.getMessageId()));
      }
    }
    context.getLogger().log("Processed " + event.getRecords().size() + " messages, "
        + failures.size() + " failed");
    return new SQSBatchResponse(failures);
  }

  List<DeliveryRecord> processWebhookMessage(SQSEvent.SQSMessage sqsMessage, LambdaLogger logger)
      throws Exception {
    WebhookEvent event = readObjectMapper.readValue(sqsMessage.getBody(), WebhookEvent.class);
    if (event.getEventType() == null || event.getTenantId() == null) {
      throw new IllegalArgumentException("eventType and tenantId are required");
    }
    logger.log("Processing webhook event: " + event);

    List<DeliveryRecord> deliveries = webhookManager.dispatch(event);
    long delivered = deliveries.stream()
        .filter(d -> d.getStatus() == DeliveryStatus.SUCCESS).count();
    logger.log("Dispatched " + event.getEventType() + " to " + deliveries.size()
        + " webhook(s), " + delivered + " delivered");
    return deliveries;
  }
}
