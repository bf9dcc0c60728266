package com.platformcore.webhook.handlers;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import com.amazonaws.services.lambda.runtime.events.ScheduledEvent;
import com.platformcore.webhook.config.WebhookSettings;
import com.platformcore.webhook.services.WebhookManager;

/**
 * Scheduled pruning of old successful delivery records, run from an EventBridge rule.
 */
public class WebhookCleanupLambda implements RequestHandler<ScheduledEvent, String> {

  private final WebhookManager webhookManager;

  public WebhookCleanupLambda() {
    this(WebhookManager.create(WebhookSettings.fromEnvironment()));
  }

  public WebhookCleanupLambda(WebhookManager webhookManager) {
    this.webhookManager = webhookManager;
  }

  @Override
  public String handleRequest(ScheduledEvent event, Context context) {
    int retentionDays = webhookManager.getSettings().getRetentionDays();
    context.getLogger().log("Cleaning up webhook deliveries older than " + retentionDays
        + " days (event " + event.getId() + ")");
    int removed = webhookManager.cleanup(retentionDays);
    return "Removed " + removed + " webhook deliveries";
  }
}
