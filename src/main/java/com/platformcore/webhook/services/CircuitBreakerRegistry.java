package com.platformcore.webhook.services;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import com.platformcore.webhook.config.WebhookSettings;

/**
 * Process-local circuit breakers keyed by endpoint URL. Breakers are created on first use and
 * live as long as the registry; they are not shared across Lambda instances.
 */
public class CircuitBreakerRegistry {

    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final WebhookSettings settings;
    private final Clock clock;

    public CircuitBreakerRegistry(WebhookSettings settings, Clock clock) {
        this.settings = settings;
        this.clock = clock;
    }

    public CircuitBreaker forUrl(String url) {
        return breakers.computeIfAbsent(url, key -> new CircuitBreaker(
            "Webhook-" + settings.getServiceName() + "-" + key,
            settings.getBreakerFailureThreshold(),
            settings.getBreakerResetTimeoutMs(),
            settings.getBreakerMonitoringWindowMs(),
            clock));
    }
}
