package com.platformcore.webhook.services;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import com.amazonaws.services.lambda.runtime.LambdaLogger;
import com.amazonaws.services.lambda.runtime.LambdaRuntime;

public class WebhookHttpService {
    public static final String SIGNATURE_HEADER = "X-Webhook-Signature";
    public static final String TIMESTAMP_HEADER = "X-Webhook-Timestamp";
    public static final String ID_HEADER = "X-Webhook-ID";

    private static final LambdaLogger logger = LambdaRuntime.getLogger();

    private final HttpClient httpClient;
    private final String userAgent;

    public WebhookHttpService(String userAgent) {
        this(HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .build(), userAgent);
    }

    public WebhookHttpService(HttpClient httpClient, String userAgent) {
        this.httpClient = httpClient;
        this.userAgent = userAgent;
    }

    /**
     * POSTs a signed body. The request is aborted with an
     * {@link java.net.http.HttpTimeoutException} when no response arrives within {@code timeout}.
     */
    public HttpResponse<String> sendWebhook(String url, String payload, String signature,
            long timestamp, String eventId, Map<String, String> customHeaders, Duration timeout)
            throws IOException, InterruptedException {
        HttpRequest.Builder requestBuilder = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .timeout(timeout)
            .header("Content-Type", "application/json")
            .header("User-Agent", userAgent)
            .header(SIGNATURE_HEADER, signature)
            .header(TIMESTAMP_HEADER, String.valueOf(timestamp))
            .header(ID_HEADER, eventId)
            .POST(HttpRequest.BodyPublishers.ofString(payload));

        // subscriber headers go last and replace defaults of the same name
        if (customHeaders != null) {
            for (Map.Entry<String, String> header : customHeaders.entrySet()) {
                try {
                    requestBuilder.setHeader(header.getKey(), header.getValue());
                } catch (IllegalArgumentException e) {
                    logger.log("Skipping restricted header " + header.getKey() + " for " + url);
                }
            }
        }

        return httpClient.send(requestBuilder.build(), HttpResponse.BodyHandlers.ofString());
    }
}
