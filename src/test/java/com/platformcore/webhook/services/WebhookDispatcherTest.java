package com.platformcore.webhook.services;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.platformcore.webhook.config.WebhookSettings;
import com.platformcore.webhook.exceptions.ValidationException;
import com.platformcore.webhook.models.DeliveryRecord;
import com.platformcore.webhook.models.DeliveryStatus;
import com.platformcore.webhook.models.RegisterWebhookRequest;
import com.platformcore.webhook.models.WebhookEvent;
import com.platformcore.webhook.models.WebhookSubscription;
import com.platformcore.webhook.models.WebhookTestResult;
import com.platformcore.webhook.utils.JsonUtils;
import com.platformcore.webhook.utils.WebhookSignatureUtils;
import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Delivery path against a local HTTP endpoint.
 */
class WebhookDispatcherTest {

    private static final String TENANT = "tenant-1";
    private static final String SECRET = "whsec_dispatch";

    private final ObjectMapper objectMapper = JsonUtils.newObjectMapper();

    private HttpServer server;
    private String baseUrl;
    private InMemoryWebhookStore store;
    private MutableClock clock;
    private WebhookManager manager;

    private final AtomicInteger hits = new AtomicInteger();
    private final AtomicReference<Headers> lastHeaders = new AtomicReference<>();
    private final AtomicReference<String> lastBody = new AtomicReference<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();

        store = new InMemoryWebhookStore();
        clock = new MutableClock(Instant.parse("2024-03-01T10:00:00Z"));
        manager = newManager(1);
    }

    private WebhookManager newManager(long retryBaseDelayMs) {
        WebhookSettings settings = new WebhookSettings("loyalty");
        settings.setRetryBaseDelayMs(retryBaseDelayMs);
        settings.setRetryMaxDelayMs(Math.max(5, retryBaseDelayMs));
        settings.setRetryJitter(false);
        settings.setDefaultTimeoutMs(5000);

        WebhookManager webhookManager = new WebhookManager(settings, store,
            new WebhookHttpService(settings.getUserAgent()), clock);
        webhookManager.initialize();
        return webhookManager;
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private void respond(String path, int status, String body) {
        respondSequence(path, new int[] {status}, body);
    }

    // answers with statuses[i] on call i, repeating the last one
    private void respondSequence(String path, int[] statuses, String body) {
        server.createContext(path, exchange -> {
            int call = hits.getAndIncrement();
            capture(exchange);
            int status = statuses[Math.min(call, statuses.length - 1)];
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
    }

    private void capture(HttpExchange exchange) throws IOException {
        try (InputStream in = exchange.getRequestBody()) {
            lastBody.set(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        }
        lastHeaders.set(exchange.getRequestHeaders());
    }

    private WebhookSubscription register(String path, Integer maxRetries, String... events) {
        RegisterWebhookRequest request = new RegisterWebhookRequest(TENANT, "hook " + path,
            baseUrl + path, SECRET, Set.of(events));
        request.setMaxRetries(maxRetries);
        return manager.register(request);
    }

    private static WebhookEvent userCreated() {
        WebhookEvent event = new WebhookEvent("user.created", TENANT, "user-42",
            Map.of("email", "a@example.com"));
        event.setCorrelationId("corr-1");
        return event;
    }

    @Test
    void deliversSignedEnvelope() throws Exception {
        respond("/ok", 200, "accepted");
        WebhookSubscription webhook = register("/ok", null, "user.*");

        List<DeliveryRecord> deliveries = manager.dispatch(userCreated());

        assertEquals(1, deliveries.size());
        DeliveryRecord delivery = deliveries.get(0);
        assertEquals(DeliveryStatus.SUCCESS, delivery.getStatus());
        assertEquals(1, delivery.getAttempts());
        assertEquals(200, delivery.getStatusCode());
        assertEquals("accepted", delivery.getResponseBody());
        assertEquals(clock.instant(), delivery.getDeliveredAt());
        assertNull(delivery.getError());
        assertEquals(1, hits.get());

        Headers headers = lastHeaders.get();
        assertEquals(delivery.getEventId(), headers.getFirst("X-Webhook-ID"));
        assertEquals("application/json", headers.getFirst("Content-Type"));
        assertEquals("Webhooks/1.0", headers.getFirst("User-Agent"));
        assertEquals(String.valueOf(clock.millis()), headers.getFirst("X-Webhook-Timestamp"));
        assertTrue(WebhookSignatureUtils.verifySignature(lastBody.get(),
            headers.getFirst("X-Webhook-Signature"), SECRET,
            WebhookSignatureUtils.DEFAULT_TOLERANCE_MS, clock.millis()));

        JsonNode envelope = objectMapper.readTree(lastBody.get());
        assertEquals(delivery.getEventId(), envelope.get("id").asText());
        assertEquals("user.created", envelope.get("type").asText());
        assertEquals(TENANT, envelope.get("tenantId").asText());
        assertEquals("user-42", envelope.get("userId").asText());
        assertEquals("a@example.com", envelope.get("data").get("email").asText());
        assertEquals("2024-01-01", envelope.get("apiVersion").asText());
        assertEquals("2024-03-01T10:00:00Z", envelope.get("timestamp").asText());

        WebhookSubscription stored = store.find(TENANT, webhook.getId()).orElseThrow();
        assertEquals(List.of(delivery), stored.getDeliveries());
        assertEquals(DeliveryStatus.SUCCESS, stored.getLastDeliveryStatus());
        assertEquals(0, stored.getConsecutiveFailures());
    }

    @Test
    void failingEndpointUsesAllAttemptsAndCountsOneFailure() {
        respond("/fail", 500, "oops");
        WebhookSubscription webhook = register("/fail", 3, "user.created");

        DeliveryRecord delivery = manager.dispatch(userCreated()).get(0);

        assertEquals(DeliveryStatus.FAILED, delivery.getStatus());
        assertEquals(3, delivery.getAttempts());
        assertEquals(3, hits.get());
        assertEquals(500, delivery.getStatusCode());
        assertEquals("HTTP 500", delivery.getError());
        assertNull(delivery.getDeliveredAt());
        assertNull(delivery.getNextRetryAt());

        WebhookSubscription stored = store.find(TENANT, webhook.getId()).orElseThrow();
        assertEquals(1, stored.getConsecutiveFailures());
        assertEquals(DeliveryStatus.FAILED, stored.getLastDeliveryStatus());
        assertEquals(1, stored.getDeliveries().size());
    }

    @Test
    void transientFailureIsRetried() {
        respondSequence("/flaky", new int[] {503, 200}, "ok");
        register("/flaky", 3, "user.created");

        DeliveryRecord delivery = manager.dispatch(userCreated()).get(0);

        assertEquals(DeliveryStatus.SUCCESS, delivery.getStatus());
        assertEquals(2, delivery.getAttempts());
        assertEquals(200, delivery.getStatusCode());
        assertEquals(2, hits.get());
    }

    @Test
    void allMatchesShareOneEventId() {
        respond("/a", 200, "a");
        respond("/b", 200, "b");
        register("/a", null, "user.*");
        register("/b", null, "*.created");
        register("/b", null, "bonus.*");

        List<DeliveryRecord> deliveries = manager.dispatch(userCreated());

        assertEquals(2, deliveries.size());
        assertEquals(deliveries.get(0).getEventId(), deliveries.get(1).getEventId());
        assertFalse(deliveries.get(0).getId().equals(deliveries.get(1).getId()));
    }

    @Test
    void missingSecretIsAConfigurationError() {
        respond("/nosecret", 200, "ok");
        WebhookSubscription webhook = new WebhookSubscription();
        webhook.setId("legacy");
        webhook.setTenantId(TENANT);
        webhook.setName("legacy");
        webhook.setUrl(baseUrl + "/nosecret");
        webhook.setSecret("");
        webhook.setEvents(Set.of("user.created"));
        webhook.setIsActive(true);
        store.put(webhook);

        assertThrows(ValidationException.class, () -> manager.dispatch(userCreated()));
        assertEquals(0, hits.get());
        assertTrue(store.find(TENANT, "legacy").orElseThrow().getDeliveries().isEmpty());
    }

    @Test
    void openBreakerFailsWithoutCallingEndpoint() {
        respond("/guarded", 200, "ok");
        WebhookSubscription webhook = register("/guarded", 5, "user.created");
        CircuitBreaker breaker = manager.getCircuitBreakers().forUrl(webhook.getUrl());
        for (int i = 0; i < 5; i++) {
            assertThrows(IOException.class, () -> breaker.execute(() -> {
                throw new IOException("down");
            }));
        }

        DeliveryRecord delivery = manager.dispatch(userCreated()).get(0);

        assertEquals(DeliveryStatus.FAILED, delivery.getStatus());
        assertEquals(1, delivery.getAttempts());
        assertTrue(delivery.getError().contains("is OPEN"));
        assertEquals(0, hits.get());
    }

    @Test
    void unreachableEndpointRecordsTransportError() throws IOException {
        HttpServer closed = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        int port = closed.getAddress().getPort();
        closed.start();
        closed.stop(0);
        RegisterWebhookRequest request = new RegisterWebhookRequest(TENANT, "gone",
            "http://127.0.0.1:" + port + "/hook", SECRET, Set.of("user.created"));
        request.setMaxRetries(1);
        manager.register(request);

        DeliveryRecord delivery = manager.dispatch(userCreated()).get(0);

        assertEquals(DeliveryStatus.FAILED, delivery.getStatus());
        assertEquals(1, delivery.getAttempts());
        assertNull(delivery.getStatusCode());
        assertTrue(delivery.getError().startsWith("Webhook request failed"));
    }

    @Test
    void attemptTimeoutIsRetriedThenFails() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        server.setExecutor(Executors.newCachedThreadPool());
        server.createContext("/slow", exchange -> {
            hits.incrementAndGet();
            try {
                release.await(1500, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            exchange.sendResponseHeaders(200, -1);
            exchange.close();
        });
        RegisterWebhookRequest request = new RegisterWebhookRequest(TENANT, "slow",
            baseUrl + "/slow", SECRET, Set.of("user.created"));
        request.setTimeout(200);
        request.setMaxRetries(2);
        WebhookSubscription webhook = manager.register(request);

        long start = System.nanoTime();
        DeliveryRecord delivery;
        try {
            delivery = manager.dispatch(userCreated()).get(0);
        } finally {
            release.countDown();
        }
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertEquals(DeliveryStatus.FAILED, delivery.getStatus());
        assertEquals(2, delivery.getAttempts());
        assertNull(delivery.getStatusCode());
        assertTrue(delivery.getError().startsWith("Webhook request failed"));
        assertTrue(delivery.getError().contains("timed out"), delivery.getError());
        assertTrue(elapsedMs < 1500, "attempts were not cut off: " + elapsedMs + "ms");
        assertEquals(1, store.find(TENANT, webhook.getId()).orElseThrow().getConsecutiveFailures());
    }

    @Test
    void interruptDuringBackoffStillRecordsFailure() throws Exception {
        WebhookManager slowRetries = newManager(3000);
        respond("/down", 500, "oops");
        RegisterWebhookRequest request = new RegisterWebhookRequest(TENANT, "down",
            baseUrl + "/down", SECRET, Set.of("user.created"));
        request.setMaxRetries(3);
        WebhookSubscription webhook = slowRetries.register(request);

        Thread dispatching = Thread.currentThread();
        Thread interrupter = new Thread(() -> {
            try {
                Thread.sleep(500);
                dispatching.interrupt();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        interrupter.start();

        List<DeliveryRecord> deliveries;
        try {
            deliveries = slowRetries.dispatch(userCreated());
        } finally {
            interrupter.join();
            assertTrue(Thread.interrupted(), "interrupt flag should survive the dispatch");
        }

        assertEquals(1, deliveries.size());
        DeliveryRecord delivery = deliveries.get(0);
        assertEquals(DeliveryStatus.FAILED, delivery.getStatus());
        assertEquals(1, delivery.getAttempts());
        assertNull(delivery.getNextRetryAt());

        WebhookSubscription stored = store.find(TENANT, webhook.getId()).orElseThrow();
        assertEquals(List.of(delivery), stored.getDeliveries());
        assertEquals(1, stored.getConsecutiveFailures());
        assertEquals(DeliveryStatus.FAILED, stored.getLastDeliveryStatus());
    }

    @Test
    void customHeadersAreSent() {
        respond("/headers", 200, "ok");
        RegisterWebhookRequest request = new RegisterWebhookRequest(TENANT, "headers",
            baseUrl + "/headers", SECRET, Set.of("user.created"));
        request.setHeaders(Map.of("X-Api-Key", "key-1"));
        manager.register(request);

        manager.dispatch(userCreated());

        assertEquals("key-1", lastHeaders.get().getFirst("X-Api-Key"));
    }

    @Test
    void longResponseBodyIsTruncated() {
        respond("/long", 200, "x".repeat(2500));
        register("/long", null, "user.created");

        DeliveryRecord delivery = manager.dispatch(userCreated()).get(0);

        assertEquals(1000, delivery.getResponseBody().length());
    }

    @Test
    void disabledDispatcherDoesNothing() {
        respond("/ok", 200, "ok");
        register("/ok", null, "user.created");
        manager.disable();

        assertFalse(manager.isEnabled());
        assertTrue(manager.dispatch(userCreated()).isEmpty());
        assertEquals(0, hits.get());

        manager.enable();
        assertEquals(1, manager.dispatch(userCreated()).size());
    }

    @Test
    void noMatchingSubscriptions() {
        register("/ok", null, "bonus.*");

        assertTrue(manager.dispatch(userCreated()).isEmpty());
    }

    @Test
    void testDeliverySendsSyntheticEvent() throws Exception {
        respond("/test", 200, "ok");
        WebhookSubscription webhook = register("/test", null, "user.created");

        WebhookTestResult result = manager.test(webhook.getId(), TENANT);

        assertTrue(result.isSuccess());
        assertEquals(200, result.getStatusCode());
        assertNull(result.getError());
        JsonNode envelope = objectMapper.readTree(lastBody.get());
        assertEquals("webhook.test", envelope.get("type").asText());
        assertEquals(webhook.getId(), envelope.get("data").get("webhookId").asText());
        assertEquals("loyalty", envelope.get("data").get("service").asText());
        assertEquals(1, store.find(TENANT, webhook.getId()).orElseThrow().getDeliveries().size());
    }

    @Test
    void testOfUnknownWebhook() {
        WebhookTestResult result = manager.test("missing", TENANT);

        assertFalse(result.isSuccess());
        assertEquals("Webhook not found", result.getError());
        assertNull(result.getStatusCode());
    }
}
