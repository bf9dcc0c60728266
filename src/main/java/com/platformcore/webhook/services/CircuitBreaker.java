package com.platformcore.webhook.services;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.Callable;
import com.amazonaws.services.lambda.runtime.LambdaLogger;
import com.amazonaws.services.lambda.runtime.LambdaRuntime;
import com.platformcore.webhook.exceptions.CircuitBreakerOpenException;
import com.platformcore.webhook.models.CircuitBreakerState;
import com.platformcore.webhook.models.CircuitBreakerStats;

/**
 * Failure isolation for a single endpoint.
 *
 * <ul>
 * <li>closed to open: {@code failureThreshold} failures inside {@code monitoringWindowMs}</li>
 * <li>open to half-open: {@code resetTimeoutMs} elapsed since the last failure</li>
 * <li>half-open to closed: two consecutive successes</li>
 * <li>half-open to open: any failure</li>
 * </ul>
 *
 * State transitions are synchronized but the protected call itself runs outside the lock, so
 * two concurrent calls may both be admitted while half-open.
 */
public class CircuitBreaker {

    public static final int DEFAULT_FAILURE_THRESHOLD = 5;
    public static final long DEFAULT_RESET_TIMEOUT_MS = 60000L;
    public static final long DEFAULT_MONITORING_WINDOW_MS = 120000L;

    static final int HALF_OPEN_SUCCESSES_TO_CLOSE = 2;

    private static final LambdaLogger logger = LambdaRuntime.getLogger();

    private final String name;
    private final int failureThreshold;
    private final long resetTimeoutMs;
    private final long monitoringWindowMs;
    private final Clock clock;

    private final Deque<Long> failures = new ArrayDeque<>();
    private long lastFailureTime;
    private CircuitBreakerState state = CircuitBreakerState.CLOSED;
    private int successCount;

    public CircuitBreaker(String name) {
        this(name, DEFAULT_FAILURE_THRESHOLD, DEFAULT_RESET_TIMEOUT_MS, DEFAULT_MONITORING_WINDOW_MS,
            Clock.systemUTC());
    }

    public CircuitBreaker(String name, int failureThreshold, long resetTimeoutMs,
            long monitoringWindowMs, Clock clock) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1");
        }
        this.name = name;
        this.failureThreshold = failureThreshold;
        this.resetTimeoutMs = resetTimeoutMs;
        this.monitoringWindowMs = monitoringWindowMs;
        this.clock = clock;
    }

    public <T> T execute(Callable<T> fn) throws Exception {
        beforeCall();
        T result;
        try {
            result = fn.call();
        } catch (Exception e) {
            onFailure();
            throw e;
        }
        onSuccess();
        return result;
    }

    private synchronized void beforeCall() {
        long now = clock.millis();
        pruneOldFailures(now);

        if (state == CircuitBreakerState.OPEN) {
            long sinceLastFailure = now - lastFailureTime;
            if (sinceLastFailure >= resetTimeoutMs) {
                state = CircuitBreakerState.HALF_OPEN;
                successCount = 0;
                logger.log(name + ": transitioning to HALF-OPEN after " + sinceLastFailure + "ms");
            } else {
                throw new CircuitBreakerOpenException(name, state, resetTimeoutMs - sinceLastFailure);
            }
        }
    }

    private synchronized void onSuccess() {
        if (state == CircuitBreakerState.HALF_OPEN) {
            successCount++;
            if (successCount >= HALF_OPEN_SUCCESSES_TO_CLOSE) {
                state = CircuitBreakerState.CLOSED;
                failures.clear();
                lastFailureTime = 0;
                successCount = 0;
                logger.log(name + ": circuit breaker CLOSED (service recovered)");
            }
        } else if (state == CircuitBreakerState.CLOSED) {
            failures.clear();
        }
    }

    private synchronized void onFailure() {
        long now = clock.millis();
        failures.addLast(now);
        lastFailureTime = now;

        if (state == CircuitBreakerState.HALF_OPEN) {
            state = CircuitBreakerState.OPEN;
            successCount = 0;
            logger.log(name + ": circuit breaker OPENED (service still failing)");
        } else if (state == CircuitBreakerState.CLOSED) {
            pruneOldFailures(now);
            if (failures.size() >= failureThreshold) {
                state = CircuitBreakerState.OPEN;
                logger.log(name + ": circuit breaker OPENED after " + failures.size()
                    + " failures within " + monitoringWindowMs + "ms");
            }
        }
    }

    private void pruneOldFailures(long now) {
        long cutoff = now - monitoringWindowMs;
        while (!failures.isEmpty() && failures.peekFirst() < cutoff) {
            failures.removeFirst();
        }
    }

    public synchronized CircuitBreakerState getState() {
        return state;
    }

    public synchronized CircuitBreakerStats getStats() {
        long now = clock.millis();
        long cutoff = now - monitoringWindowMs;
        int recent = (int) failures.stream().filter(timestamp -> timestamp >= cutoff).count();
        Long timeUntilRetry = state == CircuitBreakerState.OPEN
            ? Math.max(0L, resetTimeoutMs - (now - lastFailureTime))
            : null;
        return new CircuitBreakerStats(state, failures.size(), recent,
            lastFailureTime == 0 ? null : lastFailureTime, timeUntilRetry);
    }

    public synchronized void reset() {
        state = CircuitBreakerState.CLOSED;
        failures.clear();
        lastFailureTime = 0;
        successCount = 0;
        logger.log(name + ": circuit breaker manually RESET");
    }

    public String getName() {
        return name;
    }
}
