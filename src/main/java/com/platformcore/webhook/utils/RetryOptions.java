package com.platformcore.webhook.utils;

import java.util.function.Predicate;

/**
 * Settings for {@link RetryUtils#retry}. {@code maxRetries} counts retries after the first
 * attempt, so a call runs at most {@code maxRetries + 1} times.
 */
public class RetryOptions {
    private int maxRetries = 3;
    private RetryStrategy strategy = RetryStrategy.EXPONENTIAL;
    private long baseDelayMs = 100L;
    private long maxDelayMs = 5000L;
    private boolean jitter = true;
    private String name = "Retry";
    private Predicate<Throwable> isRetryable = error -> true;
    private RetryListener listener = (attempt, error, delayMs) -> { };

    public interface RetryListener {
        void onRetry(int attempt, Throwable error, long delayMs);
    }

    public RetryOptions maxRetries(int maxRetries) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        this.maxRetries = maxRetries;
        return this;
    }

    public RetryOptions strategy(RetryStrategy strategy) {
        this.strategy = strategy;
        return this;
    }

    public RetryOptions baseDelayMs(long baseDelayMs) {
        this.baseDelayMs = baseDelayMs;
        return this;
    }

    public RetryOptions maxDelayMs(long maxDelayMs) {
        this.maxDelayMs = maxDelayMs;
        return this;
    }

    public RetryOptions jitter(boolean jitter) {
        this.jitter = jitter;
        return this;
    }

    public RetryOptions name(String name) {
        this.name = name;
        return this;
    }

    public RetryOptions isRetryable(Predicate<Throwable> isRetryable) {
        this.isRetryable = isRetryable;
        return this;
    }

    public RetryOptions onRetry(RetryListener listener) {
        this.listener = listener;
        return this;
    }

    public int getMaxRetries() { return maxRetries; }

    public RetryStrategy getStrategy() { return strategy; }

    public long getBaseDelayMs() { return baseDelayMs; }

    public long getMaxDelayMs() { return maxDelayMs; }

    public boolean isJitter() { return jitter; }

    public String getName() { return name; }

    public Predicate<Throwable> getIsRetryable() { return isRetryable; }

    public RetryListener getListener() { return listener; }
}
