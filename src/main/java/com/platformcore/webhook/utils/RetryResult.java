package com.platformcore.webhook.utils;

public class RetryResult<T> {
    private final T result;
    private final int attempts;
    private final long totalDelayMs;

    public RetryResult(T result, int attempts, long totalDelayMs) {
        this.result = result;
        this.attempts = attempts;
        this.totalDelayMs = totalDelayMs;
    }

    public T getResult() {
        return result;
    }

    public int getAttempts() {
        return attempts;
    }

    public long getTotalDelayMs() {
        return totalDelayMs;
    }
}
