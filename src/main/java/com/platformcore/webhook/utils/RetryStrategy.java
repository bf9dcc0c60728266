package com.platformcore.webhook.utils;

public enum RetryStrategy {
    EXPONENTIAL,
    LINEAR,
    FIXED
}
