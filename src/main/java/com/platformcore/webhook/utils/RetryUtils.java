package com.platformcore.webhook.utils;

import java.util.concurrent.Callable;
import java.util.concurrent.ThreadLocalRandom;
import com.amazonaws.services.lambda.runtime.LambdaLogger;
import com.amazonaws.services.lambda.runtime.LambdaRuntime;
import com.platformcore.webhook.exceptions.RetryException;

public class RetryUtils {

    private static final LambdaLogger logger = LambdaRuntime.getLogger();

    public static <T> RetryResult<T> retry(Callable<T> fn, RetryOptions options) {
        long totalDelay = 0;
        int maxAttempts = options.getMaxRetries() + 1;

        for (int attempt = 1; ; attempt++) {
            try {
                T result = fn.call();
                if (attempt > 1) {
                    logger.log(options.getName() + ": succeeded after " + (attempt - 1)
                        + " retry(ies), totalDelay=" + totalDelay + "ms");
                }
                return new RetryResult<>(result, attempt, totalDelay);
            } catch (Exception e) {
                if (!options.getIsRetryable().test(e)) {
                    throw new RetryException(options.getName(), attempt, false, e);
                }
                if (attempt >= maxAttempts) {
                    throw new RetryException(options.getName(), attempt, true, e);
                }

                long delay = calculateDelay(attempt, options.getStrategy(),
                    options.getBaseDelayMs(), options.getMaxDelayMs());
                if (options.isJitter()) {
                    delay = addJitter(delay);
                }
                options.getListener().onRetry(attempt, e, delay);
                sleep(delay, options, attempt);
                totalDelay += delay;
            }
        }
    }

    /**
     * Delay before retry number {@code attempt} (1-based), capped at {@code maxDelayMs}.
     */
    public static long calculateDelay(int attempt, RetryStrategy strategy, long baseDelayMs,
            long maxDelayMs) {
        long delay;
        switch (strategy) {
            case LINEAR:
                delay = baseDelayMs * attempt;
                break;
            case FIXED:
                delay = baseDelayMs;
                break;
            case EXPONENTIAL:
            default:
                // shift is capped so the multiplication cannot overflow
                delay = baseDelayMs * (1L << Math.min(attempt - 1, 30));
                break;
        }
        return Math.min(delay, maxDelayMs);
    }

    // full jitter: uniform in [0, delay)
    public static long addJitter(long delay) {
        if (delay <= 0) {
            return 0;
        }
        return ThreadLocalRandom.current().nextLong(delay);
    }

    // an interrupted wait ends the loop like a non-retryable failure
    private static void sleep(long delayMs, RetryOptions options, int attempt) {
        if (delayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RetryException(options.getName(), attempt, false, e);
        }
    }
}
