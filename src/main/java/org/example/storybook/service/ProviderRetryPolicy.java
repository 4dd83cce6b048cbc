package org.example.storybook.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Bounded retry with exponential backoff for provider calls.
 * A max-attempts value of 1 disables retries. The delay doubles after each failure up to the max delay.
 */
public class ProviderRetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(ProviderRetryPolicy.class);

    static final long DEFAULT_MAX_DELAY_MILLIS = 60_000L;

    private final int maxAttempts;
    private final long initialDelayMillis;
    private final long maxDelayMillis;

    public ProviderRetryPolicy(int maxAttempts, long initialDelayMillis) {
        this(maxAttempts, initialDelayMillis, DEFAULT_MAX_DELAY_MILLIS);
    }

    public ProviderRetryPolicy(int maxAttempts, long initialDelayMillis, long maxDelayMillis) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.maxDelayMillis = Math.max(0L, maxDelayMillis);
        this.initialDelayMillis = Math.min(Math.max(0L, initialDelayMillis), this.maxDelayMillis);
    }

    public static ProviderRetryPolicy noRetry() {
        return new ProviderRetryPolicy(1, 0L);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public <T> T execute(String operation, Supplier<T> call) {
        long delay = initialDelayMillis;
        for (int attempt = 1; ; attempt++) {
            try {
                return call.get();
            } catch (ProviderException e) {
                if (attempt >= maxAttempts) {
                    throw e;
                }
                log.warn("{} failed (attempt {}/{}): {} - retrying in {}ms",
                        operation, attempt, maxAttempts, e.getMessage(), delay);
                sleep(delay, operation);
                delay = nextDelay(delay);
            }
        }
    }

    long nextDelay(long currentDelayMillis) {
        if (currentDelayMillis >= maxDelayMillis / 2) {
            return maxDelayMillis;
        }
        return currentDelayMillis * 2;
    }

    private void sleep(long delayMillis, String operation) {
        if (delayMillis <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException(operation + " interrupted while waiting to retry", e);
        }
    }
}
