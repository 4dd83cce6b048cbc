package org.example.storybook.service;

import org.example.storybook.service.llm.LlmProviderException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProviderRetryPolicyTest {

    @Test
    void execute_retriesProviderFailuresUpToLimit() {
        ProviderRetryPolicy policy = new ProviderRetryPolicy(3, 1);
        AtomicInteger calls = new AtomicInteger();

        String result = policy.execute("test call", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new LlmProviderException("temporarily unavailable");
            }
            return "ok";
        });

        assertEquals("ok", result);
        assertEquals(3, calls.get());
    }

    @Test
    void execute_givesUpAfterMaxAttempts() {
        ProviderRetryPolicy policy = new ProviderRetryPolicy(2, 1);
        AtomicInteger calls = new AtomicInteger();

        assertThrows(ProviderException.class, () -> policy.execute("test call", () -> {
            calls.incrementAndGet();
            throw new ProviderException("down");
        }));
        assertEquals(2, calls.get());
    }

    @Test
    void execute_doesNotRetryOtherFailures() {
        ProviderRetryPolicy policy = new ProviderRetryPolicy(5, 1);
        AtomicInteger calls = new AtomicInteger();

        assertThrows(IllegalStateException.class, () -> policy.execute("test call", () -> {
            calls.incrementAndGet();
            throw new IllegalStateException("bug");
        }));
        assertEquals(1, calls.get());
    }

    @Test
    void nextDelay_doublesUntilCappedAndNeverOverflows() {
        ProviderRetryPolicy policy = new ProviderRetryPolicy(100, 2000, 60_000);

        assertEquals(4000, policy.nextDelay(2000));
        assertEquals(60_000, policy.nextDelay(32_000));
        assertEquals(60_000, policy.nextDelay(60_000));

        long delay = 2000;
        for (int attempt = 0; attempt < 99; attempt++) {
            delay = policy.nextDelay(delay);
            assertTrue(delay > 0 && delay <= 60_000, "delay after attempt " + attempt + " was " + delay);
        }
        assertEquals(60_000, delay);
    }

    @Test
    void nextDelay_defaultCapAppliesToTwoArgumentPolicy() {
        ProviderRetryPolicy policy = new ProviderRetryPolicy(64, Long.MAX_VALUE / 2);

        assertEquals(ProviderRetryPolicy.DEFAULT_MAX_DELAY_MILLIS, policy.nextDelay(Long.MAX_VALUE / 2));
    }

    @Test
    void noRetry_makesSingleAttempt() {
        assertEquals(1, ProviderRetryPolicy.noRetry().getMaxAttempts());
        assertEquals(1, new ProviderRetryPolicy(0, 10).getMaxAttempts());
    }
}
