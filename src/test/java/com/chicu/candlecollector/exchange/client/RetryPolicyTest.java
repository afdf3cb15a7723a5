package com.chicu.candlecollector.exchange.client;

import com.chicu.candlecollector.exchange.exception.RateLimitedException;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    private final RetryPolicy policy = RetryPolicy.builder()
            .maxAttempts(4)
            .initialDelay(Duration.ofMillis(100))
            .maxDelay(Duration.ofMillis(500))
            .multiplier(2.0)
            .build();

    @Test
    void delay_shouldGrowExponentially_andBeCapped() {
        assertEquals(Duration.ofMillis(100), policy.delayFor(1));
        assertEquals(Duration.ofMillis(200), policy.delayFor(2));
        assertEquals(Duration.ofMillis(400), policy.delayFor(3));
        assertEquals(Duration.ofMillis(500), policy.delayFor(4));
        assertEquals(Duration.ofMillis(500), policy.delayFor(20));
    }

    @Test
    void canRetry_shouldStopAtMaxAttempts() {
        assertTrue(policy.canRetry(1));
        assertTrue(policy.canRetry(3));
        assertFalse(policy.canRetry(4));
        assertFalse(RetryPolicy.noRetry().canRetry(1));
    }

    @Test
    void rateLimit_shouldHonorRetryAfter_withinMaxDelay() {
        RateLimitedException hint300 = new RateLimitedException("binance", "429", 300);
        RateLimitedException hint10s = new RateLimitedException("binance", "429", 10_000);
        RateLimitedException noHint = new RateLimitedException("binance", "429", 0);

        assertEquals(Duration.ofMillis(300), policy.delayFor(1, hint300));
        assertEquals(Duration.ofMillis(500), policy.delayFor(1, hint10s));
        assertEquals(Duration.ofMillis(100), policy.delayFor(1, noHint));
    }

    @Test
    void builder_shouldRejectInvalidSettings() {
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.builder().maxAttempts(0));
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.builder().multiplier(0.5));
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.builder()
                .initialDelay(Duration.ofSeconds(10))
                .maxDelay(Duration.ofSeconds(1))
                .build());
    }
}
