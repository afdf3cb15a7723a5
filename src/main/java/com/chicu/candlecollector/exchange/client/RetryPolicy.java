package com.chicu.candlecollector.exchange.client;

import com.chicu.candlecollector.exchange.exception.RateLimitedException;

import java.time.Duration;

/**
 * Ограниченный экспоненциальный backoff для запросов к бирже.
 *
 * Неизменяемый: одна политика на всё приложение, счётчик попыток
 * живёт в вызывающем цикле.
 */
public final class RetryPolicy {

    private final int maxAttempts;
    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;

    private RetryPolicy(int maxAttempts, Duration initialDelay, Duration maxDelay, double multiplier) {
        this.maxAttempts = maxAttempts;
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
    }

    /** Всего попыток, включая первую */
    public int getMaxAttempts() {
        return maxAttempts;
    }

    public boolean canRetry(int failedAttempts) {
        return failedAttempts < maxAttempts;
    }

    /**
     * Пауза после failedAttempts неудач (1: после первой).
     */
    public Duration delayFor(int failedAttempts) {
        double factor = Math.pow(multiplier, Math.max(0, failedAttempts - 1));
        long millis = (long) Math.min(initialDelay.toMillis() * factor, (double) maxDelay.toMillis());
        return Duration.ofMillis(millis);
    }

    /**
     * Для лимита: не меньше Retry-After биржи, но не больше maxDelay.
     */
    public Duration delayFor(int failedAttempts, RateLimitedException e) {
        Duration backoff = delayFor(failedAttempts);
        long hinted = Math.min(e.getRetryAfterMs(), maxDelay.toMillis());
        return hinted > backoff.toMillis() ? Duration.ofMillis(hinted) : backoff;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Без повторов: для тестов и ручной диагностики */
    public static RetryPolicy noRetry() {
        return builder().maxAttempts(1).build();
    }

    public static class Builder {
        private int maxAttempts = 4;
        private Duration initialDelay = Duration.ofMillis(500);
        private Duration maxDelay = Duration.ofSeconds(30);
        private double multiplier = 2.0;

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts <= 0) {
                throw new IllegalArgumentException("Max attempts must be positive");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder initialDelay(Duration initialDelay) {
            if (initialDelay.isNegative()) {
                throw new IllegalArgumentException("Initial delay must not be negative");
            }
            this.initialDelay = initialDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            if (maxDelay.isNegative()) {
                throw new IllegalArgumentException("Max delay must not be negative");
            }
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder multiplier(double multiplier) {
            if (multiplier < 1.0) {
                throw new IllegalArgumentException("Multiplier must be >= 1.0");
            }
            this.multiplier = multiplier;
            return this;
        }

        public RetryPolicy build() {
            if (initialDelay.compareTo(maxDelay) > 0) {
                throw new IllegalArgumentException("Initial delay cannot exceed max delay");
            }
            return new RetryPolicy(maxAttempts, initialDelay, maxDelay, multiplier);
        }
    }
}
