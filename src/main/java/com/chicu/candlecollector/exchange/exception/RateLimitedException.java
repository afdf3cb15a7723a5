package com.chicu.candlecollector.exchange.exception;

/**
 * Биржа ответила лимитом (HTTP 429/418 или код лимита в теле).
 */
public class RateLimitedException extends ExchangeException {

    /** Подсказка биржи (Retry-After), 0: не указана */
    private final long retryAfterMs;

    public RateLimitedException(String exchange, String message, long retryAfterMs) {
        super(exchange, message);
        this.retryAfterMs = Math.max(0, retryAfterMs);
    }

    public long getRetryAfterMs() {
        return retryAfterMs;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
