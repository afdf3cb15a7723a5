package com.chicu.candlecollector.exchange.exception;

/**
 * Сеть, таймаут, 5xx: повторяем с backoff.
 */
public class TransientExchangeException extends ExchangeException {

    public TransientExchangeException(String exchange, String message) {
        super(exchange, message);
    }

    public TransientExchangeException(String exchange, String message, Throwable cause) {
        super(exchange, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
