package com.chicu.candlecollector.exchange.exception;

/**
 * Плохой запрос, неподдерживаемая пара/таймфрейм, ключи, исчерпанные повторы.
 * Серия помечается failed в текущем прогоне, остальные продолжают.
 */
public class FatalExchangeException extends ExchangeException {

    public FatalExchangeException(String exchange, String message) {
        super(exchange, message);
    }

    public FatalExchangeException(String exchange, String message, Throwable cause) {
        super(exchange, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
