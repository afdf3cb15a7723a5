package com.chicu.candlecollector.exchange.exception;

/**
 * Базовая ошибка адаптера биржи.
 * Подклассы задают классификацию: лимит, временная ошибка сети, фатальная.
 */
public abstract class ExchangeException extends Exception {

    private final String exchange;

    protected ExchangeException(String exchange, String message) {
        super(message);
        this.exchange = exchange;
    }

    protected ExchangeException(String exchange, String message, Throwable cause) {
        super(message, cause);
        this.exchange = exchange;
    }

    public String getExchange() {
        return exchange;
    }

    /** Имеет ли смысл повторить запрос */
    public abstract boolean isRetryable();
}
