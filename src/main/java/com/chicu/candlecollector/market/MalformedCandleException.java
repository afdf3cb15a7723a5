package com.chicu.candlecollector.market;

/**
 * Бар от биржи не прошёл проверку: нет поля, нарушен OHLCV или не та сетка.
 */
public class MalformedCandleException extends Exception {

    public MalformedCandleException(String message) {
        super(message);
    }
}
