package com.chicu.candlecollector.exchange.ratelimit;

/**
 * Ограничитель запросов к одной бирже.
 * Один экземпляр на биржу, общий для всех воркеров, которые в неё ходят.
 */
public interface ExchangeRateLimiter {

    /**
     * Забрать permits из бюджета, блокируясь при необходимости.
     */
    void acquire(int permits) throws InterruptedException;

    /**
     * Попробовать забрать permits без ожидания.
     */
    boolean tryAcquire(int permits);

    /** Бюджет запросов в минуту */
    int getRequestsPerMinute();
}
