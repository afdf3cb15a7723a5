package com.chicu.candlecollector.market.store;

/**
 * Батч не записан: транзакция откатилась целиком.
 */
public class CandlePersistenceException extends RuntimeException {

    public CandlePersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
