package com.chicu.candlecollector.common.enums;

/** Тип рынка валютной пары. */
public enum MarketType {
    SPOT,
    FUTURES
}
