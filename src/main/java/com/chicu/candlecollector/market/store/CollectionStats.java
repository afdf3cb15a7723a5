package com.chicu.candlecollector.market.store;

import java.time.Instant;
import java.util.Map;

/**
 * Сводка по хранилищу: счётчики + последнее обновление свечей по биржам.
 */
public record CollectionStats(
        long totalCandles,
        long totalExchanges,
        long totalPairs,
        long totalPeriods,
        Map<String, Instant> latestUpdatePerExchange
) {
}
