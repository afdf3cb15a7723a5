package com.chicu.candlecollector.market.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Каноническая свеча после CandleNormalizer: инварианты OHLCV и сетка уже проверены.
 *
 * @param closed период был закрыт на момент fetchedAt
 */
public record NormalizedCandle(
        Instant openTime,
        Instant closeTime,
        BigDecimal open,
        BigDecimal high,
        BigDecimal low,
        BigDecimal close,
        BigDecimal volume,
        BigDecimal quoteVolume,
        Integer tradesCount,
        boolean closed,
        Instant fetchedAt
) {
}
