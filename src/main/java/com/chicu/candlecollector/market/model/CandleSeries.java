package com.chicu.candlecollector.market.model;

import com.chicu.candlecollector.common.time.Timeframe;
import com.chicu.candlecollector.domain.CurrencyPair;
import com.chicu.candlecollector.domain.Exchange;
import com.chicu.candlecollector.domain.TimePeriod;

import java.util.Objects;

/**
 * Ключ серии свечей: (биржа, пара, таймфрейм).
 * Единица работы сборщика и граница транзакции upsert'а.
 */
public record CandleSeries(
        Long exchangeId,
        String exchangeCode,
        Long currencyPairId,
        String baseSymbol,
        String quoteSymbol,
        Long timePeriodId,
        Timeframe timeframe
) {

    public CandleSeries {
        Objects.requireNonNull(exchangeCode, "exchangeCode");
        Objects.requireNonNull(baseSymbol, "baseSymbol");
        Objects.requireNonNull(quoteSymbol, "quoteSymbol");
        Objects.requireNonNull(timeframe, "timeframe");
    }

    public static CandleSeries of(Exchange exchange, CurrencyPair pair, TimePeriod period, Timeframe timeframe) {
        return new CandleSeries(
                exchange.getId(),
                exchange.normalizedCode(),
                pair.getId(),
                pair.baseCode(),
                pair.quoteCode(),
                period.getId(),
                timeframe
        );
    }

    /** "BTC/USDT" */
    public String symbol() {
        return baseSymbol + "/" + quoteSymbol;
    }

    @Override
    public String toString() {
        return exchangeCode + " " + symbol() + " " + timeframe.getCode();
    }
}
