package com.chicu.candlecollector.collector;

import com.chicu.candlecollector.market.model.CandleSeries;
import com.chicu.candlecollector.market.store.UpsertResult;

/**
 * Итог одной единицы сбора (биржа × пара × таймфрейм).
 */
public record UnitResult(
        String exchange,
        String symbol,
        String timeframe,
        UnitStatus status,
        int fetched,
        int rejected,
        int inserted,
        int updated,
        int skipped,
        String message
) {

    public static UnitResult of(CandleSeries series, UnitStatus status, int fetched, int rejected, UpsertResult stored) {
        return new UnitResult(
                series.exchangeCode(), series.symbol(), series.timeframe().getCode(),
                status, fetched, rejected,
                stored.inserted(), stored.updated(), stored.skipped(),
                null
        );
    }

    public static UnitResult failed(CandleSeries series, String message) {
        return new UnitResult(
                series.exchangeCode(), series.symbol(), series.timeframe().getCode(),
                UnitStatus.FAILED, 0, 0, 0, 0, 0, message
        );
    }

    public static UnitResult skipped(CandleSeries series, String message) {
        return new UnitResult(
                series.exchangeCode(), series.symbol(), series.timeframe().getCode(),
                UnitStatus.SKIPPED, 0, 0, 0, 0, 0, message
        );
    }

    public UnitResult withMessage(String msg) {
        return new UnitResult(exchange, symbol, timeframe, status, fetched, rejected, inserted, updated, skipped, msg);
    }
}
