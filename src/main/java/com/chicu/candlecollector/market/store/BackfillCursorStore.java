package com.chicu.candlecollector.market.store;

import com.chicu.candlecollector.market.model.CandleSeries;

import java.time.Instant;
import java.util.Optional;

/**
 * Курсор исторической догрузки: openTime последней сохранённой свечи серии.
 */
public interface BackfillCursorStore {

    Optional<Instant> load(CandleSeries series);

    void save(CandleSeries series, Instant lastOpenTime);
}
