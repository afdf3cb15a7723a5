package com.chicu.candlecollector.support;

import com.chicu.candlecollector.market.model.CandleSeries;
import com.chicu.candlecollector.market.store.BackfillCursorStore;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryBackfillCursorStore implements BackfillCursorStore {

    private final Map<CandleSeries, Instant> cursors = new ConcurrentHashMap<>();

    @Override
    public Optional<Instant> load(CandleSeries series) {
        return Optional.ofNullable(cursors.get(series));
    }

    @Override
    public void save(CandleSeries series, Instant lastOpenTime) {
        cursors.merge(series, lastOpenTime, (a, b) -> b.isAfter(a) ? b : a);
    }
}
