package com.chicu.candlecollector.support;

import com.chicu.candlecollector.domain.Candle;
import com.chicu.candlecollector.domain.CurrencyPair;
import com.chicu.candlecollector.domain.Exchange;
import com.chicu.candlecollector.domain.TimePeriod;
import com.chicu.candlecollector.market.model.CandleSeries;
import com.chicu.candlecollector.market.model.NormalizedCandle;
import com.chicu.candlecollector.market.store.CandleMergePolicy;
import com.chicu.candlecollector.market.store.CandlePersistenceException;
import com.chicu.candlecollector.market.store.CandleStore;
import com.chicu.candlecollector.market.store.CollectionStats;
import com.chicu.candlecollector.market.store.UpsertResult;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * CandleStore в памяти с теми же правилами слияния, что и JPA-реализация.
 */
public class InMemoryCandleStore implements CandleStore {

    private final List<Exchange> exchanges = new ArrayList<>();
    private final List<CurrencyPair> pairs = new ArrayList<>();
    private final List<TimePeriod> periods = new ArrayList<>();

    private final Map<CandleSeries, TreeMap<Instant, Candle>> candles = new HashMap<>();
    private final Set<String> failingExchanges = new HashSet<>();

    // ===== СПРАВОЧНИКИ =====

    public InMemoryCandleStore exchange(Exchange e) {
        exchanges.add(e);
        return this;
    }

    public InMemoryCandleStore pair(CurrencyPair p) {
        pairs.add(p);
        return this;
    }

    public InMemoryCandleStore period(TimePeriod p) {
        periods.add(p);
        return this;
    }

    /** Запись по бирже падает, как при недоступной БД */
    public InMemoryCandleStore failWritesFor(String exchangeCode) {
        failingExchanges.add(exchangeCode);
        return this;
    }

    @Override
    public synchronized List<Exchange> listActiveExchanges() {
        return exchanges.stream().filter(Exchange::isActive).toList();
    }

    @Override
    public synchronized List<CurrencyPair> listActivePairs(Exchange exchange) {
        return pairs.stream()
                .filter(CurrencyPair::isActive)
                .filter(p -> p.getExchange() == null || p.getExchange().getId().equals(exchange.getId()))
                .toList();
    }

    @Override
    public synchronized List<TimePeriod> listActivePeriods() {
        return periods.stream().filter(TimePeriod::isActive).toList();
    }

    // ===== СВЕЧИ =====

    @Override
    public synchronized Optional<Instant> latestStoredOpenTime(CandleSeries series) {
        TreeMap<Instant, Candle> rows = candles.get(series);
        return rows == null || rows.isEmpty() ? Optional.empty() : Optional.of(rows.lastKey());
    }

    @Override
    public synchronized UpsertResult upsertCandles(CandleSeries series, List<NormalizedCandle> batch) {
        if (failingExchanges.contains(series.exchangeCode())) {
            throw new CandlePersistenceException("connection refused", new IllegalStateException("db down"));
        }

        TreeMap<Instant, Candle> rows = candles.computeIfAbsent(series, k -> new TreeMap<>());
        int inserted = 0;
        int updated = 0;
        int skipped = 0;

        for (NormalizedCandle c : CandleMergePolicy.dedupe(batch)) {
            Candle existing = rows.get(c.openTime());
            switch (CandleMergePolicy.decide(existing, c)) {
                case INSERT -> {
                    rows.put(c.openTime(), toEntity(c));
                    inserted++;
                }
                case UPDATE -> {
                    rows.put(c.openTime(), toEntity(c));
                    updated++;
                }
                default -> skipped++;
            }
        }
        return new UpsertResult(inserted, updated, skipped);
    }

    @Override
    public synchronized CollectionStats collectionStats() {
        long total = candles.values().stream().mapToLong(TreeMap::size).sum();
        return new CollectionStats(total, exchanges.size(), pairs.size(), periods.size(), Map.of());
    }

    public synchronized List<Candle> stored(CandleSeries series) {
        TreeMap<Instant, Candle> rows = candles.get(series);
        return rows == null ? List.of() : new ArrayList<>(rows.values());
    }

    public synchronized int seriesCount() {
        return (int) candles.values().stream().filter(m -> !m.isEmpty()).count();
    }

    private static Candle toEntity(NormalizedCandle c) {
        return Candle.builder()
                .openTime(c.openTime())
                .closeTime(c.closeTime())
                .open(c.open())
                .high(c.high())
                .low(c.low())
                .close(c.close())
                .volume(c.volume())
                .quoteVolume(c.quoteVolume())
                .tradesCount(c.tradesCount())
                .closed(c.closed())
                .fetchedAt(c.fetchedAt())
                .build();
    }
}
