package com.chicu.candlecollector.market.store;

import com.chicu.candlecollector.domain.CurrencyPair;
import com.chicu.candlecollector.domain.Exchange;
import com.chicu.candlecollector.domain.TimePeriod;
import com.chicu.candlecollector.market.model.CandleSeries;
import com.chicu.candlecollector.market.model.NormalizedCandle;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Хранилище свечей и справочников, как его видит сборщик.
 */
public interface CandleStore {

    List<Exchange> listActiveExchanges();

    /** Активные пары биржи, включая глобальные */
    List<CurrencyPair> listActivePairs(Exchange exchange);

    List<TimePeriod> listActivePeriods();

    Optional<Instant> latestStoredOpenTime(CandleSeries series);

    /**
     * Одна транзакция на батч.
     *
     * @throws CandlePersistenceException запись не удалась, ничего из батча не сохранено
     */
    UpsertResult upsertCandles(CandleSeries series, List<NormalizedCandle> batch);

    CollectionStats collectionStats();
}
