package com.chicu.candlecollector.market.store;

import com.chicu.candlecollector.domain.CurrencyPair;
import com.chicu.candlecollector.domain.Exchange;
import com.chicu.candlecollector.domain.TimePeriod;
import com.chicu.candlecollector.market.model.CandleSeries;
import com.chicu.candlecollector.market.model.NormalizedCandle;
import com.chicu.candlecollector.repository.CandleRepository;
import com.chicu.candlecollector.repository.CurrencyPairRepository;
import com.chicu.candlecollector.repository.ExchangeRepository;
import com.chicu.candlecollector.repository.TimePeriodRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class JpaCandleStore implements CandleStore {

    private final ExchangeRepository exchangeRepository;
    private final CurrencyPairRepository currencyPairRepository;
    private final TimePeriodRepository timePeriodRepository;
    private final CandleRepository candleRepository;
    private final CandleUpsertService upsertService;

    // =====================================================================
    // СПРАВОЧНИКИ
    // =====================================================================

    @Override
    @Transactional(readOnly = true)
    public List<Exchange> listActiveExchanges() {
        return exchangeRepository.findAllByActiveTrueOrderByIdAsc();
    }

    @Override
    @Transactional(readOnly = true)
    public List<CurrencyPair> listActivePairs(Exchange exchange) {
        return currencyPairRepository.findActiveForExchange(exchange.getId());
    }

    @Override
    @Transactional(readOnly = true)
    public List<TimePeriod> listActivePeriods() {
        return timePeriodRepository.findAllByActiveTrueOrderByMinutesAsc();
    }

    // =====================================================================
    // СВЕЧИ
    // =====================================================================

    @Override
    @Transactional(readOnly = true)
    public Optional<Instant> latestStoredOpenTime(CandleSeries series) {
        return Optional.ofNullable(candleRepository.findLatestOpenTime(
                series.exchangeId(), series.currencyPairId(), series.timePeriodId()));
    }

    @Override
    public UpsertResult upsertCandles(CandleSeries series, List<NormalizedCandle> batch) {
        try {
            return upsertService.upsert(series, batch);
        } catch (DataAccessException | TransactionException e) {
            log.error("❌ [{}] батч из {} свечей не записан: {}", series, batch.size(), e.getMessage());
            throw new CandlePersistenceException("Upsert failed for " + series, e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public CollectionStats collectionStats() {
        Map<String, Instant> latest = new LinkedHashMap<>();
        for (CandleRepository.ExchangeLastUpdate row : candleRepository.findLatestUpdatePerExchange()) {
            latest.put(row.getExchangeName(), row.getLastUpdate());
        }

        return new CollectionStats(
                candleRepository.count(),
                exchangeRepository.count(),
                currencyPairRepository.count(),
                timePeriodRepository.count(),
                latest
        );
    }
}
