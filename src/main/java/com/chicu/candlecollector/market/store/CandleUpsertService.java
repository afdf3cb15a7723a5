package com.chicu.candlecollector.market.store;

import com.chicu.candlecollector.domain.Candle;
import com.chicu.candlecollector.market.model.CandleSeries;
import com.chicu.candlecollector.market.model.NormalizedCandle;
import com.chicu.candlecollector.repository.CandleRepository;
import com.chicu.candlecollector.repository.CurrencyPairRepository;
import com.chicu.candlecollector.repository.ExchangeRepository;
import com.chicu.candlecollector.repository.TimePeriodRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Upsert батча свечей одной серии. Весь батч: одна транзакция.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CandleUpsertService {

    private final CandleRepository candleRepository;
    private final ExchangeRepository exchangeRepository;
    private final CurrencyPairRepository currencyPairRepository;
    private final TimePeriodRepository timePeriodRepository;

    @Transactional
    public UpsertResult upsert(CandleSeries series, List<NormalizedCandle> batch) {
        if (batch == null || batch.isEmpty()) {
            return UpsertResult.empty();
        }

        List<NormalizedCandle> candles = CandleMergePolicy.dedupe(batch);

        Map<Instant, Candle> existing = new HashMap<>();
        for (Candle c : candleRepository.findSeriesByOpenTimes(
                series.exchangeId(),
                series.currencyPairId(),
                series.timePeriodId(),
                candles.stream().map(NormalizedCandle::openTime).toList())) {
            existing.put(c.getOpenTime(), c);
        }

        List<Candle> toSave = new ArrayList<>();
        int inserted = 0;
        int updated = 0;
        int skipped = 0;

        for (NormalizedCandle nc : candles) {
            Candle current = existing.get(nc.openTime());

            switch (CandleMergePolicy.decide(current, nc)) {
                case INSERT -> {
                    Candle fresh = Candle.builder()
                            .exchange(exchangeRepository.getReferenceById(series.exchangeId()))
                            .currencyPair(currencyPairRepository.getReferenceById(series.currencyPairId()))
                            .timePeriod(timePeriodRepository.getReferenceById(series.timePeriodId()))
                            .openTime(nc.openTime())
                            .build();
                    apply(fresh, nc);
                    toSave.add(fresh);
                    inserted++;
                }
                case UPDATE -> {
                    apply(current, nc);
                    toSave.add(current);
                    updated++;
                }
                case SKIP -> skipped++;
            }
        }

        if (!toSave.isEmpty()) {
            candleRepository.saveAll(toSave);
            candleRepository.flush();
        }

        log.debug("💾 [{}] +{} ~{} ={}", series, inserted, updated, skipped);
        return new UpsertResult(inserted, updated, skipped);
    }

    private static void apply(Candle target, NormalizedCandle nc) {
        target.setCloseTime(nc.closeTime());
        target.setOpen(nc.open());
        target.setHigh(nc.high());
        target.setLow(nc.low());
        target.setClose(nc.close());
        target.setVolume(nc.volume());
        target.setQuoteVolume(nc.quoteVolume());
        target.setTradesCount(nc.tradesCount());
        target.setClosed(nc.closed());
        target.setFetchedAt(nc.fetchedAt());
    }
}
