package com.chicu.candlecollector.market.store;

import com.chicu.candlecollector.domain.CollectionCursor;
import com.chicu.candlecollector.market.model.CandleSeries;
import com.chicu.candlecollector.repository.CollectionCursorRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class JpaBackfillCursorStore implements BackfillCursorStore {

    private final CollectionCursorRepository repository;

    @Override
    @Transactional(readOnly = true)
    public Optional<Instant> load(CandleSeries series) {
        return find(series).map(CollectionCursor::getLastOpenTime);
    }

    /**
     * Курсор только растёт: более ранний openTime игнорируется.
     */
    @Override
    @Transactional
    public void save(CandleSeries series, Instant lastOpenTime) {
        CollectionCursor cursor = find(series).orElseGet(() -> CollectionCursor.builder()
                .exchangeId(series.exchangeId())
                .currencyPairId(series.currencyPairId())
                .timePeriodId(series.timePeriodId())
                .build());

        if (cursor.getLastOpenTime() != null && !lastOpenTime.isAfter(cursor.getLastOpenTime())) {
            return;
        }
        cursor.setLastOpenTime(lastOpenTime);
        repository.save(cursor);
    }

    private Optional<CollectionCursor> find(CandleSeries series) {
        return repository.findByExchangeIdAndCurrencyPairIdAndTimePeriodId(
                series.exchangeId(), series.currencyPairId(), series.timePeriodId());
    }
}
