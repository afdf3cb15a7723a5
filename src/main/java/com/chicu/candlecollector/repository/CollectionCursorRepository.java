package com.chicu.candlecollector.repository;

import com.chicu.candlecollector.domain.CollectionCursor;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface CollectionCursorRepository extends JpaRepository<CollectionCursor, Long> {

    Optional<CollectionCursor> findByExchangeIdAndCurrencyPairIdAndTimePeriodId(Long exchangeId,
                                                                               Long currencyPairId,
                                                                               Long timePeriodId);
}
