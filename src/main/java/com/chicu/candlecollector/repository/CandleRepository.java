package com.chicu.candlecollector.repository;

import com.chicu.candlecollector.domain.Candle;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

@Repository
public interface CandleRepository extends JpaRepository<Candle, Long> {

    /**
     * Уже сохранённые свечи серии по набору openTime (одним запросом на батч).
     */
    @Query("""
           select c
           from Candle c
           where c.exchange.id = :exchangeId
             and c.currencyPair.id = :pairId
             and c.timePeriod.id = :periodId
             and c.openTime in :openTimes
           """)
    List<Candle> findSeriesByOpenTimes(@Param("exchangeId") Long exchangeId,
                                       @Param("pairId") Long pairId,
                                       @Param("periodId") Long periodId,
                                       @Param("openTimes") Collection<Instant> openTimes);

    @Query("""
           select max(c.openTime)
           from Candle c
           where c.exchange.id = :exchangeId
             and c.currencyPair.id = :pairId
             and c.timePeriod.id = :periodId
           """)
    Instant findLatestOpenTime(@Param("exchangeId") Long exchangeId,
                               @Param("pairId") Long pairId,
                               @Param("periodId") Long periodId);

    /**
     * Последнее обновление свечей по каждой бирже.
     */
    @Query("""
           select c.exchange.name as exchangeName, max(c.updatedAt) as lastUpdate
           from Candle c
           group by c.exchange.name
           order by max(c.updatedAt) desc
           """)
    List<ExchangeLastUpdate> findLatestUpdatePerExchange();

    interface ExchangeLastUpdate {
        String getExchangeName();

        Instant getLastUpdate();
    }
}
