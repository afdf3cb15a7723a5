package com.chicu.candlecollector.repository;

import com.chicu.candlecollector.domain.CurrencyPair;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface CurrencyPairRepository extends JpaRepository<CurrencyPair, Long> {

    /**
     * Активные пары биржи: собственные + глобальные (exchange = null).
     */
    @Query("""
           select p
           from CurrencyPair p
           where p.active = true
             and (p.exchange is null or p.exchange.id = :exchangeId)
           order by p.id
           """)
    List<CurrencyPair> findActiveForExchange(@Param("exchangeId") Long exchangeId);
}
