package com.chicu.candlecollector.repository;

import com.chicu.candlecollector.domain.Exchange;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ExchangeRepository extends JpaRepository<Exchange, Long> {

    // 🔹 Активные биржи в стабильном порядке
    List<Exchange> findAllByActiveTrueOrderByIdAsc();

    Optional<Exchange> findByCode(String code);
}
