package com.chicu.candlecollector.repository;

import com.chicu.candlecollector.domain.TimePeriod;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TimePeriodRepository extends JpaRepository<TimePeriod, Long> {

    List<TimePeriod> findAllByActiveTrueOrderByMinutesAsc();
}
