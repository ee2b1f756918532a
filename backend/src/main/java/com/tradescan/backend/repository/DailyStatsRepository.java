package com.tradescan.backend.repository;

import com.tradescan.backend.model.DailyStats;
import com.tradescan.backend.model.TradingMode;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface DailyStatsRepository extends JpaRepository<DailyStats, Long> {

    Optional<DailyStats> findByStatDateAndTradingMode(LocalDate statDate, TradingMode tradingMode);

    List<DailyStats> findByTradingModeAndStatDateBetween(TradingMode tradingMode, LocalDate from, LocalDate to);
}
