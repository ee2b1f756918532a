package com.tradescan.backend.service;

import com.tradescan.backend.model.DailyStats;
import com.tradescan.backend.model.TradingMode;
import com.tradescan.backend.repository.DailyStatsRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.function.Consumer;

/**
 * Per-day, per-mode counters bucketed by the exchange calendar date.
 */
@Service
@RequiredArgsConstructor
public class DailyStatsService {

    /** Weekly spend covers this many calendar days, today included. */
    public static final int WEEK_DAYS = 7;

    private final DailyStatsRepository dailyStatsRepository;
    private final LedgerWriter ledgerWriter;
    private final Clock clock;
    private final ZoneId exchangeZone;

    public LocalDate today() {
        return LocalDate.now(clock.withZone(exchangeZone));
    }

    public LocalDate weekStart() {
        return today().minusDays(WEEK_DAYS - 1L);
    }

    public Instant startOf(LocalDate date) {
        return date.atStartOfDay(exchangeZone).toInstant();
    }

    public DailyStats todayStats(TradingMode mode) {
        return dailyStatsRepository.findByStatDateAndTradingMode(today(), mode)
                .orElseGet(() -> DailyStats.builder().statDate(today()).tradingMode(mode).build());
    }

    public List<DailyStats> history(TradingMode mode, LocalDate from, LocalDate to) {
        return dailyStatsRepository.findByTradingModeAndStatDateBetween(mode, from, to);
    }

    public BigDecimal spentToday(TradingMode mode) {
        return dailyStatsRepository.findByStatDateAndTradingMode(today(), mode)
                .map(DailyStats::getTotalSpent)
                .orElse(BigDecimal.ZERO);
    }

    public BigDecimal spentThisWeek(TradingMode mode) {
        return history(mode, weekStart(), today()).stream()
                .map(DailyStats::getTotalSpent)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public void recordScan(TradingMode mode, int matches) {
        update(mode, stats -> {
            stats.setScansRun(stats.getScansRun() + 1);
            stats.setMatchesFound(stats.getMatchesFound() + matches);
        });
    }

    public void recordOrderPlaced(TradingMode mode) {
        update(mode, stats -> stats.setOrdersPlaced(stats.getOrdersPlaced() + 1));
    }

    public void recordOrderRejected(TradingMode mode) {
        update(mode, stats -> stats.setOrdersRejected(stats.getOrdersRejected() + 1));
    }

    public void recordOrderFilled(TradingMode mode) {
        update(mode, stats -> stats.setOrdersFilled(stats.getOrdersFilled() + 1));
    }

    public void recordSpend(TradingMode mode, BigDecimal amount) {
        update(mode, stats -> stats.setTotalSpent(stats.getTotalSpent().add(amount)));
    }

    public void recordPositionOpened(TradingMode mode) {
        update(mode, stats -> stats.setPositionsOpened(stats.getPositionsOpened() + 1));
    }

    public void recordPositionClosed(TradingMode mode, BigDecimal realizedPl) {
        update(mode, stats -> {
            stats.setPositionsClosed(stats.getPositionsClosed() + 1);
            stats.setRealizedPl(stats.getRealizedPl().add(realizedPl));
        });
    }

    public void recordRealizedPl(TradingMode mode, BigDecimal amount) {
        update(mode, stats -> stats.setRealizedPl(stats.getRealizedPl().add(amount)));
    }

    private void update(TradingMode mode, Consumer<DailyStats> change) {
        ledgerWriter.run(() -> {
            DailyStats stats = todayStats(mode);
            change.accept(stats);
            dailyStatsRepository.save(stats);
        });
    }
}
