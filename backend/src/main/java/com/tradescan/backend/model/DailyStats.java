package com.tradescan.backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

@Entity
@Table(name = "daily_stats", uniqueConstraints = {
        @UniqueConstraint(name = "uk_daily_stats_date_mode", columnNames = {"stat_date", "trading_mode"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DailyStats {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "stat_date", nullable = false)
    private LocalDate statDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "trading_mode", nullable = false, length = 8)
    private TradingMode tradingMode;

    @Builder.Default
    private int scansRun = 0;

    @Builder.Default
    private int matchesFound = 0;

    @Builder.Default
    private int ordersPlaced = 0;

    @Builder.Default
    private int ordersFilled = 0;

    @Builder.Default
    private int ordersRejected = 0;

    @Builder.Default
    private int positionsOpened = 0;

    @Builder.Default
    private int positionsClosed = 0;

    @Builder.Default
    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal totalSpent = BigDecimal.ZERO;

    @Builder.Default
    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal realizedPl = BigDecimal.ZERO;
}
