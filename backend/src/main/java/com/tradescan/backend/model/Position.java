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
import java.time.Instant;

@Entity
@Table(name = "positions", uniqueConstraints = {
        @UniqueConstraint(name = "uk_positions_symbol_mode", columnNames = {"symbol", "trading_mode"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Position {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "trading_mode", nullable = false, length = 8)
    private TradingMode tradingMode;

    @Column(nullable = false, length = 32)
    private String symbol;

    @Column(nullable = false)
    private Integer quantity;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal avgCost;

    @Builder.Default
    @Column(nullable = false)
    private Integer contractMultiplier = 1;

    @Column(nullable = false, precision = 9, scale = 4)
    private BigDecimal stopLossPercent;

    @Column(nullable = false, precision = 9, scale = 4)
    private BigDecimal takeProfitPercent;

    @Column(precision = 19, scale = 4)
    private BigDecimal currentPrice;

    @Column(precision = 19, scale = 4)
    private BigDecimal marketValue;

    @Column(precision = 19, scale = 4)
    private BigDecimal unrealizedPl;

    @Column(precision = 9, scale = 4)
    private BigDecimal unrealizedPlPercent;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private PositionState state = PositionState.OPEN;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private CloseReason pendingCloseReason;

    private Long closingTradeId;

    @Column(nullable = false)
    private Instant openedAt;

    private Instant lastPricedAt;

    private Instant updatedAt;
}
