package com.tradescan.backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "closed_positions")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClosedPosition {

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

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal closePrice;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal realizedPl;

    @Column(nullable = false, precision = 9, scale = 4)
    private BigDecimal realizedPlPercent;

    private Long holdingPeriodDays;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private CloseReason closeReason;

    private Long closingTradeId;

    @Column(nullable = false)
    private Instant openedAt;

    @Column(nullable = false)
    private Instant closedAt;
}
