package com.tradescan.backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "trade_history", indexes = {
        @Index(name = "idx_trade_history_mode_status", columnList = "trading_mode,status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradeRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "trading_mode", nullable = false, length = 8)
    private TradingMode tradingMode;

    private Long profileId;

    @Column(nullable = false, length = 32)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 8)
    private OrderSide side;

    @Column(nullable = false)
    private Integer quantity;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private OrderType orderType;

    @Column(precision = 19, scale = 4)
    private BigDecimal limitPrice;

    @Column(precision = 19, scale = 4)
    private BigDecimal stopPrice;

    @Column(precision = 9, scale = 4)
    private BigDecimal trailPercent;

    /** Price used for risk checks and pending-spend accounting. */
    @Column(precision = 19, scale = 4)
    private BigDecimal estimatedPrice;

    @Builder.Default
    @Column(nullable = false)
    private Integer contractMultiplier = 1;

    @Builder.Default
    @Column(nullable = false)
    private Integer filledQuantity = 0;

    @Column(precision = 19, scale = 4)
    private BigDecimal filledPrice;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private TradeStatus status;

    @Column(length = 1000)
    private String rejectionReason;

    @Column(length = 64)
    private String brokerOrderId;

    @Column(length = 64)
    private String clientOrderId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private TradeSource source;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private CloseReason closeReason;

    @Column(nullable = false)
    private Instant createdAt;

    private Instant submittedAt;

    private Instant filledAt;

    private Instant updatedAt;

    public int remainingQuantity() {
        return Math.max(0, quantity - (filledQuantity == null ? 0 : filledQuantity));
    }
}
