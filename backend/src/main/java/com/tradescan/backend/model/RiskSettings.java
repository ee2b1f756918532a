package com.tradescan.backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Singleton row (id 1) holding the global trade limits.
 */
@Entity
@Table(name = "risk_settings")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskSettings {

    public static final long SINGLETON_ID = 1L;

    @Id
    private Long id;

    @Builder.Default
    @Column(nullable = false)
    private boolean enabled = true;

    @Builder.Default
    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal maxTransactionAmount = new BigDecimal("1000");

    @Builder.Default
    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal dailySpendLimit = new BigDecimal("5000");

    @Builder.Default
    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal weeklySpendLimit = new BigDecimal("20000");

    @Builder.Default
    @Column(nullable = false)
    private Integer maxOpenPositions = 10;

    @Builder.Default
    @Column(nullable = false, precision = 9, scale = 4)
    private BigDecimal stopLossDefaultPercent = new BigDecimal("5");

    @Builder.Default
    @Column(nullable = false, precision = 9, scale = 4)
    private BigDecimal takeProfitDefaultPercent = new BigDecimal("10");

    @Builder.Default
    @Column(nullable = false)
    private boolean allowDuplicatePositions = false;

    private Instant updatedAt;
}
