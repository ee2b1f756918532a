package com.tradescan.backend.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskSettingsUpdateRequest {

    private Boolean enabled;

    @DecimalMin("0.01")
    private BigDecimal maxTransactionAmount;

    @DecimalMin("0.01")
    private BigDecimal dailySpendLimit;

    @DecimalMin("0.01")
    private BigDecimal weeklySpendLimit;

    @Positive
    private Integer maxOpenPositions;

    @DecimalMin("0.01")
    @DecimalMax("100")
    private BigDecimal stopLossDefaultPercent;

    @DecimalMin("0.01")
    @DecimalMax("1000")
    private BigDecimal takeProfitDefaultPercent;

    private Boolean allowDuplicatePositions;
}
