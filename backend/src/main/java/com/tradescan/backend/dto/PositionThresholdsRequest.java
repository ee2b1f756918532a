package com.tradescan.backend.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PositionThresholdsRequest {

    @DecimalMin("0.01")
    @DecimalMax("100")
    private BigDecimal stopLossPercent;

    @DecimalMin("0.01")
    @DecimalMax("1000")
    private BigDecimal takeProfitPercent;
}
