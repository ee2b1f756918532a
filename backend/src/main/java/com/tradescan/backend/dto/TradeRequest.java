package com.tradescan.backend.dto;

import com.tradescan.backend.model.OrderSide;
import com.tradescan.backend.model.OrderType;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Manual order intent. Risk checks price it from the limit price, the stop price or a fresh quote.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradeRequest {

    @NotBlank
    private String symbol;

    @NotNull
    private OrderSide side;

    @NotNull
    @Positive
    private Integer quantity;

    @Builder.Default
    private OrderType orderType = OrderType.MARKET;

    @DecimalMin(value = "0.0", inclusive = false)
    private BigDecimal limitPrice;

    @DecimalMin(value = "0.0", inclusive = false)
    private BigDecimal stopPrice;

    @DecimalMin(value = "0.0", inclusive = false)
    private BigDecimal trailPercent;
}
