package com.tradescan.backend.service.brokerage;

import com.tradescan.backend.model.OrderSide;
import com.tradescan.backend.model.OrderType;
import lombok.Builder;

import java.math.BigDecimal;

@Builder
public record BrokerOrderRequest(
        String symbol,
        int quantity,
        OrderSide side,
        OrderType type,
        String timeInForce,
        BigDecimal limitPrice,
        BigDecimal stopPrice,
        BigDecimal trailPercent,
        String clientOrderId
) {}
