package com.tradescan.backend.service.trading;

import com.tradescan.backend.model.CloseReason;
import com.tradescan.backend.model.OrderSide;
import com.tradescan.backend.model.OrderType;
import com.tradescan.backend.model.TradeSource;
import com.tradescan.backend.util.MoneyUtils;
import lombok.Builder;

import java.math.BigDecimal;

/**
 * A proposed order before it reaches the broker. {@code estimatedPrice} is per share; value includes the multiplier.
 */
@Builder(toBuilder = true)
public record TradeIntent(
        String symbol,
        OrderSide side,
        int quantity,
        OrderType orderType,
        BigDecimal limitPrice,
        BigDecimal stopPrice,
        BigDecimal trailPercent,
        BigDecimal estimatedPrice,
        int contractMultiplier,
        Long profileId,
        BigDecimal profileMaxOrderValue,
        TradeSource source,
        CloseReason closeReason
) {

    public BigDecimal orderValue() {
        return MoneyUtils.notional(estimatedPrice, quantity, contractMultiplier);
    }

    public boolean isBuy() {
        return side == OrderSide.BUY;
    }
}
