package com.tradescan.backend.service.brokerage;

import com.tradescan.backend.model.TradeStatus;

import java.math.BigDecimal;

/**
 * Broker view of an order. {@code status} is the provider's raw status string.
 */
public record BrokerOrder(
        String orderId,
        String clientOrderId,
        String symbol,
        String status,
        int filledQuantity,
        BigDecimal filledAveragePrice,
        String rejectReason
) {

    public TradeStatus toTradeStatus() {
        if (status == null) {
            return TradeStatus.PENDING;
        }
        return switch (status.trim().toLowerCase()) {
            case "filled" -> TradeStatus.FILLED;
            case "partially_filled" -> TradeStatus.PARTIAL_FILL;
            case "rejected" -> TradeStatus.REJECTED;
            case "canceled", "cancelled", "expired", "done_for_day", "stopped", "suspended" -> TradeStatus.CANCELLED;
            default -> TradeStatus.PENDING;
        };
    }
}
