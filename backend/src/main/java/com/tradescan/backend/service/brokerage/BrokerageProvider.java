package com.tradescan.backend.service.brokerage;

import com.tradescan.backend.model.TradingMode;

import java.math.BigDecimal;

/**
 * Brokerage collaborator. Credentials are chosen by {@code mode}; paper and live never share keys.
 */
public interface BrokerageProvider {

    BrokerOrder submitOrder(TradingMode mode, BrokerOrderRequest order);

    BrokerOrder getOrderStatus(TradingMode mode, String orderId);

    BrokerAccount getAccount(TradingMode mode);

    record BrokerAccount(String accountId, String status, BigDecimal buyingPower, BigDecimal cash,
                         BigDecimal equity) {}
}
