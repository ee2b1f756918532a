package com.tradescan.backend.service.trading;

import com.tradescan.backend.config.AlpacaProperties;
import com.tradescan.backend.model.Provider;
import com.tradescan.backend.model.TradeRecord;
import com.tradescan.backend.model.TradingMode;
import com.tradescan.backend.repository.TradeRecordRepository;
import com.tradescan.backend.service.ScheduledTaskGuard;
import com.tradescan.backend.service.brokerage.BrokerOrder;
import com.tradescan.backend.service.brokerage.BrokerageProvider;
import com.tradescan.backend.service.governor.ProviderGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Polls the broker for working orders in both modes and feeds status changes back into the executor.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "tradescan.orders", name = "reconcile-enabled", havingValue = "true", matchIfMissing = true)
public class OrderStatusReconciler {

    private final TradeRecordRepository tradeRecordRepository;
    private final BrokerageProvider brokerageProvider;
    private final ProviderGateway providerGateway;
    private final TradeExecutor tradeExecutor;
    private final AlpacaProperties alpacaProperties;
    private final ScheduledTaskGuard scheduledTaskGuard;

    @Scheduled(fixedDelayString = "${tradescan.orders.reconcile-interval-ms:15000}",
            initialDelayString = "${tradescan.orders.reconcile-interval-ms:15000}")
    public void reconcileScheduled() {
        scheduledTaskGuard.run("order-reconcile", this::reconcile);
    }

    /**
     * @return number of trades whose status was refreshed
     */
    public int reconcile() {
        int refreshed = 0;
        for (TradingMode mode : TradingMode.values()) {
            if (!alpacaProperties.accountFor(mode).isConfigured()) {
                continue;
            }
            List<TradeRecord> working = tradeRecordRepository.findByTradingModeAndStatusIn(mode,
                    TradeExecutor.WORKING_STATUSES);
            for (TradeRecord trade : working) {
                if (trade.getBrokerOrderId() == null) {
                    continue;
                }
                try {
                    BrokerOrder order = providerGateway.fetch(Provider.ALPACA,
                            () -> brokerageProvider.getOrderStatus(mode, trade.getBrokerOrderId()));
                    TradeRecord updated = tradeExecutor.applyBrokerUpdate(trade.getId(), order);
                    if (updated.getStatus() != trade.getStatus()
                            || !updated.getFilledQuantity().equals(trade.getFilledQuantity())) {
                        refreshed++;
                    }
                } catch (RuntimeException e) {
                    log.warn("Could not refresh order {} ({} {}): {}", trade.getBrokerOrderId(), mode,
                            trade.getSymbol(), e.getMessage());
                }
            }
        }
        if (refreshed > 0) {
            log.info("Reconciled {} working orders", refreshed);
        }
        return refreshed;
    }
}
