package com.tradescan.backend.service.trading;

import com.tradescan.backend.config.AlpacaProperties;
import com.tradescan.backend.exception.ProviderCallException;
import com.tradescan.backend.model.Provider;
import com.tradescan.backend.model.TradeRecord;
import com.tradescan.backend.model.TradeStatus;
import com.tradescan.backend.model.TradingMode;
import com.tradescan.backend.repository.TradeRecordRepository;
import com.tradescan.backend.service.ScheduledTaskGuard;
import com.tradescan.backend.service.brokerage.BrokerOrder;
import com.tradescan.backend.service.brokerage.BrokerageProvider;
import com.tradescan.backend.service.governor.ProviderGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.concurrent.Callable;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OrderStatusReconcilerTest {

    @Mock
    private TradeRecordRepository tradeRecordRepository;
    @Mock
    private BrokerageProvider brokerageProvider;
    @Mock
    private ProviderGateway providerGateway;
    @Mock
    private TradeExecutor tradeExecutor;

    private OrderStatusReconciler reconciler;

    @BeforeEach
    void setUp() {
        AlpacaProperties alpacaProperties = new AlpacaProperties();
        alpacaProperties.getPaper().setKeyId("paper-key");
        alpacaProperties.getPaper().setSecretKey("paper-secret");
        reconciler = new OrderStatusReconciler(tradeRecordRepository, brokerageProvider, providerGateway, tradeExecutor,
                alpacaProperties, new ScheduledTaskGuard());
    }

    @Test
    void workingOrdersAreRefreshedOnlyForConfiguredModes() throws Exception {
        TradeRecord pending = working(7L, "ord-7");
        BrokerOrder filled = new BrokerOrder("ord-7", null, "AAPL", "filled", 5, new BigDecimal("101.5"), null);
        when(tradeRecordRepository.findByTradingModeAndStatusIn(TradingMode.PAPER, TradeExecutor.WORKING_STATUSES))
                .thenReturn(List.of(pending, working(8L, null)));
        when(providerGateway.fetch(eq(Provider.ALPACA), any())).thenAnswer(invocation -> {
            Callable<?> call = invocation.getArgument(1);
            return call.call();
        });
        when(brokerageProvider.getOrderStatus(TradingMode.PAPER, "ord-7")).thenReturn(filled);
        when(tradeExecutor.applyBrokerUpdate(7L, filled))
                .thenReturn(TradeRecord.builder().id(7L).status(TradeStatus.FILLED).filledQuantity(5).build());

        int refreshed = reconciler.reconcile();

        assertThat(refreshed).isEqualTo(1);
        verify(tradeRecordRepository, never()).findByTradingModeAndStatusIn(eq(TradingMode.LIVE), any());
        verify(tradeExecutor, never()).applyBrokerUpdate(eq(8L), any());
    }

    @Test
    void failedLookupDoesNotStopOtherOrders() {
        when(tradeRecordRepository.findByTradingModeAndStatusIn(TradingMode.PAPER, TradeExecutor.WORKING_STATUSES))
                .thenReturn(List.of(working(1L, "ord-1"), working(2L, "ord-2")));
        when(providerGateway.fetch(eq(Provider.ALPACA), any()))
                .thenThrow(new ProviderCallException(Provider.ALPACA, "alpaca unreachable", null, true, null))
                .thenReturn(new BrokerOrder("ord-2", null, "AAPL", "new", 0, null, null));
        when(tradeExecutor.applyBrokerUpdate(eq(2L), any()))
                .thenReturn(working(2L, "ord-2"));

        int refreshed = reconciler.reconcile();

        assertThat(refreshed).isZero();
        verify(tradeExecutor).applyBrokerUpdate(eq(2L), any());
        verify(tradeExecutor, never()).applyBrokerUpdate(eq(1L), any());
    }

    private static TradeRecord working(Long id, String brokerOrderId) {
        return TradeRecord.builder()
                .id(id)
                .tradingMode(TradingMode.PAPER)
                .symbol("AAPL")
                .quantity(5)
                .status(TradeStatus.PENDING)
                .brokerOrderId(brokerOrderId)
                .build();
    }
}
