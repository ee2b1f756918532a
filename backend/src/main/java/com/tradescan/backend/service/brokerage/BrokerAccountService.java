package com.tradescan.backend.service.brokerage;

import com.tradescan.backend.model.Provider;
import com.tradescan.backend.model.TradingMode;
import com.tradescan.backend.service.TradingModeService;
import com.tradescan.backend.service.governor.ProviderGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Brokerage account snapshot (buying power, cash, equity) for a trading mode, read through the governor.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BrokerAccountService {

    private final BrokerageProvider brokerageProvider;
    private final ProviderGateway providerGateway;
    private final TradingModeService tradingModeService;

    public BrokerageProvider.BrokerAccount account(TradingMode mode) {
        BrokerageProvider.BrokerAccount account = providerGateway.fetch(Provider.ALPACA,
                () -> brokerageProvider.getAccount(mode));
        log.debug("Fetched {} account {} status={}", mode, account.accountId(), account.status());
        return account;
    }

    public BrokerageProvider.BrokerAccount currentAccount() {
        return account(tradingModeService.current());
    }
}
