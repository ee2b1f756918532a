package com.tradescan.backend.service;

import com.tradescan.backend.model.TradingMode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the current trading mode. Everything that reads or writes mode-tagged state asks this service.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TradingModeService {

    private final AppSettingsService appSettingsService;
    private final AtomicReference<TradingMode> current = new AtomicReference<>();

    public TradingMode current() {
        TradingMode mode = current.get();
        if (mode == null) {
            mode = TradingMode.fromStored(appSettingsService.get(AppSettingsService.TRADING_MODE).orElse(null));
            current.compareAndSet(null, mode);
        }
        return current.get();
    }

    public TradingMode switchTo(TradingMode mode) {
        appSettingsService.put(AppSettingsService.TRADING_MODE, mode.name());
        TradingMode previous = current.getAndSet(mode);
        if (previous != mode) {
            log.info("Trading mode switched {} -> {}", previous, mode);
        }
        return mode;
    }
}
