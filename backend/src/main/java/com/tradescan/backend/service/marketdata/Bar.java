package com.tradescan.backend.service.marketdata;

import java.time.Instant;

/**
 * Daily bar. {@code previousClose} is null when the provider returned a single bar.
 */
public record Bar(String symbol, Instant timestamp, double open, double high, double low, double close, long volume,
                  Double previousClose) {

    public Double dayChangePercent() {
        if (previousClose == null || previousClose == 0) {
            return null;
        }
        return (close - previousClose) / previousClose * 100.0;
    }
}
