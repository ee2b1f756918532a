package com.tradescan.backend.service.scanner;

/**
 * Indicator values derived from daily closes. Fields are null when history is too short.
 */
public record TechnicalSnapshot(Double rsi, Double sma20, Double sma50, Double sma200, Double macd, String macdSignal) {}
