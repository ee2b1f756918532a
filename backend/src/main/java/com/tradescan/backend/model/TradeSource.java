package com.tradescan.backend.model;

public enum TradeSource {
    MANUAL,
    AUTO_EXECUTE,
    MONITOR
}
