package com.tradescan.backend.model;

public enum OrderType {
    MARKET,
    LIMIT,
    STOP,
    STOP_LIMIT,
    TRAILING_STOP;

    public boolean requiresLimitPrice() {
        return this == LIMIT || this == STOP_LIMIT;
    }

    public boolean requiresStopPrice() {
        return this == STOP || this == STOP_LIMIT;
    }

    public String wireValue() {
        return name().toLowerCase();
    }
}
