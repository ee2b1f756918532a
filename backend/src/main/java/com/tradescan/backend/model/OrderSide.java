package com.tradescan.backend.model;

public enum OrderSide {
    BUY,
    SELL;

    public String wireValue() {
        return name().toLowerCase();
    }
}
