package com.tradescan.backend.model;

public enum CloseReason {
    MANUAL,
    STOP_LOSS,
    TAKE_PROFIT;

    public String wireValue() {
        return name().toLowerCase();
    }
}
