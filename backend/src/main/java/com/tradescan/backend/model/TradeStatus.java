package com.tradescan.backend.model;

public enum TradeStatus {
    PENDING,
    PARTIAL_FILL,
    FILLED,
    REJECTED,
    CANCELLED;

    public boolean isTerminal() {
        return this == FILLED || this == REJECTED || this == CANCELLED;
    }

    public boolean canTransitionTo(TradeStatus next) {
        if (next == null || isTerminal()) {
            return false;
        }
        return switch (this) {
            case PENDING -> next != PENDING;
            case PARTIAL_FILL -> next != PENDING;
            default -> false;
        };
    }
}
