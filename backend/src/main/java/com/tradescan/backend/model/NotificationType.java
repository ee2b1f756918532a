package com.tradescan.backend.model;

public enum NotificationType {
    SCAN_MATCHES,
    SCAN_FAILED,
    TRADE_REJECTED,
    ORDER_FILLED,
    POSITION_CLOSED
}
