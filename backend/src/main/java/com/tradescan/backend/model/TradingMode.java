package com.tradescan.backend.model;

import com.tradescan.backend.exception.BadRequestException;

public enum TradingMode {
    PAPER,
    LIVE;

    public static TradingMode fromStored(String value) {
        if (value == null || value.isBlank()) {
            return PAPER;
        }
        try {
            return TradingMode.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException ex) {
            return PAPER;
        }
    }

    public static TradingMode fromRequest(String value) {
        if (value == null || value.isBlank()) {
            throw new BadRequestException("Trading mode is required");
        }
        try {
            return TradingMode.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException ex) {
            throw new BadRequestException("Unknown trading mode: " + value);
        }
    }
}
