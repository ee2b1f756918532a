package com.tradescan.backend.model.params;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum MacdSignal {
    BULLISH,
    BEARISH,
    ANY;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static MacdSignal fromWire(String value) {
        return value == null ? ANY : MacdSignal.valueOf(value.trim().toUpperCase());
    }
}
