package com.tradescan.backend.model.params;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Moneyness {
    ITM,
    ATM,
    OTM,
    ANY;

    @JsonValue
    public String wireValue() {
        return name();
    }

    @JsonCreator
    public static Moneyness fromWire(String value) {
        return value == null ? ANY : Moneyness.valueOf(value.trim().toUpperCase());
    }
}
