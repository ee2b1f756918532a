package com.tradescan.backend.model;

import com.tradescan.backend.exception.BadRequestException;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * External providers whose request volume is governed. Setting keys follow {@code <key>_rate_limit_per_minute}.
 */
@Getter
@RequiredArgsConstructor
public enum Provider {
    ALPACA("alpaca"),
    ALPHA_VANTAGE("alpha_vantage");

    private final String key;

    public String perMinuteSettingKey() {
        return key + "_rate_limit_per_minute";
    }

    public String perDaySettingKey() {
        return key + "_rate_limit_per_day";
    }

    public static Provider fromKey(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase().replace('-', '_');
            for (Provider provider : values()) {
                if (provider.key.equals(normalized) || provider.name().equalsIgnoreCase(normalized)) {
                    return provider;
                }
            }
            if ("alphavantage".equals(normalized)) {
                return ALPHA_VANTAGE;
            }
        }
        throw new BadRequestException("Unknown provider: " + value);
    }
}
