package com.tradescan.backend.service.governor;

/**
 * @param maxPerMinute calls admitted in any rolling minute
 * @param maxPerDay    calls admitted in any rolling day, or null for no daily cap
 */
public record QuotaLimits(int maxPerMinute, Integer maxPerDay) {

    public QuotaLimits {
        if (maxPerMinute < 1) {
            throw new IllegalArgumentException("maxPerMinute must be at least 1");
        }
        if (maxPerDay != null && maxPerDay < 1) {
            throw new IllegalArgumentException("maxPerDay must be at least 1 when set");
        }
    }
}
