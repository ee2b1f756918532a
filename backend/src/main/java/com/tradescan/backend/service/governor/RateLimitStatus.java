package com.tradescan.backend.service.governor;

public record RateLimitStatus(
        int usedThisMinute,
        int maxPerMinute,
        long usedToday,
        Integer maxPerDay,
        int queued,
        long resetsInMs,
        long dayResetsInMs
) {}
