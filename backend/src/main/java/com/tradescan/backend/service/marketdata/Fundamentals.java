package com.tradescan.backend.service.marketdata;

/**
 * Company fundamentals; any field the provider leaves blank is null.
 */
public record Fundamentals(
        String symbol,
        Double pe,
        Double pb,
        Double eps,
        Double marketCap,
        Double dividendYieldPercent,
        Double beta,
        Double debtToEquity,
        Double currentRatio,
        String sector,
        String industry
) {}
