package com.tradescan.backend.service.marketdata;

import java.math.BigDecimal;
import java.time.Instant;

public record Quote(String symbol, BigDecimal bidPrice, BigDecimal askPrice, BigDecimal lastPrice, Instant timestamp) {

    /**
     * Best available mark: last trade, else the bid/ask midpoint, else whichever side is quoted.
     */
    public BigDecimal price() {
        if (positive(lastPrice)) {
            return lastPrice;
        }
        if (positive(bidPrice) && positive(askPrice)) {
            return bidPrice.add(askPrice).divide(BigDecimal.valueOf(2), 4, java.math.RoundingMode.HALF_UP);
        }
        if (positive(askPrice)) {
            return askPrice;
        }
        return positive(bidPrice) ? bidPrice : null;
    }

    private static boolean positive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }
}
