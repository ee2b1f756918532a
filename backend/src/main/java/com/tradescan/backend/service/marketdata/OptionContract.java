package com.tradescan.backend.service.marketdata;

import java.time.LocalDate;

public record OptionContract(
        String symbol,
        String underlying,
        boolean call,
        double strike,
        LocalDate expiration,
        Double bid,
        Double ask,
        Double last,
        Long volume,
        Long openInterest,
        Double delta,
        Double gamma,
        Double theta,
        Double vega,
        Double impliedVolatility
) {

    /** Premium per share: midpoint when both sides are quoted, else last trade. */
    public Double premium() {
        if (bid != null && ask != null && bid > 0 && ask > 0) {
            return (bid + ask) / 2.0;
        }
        return last;
    }

    public Double spread() {
        return bid != null && ask != null ? ask - bid : null;
    }
}
