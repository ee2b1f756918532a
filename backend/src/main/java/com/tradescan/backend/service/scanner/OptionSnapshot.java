package com.tradescan.backend.service.scanner;

import com.tradescan.backend.model.params.Moneyness;
import com.tradescan.backend.service.marketdata.OptionContract;

/**
 * Match snapshot for one option contract together with the derived values the filters used.
 */
public record OptionSnapshot(OptionContract contract, Double underlyingPrice, Long daysToExpiration,
                             Moneyness moneyness, Double premium, Double spread) {}
