package com.tradescan.backend.service.marketdata;

import java.util.List;

/**
 * Market data collaborator. Each method issues exactly one provider request and is meant to run under the governor.
 */
public interface MarketDataProvider {

    Quote getQuote(String symbol);

    Bar getBar(String symbol);

    List<Bar> getHistoricalBars(String symbol, int limit);

    Fundamentals getFundamentals(String symbol);

    List<OptionContract> getOptionChain(String underlying);
}
