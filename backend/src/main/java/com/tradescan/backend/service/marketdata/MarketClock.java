package com.tradescan.backend.service.marketdata;

public interface MarketClock {

    boolean isOpen();
}
