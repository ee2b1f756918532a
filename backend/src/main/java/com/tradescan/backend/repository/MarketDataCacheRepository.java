package com.tradescan.backend.repository;

import com.tradescan.backend.model.MarketDataCacheEntry;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface MarketDataCacheRepository extends JpaRepository<MarketDataCacheEntry, Long> {

    Optional<MarketDataCacheEntry> findBySymbolAndDataType(String symbol, MarketDataCacheEntry.DataType dataType);
}
