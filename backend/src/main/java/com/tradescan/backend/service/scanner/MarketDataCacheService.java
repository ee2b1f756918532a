package com.tradescan.backend.service.scanner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradescan.backend.model.MarketDataCacheEntry;
import com.tradescan.backend.repository.MarketDataCacheRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Persistent TTL cache for slow-moving data (fundamentals, indicators) so repeated scans spend no quota on them.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MarketDataCacheService {

    private final MarketDataCacheRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public <T> Optional<T> get(String symbol, MarketDataCacheEntry.DataType type, Class<T> valueType) {
        Instant now = clock.instant();
        return repository.findBySymbolAndDataType(symbol, type)
                .filter(entry -> entry.getExpiresAt().isAfter(now))
                .flatMap(entry -> {
                    try {
                        return Optional.of(objectMapper.readValue(entry.getPayload(), valueType));
                    } catch (JsonProcessingException e) {
                        log.debug("Discarding unreadable {} cache entry for {}", type, symbol);
                        return Optional.empty();
                    }
                });
    }

    public void put(String symbol, MarketDataCacheEntry.DataType type, Object value, Duration ttl) {
        Instant now = clock.instant();
        try {
            String payload = objectMapper.writeValueAsString(value);
            MarketDataCacheEntry entry = repository.findBySymbolAndDataType(symbol, type)
                    .orElseGet(() -> MarketDataCacheEntry.builder().symbol(symbol).dataType(type).build());
            entry.setPayload(payload);
            entry.setCachedAt(now);
            entry.setExpiresAt(now.plus(ttl));
            repository.save(entry);
        } catch (JsonProcessingException | DataAccessException e) {
            log.warn("Could not cache {} for {}: {}", type, symbol, e.getMessage());
        }
    }
}
