package com.tradescan.backend.service.marketdata;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradescan.backend.config.AlpacaProperties;
import com.tradescan.backend.config.MarketProperties;
import com.tradescan.backend.exception.UpstreamValidationException;
import com.tradescan.backend.model.Provider;
import com.tradescan.backend.service.ProviderHttpClient;
import com.tradescan.backend.service.TradingModeService;
import com.tradescan.backend.service.governor.ProviderGateway;
import com.tradescan.backend.service.governor.RequestOptions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@code GET /v2/clock}, cached briefly so several profiles ticking together cost one request.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlpacaMarketClock implements MarketClock {

    private final ProviderGateway providerGateway;
    private final ProviderHttpClient httpClient;
    private final AlpacaProperties alpacaProperties;
    private final MarketProperties marketProperties;
    private final TradingModeService tradingModeService;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final AtomicReference<Reading> lastReading = new AtomicReference<>();

    @Override
    public boolean isOpen() {
        Instant now = clock.instant();
        Reading cached = lastReading.get();
        if (cached != null && now.isBefore(cached.readAt().plus(Duration.ofSeconds(marketProperties.getClockCacheSeconds())))) {
            return cached.open();
        }
        boolean open = providerGateway.fetch(Provider.ALPACA, this::fetchClock, RequestOptions.high());
        lastReading.set(new Reading(open, now));
        return open;
    }

    private boolean fetchClock() {
        AlpacaProperties.Account account = alpacaProperties.accountFor(tradingModeService.current());
        HttpHeaders headers = new HttpHeaders();
        if (account.isConfigured()) {
            headers.set("APCA-API-KEY-ID", account.getKeyId());
            headers.set("APCA-API-SECRET-KEY", account.getSecretKey());
        }
        String body = httpClient.get(Provider.ALPACA, account.getBaseUrl() + "/v2/clock", headers);
        try {
            JsonNode root = body == null ? null : objectMapper.readTree(body);
            if (root == null || !root.has("is_open")) {
                throw new UpstreamValidationException(Provider.ALPACA, "Clock response lacks is_open");
            }
            return root.get("is_open").asBoolean();
        } catch (JsonProcessingException e) {
            throw new UpstreamValidationException(Provider.ALPACA, "Malformed clock response", e);
        }
    }

    private record Reading(boolean open, Instant readAt) {}
}
