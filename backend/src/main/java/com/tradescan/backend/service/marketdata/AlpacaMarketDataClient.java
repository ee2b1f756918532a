package com.tradescan.backend.service.marketdata;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradescan.backend.config.AlpacaProperties;
import com.tradescan.backend.exception.UpstreamValidationException;
import com.tradescan.backend.model.Provider;
import com.tradescan.backend.service.ProviderHttpClient;
import com.tradescan.backend.util.OptionSymbols;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Alpaca market data v2 (stocks) and v1beta1 (options). Fundamentals are delegated to Alpha Vantage.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlpacaMarketDataClient implements MarketDataProvider {

    private final ProviderHttpClient httpClient;
    private final AlpacaProperties alpacaProperties;
    private final AlphaVantageFundamentalsClient fundamentalsClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public Quote getQuote(String symbol) {
        if (OptionSymbols.isOptionSymbol(symbol)) {
            return getOptionQuote(symbol);
        }
        String url = UriComponentsBuilder.fromHttpUrl(alpacaProperties.getDataBaseUrl())
                .path("/v2/stocks/{symbol}/quotes/latest")
                .queryParam("feed", alpacaProperties.getStockFeed())
                .buildAndExpand(symbol)
                .toUriString();
        JsonNode quote = read(httpClient.get(Provider.ALPACA, url, headers()), "quote for " + symbol).path("quote");
        if (quote.isMissingNode() || quote.isNull()) {
            throw new UpstreamValidationException(Provider.ALPACA, "Quote payload missing for " + symbol);
        }
        return new Quote(symbol,
                JsonFields.money(quote, "bp"),
                JsonFields.money(quote, "ap"),
                null,
                timestamp(quote, "t"));
    }

    @Override
    public Bar getBar(String symbol) {
        List<Bar> bars = fetchDailyBars(symbol, 2, clock.instant().atZone(ZoneOffset.UTC).toLocalDate().minusDays(14));
        if (bars.isEmpty()) {
            throw new UpstreamValidationException(Provider.ALPACA, "No daily bar returned for " + symbol);
        }
        Bar latest = bars.get(bars.size() - 1);
        Double previousClose = bars.size() > 1 ? bars.get(bars.size() - 2).close() : null;
        return new Bar(latest.symbol(), latest.timestamp(), latest.open(), latest.high(), latest.low(),
                latest.close(), latest.volume(), previousClose);
    }

    @Override
    public List<Bar> getHistoricalBars(String symbol, int limit) {
        // Calendar days comfortably covering the requested number of sessions.
        LocalDate start = clock.instant().atZone(ZoneOffset.UTC).toLocalDate().minusDays((long) (limit * 1.6) + 10);
        return fetchDailyBars(symbol, limit, start);
    }

    @Override
    public Fundamentals getFundamentals(String symbol) {
        return fundamentalsClient.getOverview(symbol);
    }

    @Override
    public List<OptionContract> getOptionChain(String underlying) {
        String url = UriComponentsBuilder.fromHttpUrl(alpacaProperties.getDataBaseUrl())
                .path("/v1beta1/options/snapshots/{underlying}")
                .queryParam("feed", alpacaProperties.getOptionFeed())
                .queryParam("limit", 1000)
                .buildAndExpand(underlying)
                .toUriString();
        JsonNode snapshots = read(httpClient.get(Provider.ALPACA, url, headers()), "option chain for " + underlying)
                .path("snapshots");
        if (!snapshots.isObject()) {
            throw new UpstreamValidationException(Provider.ALPACA, "Option chain payload missing for " + underlying);
        }
        List<OptionContract> contracts = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = snapshots.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            OptionSymbols.parse(entry.getKey()).ifPresentOrElse(
                    parsed -> contracts.add(toContract(entry.getKey(), parsed, entry.getValue())),
                    () -> log.warn("Skipping unparseable option symbol {} in chain of {}", entry.getKey(), underlying));
        }
        contracts.sort((left, right) -> left.symbol().compareTo(right.symbol()));
        return contracts;
    }

    private Quote getOptionQuote(String symbol) {
        String url = UriComponentsBuilder.fromHttpUrl(alpacaProperties.getDataBaseUrl())
                .path("/v1beta1/options/quotes/latest")
                .queryParam("symbols", symbol)
                .queryParam("feed", alpacaProperties.getOptionFeed())
                .toUriString();
        JsonNode quote = read(httpClient.get(Provider.ALPACA, url, headers()), "option quote for " + symbol)
                .path("quotes").path(symbol);
        if (quote.isMissingNode() || quote.isNull()) {
            throw new UpstreamValidationException(Provider.ALPACA, "Option quote missing for " + symbol);
        }
        return new Quote(symbol, JsonFields.money(quote, "bp"), JsonFields.money(quote, "ap"), null,
                timestamp(quote, "t"));
    }

    private List<Bar> fetchDailyBars(String symbol, int limit, LocalDate start) {
        String url = UriComponentsBuilder.fromHttpUrl(alpacaProperties.getDataBaseUrl())
                .path("/v2/stocks/{symbol}/bars")
                .queryParam("timeframe", "1Day")
                .queryParam("start", start.toString())
                .queryParam("limit", limit)
                .queryParam("sort", "desc")
                .queryParam("adjustment", "raw")
                .queryParam("feed", alpacaProperties.getStockFeed())
                .buildAndExpand(symbol)
                .toUriString();
        JsonNode bars = read(httpClient.get(Provider.ALPACA, url, headers()), "bars for " + symbol).path("bars");
        if (bars.isNull() || bars.isMissingNode()) {
            return List.of();
        }
        if (!bars.isArray()) {
            throw new UpstreamValidationException(Provider.ALPACA, "Bars payload for " + symbol + " is not a list");
        }
        List<Bar> result = new ArrayList<>();
        for (JsonNode bar : bars) {
            Double close = JsonFields.decimal(bar, "c");
            if (close == null) {
                throw new UpstreamValidationException(Provider.ALPACA, "Bar without close price for " + symbol);
            }
            result.add(new Bar(symbol, timestamp(bar, "t"),
                    orZero(JsonFields.decimal(bar, "o")),
                    orZero(JsonFields.decimal(bar, "h")),
                    orZero(JsonFields.decimal(bar, "l")),
                    close,
                    JsonFields.whole(bar, "v") == null ? 0L : JsonFields.whole(bar, "v"),
                    null));
        }
        // Requested newest first; callers want chronological order.
        Collections.reverse(result);
        return result;
    }

    private OptionContract toContract(String symbol, OptionSymbols.Parsed parsed, JsonNode snapshot) {
        JsonNode quote = snapshot.path("latestQuote");
        JsonNode trade = snapshot.path("latestTrade");
        JsonNode greeks = snapshot.path("greeks");
        JsonNode dailyBar = snapshot.path("dailyBar");
        return new OptionContract(
                symbol,
                parsed.underlying(),
                parsed.call(),
                parsed.strike().doubleValue(),
                parsed.expiration(),
                JsonFields.decimal(quote, "bp"),
                JsonFields.decimal(quote, "ap"),
                JsonFields.decimal(trade, "p"),
                JsonFields.whole(dailyBar, "v"),
                JsonFields.whole(snapshot, "openInterest"),
                JsonFields.decimal(greeks, "delta"),
                JsonFields.decimal(greeks, "gamma"),
                JsonFields.decimal(greeks, "theta"),
                JsonFields.decimal(greeks, "vega"),
                JsonFields.decimal(snapshot, "impliedVolatility")
        );
    }

    private JsonNode read(String body, String what) {
        if (body == null || body.isBlank()) {
            throw new UpstreamValidationException(Provider.ALPACA, "Empty response for " + what);
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new UpstreamValidationException(Provider.ALPACA, "Malformed JSON for " + what, e);
        }
    }

    private HttpHeaders headers() {
        AlpacaProperties.Account account = alpacaProperties.dataAccount();
        HttpHeaders headers = new HttpHeaders();
        if (account.isConfigured()) {
            headers.set("APCA-API-KEY-ID", account.getKeyId());
            headers.set("APCA-API-SECRET-KEY", account.getSecretKey());
        }
        return headers;
    }

    private static Instant timestamp(JsonNode node, String field) {
        String text = JsonFields.text(node, field);
        if (text == null) {
            return null;
        }
        try {
            return Instant.parse(text);
        } catch (RuntimeException e) {
            return null;
        }
    }

    private static double orZero(Double value) {
        return value == null ? 0.0 : value;
    }
}
