package com.tradescan.backend.service.marketdata;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradescan.backend.config.AlphaVantageProperties;
import com.tradescan.backend.exception.ProviderCallException;
import com.tradescan.backend.exception.UpstreamValidationException;
import com.tradescan.backend.model.Provider;
import com.tradescan.backend.service.ProviderHttpClient;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Alpha Vantage {@code OVERVIEW} lookups. The service reports throttling inside a 200 body, which is mapped to a
 * retryable failure.
 */
@Service
@RequiredArgsConstructor
public class AlphaVantageFundamentalsClient {

    private final ProviderHttpClient httpClient;
    private final AlphaVantageProperties properties;
    private final ObjectMapper objectMapper;

    public Fundamentals getOverview(String symbol) {
        String url = UriComponentsBuilder.fromHttpUrl(properties.getBaseUrl())
                .path("/query")
                .queryParam("function", "OVERVIEW")
                .queryParam("symbol", symbol)
                .queryParam("apikey", properties.getApiKey() == null ? "demo" : properties.getApiKey())
                .toUriString();
        String body = httpClient.get(Provider.ALPHA_VANTAGE, url, null);
        JsonNode root;
        try {
            root = body == null ? null : objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new UpstreamValidationException(Provider.ALPHA_VANTAGE, "Malformed overview JSON for " + symbol, e);
        }
        if (root == null || !root.isObject()) {
            throw new UpstreamValidationException(Provider.ALPHA_VANTAGE, "Empty overview for " + symbol);
        }
        if (root.has("Note") || root.has("Information")) {
            String message = root.has("Note") ? root.get("Note").asText() : root.get("Information").asText();
            throw ProviderCallException.transientFailure(Provider.ALPHA_VANTAGE,
                    "Alpha Vantage throttled: " + message, 429, null);
        }
        if (root.has("Error Message") || root.isEmpty() || !root.has("Symbol")) {
            throw new UpstreamValidationException(Provider.ALPHA_VANTAGE, "No overview available for " + symbol);
        }
        Double dividendYield = JsonFields.decimal(root, "DividendYield");
        return new Fundamentals(
                symbol,
                JsonFields.decimal(root, "PERatio"),
                JsonFields.decimal(root, "PriceToBookRatio"),
                JsonFields.decimal(root, "EPS"),
                JsonFields.decimal(root, "MarketCapitalization"),
                dividendYield == null ? null : dividendYield * 100.0,
                JsonFields.decimal(root, "Beta"),
                JsonFields.decimal(root, "DebtToEquityRatio"),
                JsonFields.decimal(root, "CurrentRatio"),
                JsonFields.text(root, "Sector"),
                JsonFields.text(root, "Industry")
        );
    }
}
