package com.tradescan.backend.service.brokerage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tradescan.backend.config.AlpacaProperties;
import com.tradescan.backend.exception.BrokerRejectionException;
import com.tradescan.backend.exception.ProviderCallException;
import com.tradescan.backend.exception.TradingException;
import com.tradescan.backend.exception.UpstreamValidationException;
import com.tradescan.backend.model.Provider;
import com.tradescan.backend.model.TradingMode;
import com.tradescan.backend.service.ProviderHttpClient;
import com.tradescan.backend.service.marketdata.JsonFields;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;

/**
 * Alpaca trading API v2.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlpacaBrokerageClient implements BrokerageProvider {

    private final ProviderHttpClient httpClient;
    private final AlpacaProperties alpacaProperties;
    private final ObjectMapper objectMapper;

    @Override
    public BrokerOrder submitOrder(TradingMode mode, BrokerOrderRequest order) {
        AlpacaProperties.Account account = account(mode);
        ObjectNode body = objectMapper.createObjectNode();
        body.put("symbol", order.symbol());
        body.put("qty", String.valueOf(order.quantity()));
        body.put("side", order.side().wireValue());
        body.put("type", order.type().wireValue());
        body.put("time_in_force", order.timeInForce() == null ? "day" : order.timeInForce());
        putPrice(body, "limit_price", order.limitPrice());
        putPrice(body, "stop_price", order.stopPrice());
        putPrice(body, "trail_percent", order.trailPercent());
        if (order.clientOrderId() != null) {
            body.put("client_order_id", order.clientOrderId());
        }
        try {
            String response = httpClient.post(Provider.ALPACA, account.getBaseUrl() + "/v2/orders", headers(account),
                    objectMapper.writeValueAsString(body));
            return toOrder(read(response, "order submission"));
        } catch (JsonProcessingException e) {
            throw new TradingException("Unable to encode order for " + order.symbol(), e);
        } catch (ProviderCallException e) {
            Integer status = e.getStatusCode();
            if (status != null && (status == 403 || status == 422)) {
                throw new BrokerRejectionException(extractMessage(e.getMessage()), status);
            }
            throw e;
        }
    }

    @Override
    public BrokerOrder getOrderStatus(TradingMode mode, String orderId) {
        AlpacaProperties.Account account = account(mode);
        String response = httpClient.get(Provider.ALPACA, account.getBaseUrl() + "/v2/orders/" + orderId,
                headers(account));
        return toOrder(read(response, "order " + orderId));
    }

    @Override
    public BrokerAccount getAccount(TradingMode mode) {
        AlpacaProperties.Account account = account(mode);
        JsonNode root = read(httpClient.get(Provider.ALPACA, account.getBaseUrl() + "/v2/account", headers(account)),
                "account");
        return new BrokerAccount(
                JsonFields.text(root, "id"),
                JsonFields.text(root, "status"),
                JsonFields.money(root, "buying_power"),
                JsonFields.money(root, "cash"),
                JsonFields.money(root, "equity"));
    }

    private BrokerOrder toOrder(JsonNode node) {
        String id = JsonFields.text(node, "id");
        if (id == null) {
            throw new UpstreamValidationException(Provider.ALPACA, "Order response without id");
        }
        Long filled = JsonFields.whole(node, "filled_qty");
        return new BrokerOrder(
                id,
                JsonFields.text(node, "client_order_id"),
                JsonFields.text(node, "symbol"),
                JsonFields.text(node, "status"),
                filled == null ? 0 : filled.intValue(),
                JsonFields.money(node, "filled_avg_price"),
                JsonFields.text(node, "reject_reason"));
    }

    private AlpacaProperties.Account account(TradingMode mode) {
        AlpacaProperties.Account account = alpacaProperties.accountFor(mode);
        if (!account.isConfigured()) {
            throw new TradingException("Alpaca " + mode.name().toLowerCase() + " credentials are not configured");
        }
        return account;
    }

    private JsonNode read(String body, String what) {
        try {
            JsonNode node = body == null ? null : objectMapper.readTree(body);
            if (node == null || !node.isObject()) {
                throw new UpstreamValidationException(Provider.ALPACA, "Empty response for " + what);
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new UpstreamValidationException(Provider.ALPACA, "Malformed JSON for " + what, e);
        }
    }

    private String extractMessage(String raw) {
        int brace = raw == null ? -1 : raw.indexOf('{');
        if (brace >= 0) {
            try {
                String message = JsonFields.text(objectMapper.readTree(raw.substring(brace)), "message");
                if (message != null) {
                    return message;
                }
            } catch (JsonProcessingException e) {
                log.debug("Rejection body was not JSON: {}", raw);
            }
        }
        return raw;
    }

    private static HttpHeaders headers(AlpacaProperties.Account account) {
        HttpHeaders headers = new HttpHeaders();
        headers.set("APCA-API-KEY-ID", account.getKeyId());
        headers.set("APCA-API-SECRET-KEY", account.getSecretKey());
        return headers;
    }

    private static void putPrice(ObjectNode body, String field, BigDecimal value) {
        if (value != null) {
            body.put(field, value.stripTrailingZeros().toPlainString());
        }
    }
}
