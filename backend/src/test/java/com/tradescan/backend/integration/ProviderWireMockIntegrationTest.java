package com.tradescan.backend.integration;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.tradescan.backend.exception.BrokerRejectionException;
import com.tradescan.backend.exception.ProviderCallException;
import com.tradescan.backend.exception.UpstreamValidationException;
import com.tradescan.backend.model.OrderSide;
import com.tradescan.backend.model.OrderType;
import com.tradescan.backend.model.TradeStatus;
import com.tradescan.backend.model.TradingMode;
import com.tradescan.backend.service.brokerage.BrokerAccountService;
import com.tradescan.backend.service.brokerage.BrokerOrder;
import com.tradescan.backend.service.brokerage.BrokerOrderRequest;
import com.tradescan.backend.service.brokerage.BrokerageProvider;
import com.tradescan.backend.service.marketdata.AlphaVantageFundamentalsClient;
import com.tradescan.backend.service.marketdata.Bar;
import com.tradescan.backend.service.marketdata.Fundamentals;
import com.tradescan.backend.service.marketdata.MarketDataProvider;
import com.tradescan.backend.service.marketdata.Quote;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.math.BigDecimal;
import java.util.List;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.configureFor;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.equalToJson;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.okJson;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.stubFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static com.github.tomakehurst.wiremock.client.WireMock.verify;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;

@SpringBootTest
class ProviderWireMockIntegrationTest {

    private static final WireMockServer wireMock = new WireMockServer(0);

    static {
        wireMock.start();
        configureFor("localhost", wireMock.port());
    }

    @DynamicPropertySource
    static void registerProperties(DynamicPropertyRegistry registry) {
        String base = "http://localhost:" + wireMock.port();
        registry.add("tradescan.alpaca.data-base-url", () -> base + "/data");
        registry.add("tradescan.alpaca.paper.base-url", () -> base + "/paper");
        registry.add("tradescan.alpaca.paper.key-id", () -> "paper-key");
        registry.add("tradescan.alpaca.paper.secret-key", () -> "paper-secret");
        registry.add("tradescan.alpha-vantage.base-url", () -> base + "/av");
        registry.add("tradescan.alpha-vantage.api-key", () -> "av-key");
    }

    @AfterAll
    static void stopWireMock() {
        wireMock.stop();
    }

    @Autowired
    private MarketDataProvider marketDataProvider;

    @Autowired
    private BrokerageProvider brokerageProvider;

    @Autowired
    private AlphaVantageFundamentalsClient fundamentalsClient;

    @Autowired
    private BrokerAccountService brokerAccountService;

    @BeforeEach
    void resetStubs() {
        wireMock.resetAll();
    }

    @Test
    void latestQuoteUsesBidAskMidpoint() {
        stubFor(get(urlPathEqualTo("/data/v2/stocks/AAPL/quotes/latest"))
                .willReturn(okJson("{\"symbol\":\"AAPL\",\"quote\":{\"bp\":189.5,\"ap\":190.5,\"t\":\"2026-10-19T14:30:00Z\"}}")));

        Quote quote = marketDataProvider.getQuote("AAPL");

        assertThat(quote.price()).isEqualByComparingTo("190");
        assertThat(quote.timestamp()).isNotNull();
        verify(getRequestedFor(urlPathEqualTo("/data/v2/stocks/AAPL/quotes/latest"))
                .withHeader("APCA-API-KEY-ID", equalTo("paper-key"))
                .withQueryParam("feed", equalTo("iex")));
    }

    @Test
    void historicalBarsComeBackOldestFirst() {
        stubFor(get(urlPathEqualTo("/data/v2/stocks/MSFT/bars"))
                .willReturn(okJson("{\"bars\":["
                        + "{\"t\":\"2026-10-16T04:00:00Z\",\"o\":410,\"h\":415,\"l\":408,\"c\":414,\"v\":1200000},"
                        + "{\"t\":\"2026-10-15T04:00:00Z\",\"o\":405,\"h\":411,\"l\":404,\"c\":409,\"v\":1100000}"
                        + "],\"symbol\":\"MSFT\"}")));

        List<Bar> bars = marketDataProvider.getHistoricalBars("MSFT", 2);

        assertThat(bars).extracting(Bar::close).containsExactly(409.0, 414.0);
        assertThat(bars.get(1).volume()).isEqualTo(1200000L);
    }

    @Test
    void serverErrorIsRetryableFailure() {
        stubFor(get(urlPathEqualTo("/data/v2/stocks/AAPL/quotes/latest"))
                .willReturn(aResponse().withStatus(503).withBody("unavailable")));

        assertThatThrownBy(() -> marketDataProvider.getQuote("AAPL"))
                .isInstanceOfSatisfying(ProviderCallException.class, e -> {
                    assertThat(e.getStatusCode()).isEqualTo(503);
                    assertThat(e.isRetryable()).isTrue();
                });
    }

    @Test
    void missingQuotePayloadIsUpstreamValidationError() {
        stubFor(get(urlPathEqualTo("/data/v2/stocks/AAPL/quotes/latest"))
                .willReturn(okJson("{\"symbol\":\"AAPL\"}")));

        assertThatThrownBy(() -> marketDataProvider.getQuote("AAPL"))
                .isInstanceOf(UpstreamValidationException.class);
    }

    @Test
    void orderSubmissionPostsAlpacaPayload() {
        stubFor(post(urlEqualTo("/paper/v2/orders"))
                .willReturn(okJson("{\"id\":\"ord-42\",\"client_order_id\":\"c-1\",\"symbol\":\"AAPL\","
                        + "\"status\":\"filled\",\"filled_qty\":\"3\",\"filled_avg_price\":\"190.25\"}")));

        BrokerOrder order = brokerageProvider.submitOrder(TradingMode.PAPER, BrokerOrderRequest.builder()
                .symbol("AAPL")
                .quantity(3)
                .side(OrderSide.BUY)
                .type(OrderType.LIMIT)
                .timeInForce("day")
                .limitPrice(new BigDecimal("190.50"))
                .clientOrderId("c-1")
                .build());

        assertThat(order.orderId()).isEqualTo("ord-42");
        assertThat(order.toTradeStatus()).isEqualTo(TradeStatus.FILLED);
        assertThat(order.filledQuantity()).isEqualTo(3);
        assertThat(order.filledAveragePrice()).isEqualByComparingTo("190.25");
        verify(postRequestedFor(urlEqualTo("/paper/v2/orders"))
                .withHeader("APCA-API-SECRET-KEY", equalTo("paper-secret"))
                .withRequestBody(equalToJson("{\"symbol\":\"AAPL\",\"qty\":\"3\",\"side\":\"buy\",\"type\":\"limit\","
                        + "\"time_in_force\":\"day\",\"limit_price\":\"190.5\",\"client_order_id\":\"c-1\"}")));
    }

    @Test
    void unprocessableOrderBecomesBrokerRejection() {
        stubFor(post(urlEqualTo("/paper/v2/orders"))
                .willReturn(aResponse().withStatus(422)
                        .withHeader("Content-Type", "application/json")
                        .withBody("{\"code\":42210000,\"message\":\"qty must be > 0\"}")));

        assertThatThrownBy(() -> brokerageProvider.submitOrder(TradingMode.PAPER, BrokerOrderRequest.builder()
                .symbol("AAPL")
                .quantity(1)
                .side(OrderSide.BUY)
                .type(OrderType.MARKET)
                .build()))
                .isInstanceOfSatisfying(BrokerRejectionException.class,
                        e -> assertThat(e.getReason()).isEqualTo("qty must be > 0"));
    }

    @Test
    void liveOrderWithoutCredentialsIsRefused() {
        assertThatThrownBy(() -> brokerageProvider.submitOrder(TradingMode.LIVE, BrokerOrderRequest.builder()
                .symbol("AAPL")
                .quantity(1)
                .side(OrderSide.BUY)
                .type(OrderType.MARKET)
                .build()))
                .hasMessageContaining("live credentials are not configured");
    }

    @Test
    void paperAccountIsReadWithPaperCredentials() {
        stubFor(get(urlEqualTo("/paper/v2/account"))
                .willReturn(okJson("{\"id\":\"acct-7\",\"status\":\"ACTIVE\",\"buying_power\":\"40000.5\","
                        + "\"cash\":\"20000.25\",\"equity\":\"25000\"}")));

        BrokerageProvider.BrokerAccount account = brokerAccountService.account(TradingMode.PAPER);

        assertThat(account.accountId()).isEqualTo("acct-7");
        assertThat(account.status()).isEqualTo("ACTIVE");
        assertThat(account.buyingPower()).isEqualByComparingTo("40000.5");
        assertThat(account.cash()).isEqualByComparingTo("20000.25");
        assertThat(account.equity()).isEqualByComparingTo("25000");
        verify(getRequestedFor(urlEqualTo("/paper/v2/account"))
                .withHeader("APCA-API-KEY-ID", equalTo("paper-key"))
                .withHeader("APCA-API-SECRET-KEY", equalTo("paper-secret")));
    }

    @Test
    void liveAccountWithoutCredentialsIsRefused() {
        assertThatThrownBy(() -> brokerAccountService.account(TradingMode.LIVE))
                .hasMessageContaining("live credentials are not configured");
    }

    @Test
    void overviewIsMappedToFundamentals() {
        stubFor(get(urlPathEqualTo("/av/query"))
                .willReturn(okJson("{\"Symbol\":\"AAPL\",\"PERatio\":\"29.4\",\"PriceToBookRatio\":\"45.1\","
                        + "\"EPS\":\"6.42\",\"MarketCapitalization\":\"2900000000000\",\"DividendYield\":\"0.0052\","
                        + "\"Beta\":\"1.24\",\"Sector\":\"TECHNOLOGY\",\"Industry\":\"ELECTRONIC COMPUTERS\"}")));

        Fundamentals fundamentals = fundamentalsClient.getOverview("AAPL");

        assertThat(fundamentals.pe()).isEqualTo(29.4);
        assertThat(fundamentals.dividendYieldPercent()).isCloseTo(0.52, offset(1e-9));
        assertThat(fundamentals.sector()).isEqualTo("TECHNOLOGY");
        verify(getRequestedFor(urlPathEqualTo("/av/query"))
                .withQueryParam("function", equalTo("OVERVIEW"))
                .withQueryParam("apikey", equalTo("av-key")));
    }

    @Test
    void throttleNoteIsTransientFailure() {
        stubFor(get(urlPathEqualTo("/av/query"))
                .willReturn(okJson("{\"Note\":\"Thank you for using Alpha Vantage! Our standard API call frequency is 5 calls per minute.\"}")));

        assertThatThrownBy(() -> fundamentalsClient.getOverview("AAPL"))
                .isInstanceOfSatisfying(ProviderCallException.class, e -> assertThat(e.isRetryable()).isTrue());
    }
}
