package com.tradescan.backend.service.scanner;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradescan.backend.config.RateLimitProperties;
import com.tradescan.backend.config.ScannerProperties;
import com.tradescan.backend.exception.BadRequestException;
import com.tradescan.backend.exception.ProviderCallException;
import com.tradescan.backend.model.AssetType;
import com.tradescan.backend.model.MarketDataCacheEntry.DataType;
import com.tradescan.backend.model.Provider;
import com.tradescan.backend.model.ScanResult;
import com.tradescan.backend.model.ScreeningProfile;
import com.tradescan.backend.model.TradingMode;
import com.tradescan.backend.model.params.NumericRange;
import com.tradescan.backend.model.params.OptionParameters;
import com.tradescan.backend.model.params.ProfileParameters;
import com.tradescan.backend.model.params.StockParameters;
import com.tradescan.backend.repository.ScanResultRepository;
import com.tradescan.backend.repository.ScreeningProfileRepository;
import com.tradescan.backend.service.DailyStatsService;
import com.tradescan.backend.service.LedgerWriter;
import com.tradescan.backend.service.MetricsService;
import com.tradescan.backend.service.TradingModeService;
import com.tradescan.backend.service.governor.QuotaLimits;
import com.tradescan.backend.service.governor.RequestGovernor;
import com.tradescan.backend.service.marketdata.Bar;
import com.tradescan.backend.service.marketdata.Fundamentals;
import com.tradescan.backend.service.marketdata.MarketDataProvider;
import com.tradescan.backend.service.marketdata.OptionContract;
import com.tradescan.backend.service.marketdata.Quote;
import com.tradescan.backend.support.ClockAdvancingDelayService;
import com.tradescan.backend.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScreeningEngineTest {

    private static final ZoneId NEW_YORK = ZoneId.of("America/New_York");
    private static final Instant NOW = Instant.parse("2026-10-19T15:00:00Z");

    @Mock
    private ScreeningProfileRepository profileRepository;
    @Mock
    private ScanResultRepository scanResultRepository;
    @Mock
    private MarketDataProvider marketDataProvider;
    @Mock
    private MarketDataCacheService cacheService;
    @Mock
    private DailyStatsService dailyStatsService;
    @Mock
    private TradingModeService tradingModeService;
    @Mock
    private MetricsService metricsService;

    private ScreeningEngine engine;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(NOW);
        Map<Provider, QuotaLimits> quotas = new EnumMap<>(Provider.class);
        quotas.put(Provider.ALPACA, new QuotaLimits(1_000, null));
        quotas.put(Provider.ALPHA_VANTAGE, new QuotaLimits(1_000, null));
        RequestGovernor governor = new RequestGovernor(clock, new ClockAdvancingDelayService(clock), Runnable::run,
                Runnable::run, quotas, Duration.ZERO, Duration.ofMinutes(1), null);
        ScannerProperties scannerProperties = new ScannerProperties();
        RateLimitProperties rateLimitProperties = new RateLimitProperties();
        engine = new ScreeningEngine(profileRepository, scanResultRepository, marketDataProvider, governor,
                new InstrumentUniverseResolver(scannerProperties), cacheService, new TechnicalIndicatorCalculator(),
                new ScreeningFilters(), scannerProperties, rateLimitProperties, dailyStatsService, tradingModeService,
                new LedgerWriter(mock(PlatformTransactionManager.class)), metricsService,
                new ObjectMapper().findAndRegisterModules(), clock, NEW_YORK);
    }

    @Test
    void stockScanKeepsMatchesAndExcludesSymbolsThatFailedToFetch() {
        givenProfile(AssetType.STOCK, StockParameters.builder()
                .symbols(List.of("msft", "AAPL", "BAD"))
                .price(NumericRange.between(100.0, 200.0))
                .build());
        Map<String, Double> prices = Map.of("AAPL", 150.0, "MSFT", 410.0);
        when(marketDataProvider.getQuote(anyString())).thenAnswer(invocation -> {
            String symbol = invocation.getArgument(0);
            if (!prices.containsKey(symbol)) {
                throw new ProviderCallException(Provider.ALPACA, "no quote for " + symbol, null);
            }
            return quote(symbol, prices.get(symbol));
        });
        when(marketDataProvider.getBar(anyString())).thenAnswer(invocation -> bar(invocation.getArgument(0), 100.0));
        when(tradingModeService.current()).thenReturn(TradingMode.PAPER);

        ScanOutcome outcome = engine.runScan(1L, 99L);

        assertThat(outcome.matches()).extracting(ScanMatch::symbol).containsExactly("AAPL");
        assertThat(outcome.symbolsScanned()).isEqualTo(3);
        assertThat(outcome.symbolsFailed()).isEqualTo(1);
        assertThat(outcome.jobRunId()).isEqualTo(99L);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<ScanResult>> rows = ArgumentCaptor.forClass(List.class);
        verify(scanResultRepository).saveAll(rows.capture());
        assertThat(rows.getValue()).singleElement().satisfies(row -> {
            assertThat(row.getSymbol()).isEqualTo("AAPL");
            assertThat(row.getJobRunId()).isEqualTo(99L);
            assertThat(row.getParametersSnapshot()).contains("\"min\":100.0");
            assertThat(row.getMarketDataSnapshot()).contains("\"price\":150.0");
        });
        verify(profileRepository).recordLastRun(1L, NOW, 1);
        verify(dailyStatsService).recordScan(TradingMode.PAPER, 1);
        verify(metricsService).recordScanRun("completed");
    }

    @Test
    void fundamentalsComeFromCacheBeforeTheProvider() {
        givenProfile(AssetType.STOCK, StockParameters.builder()
                .symbols(List.of("AAPL", "MSFT"))
                .pe(NumericRange.atMost(20.0))
                .build());
        when(marketDataProvider.getQuote(anyString())).thenAnswer(invocation -> quote(invocation.getArgument(0), 100.0));
        when(marketDataProvider.getBar(anyString())).thenAnswer(invocation -> bar(invocation.getArgument(0), 100.0));
        when(cacheService.get(anyString(), eq(DataType.FUNDAMENTALS), eq(Fundamentals.class)))
                .thenAnswer(invocation -> "AAPL".equals(invocation.getArgument(0))
                        ? Optional.of(fundamentals("AAPL", 30.0))
                        : Optional.empty());
        when(marketDataProvider.getFundamentals("MSFT")).thenReturn(fundamentals("MSFT", 15.0));
        when(tradingModeService.current()).thenReturn(TradingMode.PAPER);

        ScanOutcome outcome = engine.runScan(1L);

        assertThat(outcome.matches()).extracting(ScanMatch::symbol).containsExactly("MSFT");
        verify(marketDataProvider, never()).getFundamentals("AAPL");
        verify(cacheService).put(eq("MSFT"), eq(DataType.FUNDAMENTALS), any(Fundamentals.class), eq(Duration.ofHours(24)));
    }

    @Test
    void technicalsAreComputedFromHistoryOnlyWhenRequested() {
        givenProfile(AssetType.STOCK, StockParameters.builder()
                .symbols(List.of("AAPL"))
                .sma20Above(true)
                .build());
        when(marketDataProvider.getQuote("AAPL")).thenReturn(quote("AAPL", 200.0));
        when(marketDataProvider.getBar("AAPL")).thenReturn(bar("AAPL", 195.0));
        when(cacheService.get("AAPL", DataType.TECHNICALS, TechnicalSnapshot.class)).thenReturn(Optional.empty());
        List<Bar> history = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            history.add(bar("AAPL", 100.0 + i));
        }
        when(marketDataProvider.getHistoricalBars("AAPL", 250)).thenReturn(history);
        when(tradingModeService.current()).thenReturn(TradingMode.PAPER);

        ScanOutcome outcome = engine.runScan(1L);

        assertThat(outcome.matches()).singleElement().satisfies(match -> {
            StockSnapshot snapshot = (StockSnapshot) match.snapshot();
            assertThat(snapshot.getSma20()).isEqualTo(119.5);
            assertThat(snapshot.getMacdSignal()).isEqualTo("bullish");
        });
        verify(cacheService).put(eq("AAPL"), eq(DataType.TECHNICALS), any(TechnicalSnapshot.class), eq(Duration.ofHours(1)));
        verify(marketDataProvider, never()).getFundamentals(anyString());
    }

    @Test
    void callProfileOnlyConsidersCallContracts() {
        givenProfile(AssetType.CALL_OPTION, OptionParameters.builder()
                .underlyings(List.of("AAPL"))
                .openInterestMin(10L)
                .build());
        when(marketDataProvider.getQuote("AAPL")).thenReturn(quote("AAPL", 100.0));
        LocalDate expiry = LocalDate.of(2026, 11, 20);
        when(marketDataProvider.getOptionChain("AAPL")).thenReturn(List.of(
                new OptionContract("AAPL261120C00100000", "AAPL", true, 100.0, expiry, 2.0, 2.2, null, 40L, 50L,
                        0.5, null, null, null, null),
                new OptionContract("AAPL261120P00100000", "AAPL", false, 100.0, expiry, 1.8, 2.0, null, 40L, 50L,
                        -0.5, null, null, null, null),
                new OptionContract("AAPL261120C00120000", "AAPL", true, 120.0, expiry, 0.2, 0.3, null, 4L, 5L,
                        0.1, null, null, null, null)));
        when(tradingModeService.current()).thenReturn(TradingMode.LIVE);

        ScanOutcome outcome = engine.runScan(1L);

        assertThat(outcome.matches()).singleElement().satisfies(match -> {
            assertThat(match.symbol()).isEqualTo("AAPL261120C00100000");
            assertThat(match.assetType()).isEqualTo(AssetType.CALL_OPTION);
            assertThat(match.price()).isCloseTo(2.1, within(1e-9));
        });
        assertThat(outcome.symbolsScanned()).isEqualTo(2);
        verify(dailyStatsService).recordScan(TradingMode.LIVE, 1);
    }

    @Test
    void parametersThatDoNotFitTheAssetTypeAreRejected() {
        givenProfile(AssetType.STOCK, OptionParameters.builder().underlyings(List.of("AAPL")).build());

        assertThatThrownBy(() -> engine.runScan(1L)).isInstanceOf(BadRequestException.class);
        verifyNoInteractions(marketDataProvider, scanResultRepository);
    }

    private void givenProfile(AssetType assetType, ProfileParameters parameters) {
        when(profileRepository.findById(1L)).thenReturn(Optional.of(ScreeningProfile.builder()
                .id(1L)
                .name("Test profile")
                .assetType(assetType)
                .parameters(parameters)
                .build()));
    }

    private static Quote quote(String symbol, double last) {
        return new Quote(symbol, null, null, BigDecimal.valueOf(last), NOW);
    }

    private static Bar bar(String symbol, double close) {
        return new Bar(symbol, NOW, close, close, close, close, 1_000_000L, close);
    }

    private static Fundamentals fundamentals(String symbol, double pe) {
        return new Fundamentals(symbol, pe, null, null, null, null, null, null, null, "Technology", null);
    }
}
