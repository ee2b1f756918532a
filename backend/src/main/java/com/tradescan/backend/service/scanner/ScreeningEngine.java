package com.tradescan.backend.service.scanner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradescan.backend.config.RateLimitProperties;
import com.tradescan.backend.config.ScannerProperties;
import com.tradescan.backend.exception.BadRequestException;
import com.tradescan.backend.exception.NotFoundException;
import com.tradescan.backend.model.AssetType;
import com.tradescan.backend.model.MarketDataCacheEntry;
import com.tradescan.backend.model.Provider;
import com.tradescan.backend.model.ScanResult;
import com.tradescan.backend.model.ScreeningProfile;
import com.tradescan.backend.model.params.OptionParameters;
import com.tradescan.backend.model.params.ProfileParameters;
import com.tradescan.backend.model.params.StockParameters;
import com.tradescan.backend.repository.ScanResultRepository;
import com.tradescan.backend.repository.ScreeningProfileRepository;
import com.tradescan.backend.service.DailyStatsService;
import com.tradescan.backend.service.LedgerWriter;
import com.tradescan.backend.service.MetricsService;
import com.tradescan.backend.service.TradingModeService;
import com.tradescan.backend.service.governor.BatchOptions;
import com.tradescan.backend.service.governor.BatchOutcome;
import com.tradescan.backend.service.governor.RequestGovernor;
import com.tradescan.backend.service.marketdata.Bar;
import com.tradescan.backend.service.marketdata.Fundamentals;
import com.tradescan.backend.service.marketdata.MarketDataProvider;
import com.tradescan.backend.service.marketdata.OptionContract;
import com.tradescan.backend.service.marketdata.Quote;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * Evaluates one profile against fetched market data. Every provider call goes through the governor's batch helper.
 * Cheap filters run first so fundamentals and history are only fetched for symbols still in contention.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScreeningEngine {

    private final ScreeningProfileRepository profileRepository;
    private final ScanResultRepository scanResultRepository;
    private final MarketDataProvider marketDataProvider;
    private final RequestGovernor requestGovernor;
    private final InstrumentUniverseResolver universeResolver;
    private final MarketDataCacheService cacheService;
    private final TechnicalIndicatorCalculator indicatorCalculator;
    private final ScreeningFilters filters;
    private final ScannerProperties scannerProperties;
    private final RateLimitProperties rateLimitProperties;
    private final DailyStatsService dailyStatsService;
    private final TradingModeService tradingModeService;
    private final LedgerWriter ledgerWriter;
    private final MetricsService metricsService;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final ZoneId exchangeZone;

    public ScanOutcome runScan(Long profileId) {
        return runScan(profileId, null);
    }

    public ScanOutcome runScan(Long profileId, Long jobRunId) {
        ScreeningProfile profile = profileRepository.findById(profileId)
                .orElseThrow(() -> new NotFoundException("Profile not found: " + profileId));
        Instant started = clock.instant();
        ScanPass pass = switch (profile.getAssetType()) {
            case STOCK -> scanStocks(parametersOf(profile, StockParameters.class));
            case CALL_OPTION, PUT_OPTION -> scanOptions(profile.getAssetType(), parametersOf(profile, OptionParameters.class));
        };
        List<ScanMatch> matches = pass.matches().stream()
                .sorted(Comparator.comparing(ScanMatch::symbol))
                .toList();
        Instant finished = clock.instant();

        persist(profile, jobRunId, matches, finished);
        long durationMs = Duration.between(started, finished).toMillis();
        metricsService.recordScanRun("completed");
        log.info("Scan of profile {} ({}) matched {} of {} instruments in {} ms, {} fetch failures",
                profile.getId(), profile.getName(), matches.size(), pass.scanned(), durationMs, pass.failed());
        return new ScanOutcome(profile.getId(), jobRunId, profile.getAssetType(), matches, pass.scanned(),
                pass.failed(), durationMs, finished);
    }

    private ScanPass scanStocks(StockParameters params) {
        List<String> symbols = universeResolver.resolve(params);
        List<BatchOutcome<Quote>> quotes = fetchAll(Provider.ALPACA, symbols, marketDataProvider::getQuote);
        List<BatchOutcome<Bar>> bars = fetchAll(Provider.ALPACA, symbols, marketDataProvider::getBar);

        int failed = 0;
        Map<String, StockSnapshot> candidates = new LinkedHashMap<>();
        for (int i = 0; i < symbols.size(); i++) {
            String symbol = symbols.get(i);
            if (!quotes.get(i).isSuccess() || !bars.get(i).isSuccess()) {
                Throwable error = quotes.get(i).isSuccess() ? bars.get(i).error() : quotes.get(i).error();
                log.warn("Excluding {} from scan: quote/bar fetch failed: {}", symbol, error.getMessage());
                failed++;
                continue;
            }
            StockSnapshot snapshot = baseSnapshot(symbol, quotes.get(i).value(), bars.get(i).value());
            if (filters.matchesStock(snapshot, params)) {
                candidates.put(symbol, snapshot);
            }
        }

        if (params.requiresFundamentals() && !candidates.isEmpty()) {
            failed += enrichFundamentals(candidates);
            candidates.values().removeIf(snapshot -> !filters.matchesStock(snapshot, params));
        }
        if (params.requiresTechnicals() && !candidates.isEmpty()) {
            failed += enrichTechnicals(candidates);
            candidates.values().removeIf(snapshot -> !filters.matchesStock(snapshot, params));
        }

        List<ScanMatch> matches = candidates.values().stream()
                .map(snapshot -> new ScanMatch(snapshot.getSymbol(), AssetType.STOCK, snapshot.getPrice(), snapshot))
                .toList();
        return new ScanPass(matches, symbols.size(), failed);
    }

    private StockSnapshot baseSnapshot(String symbol, Quote quote, Bar bar) {
        BigDecimal mark = quote.price();
        return StockSnapshot.builder()
                .symbol(symbol)
                .price(mark != null ? mark.doubleValue() : bar.close())
                .bid(quote.bidPrice() == null ? null : quote.bidPrice().doubleValue())
                .ask(quote.askPrice() == null ? null : quote.askPrice().doubleValue())
                .open(bar.open())
                .high(bar.high())
                .low(bar.low())
                .close(bar.close())
                .volume(bar.volume())
                .dayChangePercent(bar.dayChangePercent())
                .build();
    }

    private int enrichFundamentals(Map<String, StockSnapshot> candidates) {
        Map<String, Fundamentals> known = new LinkedHashMap<>();
        List<String> misses = new ArrayList<>();
        for (String symbol : candidates.keySet()) {
            cacheService.get(symbol, MarketDataCacheEntry.DataType.FUNDAMENTALS, Fundamentals.class)
                    .ifPresentOrElse(value -> known.put(symbol, value), () -> misses.add(symbol));
        }
        int failed = 0;
        List<BatchOutcome<Fundamentals>> fetched = fetchAll(Provider.ALPHA_VANTAGE, misses,
                marketDataProvider::getFundamentals);
        Duration ttl = Duration.ofHours(scannerProperties.getFundamentalsTtlHours());
        for (int i = 0; i < misses.size(); i++) {
            String symbol = misses.get(i);
            BatchOutcome<Fundamentals> outcome = fetched.get(i);
            if (outcome.isSuccess()) {
                known.put(symbol, outcome.value());
                cacheService.put(symbol, MarketDataCacheEntry.DataType.FUNDAMENTALS, outcome.value(), ttl);
            } else {
                log.warn("Excluding {} from scan: fundamentals fetch failed: {}", symbol, outcome.error().getMessage());
                candidates.remove(symbol);
                failed++;
            }
        }
        known.forEach((symbol, fundamentals) -> {
            StockSnapshot snapshot = candidates.get(symbol);
            if (snapshot != null) {
                snapshot.setPe(fundamentals.pe());
                snapshot.setPb(fundamentals.pb());
                snapshot.setEps(fundamentals.eps());
                snapshot.setMarketCap(fundamentals.marketCap());
                snapshot.setDividendYield(fundamentals.dividendYieldPercent());
                snapshot.setBeta(fundamentals.beta());
                snapshot.setDebtToEquity(fundamentals.debtToEquity());
                snapshot.setCurrentRatio(fundamentals.currentRatio());
                snapshot.setSector(fundamentals.sector());
                snapshot.setIndustry(fundamentals.industry());
            }
        });
        return failed;
    }

    private int enrichTechnicals(Map<String, StockSnapshot> candidates) {
        Map<String, TechnicalSnapshot> known = new LinkedHashMap<>();
        List<String> misses = new ArrayList<>();
        for (String symbol : candidates.keySet()) {
            cacheService.get(symbol, MarketDataCacheEntry.DataType.TECHNICALS, TechnicalSnapshot.class)
                    .ifPresentOrElse(value -> known.put(symbol, value), () -> misses.add(symbol));
        }
        int failed = 0;
        int bars = scannerProperties.getHistoryBars();
        List<BatchOutcome<List<Bar>>> fetched = fetchAll(Provider.ALPACA, misses,
                symbol -> marketDataProvider.getHistoricalBars(symbol, bars));
        Duration ttl = Duration.ofHours(scannerProperties.getTechnicalsTtlHours());
        for (int i = 0; i < misses.size(); i++) {
            String symbol = misses.get(i);
            BatchOutcome<List<Bar>> outcome = fetched.get(i);
            if (outcome.isSuccess()) {
                List<Double> closes = outcome.value().stream().map(Bar::close).toList();
                TechnicalSnapshot technicals = indicatorCalculator.calculate(closes);
                known.put(symbol, technicals);
                cacheService.put(symbol, MarketDataCacheEntry.DataType.TECHNICALS, technicals, ttl);
            } else {
                log.warn("Excluding {} from scan: history fetch failed: {}", symbol, outcome.error().getMessage());
                candidates.remove(symbol);
                failed++;
            }
        }
        known.forEach((symbol, technicals) -> {
            StockSnapshot snapshot = candidates.get(symbol);
            if (snapshot != null) {
                snapshot.setRsi(technicals.rsi());
                snapshot.setSma20(technicals.sma20());
                snapshot.setSma50(technicals.sma50());
                snapshot.setSma200(technicals.sma200());
                snapshot.setMacd(technicals.macd());
                snapshot.setMacdSignal(technicals.macdSignal());
            }
        });
        return failed;
    }

    private ScanPass scanOptions(AssetType assetType, OptionParameters params) {
        List<String> underlyings = universeResolver.resolve(params);
        List<BatchOutcome<Quote>> quotes = fetchAll(Provider.ALPACA, underlyings, marketDataProvider::getQuote);
        List<BatchOutcome<List<OptionContract>>> chains = fetchAll(Provider.ALPACA, underlyings,
                marketDataProvider::getOptionChain);
        boolean wantCalls = assetType == AssetType.CALL_OPTION;
        LocalDate today = LocalDate.now(clock.withZone(exchangeZone));

        int failed = 0;
        int scanned = 0;
        List<ScanMatch> matches = new ArrayList<>();
        for (int i = 0; i < underlyings.size(); i++) {
            String underlying = underlyings.get(i);
            if (!quotes.get(i).isSuccess() || !chains.get(i).isSuccess()) {
                Throwable error = quotes.get(i).isSuccess() ? chains.get(i).error() : quotes.get(i).error();
                log.warn("Excluding {} from scan: quote/chain fetch failed: {}", underlying, error.getMessage());
                failed++;
                continue;
            }
            BigDecimal mark = quotes.get(i).value().price();
            Double underlyingPrice = mark == null ? null : mark.doubleValue();
            for (OptionContract contract : chains.get(i).value()) {
                if (contract.call() != wantCalls) {
                    continue;
                }
                scanned++;
                OptionSnapshot snapshot = filters.snapshot(contract, underlyingPrice, today,
                        scannerProperties.getAtmBandPercent());
                if (filters.matchesOption(snapshot, params)) {
                    matches.add(new ScanMatch(contract.symbol(), assetType, snapshot.premium(), snapshot));
                }
            }
        }
        return new ScanPass(matches, scanned, failed);
    }

    private <T> List<BatchOutcome<T>> fetchAll(Provider provider, List<String> symbols, Function<String, T> fetch) {
        if (symbols.isEmpty()) {
            return List.of();
        }
        List<Callable<T>> tasks = symbols.stream()
                .map(symbol -> (Callable<T>) () -> fetch.apply(symbol))
                .toList();
        BatchOptions options = BatchOptions.of(rateLimitProperties.getBatchSize(),
                Duration.ofMillis(rateLimitProperties.getDelayBetweenBatchesMs()));
        return requestGovernor.batch(provider, tasks, options);
    }

    private void persist(ScreeningProfile profile, Long jobRunId, List<ScanMatch> matches, Instant scannedAt) {
        String parametersJson = toJson(profile.getParameters());
        List<ScanResult> rows = matches.stream()
                .map(match -> ScanResult.builder()
                        .profileId(profile.getId())
                        .jobRunId(jobRunId)
                        .symbol(match.symbol())
                        .assetType(match.assetType())
                        .scannedAt(scannedAt)
                        .parametersSnapshot(parametersJson)
                        .marketDataSnapshot(toJson(match.snapshot()))
                        .build())
                .toList();
        ledgerWriter.run(() -> {
            scanResultRepository.saveAll(rows);
            profileRepository.recordLastRun(profile.getId(), scannedAt, matches.size());
        });
        dailyStatsService.recordScan(tradingModeService.current(), matches.size());
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize scan snapshot: {}", e.getMessage());
            return null;
        }
    }

    private static <T extends ProfileParameters> T parametersOf(ScreeningProfile profile, Class<T> type) {
        if (!type.isInstance(profile.getParameters())) {
            throw new BadRequestException("Profile " + profile.getId() + " has parameters that do not fit asset type "
                    + profile.getAssetType());
        }
        return type.cast(profile.getParameters());
    }

    private record ScanPass(List<ScanMatch> matches, int scanned, int failed) {}
}
