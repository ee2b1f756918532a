package com.tradescan.backend.service.monitor;

import com.tradescan.backend.config.MonitorProperties;
import com.tradescan.backend.dto.MonitorStatus;
import com.tradescan.backend.model.CloseReason;
import com.tradescan.backend.model.JobRun;
import com.tradescan.backend.model.Position;
import com.tradescan.backend.model.PositionState;
import com.tradescan.backend.model.Provider;
import com.tradescan.backend.model.TradeSource;
import com.tradescan.backend.model.TradingMode;
import com.tradescan.backend.repository.PositionRepository;
import com.tradescan.backend.service.JobRunService;
import com.tradescan.backend.service.LedgerWriter;
import com.tradescan.backend.service.MetricsService;
import com.tradescan.backend.service.ScheduledTaskGuard;
import com.tradescan.backend.service.TradingModeService;
import com.tradescan.backend.service.governor.ProviderGateway;
import com.tradescan.backend.service.marketdata.MarketDataProvider;
import com.tradescan.backend.service.marketdata.Quote;
import com.tradescan.backend.service.trading.TradeExecutor;
import com.tradescan.backend.util.MoneyUtils;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;

/**
 * Fixed-delay loop that re-prices open positions in the current mode and closes those past their
 * stop-loss or take-profit. A breach claims the position (OPEN to CLOSING) before the sell goes out,
 * so later ticks never re-trigger it.
 */
@Slf4j
@Service
public class PositionMonitor {

    private final TaskScheduler taskScheduler;
    private final PositionRepository positionRepository;
    private final MarketDataProvider marketDataProvider;
    private final ProviderGateway providerGateway;
    private final TradeExecutor tradeExecutor;
    private final TradingModeService tradingModeService;
    private final JobRunService jobRunService;
    private final LedgerWriter ledgerWriter;
    private final MetricsService metricsService;
    private final ScheduledTaskGuard scheduledTaskGuard;
    private final MonitorProperties monitorProperties;
    private final Clock clock;

    private ScheduledFuture<?> loop;
    private volatile long intervalSeconds;
    private volatile CycleResult lastCycle;

    public PositionMonitor(TaskScheduler taskScheduler,
                           PositionRepository positionRepository,
                           MarketDataProvider marketDataProvider,
                           ProviderGateway providerGateway,
                           TradeExecutor tradeExecutor,
                           TradingModeService tradingModeService,
                           JobRunService jobRunService,
                           LedgerWriter ledgerWriter,
                           MetricsService metricsService,
                           ScheduledTaskGuard scheduledTaskGuard,
                           MonitorProperties monitorProperties,
                           Clock clock) {
        this.taskScheduler = taskScheduler;
        this.positionRepository = positionRepository;
        this.marketDataProvider = marketDataProvider;
        this.providerGateway = providerGateway;
        this.tradeExecutor = tradeExecutor;
        this.tradingModeService = tradingModeService;
        this.jobRunService = jobRunService;
        this.ledgerWriter = ledgerWriter;
        this.metricsService = metricsService;
        this.scheduledTaskGuard = scheduledTaskGuard;
        this.monitorProperties = monitorProperties;
        this.clock = clock;
        this.intervalSeconds = Math.max(monitorProperties.getIntervalSeconds(), monitorProperties.getMinIntervalSeconds());
    }

    public synchronized MonitorStatus start() {
        if (loop == null) {
            loop = taskScheduler.scheduleWithFixedDelay(
                    () -> scheduledTaskGuard.run("position-monitor", this::runCycle),
                    clock.instant(),
                    Duration.ofSeconds(intervalSeconds));
            log.info("Position monitor started, checking every {}s", intervalSeconds);
        }
        return status();
    }

    public synchronized MonitorStatus stop() {
        if (loop != null) {
            loop.cancel(false);
            loop = null;
            log.info("Position monitor stopped");
        }
        return status();
    }

    public synchronized MonitorStatus setCheckInterval(long seconds) {
        intervalSeconds = Math.max(seconds, monitorProperties.getMinIntervalSeconds());
        if (loop != null) {
            stop();
            start();
        }
        return status();
    }

    public synchronized MonitorStatus status() {
        CycleResult cycle = lastCycle;
        return MonitorStatus.builder()
                .running(loop != null)
                .intervalSeconds(intervalSeconds)
                .tradingMode(tradingModeService.current())
                .lastCycleAt(cycle == null ? null : cycle.finishedAt())
                .lastCycleChecked(cycle == null ? 0 : cycle.checked())
                .lastCycleCloses(cycle == null ? 0 : cycle.closes())
                .build();
    }

    /**
     * One monitoring pass. A failure on one symbol is logged and the pass moves on.
     */
    public CycleResult runCycle() {
        TradingMode mode = tradingModeService.current();
        List<Position> open = positionRepository.findByTradingModeAndState(mode, PositionState.OPEN);
        metricsService.recordMonitorCycle();
        if (open.isEmpty()) {
            lastCycle = new CycleResult(0, 0, 0, clock.instant());
            return lastCycle;
        }
        JobRun run = jobRunService.start(null, JobRun.Type.MONITOR, JobRun.Trigger.SCHEDULED);
        int checked = 0;
        int closes = 0;
        int failures = 0;
        try (MDC.MDCCloseable ignoredRun = MDC.putCloseable("jobRunId", String.valueOf(run.getId()));
             MDC.MDCCloseable ignoredMode = MDC.putCloseable("tradingMode", mode.name())) {
            for (Position position : open) {
                try {
                    Optional<Position> priced = reprice(position, mode);
                    if (priced.isEmpty()) {
                        continue;
                    }
                    checked++;
                    CloseReason breach = breach(priced.get());
                    if (breach != null) {
                        log.info("{} breached {} at {} ({}%)", position.getSymbol(), breach.wireValue(),
                                priced.get().getCurrentPrice(), priced.get().getUnrealizedPlPercent());
                        if (tradeExecutor.closePosition(priced.get(), breach, TradeSource.MONITOR).isPresent()) {
                            closes++;
                        }
                    }
                } catch (RuntimeException e) {
                    failures++;
                    log.warn("Monitor could not check {} {}: {}", mode, position.getSymbol(), e.getMessage());
                }
            }
            jobRunService.complete(run, checked, closes, failures,
                    "Checked " + checked + " of " + open.size() + ", " + closes + " close(s), " + failures + " failure(s)");
        } catch (RuntimeException e) {
            jobRunService.fail(run, e.getMessage());
            throw e;
        }
        lastCycle = new CycleResult(checked, closes, failures, clock.instant());
        return lastCycle;
    }

    /**
     * Stop-loss when the loss reaches the stop percent, take-profit when the gain reaches the target.
     */
    static CloseReason breach(Position position) {
        BigDecimal change = position.getUnrealizedPlPercent();
        if (change == null) {
            return null;
        }
        if (position.getStopLossPercent() != null && change.negate().compareTo(position.getStopLossPercent()) >= 0) {
            return CloseReason.STOP_LOSS;
        }
        if (position.getTakeProfitPercent() != null && change.compareTo(position.getTakeProfitPercent()) >= 0) {
            return CloseReason.TAKE_PROFIT;
        }
        return null;
    }

    private Optional<Position> reprice(Position position, TradingMode mode) {
        Quote quote = providerGateway.fetch(Provider.ALPACA, () -> marketDataProvider.getQuote(position.getSymbol()));
        BigDecimal price = quote == null ? null : quote.price();
        if (price == null) {
            log.warn("No price for {} {}, skipped this tick", mode, position.getSymbol());
            return Optional.empty();
        }
        Instant now = clock.instant();
        return ledgerWriter.write(() -> positionRepository.findByIdAndTradingMode(position.getId(), mode)
                .filter(current -> current.getState() == PositionState.OPEN)
                .map(current -> {
                    current.setCurrentPrice(MoneyUtils.scale(price));
                    current.setMarketValue(MoneyUtils.notional(price, current.getQuantity(), current.getContractMultiplier()));
                    current.setUnrealizedPl(MoneyUtils.notional(MoneyUtils.subtract(price, current.getAvgCost()),
                            current.getQuantity(), current.getContractMultiplier()));
                    current.setUnrealizedPlPercent(MoneyUtils.percentChange(current.getAvgCost(), price));
                    current.setLastPricedAt(now);
                    current.setUpdatedAt(now);
                    return positionRepository.save(current);
                }));
    }

    @EventListener(ApplicationReadyEvent.class)
    public void autoStart() {
        if (monitorProperties.isAutoStart()) {
            start();
        }
    }

    @PreDestroy
    public void shutdown() {
        stop();
    }

    public record CycleResult(int checked, int closes, int failures, Instant finishedAt) {}
}
