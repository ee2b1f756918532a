package com.tradescan.backend.service.trading;

import com.tradescan.backend.config.OrderProperties;
import com.tradescan.backend.dto.TradeRequest;
import com.tradescan.backend.exception.BrokerRejectionException;
import com.tradescan.backend.exception.ConflictException;
import com.tradescan.backend.exception.NotFoundException;
import com.tradescan.backend.exception.TradingException;
import com.tradescan.backend.model.CloseReason;
import com.tradescan.backend.model.ClosedPosition;
import com.tradescan.backend.model.NotificationType;
import com.tradescan.backend.model.OrderSide;
import com.tradescan.backend.model.OrderType;
import com.tradescan.backend.model.Position;
import com.tradescan.backend.model.PositionState;
import com.tradescan.backend.model.Provider;
import com.tradescan.backend.model.RiskSettings;
import com.tradescan.backend.model.TradeRecord;
import com.tradescan.backend.model.TradeSource;
import com.tradescan.backend.model.TradeStatus;
import com.tradescan.backend.model.TradingMode;
import com.tradescan.backend.repository.ClosedPositionRepository;
import com.tradescan.backend.repository.PositionRepository;
import com.tradescan.backend.repository.TradeRecordRepository;
import com.tradescan.backend.service.DailyStatsService;
import com.tradescan.backend.service.LedgerWriter;
import com.tradescan.backend.service.MetricsService;
import com.tradescan.backend.service.NotificationService;
import com.tradescan.backend.service.RiskSettingsService;
import com.tradescan.backend.service.TradingModeService;
import com.tradescan.backend.service.brokerage.BrokerOrder;
import com.tradescan.backend.service.brokerage.BrokerOrderRequest;
import com.tradescan.backend.service.brokerage.BrokerageProvider;
import com.tradescan.backend.service.governor.ProviderGateway;
import com.tradescan.backend.service.governor.RequestOptions;
import com.tradescan.backend.service.marketdata.MarketDataProvider;
import com.tradescan.backend.service.marketdata.Quote;
import com.tradescan.backend.util.MoneyUtils;
import com.tradescan.backend.util.OptionSymbols;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Order lifecycle: risk gate, broker submission, fill booking and position bookkeeping.
 * Ledger changes run through {@link LedgerWriter}; broker calls happen outside it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TradeExecutor {

    static final Set<TradeStatus> WORKING_STATUSES = EnumSet.of(TradeStatus.PENDING, TradeStatus.PARTIAL_FILL);

    private final TradeRecordRepository tradeRecordRepository;
    private final PositionRepository positionRepository;
    private final ClosedPositionRepository closedPositionRepository;
    private final BrokerageProvider brokerageProvider;
    private final MarketDataProvider marketDataProvider;
    private final ProviderGateway providerGateway;
    private final RiskGate riskGate;
    private final OrderValidator orderValidator;
    private final RiskSettingsService riskSettingsService;
    private final DailyStatsService dailyStatsService;
    private final TradingModeService tradingModeService;
    private final LedgerWriter ledgerWriter;
    private final NotificationService notificationService;
    private final MetricsService metricsService;
    private final OrderProperties orderProperties;
    private final Clock clock;

    /**
     * Manual trade in the current mode. Buys still pass the risk gate.
     */
    public TradeRecord executeTrade(TradeRequest request) {
        TradingMode mode = tradingModeService.current();
        String symbol = request.getSymbol().trim().toUpperCase();
        TradeIntent intent = TradeIntent.builder()
                .symbol(symbol)
                .side(request.getSide())
                .quantity(request.getQuantity() == null ? 0 : request.getQuantity())
                .orderType(request.getOrderType() == null ? OrderType.MARKET : request.getOrderType())
                .limitPrice(request.getLimitPrice())
                .stopPrice(request.getStopPrice())
                .trailPercent(request.getTrailPercent())
                .contractMultiplier(OptionSymbols.multiplierFor(symbol))
                .source(TradeSource.MANUAL)
                .closeReason(request.getSide() == OrderSide.SELL ? CloseReason.MANUAL : null)
                .build();
        Position position = positionRepository.findBySymbolAndTradingMode(symbol, mode).orElse(null);
        orderValidator.validate(intent, position);
        if (position != null && intent.side() == OrderSide.SELL && intent.quantity() == position.getQuantity()
                && intent.orderType() == OrderType.MARKET) {
            return closePosition(position, CloseReason.MANUAL, TradeSource.MANUAL)
                    .orElseThrow(() -> new ConflictException(symbol + " is already being closed"));
        }
        return submit(intent.toBuilder().estimatedPrice(referencePrice(intent)).build(), mode);
    }

    /**
     * Gates and submits an intent. Returns a REJECTED record for risk or broker rejections.
     *
     * @throws TradingException when the order could not be handed to the broker
     */
    public TradeRecord submit(TradeIntent intent, TradingMode mode) {
        TradeRecord trade = ledgerWriter.write(() -> admit(intent, mode));
        if (trade.getStatus() == TradeStatus.REJECTED) {
            return trade;
        }
        return placeWithBroker(trade, mode);
    }

    /**
     * Claims an open position for closing and submits a full-quantity market sell, bypassing the risk gate.
     * Empty when the position is no longer open (someone else is already closing it).
     */
    public Optional<TradeRecord> closePosition(Position position, CloseReason reason, TradeSource source) {
        TradingMode mode = position.getTradingMode();
        boolean claimed = ledgerWriter.write(() -> positionRepository.transitionState(position.getId(), mode,
                PositionState.OPEN, PositionState.CLOSING, reason, clock.instant()) == 1);
        if (!claimed) {
            log.debug("Position {} {} is not open, close skipped", position.getSymbol(), mode);
            return Optional.empty();
        }
        TradeRecord pending = ledgerWriter.write(() -> {
            Position current = positionRepository.findByIdAndTradingMode(position.getId(), mode)
                    .orElseThrow(() -> new NotFoundException("Position not found: " + position.getId()));
            BigDecimal price = current.getCurrentPrice() != null ? current.getCurrentPrice() : current.getAvgCost();
            TradeIntent intent = TradeIntent.builder()
                    .symbol(current.getSymbol())
                    .side(OrderSide.SELL)
                    .quantity(current.getQuantity())
                    .orderType(OrderType.MARKET)
                    .estimatedPrice(price)
                    .contractMultiplier(current.getContractMultiplier())
                    .source(source)
                    .closeReason(reason)
                    .build();
            TradeRecord saved = tradeRecordRepository.save(newRecord(intent, mode)
                    .status(TradeStatus.PENDING)
                    .clientOrderId(UUID.randomUUID().toString())
                    .build());
            current.setClosingTradeId(saved.getId());
            positionRepository.save(current);
            dailyStatsService.recordOrderPlaced(mode);
            return saved;
        });
        log.info("Closing {} {} x{} reason={}", mode, pending.getSymbol(), pending.getQuantity(),
                reason.wireValue());
        return Optional.of(placeWithBroker(pending, mode));
    }

    /**
     * Applies a broker status report to a working trade. Fills are booked by filled-quantity delta.
     */
    public TradeRecord applyBrokerUpdate(Long tradeId, BrokerOrder order) {
        return ledgerWriter.write(() -> applyUpdate(findTrade(tradeId), order));
    }

    private TradeRecord admit(TradeIntent intent, TradingMode mode) {
        if (intent.isBuy()) {
            Position existing = positionRepository.findBySymbolAndTradingMode(intent.symbol(), mode).orElse(null);
            RiskSettings settings = riskSettingsService.current();
            RiskGate.RiskDecision decision = riskGate.evaluate(
                    intent,
                    settings,
                    MoneyUtils.add(dailyStatsService.spentToday(mode),
                            workingBuyValue(mode, dailyStatsService.startOf(dailyStatsService.today()))),
                    MoneyUtils.add(dailyStatsService.spentThisWeek(mode),
                            workingBuyValue(mode, dailyStatsService.startOf(dailyStatsService.weekStart()))),
                    positionRepository.countByTradingMode(mode),
                    existing);
            if (!decision.allowed()) {
                TradeRecord rejected = tradeRecordRepository.save(newRecord(intent, mode)
                        .status(TradeStatus.REJECTED)
                        .rejectionReason(decision.message())
                        .build());
                dailyStatsService.recordOrderRejected(mode);
                metricsService.recordOrderRejected(decision.code().name().toLowerCase());
                notificationService.notify(NotificationType.TRADE_REJECTED, "Trade rejected: " + intent.symbol(),
                        decision.message(), intent.profileId(), intent.symbol());
                log.warn("Risk gate rejected {} {} x{}: {}", intent.side(), intent.symbol(), intent.quantity(),
                        decision.message());
                return rejected;
            }
        }
        TradeRecord pending = tradeRecordRepository.save(newRecord(intent, mode)
                .status(TradeStatus.PENDING)
                .clientOrderId(UUID.randomUUID().toString())
                .build());
        dailyStatsService.recordOrderPlaced(mode);
        return pending;
    }

    private TradeRecord placeWithBroker(TradeRecord trade, TradingMode mode) {
        BrokerOrderRequest request = BrokerOrderRequest.builder()
                .symbol(trade.getSymbol())
                .quantity(trade.getQuantity())
                .side(trade.getSide())
                .type(trade.getOrderType())
                .timeInForce(orderProperties.getTimeInForce())
                .limitPrice(trade.getLimitPrice())
                .stopPrice(trade.getStopPrice())
                .trailPercent(trade.getTrailPercent())
                .clientOrderId(trade.getClientOrderId())
                .build();
        BrokerOrder order;
        try {
            order = providerGateway.send(Provider.ALPACA, () -> brokerageProvider.submitOrder(mode, request));
        } catch (BrokerRejectionException e) {
            log.warn("Broker rejected {} {} x{}: {}", trade.getSide(), trade.getSymbol(), trade.getQuantity(),
                    e.getReason());
            return markRejected(trade.getId(), e.getReason(), "broker");
        } catch (RuntimeException e) {
            log.error("Order submission failed for {} {} x{}", trade.getSide(), trade.getSymbol(), trade.getQuantity(), e);
            markRejected(trade.getId(), "Order submission failed: " + e.getMessage(), "submission_failed");
            throw new TradingException("Order submission failed for " + trade.getSymbol() + ": " + e.getMessage(), e);
        }
        metricsService.recordOrderSubmitted();
        log.info("Order submitted {} {} {} x{} brokerOrderId={}", mode, trade.getSide(), trade.getSymbol(),
                trade.getQuantity(), order.orderId());
        return ledgerWriter.write(() -> {
            TradeRecord current = findTrade(trade.getId());
            current.setBrokerOrderId(order.orderId());
            current.setSubmittedAt(clock.instant());
            return applyUpdate(current, order);
        });
    }

    private TradeRecord markRejected(Long tradeId, String reason, String metricReason) {
        return ledgerWriter.write(() -> {
            TradeRecord trade = findTrade(tradeId);
            if (trade.getStatus().isTerminal()) {
                return trade;
            }
            trade.setStatus(TradeStatus.REJECTED);
            trade.setRejectionReason(reason);
            trade.setUpdatedAt(clock.instant());
            if (trade.getCloseReason() != null) {
                reopen(trade);
            }
            dailyStatsService.recordOrderRejected(trade.getTradingMode());
            metricsService.recordOrderRejected(metricReason);
            notificationService.notify(NotificationType.TRADE_REJECTED, "Order rejected: " + trade.getSymbol(),
                    reason, trade.getProfileId(), trade.getSymbol());
            return tradeRecordRepository.save(trade);
        });
    }

    private TradeRecord applyUpdate(TradeRecord trade, BrokerOrder order) {
        if (trade.getStatus().isTerminal()) {
            return trade;
        }
        Instant now = clock.instant();
        TradeStatus next = order.toTradeStatus();
        int reported = next == TradeStatus.FILLED
                ? trade.getQuantity()
                : Math.min(Math.max(order.filledQuantity(), 0), trade.getQuantity());
        int delta = reported - trade.getFilledQuantity();
        if (delta > 0) {
            BigDecimal fillPrice = incrementalFillPrice(trade, order.filledAveragePrice(), reported, delta);
            trade.setFilledPrice(MoneyUtils.scale(order.filledAveragePrice() != null
                    ? order.filledAveragePrice() : fillPrice));
            trade.setFilledQuantity(reported);
            bookFill(trade, delta, fillPrice, now);
        }
        if (next == TradeStatus.PENDING && trade.getFilledQuantity() > 0) {
            next = TradeStatus.PARTIAL_FILL;
        }
        if (next != trade.getStatus() && trade.getStatus().canTransitionTo(next)) {
            trade.setStatus(next);
            TradingMode mode = trade.getTradingMode();
            if (next == TradeStatus.FILLED) {
                trade.setFilledAt(now);
                dailyStatsService.recordOrderFilled(mode);
                log.info("Order filled {} {} {} x{} @ {}", mode, trade.getSide(), trade.getSymbol(),
                        trade.getFilledQuantity(), trade.getFilledPrice());
            } else if (next == TradeStatus.REJECTED || next == TradeStatus.CANCELLED) {
                String reason = order.rejectReason() != null ? order.rejectReason() : "Order " + order.status() + " by broker";
                trade.setRejectionReason(reason);
                if (trade.getCloseReason() != null) {
                    reopen(trade);
                }
                if (next == TradeStatus.REJECTED) {
                    dailyStatsService.recordOrderRejected(mode);
                    metricsService.recordOrderRejected("broker");
                    notificationService.notify(NotificationType.TRADE_REJECTED, "Order rejected: " + trade.getSymbol(),
                            reason, trade.getProfileId(), trade.getSymbol());
                }
                log.warn("Order {} {} {} ended {}: {}", trade.getBrokerOrderId(), trade.getSide(), trade.getSymbol(),
                        next, reason);
            }
        }
        trade.setUpdatedAt(now);
        return tradeRecordRepository.save(trade);
    }

    /**
     * Price of the newly filled shares, derived from the broker's cumulative average.
     */
    private static BigDecimal incrementalFillPrice(TradeRecord trade, BigDecimal reportedAverage, int reported, int delta) {
        BigDecimal average = reportedAverage != null ? reportedAverage : trade.getEstimatedPrice();
        int previous = trade.getFilledQuantity();
        if (previous == 0 || trade.getFilledPrice() == null || reportedAverage == null) {
            return MoneyUtils.scale(average);
        }
        BigDecimal total = average.multiply(BigDecimal.valueOf(reported))
                .subtract(trade.getFilledPrice().multiply(BigDecimal.valueOf(previous)));
        BigDecimal price = total.divide(BigDecimal.valueOf(delta), MoneyUtils.SCALE, RoundingMode.HALF_UP);
        return price.signum() > 0 ? price : MoneyUtils.scale(average);
    }

    private void bookFill(TradeRecord trade, int quantity, BigDecimal price, Instant now) {
        TradingMode mode = trade.getTradingMode();
        Optional<Position> existing = positionRepository.findBySymbolAndTradingMode(trade.getSymbol(), mode);
        if (trade.getSide() == OrderSide.BUY) {
            Position position = existing.map(current -> average(current, quantity, price, now))
                    .orElseGet(() -> openPosition(trade, quantity, price, now));
            positionRepository.save(position);
            dailyStatsService.recordSpend(mode, MoneyUtils.notional(price, quantity, trade.getContractMultiplier()));
            return;
        }
        if (existing.isEmpty()) {
            log.warn("Sell fill for {} {} without a local position", mode, trade.getSymbol());
            return;
        }
        Position position = existing.get();
        int closing = Math.min(quantity, position.getQuantity());
        BigDecimal realized = MoneyUtils.notional(MoneyUtils.subtract(price, position.getAvgCost()), closing,
                position.getContractMultiplier());
        if (closing >= position.getQuantity()) {
            closeOut(position, trade, price, realized, now);
        } else {
            position.setQuantity(position.getQuantity() - closing);
            position.setUpdatedAt(now);
            positionRepository.save(position);
            dailyStatsService.recordRealizedPl(mode, realized);
        }
    }

    private Position average(Position position, int quantity, BigDecimal price, Instant now) {
        int total = position.getQuantity() + quantity;
        BigDecimal cost = position.getAvgCost().multiply(BigDecimal.valueOf(position.getQuantity()))
                .add(price.multiply(BigDecimal.valueOf(quantity)));
        position.setAvgCost(cost.divide(BigDecimal.valueOf(total), MoneyUtils.SCALE, RoundingMode.HALF_UP));
        position.setQuantity(total);
        position.setUpdatedAt(now);
        return position;
    }

    private Position openPosition(TradeRecord trade, int quantity, BigDecimal price, Instant now) {
        RiskSettings settings = riskSettingsService.current();
        dailyStatsService.recordPositionOpened(trade.getTradingMode());
        log.info("Opened position {} {} x{} @ {}", trade.getTradingMode(), trade.getSymbol(), quantity, price);
        return Position.builder()
                .tradingMode(trade.getTradingMode())
                .symbol(trade.getSymbol())
                .quantity(quantity)
                .avgCost(MoneyUtils.scale(price))
                .contractMultiplier(trade.getContractMultiplier())
                .stopLossPercent(settings.getStopLossDefaultPercent())
                .takeProfitPercent(settings.getTakeProfitDefaultPercent())
                .currentPrice(MoneyUtils.scale(price))
                .openedAt(now)
                .updatedAt(now)
                .build();
    }

    private void closeOut(Position position, TradeRecord trade, BigDecimal price, BigDecimal realized, Instant now) {
        CloseReason reason = trade.getCloseReason() != null ? trade.getCloseReason()
                : position.getPendingCloseReason() != null ? position.getPendingCloseReason() : CloseReason.MANUAL;
        ClosedPosition closed = ClosedPosition.builder()
                .tradingMode(position.getTradingMode())
                .symbol(position.getSymbol())
                .quantity(position.getQuantity())
                .avgCost(position.getAvgCost())
                .closePrice(MoneyUtils.scale(price))
                .realizedPl(realized)
                .realizedPlPercent(MoneyUtils.percentChange(position.getAvgCost(), price))
                .holdingPeriodDays(Duration.between(position.getOpenedAt(), now).toDays())
                .closeReason(reason)
                .closingTradeId(trade.getId())
                .openedAt(position.getOpenedAt())
                .closedAt(now)
                .build();
        closedPositionRepository.save(closed);
        positionRepository.delete(position);
        dailyStatsService.recordPositionClosed(position.getTradingMode(), realized);
        metricsService.recordPositionClosed(reason);
        notificationService.notify(NotificationType.POSITION_CLOSED,
                "Position closed: " + position.getSymbol(),
                "Closed " + position.getQuantity() + " " + position.getSymbol() + " (" + reason.wireValue()
                        + "), realized P/L $" + realized.setScale(2, RoundingMode.HALF_UP).toPlainString(),
                trade.getProfileId(), position.getSymbol());
        log.info("Closed position {} {} x{} reason={} realizedPl={}", position.getTradingMode(), position.getSymbol(),
                position.getQuantity(), reason.wireValue(), realized);
    }

    private void reopen(TradeRecord trade) {
        positionRepository.findBySymbolAndTradingMode(trade.getSymbol(), trade.getTradingMode())
                .filter(position -> position.getState() == PositionState.CLOSING
                        && trade.getId().equals(position.getClosingTradeId()))
                .ifPresent(position -> {
                    position.setState(PositionState.OPEN);
                    position.setPendingCloseReason(null);
                    position.setClosingTradeId(null);
                    position.setUpdatedAt(clock.instant());
                    positionRepository.save(position);
                    log.warn("Close order for {} {} did not complete, position reopened", trade.getTradingMode(),
                            trade.getSymbol());
                });
    }

    private BigDecimal workingBuyValue(TradingMode mode, Instant since) {
        return tradeRecordRepository.findByTradingModeAndSideAndStatusInAndCreatedAtGreaterThanEqual(
                        mode, OrderSide.BUY, WORKING_STATUSES, since).stream()
                .map(trade -> MoneyUtils.notional(trade.getEstimatedPrice(), trade.remainingQuantity(),
                        trade.getContractMultiplier()))
                .reduce(MoneyUtils.ZERO, MoneyUtils::add);
    }

    private BigDecimal referencePrice(TradeIntent intent) {
        if (intent.limitPrice() != null) {
            return intent.limitPrice();
        }
        if (intent.stopPrice() != null) {
            return intent.stopPrice();
        }
        Quote quote = providerGateway.fetch(Provider.ALPACA, () -> marketDataProvider.getQuote(intent.symbol()),
                RequestOptions.high());
        BigDecimal price = quote == null ? null : quote.price();
        if (price == null) {
            throw new TradingException("No price available for " + intent.symbol());
        }
        return price;
    }

    private TradeRecord.TradeRecordBuilder newRecord(TradeIntent intent, TradingMode mode) {
        Instant now = clock.instant();
        return TradeRecord.builder()
                .tradingMode(mode)
                .profileId(intent.profileId())
                .symbol(intent.symbol())
                .side(intent.side())
                .quantity(intent.quantity())
                .orderType(intent.orderType())
                .limitPrice(intent.limitPrice())
                .stopPrice(intent.stopPrice())
                .trailPercent(intent.trailPercent())
                .estimatedPrice(intent.estimatedPrice())
                .contractMultiplier(intent.contractMultiplier() <= 0 ? 1 : intent.contractMultiplier())
                .source(intent.source() == null ? TradeSource.MANUAL : intent.source())
                .closeReason(intent.closeReason())
                .createdAt(now)
                .updatedAt(now);
    }

    private TradeRecord findTrade(Long tradeId) {
        return tradeRecordRepository.findById(tradeId)
                .orElseThrow(() -> new NotFoundException("Trade not found: " + tradeId));
    }
}
