package com.tradescan.backend.service.trading;

import com.tradescan.backend.dto.PositionThresholdsRequest;
import com.tradescan.backend.exception.BadRequestException;
import com.tradescan.backend.exception.ConflictException;
import com.tradescan.backend.exception.NotFoundException;
import com.tradescan.backend.model.CloseReason;
import com.tradescan.backend.model.ClosedPosition;
import com.tradescan.backend.model.Position;
import com.tradescan.backend.model.PositionState;
import com.tradescan.backend.model.TradeRecord;
import com.tradescan.backend.model.TradeSource;
import com.tradescan.backend.model.TradingMode;
import com.tradescan.backend.repository.ClosedPositionRepository;
import com.tradescan.backend.repository.PositionRepository;
import com.tradescan.backend.repository.TradeRecordRepository;
import com.tradescan.backend.service.LedgerWriter;
import com.tradescan.backend.service.TradingModeService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Read side of the ledger plus the user-driven position edits. Everything is scoped to the current trading mode.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PortfolioService {

    private final PositionRepository positionRepository;
    private final ClosedPositionRepository closedPositionRepository;
    private final TradeRecordRepository tradeRecordRepository;
    private final TradeExecutor tradeExecutor;
    private final TradingModeService tradingModeService;
    private final LedgerWriter ledgerWriter;
    private final Clock clock;

    public List<Position> positions() {
        return positionRepository.findByTradingModeOrderBySymbolAsc(tradingModeService.current());
    }

    public List<ClosedPosition> closedPositions(int limit) {
        return closedPositionRepository.findByTradingModeOrderByClosedAtDesc(tradingModeService.current(),
                PageRequest.of(0, clamp(limit)));
    }

    public List<TradeRecord> tradeHistory(int limit) {
        return tradeRecordRepository.findByTradingModeOrderByCreatedAtDesc(tradingModeService.current(),
                PageRequest.of(0, clamp(limit)));
    }

    public TradeRecord trade(Long tradeId) {
        return tradeRecordRepository.findByIdAndTradingMode(tradeId, tradingModeService.current())
                .orElseThrow(() -> new NotFoundException("Trade not found: " + tradeId));
    }

    public Position updateThresholds(Long positionId, PositionThresholdsRequest request) {
        if (request.getStopLossPercent() == null && request.getTakeProfitPercent() == null) {
            throw new BadRequestException("stopLossPercent or takeProfitPercent is required");
        }
        TradingMode mode = tradingModeService.current();
        return ledgerWriter.write(() -> {
            Position position = find(positionId, mode);
            if (request.getStopLossPercent() != null) {
                position.setStopLossPercent(request.getStopLossPercent());
            }
            if (request.getTakeProfitPercent() != null) {
                position.setTakeProfitPercent(request.getTakeProfitPercent());
            }
            position.setUpdatedAt(clock.instant());
            log.info("Thresholds for {} {} set to SL {}% / TP {}%", mode, position.getSymbol(),
                    position.getStopLossPercent(), position.getTakeProfitPercent());
            return positionRepository.save(position);
        });
    }

    /**
     * Manual full close; bypasses the risk gate like a protective exit.
     */
    public TradeRecord closePosition(Long positionId) {
        Position position = find(positionId, tradingModeService.current());
        if (position.getState() != PositionState.OPEN) {
            throw new ConflictException(position.getSymbol() + " is already being closed");
        }
        return tradeExecutor.closePosition(position, CloseReason.MANUAL, TradeSource.MANUAL)
                .orElseThrow(() -> new ConflictException(position.getSymbol() + " is already being closed"));
    }

    private Position find(Long positionId, TradingMode mode) {
        return positionRepository.findByIdAndTradingMode(positionId, mode)
                .orElseThrow(() -> new NotFoundException("Position not found: " + positionId));
    }

    private static int clamp(int limit) {
        return Math.max(1, Math.min(limit, 500));
    }
}
