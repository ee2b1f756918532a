package com.tradescan.backend.repository;

import com.tradescan.backend.model.OrderSide;
import com.tradescan.backend.model.TradeRecord;
import com.tradescan.backend.model.TradeStatus;
import com.tradescan.backend.model.TradingMode;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface TradeRecordRepository extends JpaRepository<TradeRecord, Long> {

    Optional<TradeRecord> findByIdAndTradingMode(Long id, TradingMode tradingMode);

    List<TradeRecord> findByTradingModeOrderByCreatedAtDesc(TradingMode tradingMode, Pageable pageable);

    List<TradeRecord> findByTradingModeAndStatusIn(TradingMode tradingMode, Collection<TradeStatus> statuses);

    List<TradeRecord> findByTradingModeAndSideAndStatusInAndCreatedAtGreaterThanEqual(
            TradingMode tradingMode, OrderSide side, Collection<TradeStatus> statuses, Instant since);
}
