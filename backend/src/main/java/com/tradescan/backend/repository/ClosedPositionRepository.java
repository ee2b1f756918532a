package com.tradescan.backend.repository;

import com.tradescan.backend.model.ClosedPosition;
import com.tradescan.backend.model.TradingMode;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ClosedPositionRepository extends JpaRepository<ClosedPosition, Long> {

    List<ClosedPosition> findByTradingModeOrderByClosedAtDesc(TradingMode tradingMode, Pageable pageable);

    List<ClosedPosition> findByTradingModeAndSymbol(TradingMode tradingMode, String symbol);
}
