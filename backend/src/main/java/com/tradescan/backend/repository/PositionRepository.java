package com.tradescan.backend.repository;

import com.tradescan.backend.model.CloseReason;
import com.tradescan.backend.model.Position;
import com.tradescan.backend.model.PositionState;
import com.tradescan.backend.model.TradingMode;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface PositionRepository extends JpaRepository<Position, Long> {

    List<Position> findByTradingModeOrderBySymbolAsc(TradingMode tradingMode);

    List<Position> findByTradingModeAndState(TradingMode tradingMode, PositionState state);

    Optional<Position> findBySymbolAndTradingMode(String symbol, TradingMode tradingMode);

    Optional<Position> findByIdAndTradingMode(Long id, TradingMode tradingMode);

    long countByTradingMode(TradingMode tradingMode);

    /**
     * Compare-and-set of the position state; returns 1 only for the caller that won the transition.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Position p set p.state = :to, p.pendingCloseReason = :reason, p.updatedAt = :now "
            + "where p.id = :id and p.tradingMode = :mode and p.state = :from")
    int transitionState(@Param("id") Long id,
                        @Param("mode") TradingMode mode,
                        @Param("from") PositionState from,
                        @Param("to") PositionState to,
                        @Param("reason") CloseReason reason,
                        @Param("now") Instant now);
}
