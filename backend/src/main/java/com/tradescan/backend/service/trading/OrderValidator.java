package com.tradescan.backend.service.trading;

import com.tradescan.backend.exception.BadRequestException;
import com.tradescan.backend.model.OrderSide;
import com.tradescan.backend.model.OrderType;
import com.tradescan.backend.model.Position;
import com.tradescan.backend.model.PositionState;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

@Component
public class OrderValidator {

    /**
     * @param position the open position in the current mode for the symbol, or null
     */
    public void validate(TradeIntent intent, Position position) {
        List<String> problems = new ArrayList<>();
        if (intent.symbol() == null || intent.symbol().isBlank()) {
            problems.add("symbol is required");
        }
        if (intent.quantity() <= 0) {
            problems.add("quantity must be a positive integer");
        }
        if (intent.side() == null) {
            problems.add("side must be buy or sell");
        }
        OrderType type = intent.orderType();
        if (type == null) {
            problems.add("orderType must be market, limit, stop, stop_limit or trailing_stop");
        } else {
            if (type.requiresLimitPrice() && !positive(intent.limitPrice())) {
                problems.add("limitPrice is required for " + type.wireValue() + " orders");
            }
            if (type.requiresStopPrice() && !positive(intent.stopPrice())) {
                problems.add("stopPrice is required for " + type.wireValue() + " orders");
            }
            if (type == OrderType.TRAILING_STOP && !positive(intent.trailPercent())) {
                problems.add("trailPercent is required for trailing_stop orders");
            }
        }
        if (intent.side() == OrderSide.SELL && intent.quantity() > 0) {
            if (position == null) {
                problems.add("no open position in " + intent.symbol() + " to sell");
            } else if (position.getState() != PositionState.OPEN) {
                problems.add(intent.symbol() + " is already being closed");
            } else if (intent.quantity() > position.getQuantity()) {
                problems.add("cannot sell " + intent.quantity() + " " + intent.symbol() + ", only "
                        + position.getQuantity() + " held");
            }
        }
        if (!problems.isEmpty()) {
            throw new BadRequestException("Invalid order: " + String.join("; ", problems));
        }
    }

    private static boolean positive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }
}
