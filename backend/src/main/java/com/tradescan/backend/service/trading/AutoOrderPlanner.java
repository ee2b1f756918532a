package com.tradescan.backend.service.trading;

import com.tradescan.backend.model.OrderSide;
import com.tradescan.backend.model.OrderType;
import com.tradescan.backend.model.RiskSettings;
import com.tradescan.backend.model.ScreeningProfile;
import com.tradescan.backend.model.TradeSource;
import com.tradescan.backend.service.scanner.ScanMatch;
import com.tradescan.backend.util.MoneyUtils;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;

/**
 * Sizes a market buy for a scan match: as many whole units as fit under the profile cap (or the global cap).
 */
@Component
public class AutoOrderPlanner {

    public Optional<TradeIntent> plan(ScreeningProfile profile, ScanMatch match, RiskSettings settings) {
        if (match.price() == null || match.price() <= 0) {
            return Optional.empty();
        }
        BigDecimal cap = profile.getMaxOrderValue() != null ? profile.getMaxOrderValue() : settings.getMaxTransactionAmount();
        int multiplier = match.assetType().contractMultiplier();
        BigDecimal price = MoneyUtils.bd(match.price());
        BigDecimal unitCost = price.multiply(BigDecimal.valueOf(multiplier));
        if (unitCost.signum() <= 0) {
            return Optional.empty();
        }
        int quantity = cap.divide(unitCost, 0, RoundingMode.FLOOR).intValue();
        if (quantity < 1) {
            return Optional.empty();
        }
        return Optional.of(TradeIntent.builder()
                .symbol(match.symbol())
                .side(OrderSide.BUY)
                .quantity(quantity)
                .orderType(OrderType.MARKET)
                .estimatedPrice(price)
                .contractMultiplier(multiplier)
                .profileId(profile.getId())
                .profileMaxOrderValue(profile.getMaxOrderValue())
                .source(TradeSource.AUTO_EXECUTE)
                .build());
    }
}
