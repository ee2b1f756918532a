package com.tradescan.backend.service.trading;

import com.tradescan.backend.model.Position;
import com.tradescan.backend.model.RiskSettings;
import com.tradescan.backend.util.MoneyUtils;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Pure pre-trade check: no I/O, no side effects. Checks run in a fixed order and the first violation wins.
 * A disabled settings row allows everything, and sells always pass since they only reduce exposure.
 */
@Component
public class RiskGate {

    public RiskDecision evaluate(TradeIntent intent,
                                 RiskSettings settings,
                                 BigDecimal spentToday,
                                 BigDecimal spentThisWeek,
                                 long openPositionCount,
                                 Position existingPosition) {
        if (!settings.isEnabled() || !intent.isBuy()) {
            return RiskDecision.allow();
        }
        BigDecimal value = MoneyUtils.scale(intent.orderValue());

        BigDecimal cap = intent.profileMaxOrderValue() != null
                ? intent.profileMaxOrderValue()
                : settings.getMaxTransactionAmount();
        if (value.compareTo(MoneyUtils.scale(cap)) > 0) {
            return RiskDecision.reject(RiskRejectCode.MAX_TRANSACTION_AMOUNT,
                    "Transaction amount ($" + money(value) + ") exceeds maximum allowed ($" + money(cap) + ")");
        }

        BigDecimal today = MoneyUtils.add(spentToday, value);
        if (today.compareTo(MoneyUtils.scale(settings.getDailySpendLimit())) > 0) {
            return RiskDecision.reject(RiskRejectCode.DAILY_SPEND_LIMIT,
                    "Would exceed daily spend limit. Today: $" + money(spentToday)
                            + ", Limit: $" + money(settings.getDailySpendLimit()));
        }

        BigDecimal week = MoneyUtils.add(spentThisWeek, value);
        if (week.compareTo(MoneyUtils.scale(settings.getWeeklySpendLimit())) > 0) {
            return RiskDecision.reject(RiskRejectCode.WEEKLY_SPEND_LIMIT,
                    "Would exceed weekly spend limit. This week: $" + money(spentThisWeek)
                            + ", Limit: $" + money(settings.getWeeklySpendLimit()));
        }

        if (existingPosition == null && openPositionCount >= settings.getMaxOpenPositions()) {
            return RiskDecision.reject(RiskRejectCode.MAX_OPEN_POSITIONS,
                    "Maximum positions (" + settings.getMaxOpenPositions()
                            + ") already held. Close a position before opening a new one.");
        }

        if (existingPosition != null && !settings.isAllowDuplicatePositions()) {
            return RiskDecision.reject(RiskRejectCode.DUPLICATE_POSITION,
                    "Position already exists for " + intent.symbol() + " and duplicate positions are not allowed");
        }
        return RiskDecision.allow();
    }

    private static String money(BigDecimal amount) {
        return (amount == null ? BigDecimal.ZERO : amount).setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    public record RiskDecision(boolean allowed, RiskRejectCode code, String message) {

        static RiskDecision allow() {
            return new RiskDecision(true, null, null);
        }

        static RiskDecision reject(RiskRejectCode code, String message) {
            return new RiskDecision(false, code, message);
        }
    }

    public enum RiskRejectCode {
        MAX_TRANSACTION_AMOUNT,
        DAILY_SPEND_LIMIT,
        WEEKLY_SPEND_LIMIT,
        MAX_OPEN_POSITIONS,
        DUPLICATE_POSITION
    }
}
