package com.tradescan.backend.service.scanner;

import com.tradescan.backend.model.params.MacdSignal;
import com.tradescan.backend.model.params.Moneyness;
import com.tradescan.backend.model.params.NumericRange;
import com.tradescan.backend.model.params.OptionParameters;
import com.tradescan.backend.model.params.StockParameters;
import com.tradescan.backend.service.marketdata.OptionContract;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Filter evaluation with no I/O. A filter whose source value is missing is skipped, not failed.
 */
@Component
public class ScreeningFilters {

    public boolean matchesStock(StockSnapshot s, StockParameters p) {
        return inRange(p.getPrice(), s.getPrice())
                && inRange(p.getDayChangePercent(), s.getDayChangePercent())
                && inRange(p.getVolume(), s.getVolume() == null ? null : s.getVolume().doubleValue())
                && inRange(p.getPe(), s.getPe())
                && inRange(p.getPb(), s.getPb())
                && inRange(p.getEps(), s.getEps())
                && inRange(p.getMarketCap(), s.getMarketCap())
                && inRange(p.getDividendYield(), s.getDividendYield())
                && inRange(p.getBeta(), s.getBeta())
                && atMost(p.getDebtToEquityMax(), s.getDebtToEquity())
                && atLeast(p.getCurrentRatioMin(), s.getCurrentRatio())
                && sectorMatches(p.getSectors(), s.getSector())
                && inRange(p.getRsi(), s.getRsi())
                && macdMatches(p.getMacdSignal(), s.getMacdSignal())
                && priceAbove(p.getSma20Above(), s.getPrice(), s.getSma20())
                && priceAbove(p.getSma50Above(), s.getPrice(), s.getSma50())
                && priceAbove(p.getSma200Above(), s.getPrice(), s.getSma200());
    }

    public boolean matchesOption(OptionSnapshot s, OptionParameters p) {
        OptionContract c = s.contract();
        boolean liquidity = atMost(p.getBidAskSpreadMax(), s.spread())
                && atLeast(p.getOpenInterestMin(), c.openInterest())
                && atLeast(p.getVolumeMin(), c.volume())
                && atLeast(p.getVolumeOiRatioMin(), volumeToOpenInterest(c));
        return liquidity
                && inRange(p.getStrike(), c.strike())
                && inRange(p.getDaysToExpiration(), s.daysToExpiration() == null ? null : s.daysToExpiration().doubleValue())
                && inRange(p.getDelta(), c.delta())
                && inRange(p.getGamma(), c.gamma())
                && inRange(p.getTheta(), c.theta())
                && inRange(p.getVega(), c.vega())
                && inRange(p.getBid(), c.bid())
                && inRange(p.getAsk(), c.ask())
                && inRange(p.getPremium(), s.premium())
                && moneynessMatches(p.getMoneyness(), s.moneyness());
    }

    public OptionSnapshot snapshot(OptionContract contract, Double underlyingPrice, LocalDate today, double atmBandPercent) {
        Long dte = contract.expiration() == null ? null : ChronoUnit.DAYS.between(today, contract.expiration());
        return new OptionSnapshot(contract, underlyingPrice, dte,
                classify(contract, underlyingPrice, atmBandPercent), contract.premium(), contract.spread());
    }

    /**
     * ATM when the strike is within {@code bandPercent} of the underlying, otherwise ITM/OTM by option side.
     * Returns null without an underlying price.
     */
    public Moneyness classify(OptionContract contract, Double underlyingPrice, double bandPercent) {
        if (underlyingPrice == null || underlyingPrice <= 0) {
            return null;
        }
        double distancePercent = Math.abs(contract.strike() - underlyingPrice) / underlyingPrice * 100.0;
        if (distancePercent <= bandPercent) {
            return Moneyness.ATM;
        }
        boolean inTheMoney = contract.call() ? contract.strike() < underlyingPrice : contract.strike() > underlyingPrice;
        return inTheMoney ? Moneyness.ITM : Moneyness.OTM;
    }

    private static Double volumeToOpenInterest(OptionContract c) {
        if (c.volume() == null || c.openInterest() == null || c.openInterest() == 0) {
            return null;
        }
        return c.volume().doubleValue() / c.openInterest();
    }

    private static boolean inRange(NumericRange range, Double value) {
        if (range == null || !range.isConfigured() || value == null) {
            return true;
        }
        return range.contains(value);
    }

    private static boolean atMost(Double max, Double value) {
        return max == null || value == null || value <= max;
    }

    private static boolean atLeast(Number min, Number value) {
        return min == null || value == null || value.doubleValue() >= min.doubleValue();
    }

    private static boolean sectorMatches(List<String> sectors, String sector) {
        if (sectors == null || sectors.isEmpty() || sector == null) {
            return true;
        }
        return sectors.stream().anyMatch(candidate -> candidate.equalsIgnoreCase(sector.trim()));
    }

    private static boolean macdMatches(MacdSignal wanted, String actual) {
        if (wanted == null || wanted == MacdSignal.ANY || actual == null) {
            return true;
        }
        return wanted.wireValue().equalsIgnoreCase(actual);
    }

    private static boolean priceAbove(Boolean required, Double price, Double average) {
        if (!Boolean.TRUE.equals(required) || price == null || average == null) {
            return true;
        }
        return price > average;
    }

    private static boolean moneynessMatches(Moneyness wanted, Moneyness actual) {
        return wanted == null || wanted == Moneyness.ANY || actual == null || wanted == actual;
    }
}
