package com.tradescan.backend.model.params;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stock screening filters. Percent-valued fields (day change, dividend yield) are in percent units.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StockParameters implements ProfileParameters {

    @Builder.Default
    private int schemaVersion = CURRENT_SCHEMA_VERSION;

    /** Explicit instruments; when empty the configured default universe is scanned. */
    @Builder.Default
    private List<String> symbols = new ArrayList<>();

    private NumericRange price;
    private NumericRange dayChangePercent;
    private NumericRange volume;

    private NumericRange pe;
    private NumericRange pb;
    private NumericRange eps;
    private NumericRange marketCap;
    private NumericRange dividendYield;
    private NumericRange beta;
    private Double debtToEquityMax;
    private Double currentRatioMin;
    @Builder.Default
    private List<String> sectors = new ArrayList<>();

    private NumericRange rsi;
    @Builder.Default
    private MacdSignal macdSignal = MacdSignal.ANY;
    private Boolean sma20Above;
    private Boolean sma50Above;
    private Boolean sma200Above;

    public boolean requiresFundamentals() {
        return configured(pe) || configured(pb) || configured(eps) || configured(marketCap)
                || configured(dividendYield) || configured(beta)
                || debtToEquityMax != null || currentRatioMin != null
                || (sectors != null && !sectors.isEmpty());
    }

    public boolean requiresTechnicals() {
        return configured(rsi)
                || (macdSignal != null && macdSignal != MacdSignal.ANY)
                || Boolean.TRUE.equals(sma20Above)
                || Boolean.TRUE.equals(sma50Above)
                || Boolean.TRUE.equals(sma200Above);
    }

    @Override
    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        Map<String, NumericRange> ranges = new LinkedHashMap<>();
        ranges.put("price", price);
        ranges.put("dayChangePercent", dayChangePercent);
        ranges.put("volume", volume);
        ranges.put("pe", pe);
        ranges.put("pb", pb);
        ranges.put("eps", eps);
        ranges.put("marketCap", marketCap);
        ranges.put("dividendYield", dividendYield);
        ranges.put("beta", beta);
        ranges.put("rsi", rsi);
        ranges.forEach((name, range) -> {
            if (range != null && !range.isValid()) {
                problems.add(name + ": min must not exceed max");
            }
        });
        if (rsi != null && ((rsi.min() != null && rsi.min() < 0) || (rsi.max() != null && rsi.max() > 100))) {
            problems.add("rsi: bounds must lie within 0..100");
        }
        if (schemaVersion > CURRENT_SCHEMA_VERSION) {
            problems.add("schemaVersion " + schemaVersion + " is newer than supported " + CURRENT_SCHEMA_VERSION);
        }
        return problems;
    }

    private static boolean configured(NumericRange range) {
        return range != null && range.isConfigured();
    }
}
