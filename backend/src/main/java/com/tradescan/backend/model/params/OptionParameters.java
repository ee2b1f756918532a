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
 * Option-chain screening filters, applied per contract of each underlying's chain.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OptionParameters implements ProfileParameters {

    @Builder.Default
    private int schemaVersion = CURRENT_SCHEMA_VERSION;

    @Builder.Default
    private List<String> underlyings = new ArrayList<>();

    private NumericRange strike;
    private NumericRange daysToExpiration;
    private NumericRange delta;
    private NumericRange gamma;
    private NumericRange theta;
    private NumericRange vega;
    private NumericRange bid;
    private NumericRange ask;
    private NumericRange premium;
    private Double bidAskSpreadMax;
    private Long openInterestMin;
    private Long volumeMin;
    private Double volumeOiRatioMin;
    @Builder.Default
    private Moneyness moneyness = Moneyness.ANY;

    @Override
    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        if (underlyings == null || underlyings.isEmpty()) {
            problems.add("underlyings: at least one underlying is required");
        }
        Map<String, NumericRange> ranges = new LinkedHashMap<>();
        ranges.put("strike", strike);
        ranges.put("daysToExpiration", daysToExpiration);
        ranges.put("delta", delta);
        ranges.put("gamma", gamma);
        ranges.put("theta", theta);
        ranges.put("vega", vega);
        ranges.put("bid", bid);
        ranges.put("ask", ask);
        ranges.put("premium", premium);
        ranges.forEach((name, range) -> {
            if (range != null && !range.isValid()) {
                problems.add(name + ": min must not exceed max");
            }
        });
        if (bidAskSpreadMax != null && bidAskSpreadMax < 0) {
            problems.add("bidAskSpreadMax: must not be negative");
        }
        if (schemaVersion > CURRENT_SCHEMA_VERSION) {
            problems.add("schemaVersion " + schemaVersion + " is newer than supported " + CURRENT_SCHEMA_VERSION);
        }
        return problems;
    }
}
