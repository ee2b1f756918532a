package com.tradescan.backend.model.params;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Inclusive range filter. A missing bound is unbounded on that side.
 */
public record NumericRange(Double min, Double max) {

    public static NumericRange between(Double min, Double max) {
        return new NumericRange(min, max);
    }

    public static NumericRange atLeast(Double min) {
        return new NumericRange(min, null);
    }

    public static NumericRange atMost(Double max) {
        return new NumericRange(null, max);
    }

    @JsonIgnore
    public boolean isConfigured() {
        return min != null || max != null;
    }

    public boolean contains(double value) {
        if (min != null && value < min) {
            return false;
        }
        return max == null || value <= max;
    }

    @JsonIgnore
    public boolean isValid() {
        return min == null || max == null || min <= max;
    }
}
