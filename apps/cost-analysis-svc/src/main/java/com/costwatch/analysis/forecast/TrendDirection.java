package com.costwatch.analysis.forecast;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum TrendDirection {
    INCREASING,
    DECREASING,
    STABLE;

    public static TrendDirection between(double first, double last) {
        if (last > first) {
            return INCREASING;
        }
        return last < first ? DECREASING : STABLE;
    }

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
