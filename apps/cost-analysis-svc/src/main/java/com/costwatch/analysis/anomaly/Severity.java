package com.costwatch.analysis.anomaly;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * Buckets a ratio of observed deviation to its threshold: above 2x critical, above 1.5x high.
     */
    public static Severity fromRatio(double ratio) {
        if (ratio > 2d) {
            return CRITICAL;
        }
        if (ratio > 1.5d) {
            return HIGH;
        }
        return MEDIUM;
    }

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
