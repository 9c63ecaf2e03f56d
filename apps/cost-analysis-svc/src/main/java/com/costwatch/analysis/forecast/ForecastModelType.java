package com.costwatch.analysis.forecast;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Locale;

public enum ForecastModelType {
    LINEAR("linear", 0.75d, 0.2d),
    POLYNOMIAL("polynomial", 0.80d, 0.3d),
    EXPONENTIAL("exponential", 0.78d, 0.25d),
    SEASONAL("seasonal", 0.73d, 0.2d);

    private final String id;
    private final double baseAccuracy;
    private final double volatilityPenalty;

    ForecastModelType(String id, double baseAccuracy, double volatilityPenalty) {
        this.id = id;
        this.baseAccuracy = baseAccuracy;
        this.volatilityPenalty = volatilityPenalty;
    }

    @JsonValue
    public String id() {
        return id;
    }

    public double baseAccuracy() {
        return baseAccuracy;
    }

    /**
     * Accuracy lost per unit of coefficient of variation of the history.
     */
    public double volatilityPenalty() {
        return volatilityPenalty;
    }

    @JsonCreator
    public static ForecastModelType fromId(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(type -> type.id.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown forecast model: " + value));
    }
}
