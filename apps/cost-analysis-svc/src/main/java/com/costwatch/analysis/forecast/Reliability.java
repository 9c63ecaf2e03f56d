package com.costwatch.analysis.forecast;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * A model's own judgement of its fit, used to scale its ensemble weight.
 */
public enum Reliability {
    HIGH(1.2d),
    MEDIUM(1.0d),
    LOW(0.8d);

    private final double weightMultiplier;

    Reliability(double weightMultiplier) {
        this.weightMultiplier = weightMultiplier;
    }

    public double weightMultiplier() {
        return weightMultiplier;
    }

    public static Reliability fromFit(double fitQuality, double highAbove, double mediumAbove) {
        if (fitQuality > highAbove) {
            return HIGH;
        }
        if (fitQuality > mediumAbove) {
            return MEDIUM;
        }
        return LOW;
    }

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
