package com.costwatch.analysis.anomaly;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Locale;

public enum AnomalyAlgorithm {
    ZSCORE("zscore"),
    IQR("iqr"),
    REGRESSION("regression"),
    SEASONAL("seasonal");

    private final String id;

    AnomalyAlgorithm(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    @JsonCreator
    public static AnomalyAlgorithm fromId(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(algorithm -> algorithm.id.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown anomaly algorithm: " + value));
    }
}
