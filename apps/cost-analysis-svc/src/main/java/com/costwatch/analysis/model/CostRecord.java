package com.costwatch.analysis.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One billing observation: the cost of a single service for a single period.
 * {@code organization} and {@code region} are optional and only travel along to alerts.
 */
public record CostRecord(
        Instant timestamp,
        String label,
        BigDecimal amount,
        String organization,
        String region
) {
    public static final String UNKNOWN_LABEL = "Unknown";

    public static CostRecord of(Instant timestamp, String label, BigDecimal amount) {
        return new CostRecord(timestamp, label, amount, null, null);
    }

    public String labelOrUnknown() {
        return label == null || label.isBlank() ? UNKNOWN_LABEL : label;
    }

    public CostRecord withAmount(BigDecimal newAmount) {
        return new CostRecord(timestamp, label, newAmount, organization, region);
    }
}
