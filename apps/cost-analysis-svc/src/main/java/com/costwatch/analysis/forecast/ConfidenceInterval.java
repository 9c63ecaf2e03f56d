package com.costwatch.analysis.forecast;

import java.time.LocalDate;

public record ConfidenceInterval(
        LocalDate date,
        double predicted,
        double lowerBound,
        double upperBound,
        double confidence
) {
}
