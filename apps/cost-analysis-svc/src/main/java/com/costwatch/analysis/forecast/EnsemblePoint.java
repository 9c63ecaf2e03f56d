package com.costwatch.analysis.forecast;

import java.time.LocalDate;
import java.util.Map;

public record EnsemblePoint(
        LocalDate date,
        double value,
        double confidence,
        Map<ForecastModelType, ModelContribution> contributors
) {
}
