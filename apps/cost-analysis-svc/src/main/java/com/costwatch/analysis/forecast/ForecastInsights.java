package com.costwatch.analysis.forecast;

import java.util.List;

public record ForecastInsights(
        List<SignificantChange> significantChanges,
        List<Recommendation> recommendations,
        List<Alert> alerts
) {
    public ForecastInsights {
        significantChanges = List.copyOf(significantChanges);
        recommendations = List.copyOf(recommendations);
        alerts = List.copyOf(alerts);
    }

    public record SignificantChange(String type, String description, String impact, double value) {
    }

    public record Recommendation(String type, String description, String action) {
    }

    public record Alert(String type, String description, String severity) {
    }
}
