package com.costwatch.analysis.forecast;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record ForecastReport(
        String serviceName,
        int horizon,
        double confidenceLevel,
        Instant generatedAt,
        List<EnsemblePoint> predictions,
        List<ConfidenceInterval> confidenceIntervals,
        Map<ForecastModelType, Double> modelAccuracy,
        double ensembleAccuracy,
        Map<ForecastModelType, ModelResult> individualModels,
        ForecastInsights insights,
        Summary summary
) {
    public record Summary(
            double predictedTotal,
            double averageDailyCost,
            TrendDirection trendDirection,
            double volatility,
            double seasonalityStrength
    ) {
    }
}
